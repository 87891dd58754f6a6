package com.moosivp.analyzer.service;

import com.moosivp.analyzer.diagnostic.Diagnostic;
import com.moosivp.analyzer.dto.DocumentLink;
import com.moosivp.analyzer.dto.FoldingRange;
import com.moosivp.analyzer.dto.InlayHint;
import com.moosivp.analyzer.dto.SemanticToken;
import com.moosivp.analyzer.dto.SemanticToken.TokenType;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;
import com.moosivp.analyzer.model.AnalysisResult;
import com.moosivp.analyzer.preprocess.ConditionalRegion;
import com.moosivp.analyzer.tree.ConfigBlock;
import com.moosivp.analyzer.tree.IncludeDirective;
import com.moosivp.analyzer.tree.ModeDeclaration;
import com.moosivp.analyzer.tree.Node;
import com.moosivp.analyzer.tree.ProcessConfigBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the editor-facing views of an {@link AnalysisResult}.
 */
@Service
public class EditorViewService {

    private static final Logger logger = LoggerFactory.getLogger(EditorViewService.class);

    private static final Set<String> KEYWORDS = Set.of(
            "processconfig", "behavior", "set", "initialize", "initialize_", "define:");

    private static final String PUNCTUATION = "{}[](),;";

    public List<SemanticToken> semanticTokens(AnalysisResult result) {
        List<SemanticToken> tokens = new ArrayList<>();
        int line = -1;
        boolean lineStart = true;
        for (Token token : result.tokens()) {
            if (token.line() != line) {
                line = token.line();
                lineStart = true;
            }
            if (token.is(TokenKind.WHITESPACE) || token.is(TokenKind.NEWLINE)) {
                continue;
            }
            TokenType type = classify(token, lineStart);
            lineStart = false;
            String info = result.isInactive(token.line()) ? SemanticToken.INACTIVE : null;
            SourceRange range = token.range();
            tokens.add(new SemanticToken(
                    range.startLine(),
                    range.start().column(),
                    range.endLine(),
                    range.end().column(),
                    type.name(),
                    token.raw(),
                    info));
        }
        logger.debug("Produced {} semantic tokens", tokens.size());
        return tokens;
    }

    private static TokenType classify(Token token, boolean lineStart) {
        if (!token.complete()) {
            return TokenType.ERROR;
        }
        return switch (token.kind()) {
            case DIRECTIVE -> TokenType.DIRECTIVE;
            case VARIABLE -> TokenType.VARIABLE;
            case QUOTED_STRING -> TokenType.STRING_LITERAL;
            case INTEGER, FLOAT -> TokenType.NUMBER_LITERAL;
            case BOOLEAN -> TokenType.BOOLEAN_LITERAL;
            case COMMENT -> TokenType.COMMENT;
            case OPERATOR -> PUNCTUATION.contains(token.raw()) ? TokenType.PUNCTUATION : TokenType.OPERATOR;
            default -> lineStart && KEYWORDS.contains(token.raw().toLowerCase(Locale.ROOT))
                    ? TokenType.KEYWORD
                    : TokenType.IDENTIFIER;
        };
    }

    /** Diagnostics in document order. */
    public List<Diagnostic> diagnostics(AnalysisResult result) {
        return result.diagnostics().stream()
                .sorted(Comparator.comparingInt(d -> d.range().start().offset()))
                .collect(Collectors.toList());
    }

    public List<DocumentLink> documentLinks(AnalysisResult result) {
        List<DocumentLink> links = new ArrayList<>();
        for (IncludeDirective include : result.resolvedIncludes()) {
            SourceRange range = include.pathRange();
            links.add(new DocumentLink(
                    range.startLine(),
                    range.start().column(),
                    range.endLine(),
                    range.end().column(),
                    include.path(),
                    include.tag()));
        }
        return links;
    }

    public List<FoldingRange> foldingRanges(AnalysisResult result) {
        List<FoldingRange> ranges = new ArrayList<>();
        for (Node node : result.document().nodes()) {
            FoldingRange.Kind kind;
            if (node instanceof ConfigBlock) {
                kind = FoldingRange.Kind.BLOCK;
            } else if (node instanceof ModeDeclaration) {
                kind = FoldingRange.Kind.MODE;
            } else {
                continue;
            }
            if (node.range().endLine() > node.range().startLine()) {
                ranges.add(new FoldingRange(node.range().startLine(), node.range().endLine(), kind));
            }
        }
        for (ConditionalRegion region : result.conditionalRegions()) {
            if (region.endLine() > region.startLine()) {
                ranges.add(new FoldingRange(region.startLine(), region.endLine(), FoldingRange.Kind.CONDITIONAL));
            }
        }
        ranges.sort(Comparator.comparingInt(FoldingRange::startLine).thenComparingInt(FoldingRange::endLine));
        return ranges;
    }

    /** A label after each closing brace naming the block it closes. */
    public List<InlayHint> inlayHints(AnalysisResult result) {
        List<InlayHint> hints = new ArrayList<>();
        for (ConfigBlock block : result.document().nodesOf(ConfigBlock.class)) {
            if (block.closeRange() == null) {
                continue;
            }
            String keyword = block instanceof ProcessConfigBlock ? "ProcessConfig" : "Behavior";
            hints.add(new InlayHint(
                    block.closeRange().endLine(),
                    block.closeRange().end().column(),
                    keyword + " = " + block.name()));
        }
        return hints;
    }
}
