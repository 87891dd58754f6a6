package com.moosivp.analyzer.service;

import com.moosivp.analyzer.config.AnalyzerProperties;
import com.moosivp.analyzer.diagnostic.Diagnostic;
import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.dto.AnalysisRequest;
import com.moosivp.analyzer.exception.IncludeResolutionException;
import com.moosivp.analyzer.lexer.SourcePosition;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Tokenizer;
import com.moosivp.analyzer.mode.ModeHierarchyValidator;
import com.moosivp.analyzer.mode.ModeTree;
import com.moosivp.analyzer.model.AnalysisResult;
import com.moosivp.analyzer.model.FileType;
import com.moosivp.analyzer.parser.GrammarParser;
import com.moosivp.analyzer.preprocess.DirectiveProcessor;
import com.moosivp.analyzer.preprocess.IncludeResolver;
import com.moosivp.analyzer.preprocess.PreprocessedSource;
import com.moosivp.analyzer.preprocess.SymbolTable;
import com.moosivp.analyzer.preprocess.TagSlicer;
import com.moosivp.analyzer.preprocess.VariableSubstitution;
import com.moosivp.analyzer.tree.Document;
import com.moosivp.analyzer.tree.ModeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the analyzer: runs tokenizer, directive machine, grammar parser and mode validator
 * over one document and bundles what they produce.
 *
 * <p>Stateless. Every call owns its symbol table, conditional stack and diagnostics, so concurrent
 * calls share nothing mutable. Included files are analyzed by nested calls that carry the chain of
 * include paths leading to them.
 */
@Service
@Validated
public class MoosAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(MoosAnalysisService.class);

    private final AnalyzerProperties properties;

    public MoosAnalysisService(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public AnalysisResult analyze(String content, IncludeResolver resolver) {
        return analyze(AnalysisRequest.of(content, FileType.TEMPLATE), resolver);
    }

    public AnalysisResult analyze(@Valid AnalysisRequest request, IncludeResolver resolver) {
        Objects.requireNonNull(request.sourceCode(), "sourceCode");
        Objects.requireNonNull(resolver, "resolver");
        long startTime = System.currentTimeMillis();
        String content = request.sourceCode();
        FileType fileType = request.fileType();

        if (content.length() > properties.maxSourceLength()) {
            logger.warn("Rejecting {} characters of {} source, limit is {}", content.length(), fileType,
                    properties.maxSourceLength());
            return AnalysisResult.failed(content, fileType, Diagnostic.of(DiagnosticCode.ANALYSIS_FAILED,
                    SourceRange.at(SourcePosition.START),
                    "Source exceeds the maximum length of " + properties.maxSourceLength() + " characters"),
                    System.currentTimeMillis() - startTime);
        }

        try {
            logger.info("=== Starting {} analysis for {} characters of source ===", fileType, content.length());

            SymbolTable symbols = new SymbolTable(environment(request));
            DiagnosticCollector diagnostics = new DiagnosticCollector();
            Pipeline pipeline = run(content, fileType, symbols, List.of(), resolver, diagnostics);

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("=== Analysis completed in {}ms with {} tokens, {} nodes, {} diagnostics ({} errors) ===",
                    analysisTime,
                    pipeline.source().tokens().size(),
                    pipeline.document().nodes().size(),
                    diagnostics.size(),
                    diagnostics.errorCount());

            return new AnalysisResult(
                    content,
                    fileType,
                    pipeline.source().tokens(),
                    pipeline.document(),
                    pipeline.modeTree(),
                    symbols.snapshot(),
                    diagnostics.diagnostics(),
                    pipeline.source().inactiveLines(),
                    pipeline.source().regions(),
                    analysisTime);

        } catch (RuntimeException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Analysis failed", e);
            return AnalysisResult.failed(content, fileType, Diagnostic.of(DiagnosticCode.ANALYSIS_FAILED,
                    SourceRange.at(SourcePosition.START), "Analysis failed: " + e.getMessage()), analysisTime);
        }
    }

    private Map<String, String> environment(AnalysisRequest request) {
        Map<String, String> environment = new HashMap<>();
        if (properties.useEnvironment()) {
            environment.putAll(System.getenv());
        }
        environment.putAll(request.environment());
        return environment;
    }

    private record Pipeline(PreprocessedSource source, Document document, ModeTree modeTree) {
    }

    /**
     * @param chain include targets entered on the way to this content, outermost first. Its size is
     *              the include depth.
     */
    private Pipeline run(String content, FileType fileType, SymbolTable symbols, List<String> chain,
            IncludeResolver resolver, DiagnosticCollector diagnostics) {
        VariableSubstitution substitution = new VariableSubstitution(symbols, diagnostics,
                properties.substituteInQuotes());
        DirectiveProcessor processor = new DirectiveProcessor(fileType, symbols, substitution, diagnostics,
                (path, tag, range) -> include(path, tag, range, fileType, symbols, chain, resolver, diagnostics));

        PreprocessedSource source = processor.process(new Tokenizer(content));
        logger.debug("Depth {}: {} tokens, {} active lines", chain.size(), source.tokens().size(),
                source.activeLines().size());

        Document document = new GrammarParser(fileType, diagnostics).parse(source.activeLines(), source.includes());
        ModeTree modeTree = new ModeHierarchyValidator(diagnostics)
                .validate(document.nodesOf(ModeDeclaration.class));
        return new Pipeline(source, document, modeTree);
    }

    /**
     * Resolves one include and analyzes its content with a copy of the current definitions.
     * Definitions made by the included file flow back to the includer; its diagnostics are re-anchored
     * to the include directive. A path and tag already on {@code chain} form a cycle and are not
     * entered again.
     *
     * @return whether the include target was found
     */
    private boolean include(String path, String tag, SourceRange range, FileType parentType, SymbolTable symbols,
            List<String> chain, IncludeResolver resolver, DiagnosticCollector diagnostics) {
        String target = tag == null ? path : path + " <" + tag + ">";
        if (chain.contains(target)) {
            diagnostics.report(DiagnosticCode.INCLUDE_CYCLE_DETECTED, range,
                    "Include cycle: '" + target + "' is already being included ("
                            + String.join(" -> ", chain) + " -> " + target + ")");
            return true;
        }

        Optional<String> content;
        try {
            content = resolver.resolve(path, tag);
        } catch (IncludeResolutionException e) {
            logger.warn("Include resolution failed for '{}': {}", path, e.getMessage());
            content = Optional.empty();
        }
        if (content.isEmpty()) {
            diagnostics.report(DiagnosticCode.INCLUDE_NOT_FOUND, range, "Could not resolve include '" + path + "'");
            return false;
        }

        if (chain.size() + 1 > properties.maxIncludeDepth()) {
            diagnostics.report(DiagnosticCode.INCLUDE_CYCLE_DETECTED, range,
                    "Include depth limit of " + properties.maxIncludeDepth() + " exceeded at '" + path
                            + "'; the include chain is probably cyclic");
            return true;
        }

        String text = content.get();
        int firstLine = 0;
        if (tag != null) {
            Optional<TagSlicer.Slice> slice = TagSlicer.slice(text, tag);
            if (slice.isEmpty()) {
                diagnostics.report(DiagnosticCode.INCLUDE_TAG_NOT_FOUND, range,
                        "Tag <" + tag + "> not found in '" + path + "'");
                return true;
            }
            text = slice.get().content();
            firstLine = slice.get().firstLine();
        }

        FileType childType = FileType.fromPath(path);
        if (childType == FileType.TEMPLATE) {
            childType = parentType;
        }
        List<String> childChain = new ArrayList<>(chain);
        childChain.add(target);
        logger.debug("Entering include '{}' at depth {} as {}", path, childChain.size(), childType);

        SymbolTable childSymbols = symbols.copy();
        DiagnosticCollector childDiagnostics = new DiagnosticCollector();
        run(text, childType, childSymbols, List.copyOf(childChain), resolver, childDiagnostics);
        symbols.mergeFrom(childSymbols);

        for (Diagnostic diagnostic : childDiagnostics.diagnostics()) {
            diagnostics.add(reanchor(diagnostic, path, firstLine, range));
        }
        return true;
    }

    private static Diagnostic reanchor(Diagnostic diagnostic, String path, int firstLine, SourceRange range) {
        String message = diagnostic.message();
        if (!message.startsWith("In included file ")) {
            int line = diagnostic.range().startLine() + firstLine + 1;
            message = "In included file '" + path + "' at line " + line + ": " + message;
        }
        return new Diagnostic(diagnostic.severity(), diagnostic.code(), message, range, null);
    }
}
