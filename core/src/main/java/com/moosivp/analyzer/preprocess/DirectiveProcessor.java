package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.lexer.SourceLine;
import com.moosivp.analyzer.lexer.SourcePosition;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;
import com.moosivp.analyzer.lexer.Tokenizer;
import com.moosivp.analyzer.model.FileType;
import com.moosivp.analyzer.tree.IncludeDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The NSPlug directive machine. Walks the token stream line by line, keeps the stack of open
 * conditionals, binds definitions, hands includes to an {@link IncludeHandler} and decides which
 * lines stay active.
 *
 * <p>Suppressed lines are still scanned for directives so that nesting stays balanced. A conditional
 * opened inside a suppressed region is pushed without evaluating its condition.
 */
public final class DirectiveProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DirectiveProcessor.class);

    private final FileType fileType;
    private final SymbolTable symbols;
    private final VariableSubstitution substitution;
    private final DiagnosticCollector diagnostics;
    private final IncludeHandler includeHandler;

    private final Deque<ConditionalFrame> frames = new ArrayDeque<>();
    private final List<SourceLine> activeLines = new ArrayList<>();
    private final List<IncludeDirective> includes = new ArrayList<>();
    private final List<ConditionalRegion> regions = new ArrayList<>();
    private final SortedSet<Integer> inactiveLines = new TreeSet<>();

    public DirectiveProcessor(FileType fileType, SymbolTable symbols, VariableSubstitution substitution,
            DiagnosticCollector diagnostics, IncludeHandler includeHandler) {
        this.fileType = fileType;
        this.symbols = symbols;
        this.substitution = substitution;
        this.diagnostics = diagnostics;
        this.includeHandler = includeHandler == null ? IncludeHandler.NONE : includeHandler;
    }

    public PreprocessedSource process(Tokenizer tokenizer) {
        List<Token> tokens = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int line = 0;
        for (Token token : tokenizer) {
            tokens.add(token);
            if (token.is(TokenKind.NEWLINE)) {
                processLine(new SourceLine(line, current));
                current = new ArrayList<>();
                line++;
            } else {
                current.add(token);
            }
        }
        processLine(new SourceLine(line, current));

        SourcePosition end = tokenizer.endOfInput();
        if (!frames.isEmpty()) {
            ConditionalFrame outermost = frames.getLast();
            diagnostics.reportPaired(
                    DiagnosticCode.UNTERMINATED_CONDITIONAL, SourceRange.at(end),
                    "Missing #endif: " + frames.size() + " conditional(s) still open at end of file",
                    DiagnosticCode.UNTERMINATED_CONDITIONAL_ORIGIN, outermost.openRange(),
                    "This conditional is never closed");
        }

        logger.debug("Directive pass: {} lines, {} active, {} inactive, {} includes, {} regions",
                line + 1, activeLines.size(), inactiveLines.size(), includes.size(), regions.size());
        return new PreprocessedSource(tokens, activeLines, includes, regions, inactiveLines, end);
    }

    private boolean isActive() {
        return frames.isEmpty() || frames.peek().isActive();
    }

    private void processLine(SourceLine line) {
        List<Token> tokens = line.tokens();
        int directiveIndex = directiveIndex(tokens);
        if (directiveIndex >= 0) {
            processDirective(line, tokens.get(directiveIndex), tokens.subList(directiveIndex + 1, tokens.size()));
            return;
        }
        if (!isActive()) {
            inactiveLines.add(line.line());
            return;
        }
        reportIncomplete(tokens);
        SourceLine substituted = new SourceLine(line.line(), substitution.substitute(tokens));
        if (fileType.allowsMissionConstructs()) {
            bindMissionDefine(substituted);
        }
        activeLines.add(substituted);
    }

    private static int directiveIndex(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenKind.DIRECTIVE)) {
                return i;
            }
            if (!token.is(TokenKind.WHITESPACE)) {
                return -1;
            }
        }
        return -1;
    }

    private void processDirective(SourceLine line, Token directive, List<Token> rest) {
        String keyword = directive.text().substring(1).trim();
        Optional<DirectiveKind> kind = DirectiveKind.fromKeyword(keyword);
        boolean structural = kind.isPresent()
                && (kind.get() == DirectiveKind.ELSEIFDEF || kind.get() == DirectiveKind.ENDIF);
        boolean lineActive = structural ? frames.isEmpty() || frames.peek().parentActive() : isActive();
        if (!lineActive) {
            inactiveLines.add(line.line());
        } else {
            reportIncomplete(rest);
        }

        if (kind.isEmpty()) {
            String message = keyword.isEmpty()
                    ? "Expected a directive name after '#'"
                    : "Unknown directive '#" + keyword + "'";
            diagnostics.report(DiagnosticCode.UNKNOWN_DIRECTIVE, directive.range(), message);
            return;
        }

        List<Token> arguments = significant(rest);
        SourceRange lineRange = line.contentRange();
        switch (kind.get()) {
            case DEFINE -> define(directive, rest, arguments, lineActive);
            case INCLUDE -> include(directive, rest, arguments, lineRange, lineActive);
            case IFDEF -> ifdef(directive, arguments);
            case IFNDEF -> ifndef(directive, arguments);
            case ELSEIFDEF -> elseifdef(directive, arguments);
            case ENDIF -> endif(line, directive, arguments);
            default -> throw new IllegalStateException("Unhandled directive " + kind.get());
        }
    }

    private void define(Token directive, List<Token> rest, List<Token> arguments, boolean active) {
        if (arguments.isEmpty() || !arguments.get(0).kind().isWord()) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE, directive.range(),
                    "Expected a variable name after #define");
            return;
        }
        if (!active) {
            return;
        }
        Token name = arguments.get(0);
        List<Token> valueTokens = rest.subList(rest.indexOf(name) + 1, rest.size());
        String value = joinText(substitution.substitute(valueTokens)).trim();
        bind(name.text(), value, name.range());
    }

    private void include(Token directive, List<Token> rest, List<Token> arguments, SourceRange lineRange,
            boolean active) {
        if (arguments.isEmpty()) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE, directive.range(),
                    "Expected a path after #include");
            return;
        }
        List<Token> pathTokens = firstRun(rest);
        List<Token> remaining = significant(rest.subList(rest.indexOf(pathTokens.get(pathTokens.size() - 1)) + 1,
                rest.size()));
        String tag = null;
        if (!remaining.isEmpty()) {
            if (remaining.size() == 3 && remaining.get(0).isOperator("<") && remaining.get(1).kind().isWord()
                    && remaining.get(2).isOperator(">")) {
                tag = remaining.get(1).text();
            } else {
                diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE,
                        remaining.get(0).range().to(remaining.get(remaining.size() - 1).range()),
                        "Unexpected text after include path; expected an optional <TAG>");
            }
        }
        if (!active) {
            return;
        }

        SourceRange pathRange = pathTokens.get(0).range().to(pathTokens.get(pathTokens.size() - 1).range());
        String path = unquote(joinText(substitution.substitute(pathTokens)).trim());
        boolean resolved = includeHandler.include(path, tag, lineRange);
        includes.add(new IncludeDirective(path, tag, resolved, pathRange, lineRange));
        logger.debug("Include '{}' <{}> resolved={}", path, tag, resolved);
    }

    private void ifdef(Token directive, List<Token> arguments) {
        boolean parentActive = isActive();
        boolean condition = parseCondition(directive, arguments, parentActive);
        frames.push(ConditionalFrame.open(DirectiveKind.IFDEF, condition, parentActive, directive.range()));
    }

    private void ifndef(Token directive, List<Token> arguments) {
        boolean parentActive = isActive();
        boolean condition = false;
        if (arguments.isEmpty()) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE, directive.range(),
                    "Expected a variable name after #ifndef");
        } else if (arguments.stream().anyMatch(token -> token.is(TokenKind.OPERATOR))) {
            Token operator = arguments.stream().filter(token -> token.is(TokenKind.OPERATOR)).findFirst().get();
            diagnostics.report(DiagnosticCode.INVALID_IFNDEF_OPERATOR, operator.range(),
                    "#ifndef accepts a single variable name; operator '" + operator.text() + "' is not allowed");
        } else if (arguments.size() > 1) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE,
                    arguments.get(1).range().to(arguments.get(arguments.size() - 1).range()),
                    "#ifndef accepts a single variable name");
        } else if (parentActive) {
            Token name = substitution.substitute(arguments.get(0));
            condition = !symbols.isDefined(name.text());
        }
        frames.push(ConditionalFrame.open(DirectiveKind.IFNDEF, condition, parentActive, directive.range()));
    }

    private void elseifdef(Token directive, List<Token> arguments) {
        if (frames.isEmpty()) {
            diagnostics.report(DiagnosticCode.MISPLACED_ELSE_IF_DEF, directive.range(),
                    "#elseifdef without a matching #ifdef");
            return;
        }
        ConditionalFrame top = frames.peek();
        if (top.kind() == DirectiveKind.IFNDEF) {
            diagnostics.report(DiagnosticCode.ELSE_IF_NDEF_UNSUPPORTED, directive.range(),
                    "#elseifdef cannot follow #ifndef");
            return;
        }
        if (!top.canElseIf()) {
            diagnostics.report(DiagnosticCode.MISPLACED_ELSE_IF_DEF, directive.range(),
                    "Only one #elseifdef is allowed per #ifdef");
            return;
        }
        boolean condition = parseCondition(directive, arguments, top.elseIfReachable());
        frames.pop();
        frames.push(top.elseIf(condition));
    }

    private void endif(SourceLine line, Token directive, List<Token> arguments) {
        if (!arguments.isEmpty()) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE,
                    arguments.get(0).range().to(arguments.get(arguments.size() - 1).range()),
                    "#endif takes no arguments");
        }
        if (frames.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNMATCHED_ENDIF, directive.range(), "#endif without a matching #ifdef");
            return;
        }
        ConditionalFrame closed = frames.pop();
        regions.add(new ConditionalRegion(closed.openRange().startLine(), line.line()));
    }

    /**
     * Checks the syntax of an {@code #ifdef}/{@code #elseifdef} condition and, when {@code evaluate}
     * is set, evaluates it. Clauses are {@code NAME [VALUE]} joined by either {@code &&} or
     * {@code ||}; a condition mixing both is reported and evaluates to false.
     */
    private boolean parseCondition(Token directive, List<Token> arguments, boolean evaluate) {
        if (arguments.isEmpty()) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE, directive.range(),
                    "Expected a condition after " + directive.text().replace(" ", "").replace("\t", ""));
            return false;
        }
        List<List<Token>> clauses = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        boolean and = false;
        boolean or = false;
        for (Token token : arguments) {
            if (token.isOperator("&&") || token.isOperator("||")) {
                and |= token.isOperator("&&");
                or |= token.isOperator("||");
                clauses.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        clauses.add(current);

        if (and && or) {
            diagnostics.report(DiagnosticCode.MIXED_CONDITIONAL_OPERATORS,
                    arguments.get(0).range().to(arguments.get(arguments.size() - 1).range()),
                    "Cannot mix '&&' and '||' in one condition");
            return false;
        }
        if (clauses.stream().anyMatch(List::isEmpty)) {
            diagnostics.report(DiagnosticCode.MALFORMED_DIRECTIVE,
                    arguments.get(0).range().to(arguments.get(arguments.size() - 1).range()),
                    "Empty clause in condition");
            return false;
        }
        if (!evaluate) {
            return false;
        }
        if (or) {
            return clauses.stream().anyMatch(this::evaluateClause);
        }
        return clauses.stream().allMatch(this::evaluateClause);
    }

    private boolean evaluateClause(List<Token> clause) {
        List<Token> substituted = substitution.substitute(clause);
        String name = substituted.get(0).text();
        Optional<String> value = symbols.lookup(name);
        if (value.isEmpty()) {
            return false;
        }
        if (substituted.size() == 1) {
            return true;
        }
        return value.get().equals(joinSpaced(substituted.subList(1, substituted.size())));
    }

    /**
     * Binds a mission-file {@code define: NAME = VALUE} line. Lines of any other shape are left to
     * the grammar parser.
     */
    private void bindMissionDefine(SourceLine line) {
        List<Token> tokens = line.significant();
        int index;
        if (!tokens.isEmpty() && tokens.get(0).text().equalsIgnoreCase("define:")) {
            index = 1;
        } else if (tokens.size() > 1 && tokens.get(0).text().equalsIgnoreCase("define")
                && tokens.get(1).text().equals(":")) {
            index = 2;
        } else {
            return;
        }
        if (tokens.size() < index + 2 || !tokens.get(index).kind().isWord() || !tokens.get(index + 1).isOperator("=")) {
            return;
        }
        Token name = tokens.get(index);
        Token equals = tokens.get(index + 1);
        List<Token> all = line.tokens();
        String value = joinText(withoutComments(all.subList(all.indexOf(equals) + 1, all.size()))).trim();
        bind(name.text(), value, name.range());
    }

    private void bind(String name, String value, SourceRange range) {
        Optional<String> previous = symbols.define(name, value);
        if (previous.isPresent()) {
            diagnostics.report(DiagnosticCode.VARIABLE_REDEFINED, range,
                    "Variable '" + name + "' redefined (previous value '" + previous.get() + "')");
        }
    }

    private void reportIncomplete(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.complete()) {
                continue;
            }
            if (token.is(TokenKind.QUOTED_STRING)) {
                diagnostics.report(DiagnosticCode.UNTERMINATED_QUOTE, token.range(), "Missing closing '\"'");
            } else if (token.is(TokenKind.VARIABLE)) {
                char closer = token.raw().charAt(1) == '{' ? '}' : ')';
                diagnostics.report(DiagnosticCode.UNTERMINATED_VARIABLE, token.range(),
                        "Missing closing '" + closer + "' in variable reference");
            }
        }
    }

    private static List<Token> significant(List<Token> tokens) {
        return tokens.stream().filter(token -> !token.isTrivia()).collect(Collectors.toList());
    }

    private static List<Token> withoutComments(List<Token> tokens) {
        return tokens.stream().filter(token -> !token.is(TokenKind.COMMENT)).collect(Collectors.toList());
    }

    /** The first run of tokens not interrupted by whitespace. */
    private static List<Token> firstRun(List<Token> tokens) {
        List<Token> run = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isTrivia()) {
                if (!run.isEmpty()) {
                    break;
                }
                continue;
            }
            run.add(token);
        }
        return run;
    }

    private static String joinText(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    /** Joins significant tokens, restoring a single blank wherever the source had whitespace. */
    private static String joinSpaced(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && previous.range().end().offset() < token.range().start().offset()) {
                sb.append(' ');
            }
            sb.append(token.text());
            previous = token;
        }
        return sb.toString();
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
