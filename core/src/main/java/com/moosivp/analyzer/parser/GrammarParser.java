package com.moosivp.analyzer.parser;

import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.lexer.SourceLine;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;
import com.moosivp.analyzer.model.FileType;
import com.moosivp.analyzer.tree.Assignment;
import com.moosivp.analyzer.tree.BehaviorBlock;
import com.moosivp.analyzer.tree.BlockEntry;
import com.moosivp.analyzer.tree.ConditionExpression;
import com.moosivp.analyzer.tree.ConfigBlock;
import com.moosivp.analyzer.tree.DefineStatement;
import com.moosivp.analyzer.tree.Document;
import com.moosivp.analyzer.tree.IncludeDirective;
import com.moosivp.analyzer.tree.InitializeStatement;
import com.moosivp.analyzer.tree.ModeDeclaration;
import com.moosivp.analyzer.tree.Node;
import com.moosivp.analyzer.tree.Parameter;
import com.moosivp.analyzer.tree.ProcessConfigBlock;
import com.moosivp.analyzer.tree.SectionMarker;
import com.moosivp.analyzer.tree.Value;
import com.moosivp.analyzer.tree.VectorLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the {@link Document} of a mission, behavior or template file from its active, substituted
 * lines.
 *
 * <p>The parser never stops at an error. A run of lines it cannot place is reported once, and parsing
 * resumes at the next line that starts a statement or after a gap in line numbers left by a
 * directive or a suppressed region. A parser instance is used for one document only.
 */
public final class GrammarParser {

    private static final Logger logger = LoggerFactory.getLogger(GrammarParser.class);

    private enum Statement {
        ASSIGNMENT,
        DEFINE,
        PROCESS_CONFIG,
        BEHAVIOR,
        MODE,
        INITIALIZE,
        UNKNOWN
    }

    private final FileType fileType;
    private final DiagnosticCollector diagnostics;

    private List<SourceLine> lines;
    private int cursor;

    public GrammarParser(FileType fileType, DiagnosticCollector diagnostics) {
        this.fileType = fileType;
        this.diagnostics = diagnostics;
    }

    public Document parse(List<SourceLine> activeLines, List<IncludeDirective> includes) {
        lines = new ArrayList<>(activeLines);
        cursor = 0;
        List<Node> nodes = new ArrayList<>(includes);

        while (cursor < lines.size()) {
            SourceLine line = lines.get(cursor);
            if (line.isBlank()) {
                cursor++;
                continue;
            }
            Statement statement = classify(line);
            switch (statement) {
                case ASSIGNMENT -> {
                    cursor++;
                    nodes.add(assignment(line));
                }
                case DEFINE -> {
                    cursor++;
                    Optional<DefineStatement> define = define(line);
                    if (define.isPresent() && allowed(statement, define.get().range())) {
                        nodes.add(define.get());
                    }
                }
                case INITIALIZE -> {
                    cursor++;
                    InitializeStatement initialize = initialize(line);
                    if (allowed(statement, initialize.range())) {
                        nodes.add(initialize);
                    }
                }
                case PROCESS_CONFIG, BEHAVIOR -> {
                    ConfigBlock block = block(statement);
                    if (allowed(statement, block.headerRange())) {
                        nodes.add(block);
                    }
                }
                case MODE -> {
                    ModeDeclaration mode = mode();
                    if (allowed(statement, mode.headerRange())) {
                        nodes.add(mode);
                    }
                }
                default -> skipUnrecognized();
            }
        }

        nodes.sort(Comparator.comparingInt(node -> node.range().start().offset()));
        logger.debug("Parsed {} top-level nodes from {} active lines", nodes.size(), lines.size());
        return new Document(nodes);
    }

    private Statement classify(SourceLine line) {
        List<Token> sig = line.significant();
        if (sig.isEmpty()) {
            return Statement.UNKNOWN;
        }
        String first = sig.get(0).text();
        boolean secondIsEquals = sig.size() > 1 && sig.get(1).isOperator("=");
        if (secondIsEquals && first.equalsIgnoreCase("ProcessConfig")) {
            return Statement.PROCESS_CONFIG;
        }
        if (secondIsEquals && first.equalsIgnoreCase("Behavior")) {
            return Statement.BEHAVIOR;
        }
        if (sig.size() > 2 && first.equalsIgnoreCase("Set") && sig.get(1).kind().isWord()
                && sig.get(2).isOperator("=")) {
            return Statement.MODE;
        }
        if (!secondIsEquals && (first.equalsIgnoreCase("initialize") || first.equalsIgnoreCase("initialize_"))) {
            return Statement.INITIALIZE;
        }
        if (first.equalsIgnoreCase("define:")
                || (first.equalsIgnoreCase("define") && sig.size() > 1 && sig.get(1).text().equals(":"))) {
            return Statement.DEFINE;
        }
        if (secondIsEquals && (sig.get(0).kind().isWord() || sig.get(0).is(TokenKind.VARIABLE))) {
            return Statement.ASSIGNMENT;
        }
        return Statement.UNKNOWN;
    }

    private boolean isBlockStart(SourceLine line) {
        Statement statement = classify(line);
        return statement == Statement.PROCESS_CONFIG || statement == Statement.BEHAVIOR
                || statement == Statement.MODE;
    }

    private boolean allowed(Statement statement, SourceRange range) {
        boolean allowed = switch (statement) {
            case DEFINE, PROCESS_CONFIG -> fileType.allowsMissionConstructs();
            case BEHAVIOR, MODE, INITIALIZE -> fileType.allowsBehaviorConstructs();
            default -> true;
        };
        if (!allowed) {
            diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, range,
                    "'" + describe(statement) + "' is not allowed in "
                            + fileType.name().toLowerCase(Locale.ROOT) + " files");
        }
        return allowed;
    }

    private static String describe(Statement statement) {
        return switch (statement) {
            case DEFINE -> "define:";
            case PROCESS_CONFIG -> "ProcessConfig";
            case BEHAVIOR -> "Behavior";
            case MODE -> "Set";
            case INITIALIZE -> "initialize";
            default -> statement.name();
        };
    }

    private Assignment assignment(SourceLine line) {
        List<Token> sig = line.significant();
        Token name = sig.get(0);
        return new Assignment(name.text(), valueAfter(line, sig.get(1)), name.range(), line.contentRange());
    }

    private Optional<DefineStatement> define(SourceLine line) {
        List<Token> sig = line.significant();
        int index = sig.get(0).text().equalsIgnoreCase("define:") ? 1 : 2;
        if (sig.size() < index + 2 || !sig.get(index).kind().isWord() || !sig.get(index + 1).isOperator("=")) {
            diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, line.contentRange(),
                    "Expected 'define: NAME = VALUE'");
            return Optional.empty();
        }
        Token name = sig.get(index);
        return Optional.of(new DefineStatement(name.text(), valueAfter(line, sig.get(index + 1)), name.range(),
                line.contentRange()));
    }

    private InitializeStatement initialize(SourceLine line) {
        List<Token> tokens = line.tokens();
        Token keyword = line.significant().get(0);
        boolean deferred = keyword.text().endsWith("_");
        List<Parameter> pairs = new ArrayList<>();
        for (List<Token> part : splitTopLevel(tokens.subList(tokens.indexOf(keyword) + 1, tokens.size()))) {
            List<Token> sig = part.stream().filter(token -> !token.isTrivia()).collect(Collectors.toList());
            if (sig.isEmpty()) {
                continue;
            }
            int equals = TokenText.indexOfOperator(sig, "=");
            if (equals <= 0) {
                diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, TokenText.range(sig),
                        "Expected 'name = value' in " + keyword.text());
                continue;
            }
            List<Token> keyTokens = sig.subList(0, equals);
            List<Token> valueTokens = part.subList(part.indexOf(sig.get(equals)) + 1, part.size());
            Value value = value(valueTokens, sig.get(equals));
            pairs.add(new Parameter(TokenText.spaced(keyTokens), value, TokenText.range(keyTokens),
                    TokenText.range(sig)));
        }
        return new InitializeStatement(deferred, pairs, line.contentRange());
    }

    /** Splits on commas outside brackets, braces and parentheses. */
    private static List<List<Token>> splitTopLevel(List<Token> tokens) {
        List<List<Token>> parts = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token token : tokens) {
            if (token.is(TokenKind.OPERATOR)) {
                switch (token.text()) {
                    case "[", "{", "(" -> depth++;
                    case "]", "}", ")" -> depth = Math.max(0, depth - 1);
                    default -> {
                    }
                }
                if (depth == 0 && token.isOperator(",")) {
                    parts.add(current);
                    current = new ArrayList<>();
                    continue;
                }
            }
            current.add(token);
        }
        parts.add(current);
        return parts;
    }

    private ConfigBlock block(Statement statement) {
        SourceLine header = lines.get(cursor++);
        List<Token> sig = header.significant();
        String keyword = sig.get(0).text();
        boolean braceOnHeader = sig.size() > 2 && sig.get(sig.size() - 1).isOperator("{");
        String name = TokenText.spaced(sig.subList(2, braceOnHeader ? sig.size() - 1 : sig.size()));
        SourceRange headerRange = header.contentRange();
        if (name.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, headerRange,
                    "Expected a name after '" + keyword + " ='");
        }
        if (!braceOnHeader && !openBrace()) {
            diagnostics.report(DiagnosticCode.MISSING_OPEN_BRACE, headerRange,
                    "Expected '{' after '" + keyword + " = " + name + "'");
        }

        List<BlockEntry> entries = new ArrayList<>();
        UnrecognizedRun run = new UnrecognizedRun("Expected 'key = value' or '[section]' inside " + keyword);
        SourceRange closeRange = null;
        SourceRange end = headerRange;
        while (cursor < lines.size()) {
            SourceLine line = lines.get(cursor);
            if (line.isBlank()) {
                run.touch(line);
                cursor++;
                continue;
            }
            List<Token> body = line.significant();
            if (body.get(0).isOperator("}")) {
                closeRange = body.get(0).range();
                end = closeRange;
                cursor++;
                break;
            }
            if (isBlockStart(line)) {
                break;
            }
            Optional<BlockEntry> entry = blockEntry(line);
            if (entry.isPresent()) {
                run.flush();
                entries.add(entry.get());
            } else {
                run.add(line);
            }
            end = line.contentRange();
            cursor++;
        }
        run.flush();
        if (closeRange == null) {
            diagnostics.report(DiagnosticCode.MISSING_CLOSE_BRACE, headerRange,
                    "Block '" + keyword + " = " + name + "' is not closed with '}'");
        }

        SourceRange range = headerRange.to(end);
        if (statement == Statement.PROCESS_CONFIG) {
            return new ProcessConfigBlock(name, entries, headerRange, closeRange, range);
        }
        return new BehaviorBlock(name, entries, headerRange, closeRange, range);
    }

    private Optional<BlockEntry> blockEntry(SourceLine line) {
        List<Token> sig = line.significant();
        if (sig.size() >= 3 && sig.get(0).isOperator("[") && sig.get(sig.size() - 1).isOperator("]")
                && TokenText.indexOfOperator(sig, "{") < 0) {
            return Optional.of(new SectionMarker(TokenText.spaced(sig.subList(1, sig.size() - 1)),
                    line.contentRange()));
        }
        int equals = TokenText.indexOfOperator(sig, "=");
        if (equals <= 0) {
            return Optional.empty();
        }
        List<Token> keyTokens = sig.subList(0, equals);
        return Optional.of(new Parameter(TokenText.spaced(keyTokens), valueAfter(line, sig.get(equals)),
                TokenText.range(keyTokens), line.contentRange()));
    }

    /**
     * Parses a {@code Set} declaration. The body may follow the header on the same line, as in
     * {@code Set MODE = B { MODE = A } C}, or span the following lines.
     */
    private ModeDeclaration mode() {
        SourceLine header = lines.get(cursor++);
        List<Token> sig = header.significant();
        String variable = sig.get(1).text();
        int open = TokenText.indexOfOperator(sig, "{");
        String value = TokenText.spaced(sig.subList(3, open < 0 ? sig.size() : open));
        SourceRange headerRange = header.contentRange();
        if (value.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, headerRange,
                    "Expected a mode value after 'Set " + variable + " ='");
        }

        List<List<Token>> body = new ArrayList<>();
        String elseValue = null;
        boolean closed = false;
        SourceRange end = headerRange;
        if (open >= 0) {
            List<Token> rest = sig.subList(open + 1, sig.size());
            int close = TokenText.indexOfOperator(rest, "}");
            List<Token> inline = close < 0 ? rest : rest.subList(0, close);
            if (!inline.isEmpty()) {
                body.add(inline);
            }
            if (close >= 0) {
                closed = true;
                if (close + 1 < rest.size()) {
                    elseValue = TokenText.spaced(rest.subList(close + 1, rest.size()));
                }
            }
        } else if (!openBrace()) {
            diagnostics.report(DiagnosticCode.MISSING_OPEN_BRACE, headerRange,
                    "Expected '{' after 'Set " + variable + " = " + value + "'");
        }

        while (!closed && cursor < lines.size()) {
            SourceLine line = lines.get(cursor);
            if (line.isBlank()) {
                cursor++;
                continue;
            }
            List<Token> tokens = line.significant();
            if (tokens.get(0).isOperator("}")) {
                closed = true;
                end = line.contentRange();
                if (tokens.size() > 1) {
                    elseValue = TokenText.spaced(tokens.subList(1, tokens.size()));
                }
                cursor++;
                break;
            }
            if (isBlockStart(line)) {
                break;
            }
            body.add(tokens);
            end = line.contentRange();
            cursor++;
        }
        if (!closed) {
            diagnostics.report(DiagnosticCode.MISSING_CLOSE_BRACE, headerRange,
                    "Mode declaration 'Set " + variable + " = " + value + "' is not closed with '}'");
        }

        String parentValue = null;
        SourceRange parentRange = null;
        List<ConditionExpression> conditions = new ArrayList<>();
        for (List<Token> entry : body) {
            boolean parentBinding = entry.size() > 2 && entry.get(0).text().equals(variable)
                    && (entry.get(1).isOperator("=") || entry.get(1).isOperator("=="));
            if (parentBinding && parentValue == null) {
                List<Token> parentTokens = entry.subList(2, entry.size());
                parentValue = TokenText.spaced(parentTokens);
                parentRange = TokenText.range(parentTokens);
            } else {
                conditions.add(new ConditionExpression(TokenText.spaced(entry), TokenText.range(entry)));
            }
        }
        return new ModeDeclaration(variable, value, parentValue, conditions, elseValue, headerRange, parentRange,
                headerRange.to(end));
    }

    /**
     * Consumes the opening brace of a block from the next non-blank line. Content following the
     * brace on that line is left in place as the first body line.
     */
    private boolean openBrace() {
        int next = cursor;
        while (next < lines.size() && lines.get(next).isBlank()) {
            next++;
        }
        if (next >= lines.size()) {
            return false;
        }
        SourceLine line = lines.get(next);
        List<Token> sig = line.significant();
        if (!sig.get(0).isOperator("{")) {
            return false;
        }
        List<Token> tokens = line.tokens();
        lines.set(next, new SourceLine(line.line(), tokens.subList(tokens.indexOf(sig.get(0)) + 1, tokens.size())));
        cursor = next;
        return true;
    }

    private void skipUnrecognized() {
        UnrecognizedRun run = new UnrecognizedRun("Unrecognized construct");
        run.add(lines.get(cursor++));
        while (cursor < lines.size()) {
            SourceLine line = lines.get(cursor);
            if (line.isBlank()) {
                run.touch(line);
                cursor++;
                continue;
            }
            if (classify(line) != Statement.UNKNOWN || run.isGap(line)) {
                break;
            }
            run.add(line);
            cursor++;
        }
        run.flush();
    }

    private Value valueAfter(SourceLine line, Token equals) {
        List<Token> tokens = line.tokens();
        return value(tokens.subList(tokens.indexOf(equals) + 1, tokens.size()), equals);
    }

    private Value value(List<Token> tokens, Token equals) {
        List<Token> sig = tokens.stream().filter(token -> !token.isTrivia()).collect(Collectors.toList());
        SourceRange range = sig.isEmpty() ? SourceRange.at(equals.range().end()) : TokenText.range(sig);
        Value value = Value.of(TokenText.of(tokens), range);
        Optional<VectorLiteral> vector = value.asVector();
        if (vector.isPresent() && !vector.get().matchesDimensions()) {
            VectorLiteral literal = vector.get();
            String declared = literal.columns() == 1
                    ? "[" + literal.rows() + "]"
                    : "[" + literal.rows() + "x" + literal.columns() + "]";
            diagnostics.report(DiagnosticCode.VECTOR_DIMENSION_MISMATCH, range,
                    "Vector declared as " + declared + " expects " + literal.expectedSize()
                            + " elements but has " + literal.elements().size());
        }
        return value;
    }

    /** Consecutive lines that fit no rule, reported as one diagnostic. */
    private final class UnrecognizedRun {

        private final String message;
        private SourceRange range;
        private int lastLine = -1;

        UnrecognizedRun(String message) {
            this.message = message;
        }

        void add(SourceLine line) {
            if (range != null && isGap(line)) {
                flush();
            }
            range = range == null ? line.contentRange() : range.to(line.contentRange());
            lastLine = line.line();
        }

        void touch(SourceLine line) {
            if (range != null) {
                lastLine = line.line();
            }
        }

        boolean isGap(SourceLine line) {
            return lastLine >= 0 && line.line() != lastLine + 1;
        }

        void flush() {
            if (range != null) {
                diagnostics.report(DiagnosticCode.UNRECOGNIZED_CONSTRUCT, range, message);
            }
            range = null;
            lastLine = -1;
        }
    }
}
