package com.moosivp.analyzer.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Hand-rolled lexer shared by mission, behavior and NSPlug template files.
 *
 * <p>The token sequence is lazy and restartable: every call to {@link #iterator()} scans the input
 * again from the start. The sequence is lossless, so concatenating the raw text of every token
 * reproduces the input.
 */
public final class Tokenizer implements Iterable<Token> {

    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    private static final List<String> TWO_CHAR_OPERATORS = List.of("==", "!=", "<=", ">=", "&&", "||");
    private static final String SINGLE_CHAR_OPERATORS = "={}[](),;<>!@~";

    private final String input;

    public Tokenizer(String input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    public Stream<Token> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public String input() {
        return input;
    }

    public SourcePosition endOfInput() {
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(line, input.length() - lineStart, input.length());
    }

    private final class Scanner implements Iterator<Token> {

        private int pos;
        private int line;
        private int lineStart;
        private boolean lineHasContent;
        private boolean directiveLine;

        @Override
        public boolean hasNext() {
            return pos < input.length();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            char c = input.charAt(pos);
            if (c == '\n' || (c == '\r' && peek(1) == '\n')) {
                return newLine();
            }
            if (isBlank(pos)) {
                return whitespace();
            }

            Token token;
            if (c == '#' && !lineHasContent) {
                token = directive();
            } else if (c == '/' && peek(1) == '/' && !directiveLine) {
                token = comment();
            } else if (c == '"') {
                token = quote();
            } else if (isVariableStart(pos)) {
                token = variable();
            } else if (operatorAt(pos) != null) {
                String operator = operatorAt(pos);
                int start = pos;
                pos += operator.length();
                token = Token.of(TokenKind.OPERATOR, operator, range(start, pos));
            } else {
                token = word();
            }
            lineHasContent = true;
            if (logger.isTraceEnabled()) {
                logger.trace("Token {} '{}' at {}", token.kind(), token.raw(), token.range());
            }
            return token;
        }

        private Token newLine() {
            int start = pos;
            pos += input.charAt(pos) == '\r' ? 2 : 1;
            Token token = Token.of(TokenKind.NEWLINE, input.substring(start, pos), range(start, pos));
            line++;
            lineStart = pos;
            lineHasContent = false;
            directiveLine = false;
            return token;
        }

        private Token whitespace() {
            int start = pos;
            while (pos < input.length() && isBlank(pos)) {
                pos++;
            }
            return Token.of(TokenKind.WHITESPACE, input.substring(start, pos), range(start, pos));
        }

        private Token directive() {
            int start = pos;
            pos++;
            while (pos < input.length() && (input.charAt(pos) == ' ' || input.charAt(pos) == '\t')) {
                pos++;
            }
            while (pos < input.length()
                    && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                pos++;
            }
            directiveLine = true;
            return Token.of(TokenKind.DIRECTIVE, input.substring(start, pos), range(start, pos));
        }

        private Token comment() {
            int start = pos;
            pos = endOfLine(pos);
            return Token.of(TokenKind.COMMENT, input.substring(start, pos), range(start, pos));
        }

        private Token quote() {
            int start = pos;
            int lineEnd = endOfLine(pos);
            int close = input.indexOf('"', pos + 1);
            if (close < 0 || close >= lineEnd) {
                pos = lineEnd;
                return Token.incomplete(TokenKind.QUOTED_STRING, input.substring(start, pos), range(start, pos));
            }
            pos = close + 1;
            return Token.of(TokenKind.QUOTED_STRING, input.substring(start, pos), range(start, pos));
        }

        private Token variable() {
            int start = pos;
            char closer = input.charAt(pos + 1) == '{' ? '}' : ')';
            int lineEnd = endOfLine(pos);
            int close = input.indexOf(closer, pos + 2);
            if (close < 0 || close >= lineEnd) {
                pos = lineEnd;
                return Token.incomplete(TokenKind.VARIABLE, input.substring(start, pos), range(start, pos));
            }
            pos = close + 1;
            return Token.of(TokenKind.VARIABLE, input.substring(start, pos), range(start, pos));
        }

        private Token word() {
            int start = pos;
            pos++;
            while (pos < input.length() && !endsWord(pos)) {
                pos++;
            }
            String raw = input.substring(start, pos);
            return Token.of(Primitives.classify(raw), raw, range(start, pos));
        }

        private boolean endsWord(int index) {
            char c = input.charAt(index);
            return c == '\n' || c == '\r' || c == '"' || isBlank(index)
                    || isVariableStart(index)
                    || operatorAt(index) != null
                    || (c == '/' && peekAt(index + 1) == '/' && !directiveLine);
        }

        private int endOfLine(int from) {
            int newline = input.indexOf('\n', from);
            if (newline < 0) {
                return input.length();
            }
            return newline > from && input.charAt(newline - 1) == '\r' ? newline - 1 : newline;
        }

        private boolean isBlank(int index) {
            char c = input.charAt(index);
            return c == ' ' || c == '\t' || c == '\f' || (c == '\r' && peekAt(index + 1) != '\n');
        }

        private boolean isVariableStart(int index) {
            char c = input.charAt(index);
            char next = peekAt(index + 1);
            return (c == '$' && (next == '(' || next == '{')) || (c == '%' && next == '(');
        }

        private String operatorAt(int index) {
            if (index + 1 < input.length()) {
                String pair = input.substring(index, index + 2);
                if (TWO_CHAR_OPERATORS.contains(pair)) {
                    return pair;
                }
            }
            char c = input.charAt(index);
            return SINGLE_CHAR_OPERATORS.indexOf(c) >= 0 ? String.valueOf(c) : null;
        }

        private char peek(int ahead) {
            return peekAt(pos + ahead);
        }

        private char peekAt(int index) {
            return index < input.length() ? input.charAt(index) : '\0';
        }

        private SourceRange range(int start, int end) {
            return new SourceRange(
                    new SourcePosition(line, start - lineStart, start),
                    new SourcePosition(line, end - lineStart, end));
        }
    }
}
