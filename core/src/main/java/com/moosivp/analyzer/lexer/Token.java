package com.moosivp.analyzer.lexer;

/**
 * A classified slice of the input.
 *
 * <p>{@code raw} is the text exactly as written. {@code text} is the text after variable
 * substitution and equals {@code raw} for tokens produced by the {@link Tokenizer}. {@code complete}
 * is false for a quoted string or variable reference whose closing character is missing.
 */
public record Token(TokenKind kind, String text, String raw, SourceRange range, boolean complete) {

    public static Token of(TokenKind kind, String raw, SourceRange range) {
        return new Token(kind, raw, raw, range, true);
    }

    public static Token incomplete(TokenKind kind, String raw, SourceRange range) {
        return new Token(kind, raw, raw, range, false);
    }

    public Token expandTo(TokenKind newKind, String expanded) {
        return new Token(newKind, expanded, raw, range, complete);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String operator) {
        return kind == TokenKind.OPERATOR && text.equals(operator);
    }

    public boolean isTrivia() {
        return kind == TokenKind.WHITESPACE || kind == TokenKind.NEWLINE || kind == TokenKind.COMMENT;
    }

    public boolean isSubstituted() {
        return !text.equals(raw);
    }

    public int line() {
        return range.startLine();
    }
}
