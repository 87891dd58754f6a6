package com.moosivp.analyzer.lexer;

public enum TokenKind {
    IDENTIFIER,
    INTEGER,
    FLOAT,
    BOOLEAN,
    QUOTED_STRING,
    OPERATOR,
    DIRECTIVE,
    VARIABLE,
    COMMENT,
    NEWLINE,
    WHITESPACE;

    public boolean isPrimitive() {
        return this == INTEGER || this == FLOAT || this == BOOLEAN;
    }

    public boolean isWord() {
        return this == IDENTIFIER || isPrimitive();
    }
}
