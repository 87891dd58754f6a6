package com.moosivp.analyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SemanticToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {
    public static final String INACTIVE = "inactive";

    public enum TokenType {
        KEYWORD,
        DIRECTIVE,
        VARIABLE,
        IDENTIFIER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        BOOLEAN_LITERAL,
        COMMENT,
        OPERATOR,
        PUNCTUATION,
        ERROR
    }
}
