package com.moosivp.analyzer.dto;

public enum CompletionContext {
    DIRECTIVE,
    INCLUDE_PATH,
    VARIABLE,
    NONE
}
