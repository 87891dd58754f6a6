package com.moosivp.analyzer.dto;

public record FoldingRange(int startLine, int endLine, Kind kind) {

    public enum Kind {
        BLOCK,
        MODE,
        CONDITIONAL
    }
}
