package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

public record Parameter(String key, Value value, SourceRange keyRange, SourceRange range) implements BlockEntry {

    @Override
    public String name() {
        return key;
    }

    @Override
    public boolean isMarker() {
        return false;
    }
}
