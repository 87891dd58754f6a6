package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * A bare {@code [name]} line inside a block.
 */
public record SectionMarker(String name, SourceRange range) implements BlockEntry {

    @Override
    public boolean isMarker() {
        return true;
    }
}
