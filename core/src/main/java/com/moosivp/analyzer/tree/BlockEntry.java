package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * A line inside a {@code ProcessConfig} or {@code Behavior} block.
 */
public interface BlockEntry {

    String name();

    SourceRange range();

    boolean isMarker();
}
