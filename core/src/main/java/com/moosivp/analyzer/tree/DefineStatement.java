package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * A mission-file {@code define: NAME = VALUE} line.
 */
public record DefineStatement(String name, Value value, SourceRange nameRange, SourceRange range) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.DEFINE;
    }
}
