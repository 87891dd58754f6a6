package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

public record Assignment(String name, Value value, SourceRange nameRange, SourceRange range) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }
}
