package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;

public record BehaviorBlock(
        String behaviorType,
        List<BlockEntry> entries,
        SourceRange headerRange,
        SourceRange closeRange,
        SourceRange range) implements ConfigBlock {

    public BehaviorBlock {
        entries = List.copyOf(entries);
    }

    @Override
    public String name() {
        return behaviorType;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BEHAVIOR;
    }
}
