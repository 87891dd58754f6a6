package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;

public record ProcessConfigBlock(
        String appName,
        List<BlockEntry> entries,
        SourceRange headerRange,
        SourceRange closeRange,
        SourceRange range) implements ConfigBlock {

    public ProcessConfigBlock {
        entries = List.copyOf(entries);
    }

    @Override
    public String name() {
        return appName;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROCESS_CONFIG;
    }
}
