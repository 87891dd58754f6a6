package com.moosivp.analyzer.mode;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;

/**
 * @param path       colon-joined values from the root, e.g. {@code ACTIVE:SURVEYING}
 * @param realizable whether some assignment of conditions can leave the mode at this node
 * @param range      the declaration that introduced the node
 */
public record ModeNode(
        String modeVariable,
        String value,
        String path,
        List<ModeNode> children,
        boolean realizable,
        SourceRange range) {

    public ModeNode {
        children = List.copyOf(children);
    }

    public boolean isRoot() {
        return !path.contains(":");
    }
}
