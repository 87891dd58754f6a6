package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;

/**
 * {@code initialize} or, when {@code deferred}, {@code initialize_}.
 */
public record InitializeStatement(boolean deferred, List<Parameter> pairs, SourceRange range) implements Node {

    public InitializeStatement {
        pairs = List.copyOf(pairs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INITIALIZE;
    }
}
