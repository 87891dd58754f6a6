package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.Optional;

/**
 * {@code #include PATH [<TAG>]} after substitution of the path.
 */
public record IncludeDirective(String path, String tag, boolean resolved, SourceRange pathRange, SourceRange range)
        implements Node {

    public Optional<String> includeTag() {
        return Optional.ofNullable(tag);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INCLUDE;
    }
}
