package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * Called by the {@link DirectiveProcessor} for each active {@code #include}.
 */
@FunctionalInterface
public interface IncludeHandler {

    IncludeHandler NONE = (path, tag, range) -> false;

    /**
     * @param tag   the tag without angle brackets, or {@code null}
     * @param range range of the whole directive line
     * @return whether the path resolved to content
     */
    boolean include(String path, String tag, SourceRange range);
}
