package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * A top-level statement of a parsed document.
 */
public interface Node {

    NodeKind kind();

    SourceRange range();
}
