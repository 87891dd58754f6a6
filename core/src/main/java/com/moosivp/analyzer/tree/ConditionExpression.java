package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * A condition line kept as opaque text.
 */
public record ConditionExpression(String text, SourceRange range) {
}
