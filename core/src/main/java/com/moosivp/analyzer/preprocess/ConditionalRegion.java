package com.moosivp.analyzer.preprocess;

/**
 * Zero-based lines of a closed conditional, from its opening directive to its {@code #endif}.
 */
public record ConditionalRegion(int startLine, int endLine) {
}
