package com.moosivp.analyzer.lexer;

/**
 * A zero-based position in a document. {@code offset} counts UTF-16 characters from the start of the
 * input, {@code column} counts them from the start of the line.
 */
public record SourcePosition(int line, int column, int offset) implements Comparable<SourcePosition> {

    public static final SourcePosition START = new SourcePosition(0, 0, 0);

    @Override
    public int compareTo(SourcePosition other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return (line + 1) + ":" + (column + 1);
    }
}
