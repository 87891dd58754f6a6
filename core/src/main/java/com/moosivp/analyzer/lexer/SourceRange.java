package com.moosivp.analyzer.lexer;

public record SourceRange(SourcePosition start, SourcePosition end) {

    public static SourceRange at(SourcePosition position) {
        return new SourceRange(position, position);
    }

    public SourceRange to(SourceRange other) {
        SourcePosition newStart = start.compareTo(other.start) <= 0 ? start : other.start;
        SourcePosition newEnd = end.compareTo(other.end) >= 0 ? end : other.end;
        return new SourceRange(newStart, newEnd);
    }

    public int startLine() {
        return start.line();
    }

    public int endLine() {
        return end.line();
    }

    public boolean contains(int offset) {
        return offset >= start.offset() && offset <= end.offset();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * Range of {@code length} characters starting {@code shift} characters after the start of this
     * range. Only meaningful for ranges that do not span a line break.
     */
    public SourceRange slice(int shift, int length) {
        SourcePosition sliceStart = new SourcePosition(start.line(), start.column() + shift, start.offset() + shift);
        SourcePosition sliceEnd = new SourcePosition(start.line(), sliceStart.column() + length,
                sliceStart.offset() + length);
        return new SourceRange(sliceStart, sliceEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
