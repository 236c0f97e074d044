package com.raditha.rlint.syntax;

/**
 * A closed-open range of character offsets into a source text.
 *
 * @param start first offset covered by the range
 * @param end   offset just past the last character covered
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end (" + end + ") must not precede start (" + start + ")");
        }
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
