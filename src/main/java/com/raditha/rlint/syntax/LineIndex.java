package com.raditha.rlint.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps character offsets to 1-based line and column numbers.
 */
public class LineIndex {

    /**
     * A 1-based line/column pair.
     *
     * @param line   line number, starting at 1
     * @param column column number, starting at 1
     */
    public record Position(int line, int column) {
    }

    private final List<Integer> lineStarts;
    private final int length;

    public LineIndex(String source) {
        this.length = source.length();
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = Collections.unmodifiableList(starts);
    }

    public Position position(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int line = lineOf(clamped);
        return new Position(line, clamped - lineStarts.get(line - 1) + 1);
    }

    /**
     * 1-based line number containing {@code offset}.
     */
    public int lineOf(int offset) {
        int index = Collections.binarySearch(lineStarts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        return index + 1;
    }

    public int lineCount() {
        return lineStarts.size();
    }
}
