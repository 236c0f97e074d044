package com.raditha.rlint.model;

import com.raditha.rlint.syntax.TextRange;

/**
 * A replacement for part of the original source text.
 *
 * @param content replacement text
 * @param start   first replaced offset in the original text
 * @param end     offset just past the replaced text
 * @param skip    set when the flagged code contains comments that the
 *                replacement would drop; such fixes are never applied
 * @param safety  whether the replacement preserves behavior
 */
public record Fix(String content, int start, int end, boolean skip, FixSafety safety) {

    public Fix {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid fix range " + start + ".." + end);
        }
        if (safety == null) {
            safety = FixSafety.SAFE;
        }
    }

    public TextRange range() {
        return new TextRange(start, end);
    }

    /**
     * Change in text length caused by applying this fix.
     */
    public int lengthDelta() {
        return content.length() - (end - start);
    }
}
