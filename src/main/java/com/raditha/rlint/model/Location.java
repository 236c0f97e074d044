package com.raditha.rlint.model;

/**
 * A 1-based row and column in a source file.
 *
 * @param row    line number
 * @param column column number
 */
public record Location(int row, int column) {
}
