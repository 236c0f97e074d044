package com.raditha.rlint.syntax;

/**
 * A syntax error recorded while parsing.
 *
 * @param message description of what the parser expected
 * @param range   the offending source range
 */
public record ParseError(String message, TextRange range) {
}
