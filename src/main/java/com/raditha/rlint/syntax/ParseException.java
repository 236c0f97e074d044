package com.raditha.rlint.syntax;

import java.util.List;

/**
 * Thrown when a source text cannot be turned into an error-free syntax tree.
 */
public class ParseException extends Exception {

    private final transient List<ParseError> errors;

    public ParseException(List<ParseError> errors, LineIndex lines) {
        super(describe(errors, lines));
        this.errors = List.copyOf(errors);
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    private static String describe(List<ParseError> errors, LineIndex lines) {
        if (errors.isEmpty()) {
            return "Failed to parse";
        }
        ParseError first = errors.get(0);
        LineIndex.Position position = lines.position(first.range().start());
        String message = "Syntax error at " + position.line() + ":" + position.column() + ": " + first.message();
        if (errors.size() > 1) {
            message += " (and " + (errors.size() - 1) + " more)";
        }
        return message;
    }
}
