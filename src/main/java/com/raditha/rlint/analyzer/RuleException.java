package com.raditha.rlint.analyzer;

/**
 * Thrown by a rule when a node it was dispatched on does not have the shape the
 * parser guarantees for its kind.
 */
public class RuleException extends Exception {

    public RuleException(String message) {
        super(message);
    }

    public RuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
