package com.raditha.rlint.config;

/**
 * The assignment operator a project prefers for the {@code assignment} rule.
 */
public enum AssignmentOperator {
    /** {@code x <- value}, the default. */
    LEFT_ARROW("<-"),

    /** {@code x = value}. */
    EQUALS("=");

    private final String symbol;

    AssignmentOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Convert a configuration value to an operator.
     *
     * @param value {@code "<-"} or {@code "="}
     * @return the matching operator
     * @throws IllegalArgumentException if the value is neither
     */
    public static AssignmentOperator fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Assignment operator cannot be null");
        }
        return switch (value.trim()) {
            case "<-" -> LEFT_ARROW;
            case "=" -> EQUALS;
            default -> throw new IllegalArgumentException(
                    "Invalid assignment operator: " + value + ". Must be: \"<-\" or \"=\"");
        };
    }
}
