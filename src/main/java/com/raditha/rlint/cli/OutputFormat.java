package com.raditha.rlint.cli;

/**
 * How diagnostics are printed.
 */
public enum OutputFormat {
    /**
     * One line per diagnostic followed by a summary.
     */
    CONCISE,

    /**
     * Each diagnostic with its source lines underlined, followed by a summary.
     */
    FULL,

    /**
     * GitHub Actions workflow commands that annotate the pull request.
     */
    GITHUB,

    /**
     * A single JSON document with all diagnostics and file errors.
     */
    JSON;

    /**
     * Convert a string value to OutputFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding OutputFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutputFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "concise" -> CONCISE;
            case "full" -> FULL;
            case "github" -> GITHUB;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be one of: concise, full, github, json");
        };
    }
}
