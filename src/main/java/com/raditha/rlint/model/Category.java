package com.raditha.rlint.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Rule groups that can be selected or ignored by name.
 */
public enum Category {
    /** Code that is wrong or very likely to misbehave. */
    CORR,
    /** Code that works but looks like a mistake. */
    SUSP,
    /** Code with a faster equivalent. */
    PERF,
    /** Code with a clearer equivalent. */
    READ,
    /** Misuse of testthat expectations. */
    TESTTHAT;

    public static Optional<Category> fromName(String name) {
        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
