package com.raditha.rlint.model;

/**
 * Whether a rule can rewrite the code it flags, and how safely.
 */
public enum FixStatus {
    /** The rule only reports. */
    NONE,
    /** The rewrite preserves behavior and is applied with {@code --fix}. */
    SAFE,
    /** The rewrite may change behavior; it needs {@code --unsafe-fixes}. */
    UNSAFE
}
