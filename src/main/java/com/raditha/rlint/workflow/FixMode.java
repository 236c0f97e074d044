package com.raditha.rlint.workflow;

/**
 * What the file linter does with fixes.
 */
public enum FixMode {
    /**
     * Report only.
     */
    NONE,
    /**
     * Apply fixes and write the file back.
     */
    APPLY,
    /**
     * Apply fixes in memory and produce a diff, leaving the file untouched.
     */
    DIFF;

    public boolean appliesFixes() {
        return this != NONE;
    }
}
