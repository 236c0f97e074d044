package com.raditha.rlint.fix;

/**
 * Outcome of one patch pass.
 *
 * @param text              the rewritten text
 * @param appliedCount      fixes spliced into {@code text}
 * @param hasDeferredFixes  whether a fix was held back because it overlapped an applied one
 * @param skippedCount      fixes held back because they would drop comments
 */
public record PatchResult(String text, int appliedCount, boolean hasDeferredFixes, int skippedCount) {

    public boolean changed() {
        return appliedCount > 0;
    }
}
