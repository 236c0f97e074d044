package com.raditha.rlint.fix;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Fix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the fixes of a set of diagnostics to the text they were computed on.
 * <p>
 * Fixes are applied left to right. A fix that starts inside the text already
 * rewritten by an earlier fix is deferred to the next pass, when it will be
 * recomputed on the new text.
 */
public class PatchEngine {

    private static final Logger logger = LoggerFactory.getLogger(PatchEngine.class);

    /**
     * Apply every fix that does not overlap an earlier one.
     *
     * @param source      the text the diagnostics were computed on
     * @param diagnostics diagnostics in discovery order; those without a fix are ignored
     */
    public PatchResult apply(String source, List<Diagnostic> diagnostics) {
        List<Fix> fixes = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.fix() != null) {
                fixes.add(diagnostic.fix());
            }
        }
        fixes.sort(Comparator.comparingInt(Fix::start));

        StringBuilder buffer = new StringBuilder(source);
        int offsetDrift = 0;
        int lastModifiedEnd = 0;
        int applied = 0;
        int skipped = 0;
        boolean deferred = false;

        for (Fix fix : fixes) {
            if (fix.skip()) {
                skipped++;
                continue;
            }
            if (fix.end() > source.length()) {
                throw new IllegalArgumentException("Fix " + fix.range() + " lies outside a text of length "
                        + source.length());
            }
            int start = fix.start() + offsetDrift;
            int end = fix.end() + offsetDrift;
            if (start < lastModifiedEnd) {
                deferred = true;
                continue;
            }
            buffer.replace(start, end, fix.content());
            offsetDrift += fix.lengthDelta();
            lastModifiedEnd = start + fix.content().length();
            applied++;
        }

        logger.debug("Applied {} fixes, skipped {}, deferred: {}", applied, skipped, deferred);
        return new PatchResult(buffer.toString(), applied, deferred, skipped);
    }
}
