package com.raditha.rlint.workflow;

import com.raditha.rlint.model.Diagnostic;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of linting one file.
 *
 * @param path          the file
 * @param diagnostics   findings left after fixing, in source order
 * @param fixesApplied  number of fixes applied over all passes
 * @param fixesSkipped  fixes held back because they would drop comments
 * @param diff          unified diff of the applied fixes in diff mode, otherwise null
 * @param warnings      non-fatal problems, such as a fix loop that did not settle
 * @param error         why the file could not be linted, null on success
 */
public record FileOutcome(
        Path path,
        List<Diagnostic> diagnostics,
        int fixesApplied,
        int fixesSkipped,
        @Nullable String diff,
        List<String> warnings,
        @Nullable String error) {

    public FileOutcome {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FileOutcome success(Path path, List<Diagnostic> diagnostics, int fixesApplied, int fixesSkipped,
            @Nullable String diff, List<String> warnings) {
        return new FileOutcome(path, diagnostics, fixesApplied, fixesSkipped, diff, warnings, null);
    }

    public static FileOutcome failure(Path path, String error) {
        return new FileOutcome(path, List.of(), 0, 0, null, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public long fixableCount() {
        return diagnostics.stream().filter(Diagnostic::isFixable).count();
    }
}
