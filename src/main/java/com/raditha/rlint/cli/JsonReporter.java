package com.raditha.rlint.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Fix;
import com.raditha.rlint.model.Location;
import com.raditha.rlint.workflow.FileOutcome;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Machine readable output. Diagnostics are converted to DTOs so the
 * serialized form does not depend on the model classes.
 */
public class JsonReporter implements Reporter {

    private static final ObjectMapper mapper = new ObjectMapper();

    public record ReportDTO(List<DiagnosticDTO> diagnostics, List<ErrorDTO> errors, int fixesApplied) {
    }

    public record DiagnosticDTO(
            String file,
            String rule,
            String message,
            String suggestion,
            int row,
            int column,
            int start,
            int end,
            FixDTO fix) {
    }

    public record FixDTO(String content, int start, int end, boolean applicable, String safety) {
    }

    public record ErrorDTO(String file, String error) {
    }

    @Override
    public void report(List<FileOutcome> outcomes, PrintStream out) throws IOException {
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(outcomes)));
    }

    static ReportDTO toDTO(List<FileOutcome> outcomes) {
        List<DiagnosticDTO> diagnostics = new ArrayList<>();
        List<ErrorDTO> errors = new ArrayList<>();
        int fixed = 0;
        for (FileOutcome outcome : outcomes) {
            fixed += outcome.fixesApplied();
            if (!outcome.isSuccess()) {
                errors.add(new ErrorDTO(outcome.path().toString(), outcome.error()));
                continue;
            }
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                diagnostics.add(toDTO(diagnostic));
            }
        }
        return new ReportDTO(diagnostics, errors, fixed);
    }

    private static DiagnosticDTO toDTO(Diagnostic diagnostic) {
        Location location = diagnostic.location();
        Fix fix = diagnostic.fix();
        FixDTO fixDTO = fix == null ? null
                : new FixDTO(fix.content(), fix.start(), fix.end(), !fix.skip(), fix.safety().name().toLowerCase());
        return new DiagnosticDTO(
                String.valueOf(diagnostic.file()),
                diagnostic.rule().id(),
                diagnostic.message(),
                diagnostic.suggestion(),
                location == null ? 0 : location.row(),
                location == null ? 0 : location.column(),
                diagnostic.range().start(),
                diagnostic.range().end(),
                fixDTO);
    }
}
