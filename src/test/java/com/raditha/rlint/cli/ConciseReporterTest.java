package com.raditha.rlint.cli;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Fix;
import com.raditha.rlint.model.FixSafety;
import com.raditha.rlint.model.Location;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.TextRange;
import com.raditha.rlint.workflow.FileOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConciseReporterTest {

    private static final Path FILE = Path.of("R", "a.R");

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true);
    }

    private static Diagnostic diagnostic(Rule rule, int row, boolean withFix) {
        Fix fix = withFix ? new Fix("y", 0, 1, false, FixSafety.SAFE) : null;
        return new Diagnostic(rule, "Message.", null, new TextRange(0, 1), fix, FILE, new Location(row, 3));
    }

    @Test
    void testFormatLine() {
        assertEquals(FILE + ":4:3 [repeat] Message. [*]", ConciseReporter.format(diagnostic(Rule.REPEAT, 4, true)));
        assertEquals(FILE + ":4:3 [true_false_symbol] Message.",
                ConciseReporter.format(diagnostic(Rule.TRUE_FALSE_SYMBOL, 4, false)));
    }

    @Test
    void testSummary() {
        FileOutcome outcome = FileOutcome.success(FILE,
                List.of(diagnostic(Rule.REPEAT, 1, true), diagnostic(Rule.TRUE_FALSE_SYMBOL, 2, false)),
                0, 0, null, List.of());
        new ConciseReporter(true, false, false).report(List.of(outcome), out);

        String text = buffer.toString();
        assertTrue(text.contains("Found 2 errors."));
        assertTrue(text.contains("1 fixable with the `--fix` option."));
    }

    @Test
    void testHiddenUnsafeFixHint() {
        FileOutcome outcome = FileOutcome.success(FILE, List.of(diagnostic(Rule.ALL_EQUAL, 1, false)),
                0, 0, null, List.of());
        new ConciseReporter(true, false, false).report(List.of(outcome), out);
        assertTrue(buffer.toString().contains("1 fix is available with the `--fix --unsafe-fixes` option."));
    }

    @Test
    void testStatistics() {
        FileOutcome outcome = FileOutcome.success(FILE,
                List.of(diagnostic(Rule.REPEAT, 1, true), diagnostic(Rule.REPEAT, 5, true),
                        diagnostic(Rule.EQUALS_NA, 7, false)),
                0, 0, null, List.of());
        new ConciseReporter(true, true, false).report(List.of(outcome), out);

        String[] lines = buffer.toString().split("\\R");
        assertEquals("    2 [*] repeat", lines[0]);
        assertEquals("    1 [ ] equals_na", lines[1]);
    }

    @Test
    void testFixOnlyPrintsCountOnly() {
        FileOutcome outcome = FileOutcome.success(FILE, List.of(diagnostic(Rule.TRUE_FALSE_SYMBOL, 1, false)),
                3, 0, null, List.of("Fixes did not settle"));
        new ConciseReporter(false, false, false).report(List.of(outcome), out);

        String text = buffer.toString();
        assertTrue(text.contains("Fixed 3 errors."));
        assertTrue(text.contains("warning: Fixes did not settle"));
        assertFalse(text.contains("[true_false_symbol]"));
    }

    @Test
    void testCleanAndFailedRuns() {
        new ConciseReporter(true, false, false).report(List.of(FileOutcome.success(FILE, List.of(), 0, 0, null,
                List.of())), out);
        assertTrue(buffer.toString().contains("All checks passed!"));

        buffer.reset();
        new ConciseReporter(true, false, false).report(List.of(FileOutcome.failure(FILE, "R/a.R: bad")), out);
        assertTrue(buffer.toString().contains("Error: R/a.R: bad"));
        assertFalse(buffer.toString().contains("All checks passed!"));
    }
}
