package com.raditha.rlint.cli;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.FixStatus;
import com.raditha.rlint.model.Location;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.workflow.FileOutcome;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Human readable output: {@code path:row:col [rule] message}, one line per
 * diagnostic, with {@code [*]} marking those with an applicable fix.
 */
public class ConciseReporter implements Reporter {

    private final boolean showDiagnostics;
    private final boolean statistics;
    private final boolean unsafeFixesAllowed;

    /**
     * @param showDiagnostics    false to print only fix counts, as with {@code --fix-only}
     * @param statistics         print one line per rule instead of one per diagnostic
     * @param unsafeFixesAllowed whether unsafe fixes were enabled for this run
     */
    public ConciseReporter(boolean showDiagnostics, boolean statistics, boolean unsafeFixesAllowed) {
        this.showDiagnostics = showDiagnostics;
        this.statistics = statistics;
        this.unsafeFixesAllowed = unsafeFixesAllowed;
    }

    @Override
    public void report(List<FileOutcome> outcomes, PrintStream out) {
        int total = 0;
        int fixable = 0;
        int hiddenUnsafe = 0;
        int fixed = 0;
        int errors = 0;
        Map<Rule, Integer> perRule = new EnumMap<>(Rule.class);

        for (FileOutcome outcome : outcomes) {
            fixed += outcome.fixesApplied();
            if (outcome.diff() != null) {
                out.println(outcome.diff());
            }
            for (String warning : outcome.warnings()) {
                out.println(outcome.path() + ": warning: " + warning);
            }
            if (!outcome.isSuccess()) {
                errors++;
                out.println("Error: " + outcome.error());
                continue;
            }
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                total++;
                perRule.merge(diagnostic.rule(), 1, Integer::sum);
                if (diagnostic.isFixable()) {
                    fixable++;
                } else if (!diagnostic.hasFix() && diagnostic.rule().fixStatus() == FixStatus.UNSAFE
                        && !unsafeFixesAllowed) {
                    hiddenUnsafe++;
                }
                if (showDiagnostics && !statistics) {
                    printDiagnostic(diagnostic, out);
                }
            }
        }

        if (fixed > 0) {
            out.println("Fixed " + fixed + (fixed == 1 ? " error." : " errors."));
        }
        if (!showDiagnostics) {
            return;
        }
        if (statistics) {
            printStatistics(perRule, outcomes, out);
            return;
        }
        if (total == 0) {
            if (errors == 0) {
                out.println("All checks passed!");
            }
            return;
        }
        beforeSummary(out);
        out.println(total == 1 ? "Found 1 error." : "Found " + total + " errors.");
        if (fixable > 0) {
            String hint = fixable + " fixable with the `--fix` option";
            if (hiddenUnsafe > 0) {
                hint += " (" + hiddenUnsafe + (hiddenUnsafe == 1 ? " hidden fix" : " hidden fixes")
                        + " can be enabled with the `--unsafe-fixes` option)";
            }
            out.println(hint + ".");
        } else if (hiddenUnsafe > 0) {
            out.println((hiddenUnsafe == 1 ? "1 fix is" : hiddenUnsafe + " fixes are")
                    + " available with the `--fix --unsafe-fixes` option.");
        }
    }

    protected void printDiagnostic(Diagnostic diagnostic, PrintStream out) {
        out.println(format(diagnostic));
    }

    protected void beforeSummary(PrintStream out) {
        out.println();
    }

    static String format(Diagnostic diagnostic) {
        Location location = diagnostic.location();
        StringBuilder line = new StringBuilder();
        line.append(diagnostic.file());
        if (location != null) {
            line.append(':').append(location.row()).append(':').append(location.column());
        }
        line.append(" [").append(diagnostic.rule().id()).append("] ").append(diagnostic.message());
        if (diagnostic.suggestion() != null) {
            line.append(' ').append(diagnostic.suggestion());
        }
        if (diagnostic.isFixable()) {
            line.append(" [*]");
        }
        return line.toString();
    }

    private static void printStatistics(Map<Rule, Integer> perRule, List<FileOutcome> outcomes, PrintStream out) {
        if (perRule.isEmpty()) {
            out.println("All checks passed!");
            return;
        }
        Map<Rule, Boolean> hasFix = new EnumMap<>(Rule.class);
        outcomes.forEach(o -> o.diagnostics().forEach(d -> hasFix.merge(d.rule(), d.isFixable(), Boolean::logicalOr)));
        perRule.entrySet().stream()
                .sorted(Map.Entry.<Rule, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> out.printf("%5d [%s] %s%n", entry.getValue(),
                        hasFix.getOrDefault(entry.getKey(), false) ? "*" : " ", entry.getKey().id()));
        out.println();
        out.println("Rules with `[*]` have an automatic fix.");
    }
}
