package com.raditha.rlint.workflow;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.Checker;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.fix.DiffGenerator;
import com.raditha.rlint.fix.PatchEngine;
import com.raditha.rlint.fix.PatchResult;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.syntax.ParseException;
import com.raditha.rlint.syntax.RParser;
import com.raditha.rlint.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lints one file and, when asked to, fixes it.
 * <p>
 * Fixing runs in passes. Each pass applies every non-overlapping fix, then
 * reparses and rechecks the new text, because fixes deferred by an overlap
 * have to be recomputed. Passes stop when one applies nothing or after
 * {@link #MAX_FIX_PASSES}. The file is written once at the end.
 */
public class FileLinter {

    private static final Logger logger = LoggerFactory.getLogger(FileLinter.class);

    public static final int MAX_FIX_PASSES = 10;

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final Checker checker;
    private final PatchEngine patchEngine;
    private final DiffGenerator diffGenerator;

    public FileLinter() {
        this(new Checker(), new PatchEngine(), new DiffGenerator());
    }

    public FileLinter(Checker checker, PatchEngine patchEngine, DiffGenerator diffGenerator) {
        this.checker = checker;
        this.patchEngine = patchEngine;
        this.diffGenerator = diffGenerator;
    }

    /**
     * Lint the file at {@code file}.
     *
     * @throws LintException if the file cannot be read, parsed, checked or written
     */
    public FileOutcome lint(Path file, LinterConfig config, FixMode mode) throws LintException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LintException(file, "cannot read file: " + e.getMessage(), e);
        }

        Run run = run(file, source, config, mode);
        FileOutcome outcome = run.outcome();

        if (mode == FixMode.APPLY && !run.text().equals(source)) {
            try {
                Files.writeString(file, run.text(), StandardCharsets.UTF_8);
                logger.info("Wrote {} fixes to {}", outcome.fixesApplied(), file);
            } catch (IOException e) {
                throw new LintException(file, "cannot write file: " + e.getMessage(), e);
            }
        }
        return outcome;
    }

    /**
     * Lint {@code source} as the content of {@code file} without touching the file system.
     */
    public FileOutcome lintSource(Path file, String source, LinterConfig config, FixMode mode) throws LintException {
        return run(file, source, config, mode).outcome();
    }

    /**
     * Apply fixes to {@code source} and return the fixed text.
     */
    public String fix(Path file, String source, LinterConfig config) throws LintException {
        return run(file, source, config, FixMode.APPLY).text();
    }

    private record Run(FileOutcome outcome, String text) {
    }

    private Run run(Path file, String content, LinterConfig config, FixMode mode) throws LintException {
        // offsets and columns are computed without the mark, which is put back on the fixed text
        String bom = content.startsWith(BYTE_ORDER_MARK) ? BYTE_ORDER_MARK : "";
        String source = content.substring(bom.length());
        List<Diagnostic> diagnostics = check(file, source, config);
        String text = source;
        int applied = 0;
        int skipped = 0;
        List<String> warnings = new ArrayList<>();

        if (mode.appliesFixes()) {
            int pass = 0;
            while (true) {
                PatchResult result = patchEngine.apply(text, diagnostics);
                skipped = result.skippedCount();
                if (!result.changed()) {
                    break;
                }
                text = result.text();
                applied += result.appliedCount();
                diagnostics = check(file, text, config);
                pass++;
                if (pass >= MAX_FIX_PASSES) {
                    String warning = "Fixes did not settle after " + MAX_FIX_PASSES + " passes";
                    logger.warn("{}: {}", file, warning);
                    warnings.add(warning);
                    break;
                }
            }
        }

        String diff = mode == FixMode.DIFF && applied > 0
                ? diffGenerator.generateUnifiedDiff(file.toString(), source, text)
                : null;
        return new Run(FileOutcome.success(file, diagnostics, applied, skipped, diff, warnings), bom + text);
    }

    private List<Diagnostic> check(Path file, String text, LinterConfig config) throws LintException {
        SyntaxTree tree;
        try {
            tree = RParser.parse(text).requireValid();
        } catch (ParseException e) {
            throw new LintException(file, e.getMessage(), e);
        }
        try {
            return checker.check(new CheckContext(config, tree), file);
        } catch (RuleException e) {
            throw new LintException(file, "rule failed: " + e.getMessage(), e);
        }
    }
}
