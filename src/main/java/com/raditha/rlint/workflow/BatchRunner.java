package com.raditha.rlint.workflow;

import com.raditha.rlint.config.LinterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Lints many files on a fixed pool of worker threads.
 * <p>
 * Files share no state. A file that fails is recorded as a failed outcome and
 * does not stop the others.
 */
public class BatchRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    private final FileLinter linter;
    private final int threads;

    public BatchRunner(FileLinter linter, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got: " + threads);
        }
        this.linter = linter;
        this.threads = threads;
    }

    public BatchRunner(FileLinter linter) {
        this(linter, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Lint every file.
     *
     * @return one outcome per file, sorted by path
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public List<FileOutcome> run(List<Path> files, LinterConfig config, FixMode mode) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> lintOne(file, config, mode)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Unexpected failure linting {}", files.get(i), cause);
                    outcomes.add(FileOutcome.failure(files.get(i), String.valueOf(cause)));
                }
            }
            outcomes.sort(Comparator.comparing(FileOutcome::path));
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private FileOutcome lintOne(Path file, LinterConfig config, FixMode mode) {
        try {
            return linter.lint(file, config, mode);
        } catch (LintException e) {
            logger.warn("Failed to lint {}: {}", file, e.getMessage());
            return FileOutcome.failure(file, e.getMessage());
        }
    }
}
