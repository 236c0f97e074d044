package com.raditha.rlint.cli;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.config.LinterSettings;
import com.raditha.rlint.config.RuleSelection;
import com.raditha.rlint.discovery.FileDiscovery;
import com.raditha.rlint.discovery.VersionControlGuard;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.workflow.BatchRunner;
import com.raditha.rlint.workflow.FileLinter;
import com.raditha.rlint.workflow.FileOutcome;
import com.raditha.rlint.workflow.FixMode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the R linter.
 * <p>
 * Usage:
 * rlint [options] [paths...]
 * <p>
 * Configuration priority: CLI arguments > rlint.toml > defaults
 */
@Command(name = "rlint", mixinStandardHelpOptions = true, version = "rlint v1.0.0",
        description = "Lints R files and fixes what it safely can.")
@SuppressWarnings("java:S106")
public class RLintCLI implements Callable<Integer> {

    static final String VERBOSE_OPTION = "--verbose";

    @Parameters(arity = "0..*", paramLabel = "<path>", description = "Files or directories to check (default: .)")
    List<Path> paths = new ArrayList<>();

    @Option(names = "--fix", description = "Apply safe fixes")
    boolean fix;

    @Option(names = "--unsafe-fixes", description = "Also apply fixes that may change behavior")
    boolean unsafeFixes;

    @Option(names = "--fix-only", description = "Apply fixes without reporting the remaining diagnostics")
    boolean fixOnly;

    @Option(names = "--diff", description = "Print the diff of the fixes instead of writing files")
    boolean diff;

    @Option(names = "--allow-dirty", description = "Apply fixes even if the git work tree has uncommitted changes")
    boolean allowDirty;

    @Option(names = "--allow-no-vcs", description = "Apply fixes even outside a git work tree")
    boolean allowNoVcs;

    @Option(names = "--select", split = ",", paramLabel = "<rule>",
            description = "Rules or categories to run, replacing the configured selection")
    List<String> select;

    @Option(names = "--extend-select", split = ",", paramLabel = "<rule>",
            description = "Rules or categories to run on top of the selection")
    List<String> extendSelect = new ArrayList<>();

    @Option(names = "--ignore", split = ",", paramLabel = "<rule>", description = "Rules or categories to skip")
    List<String> ignore = new ArrayList<>();

    @Option(names = "--min-r-version", paramLabel = "<version>",
            description = "Oldest R version the code must run on (default: from DESCRIPTION)")
    String minRVersion;

    @Option(names = "--assignment", paramLabel = "<op>", description = "Preferred assignment operator: <- or =")
    String assignment;

    @Option(names = "--output-format", paramLabel = "<format>", converter = OutputFormatConverter.class,
            description = "Output format: ${COMPLETION-CANDIDATES}")
    OutputFormat outputFormat = OutputFormat.CONCISE;

    @Option(names = "--threads", paramLabel = "<n>", description = "Worker threads (default: available processors)")
    int threads = Runtime.getRuntime().availableProcessors();

    @Option(names = "--no-default-exclude", description = "Do not skip renv/, revdep/ and generated files")
    boolean noDefaultExclude;

    @Option(names = "--statistics", description = "Print the number of diagnostics per rule")
    boolean statistics;

    @Option(names = VERBOSE_OPTION, description = "Log progress information")
    boolean verbose;

    @Option(names = "--config", paramLabel = "<path>", description = "Use this rlint.toml instead of searching for one")
    Path configFile;

    private PrintStream out = System.out;
    private PrintStream err = System.err;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code: 0 when clean, 1 when diagnostics or file errors remain
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        List<Path> roots = paths.isEmpty() ? List.of(Path.of(".")) : paths;
        LinterSettings settings = configFile != null
                ? LinterSettings.load(configFile)
                : LinterSettings.discover(roots.get(0));

        boolean applyFixes = fix || fixOnly || diff;
        RuleSelection selection = settings.toSelection(select, extendSelect, ignore, minRVersion, roots.get(0),
                applyFixes && !fixOnly, fixOnly, unsafeFixes);
        Set<Rule> rules = selection.resolve();
        LinterConfig config = settings.toConfig(rules, assignment, unsafeFixes);

        FixMode mode = diff ? FixMode.DIFF : applyFixes ? FixMode.APPLY : FixMode.NONE;

        FileDiscovery discovery = new FileDiscovery(settings.exclude(), settings.defaultExclude() && !noDefaultExclude);
        List<Path> files = discovery.discover(roots);

        if (mode == FixMode.APPLY) {
            Optional<String> refusal = new VersionControlGuard(allowDirty, allowNoVcs).refusal(roots);
            if (refusal.isPresent()) {
                err.println(refusal.get());
                return 2;
            }
        }

        List<FileOutcome> outcomes = new BatchRunner(new FileLinter(), threads).run(files, config, mode);
        reporter().report(outcomes, out);
        return exitCode(outcomes, mode);
    }

    private Reporter reporter() {
        return switch (outputFormat) {
            case JSON -> new JsonReporter();
            case CONCISE -> new ConciseReporter(!fixOnly, statistics, unsafeFixes);
            case FULL -> new FullReporter(!fixOnly, statistics, unsafeFixes);
            case GITHUB -> new GithubReporter();
        };
    }

    int exitCode(List<FileOutcome> outcomes, FixMode mode) {
        for (FileOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                return 1;
            }
            if (!fixOnly && outcome.hasDiagnostics()) {
                return 1;
            }
            if (mode == FixMode.DIFF && outcome.fixesApplied() > 0) {
                return 1;
            }
        }
        return 0;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    void validateConfiguration() {
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (fixOnly && diff) {
            throw new IllegalArgumentException("Cannot use both --fix-only and --diff");
        }
        if (statistics && (outputFormat == OutputFormat.JSON || outputFormat == OutputFormat.GITHUB)) {
            throw new IllegalArgumentException(
                    "--statistics is only available with the concise and full output formats");
        }
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    void setStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Build the configured command line with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine(RLintCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    public static void main(String[] args) {
        // slf4j-simple reads its level once, when the first logger is created
        if (Arrays.asList(args).contains(VERBOSE_OPTION)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        }
        int exitCode = createCommandLine(new RLintCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
