package com.raditha.rlint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.rlint.workflow.FileOutcome;
import com.raditha.rlint.workflow.FixMode;
import net.jqwik.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RLintCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private StringWriter picocliErr;
    private Path script;

    @BeforeEach
    void setUp() throws IOException {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        picocliErr = new StringWriter();
        script = tempDir.resolve("script.R");
        Files.writeString(script, "x == NA\n");
    }

    private int run(String... args) {
        RLintCLI cli = new RLintCLI();
        cli.setStreams(new PrintStream(outContent, true), new PrintStream(errContent, true));
        CommandLine cmd = RLintCLI.createCommandLine(cli);
        cmd.setErr(new PrintWriter(picocliErr, true));
        return cmd.execute(args);
    }

    private String out() {
        return outContent.toString();
    }

    @Test
    void testReportsDiagnostics() {
        int exitCode = run(tempDir.toString());

        assertEquals(1, exitCode);
        assertTrue(out().contains("script.R:1:1 [equals_na]"), out());
        assertTrue(out().contains("[*]"));
        assertTrue(out().contains("Found 1 error."));
        assertTrue(out().contains("1 fixable with the `--fix` option."));
    }

    @Test
    void testCleanRunExitsZero() throws IOException {
        Files.writeString(script, "is.na(x)\n");
        assertEquals(0, run(tempDir.toString()));
        assertTrue(out().contains("All checks passed!"));
    }

    @Test
    void testFixWritesFile() throws IOException {
        int exitCode = run("--fix", "--allow-no-vcs", tempDir.toString());

        assertEquals(0, exitCode, errContent::toString);
        assertEquals("is.na(x)\n", Files.readString(script));
        assertTrue(out().contains("Fixed 1 error."));
    }

    @Test
    void testFixOutsideGitIsRefused() throws IOException {
        int exitCode = run("--fix", tempDir.toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("--allow-no-vcs"));
        assertEquals("x == NA\n", Files.readString(script));
    }

    @Test
    void testDiffLeavesFileAndExitsOne() throws IOException {
        int exitCode = run("--diff", tempDir.toString());

        assertEquals(1, exitCode);
        assertTrue(out().contains("+is.na(x)"), out());
        assertEquals("x == NA\n", Files.readString(script));
    }

    @Test
    void testFixOnlyIgnoresRemainingDiagnostics() throws IOException {
        Files.writeString(script, "x == NA\nif (T) y\n");
        int exitCode = run("--fix-only", "--allow-no-vcs", tempDir.toString());

        assertEquals(0, exitCode);
        assertEquals("is.na(x)\nif (T) y\n", Files.readString(script));
        assertFalse(out().contains("[true_false_symbol]"));
    }

    @Test
    void testSelectAndIgnore() {
        assertEquals(0, run("--select", "equals_null", tempDir.toString()));
        outContent.reset();
        assertEquals(0, run("--ignore", "CORR", tempDir.toString()));
    }

    @Test
    void testJsonOutput() throws IOException {
        int exitCode = run("--output-format", "json", tempDir.toString());

        assertEquals(1, exitCode);
        JsonNode report = new ObjectMapper().readTree(out());
        JsonNode diagnostic = report.get("diagnostics").get(0);
        assertEquals("equals_na", diagnostic.get("rule").asText());
        assertEquals(1, diagnostic.get("row").asInt());
        assertEquals("is.na(x)", diagnostic.get("fix").get("content").asText());
        assertEquals(0, report.get("fixesApplied").asInt());
    }

    @Test
    void testFullOutputShowsSource() {
        int exitCode = run("--output-format", "full", tempDir.toString());

        assertEquals(1, exitCode);
        assertTrue(out().contains("warning: equals_na [*]"), out());
        assertTrue(out().contains("script.R:1:1"));
        assertTrue(out().contains("1 | x == NA"));
        assertTrue(out().contains("  | ^^^^^^^ Use `is.na()`"));
        assertTrue(out().contains("Found 1 error."));
    }

    @Test
    void testGithubOutput() {
        int exitCode = run("--output-format", "github", tempDir.toString());

        assertEquals(1, exitCode);
        String line = out().strip();
        assertTrue(line.startsWith("::warning file="), line);
        assertTrue(line.contains("script.R,line=1,col=1::[equals_na] Use `is.na()`"));
        assertTrue(line.contains("%25in%25"));
        assertFalse(out().contains("Found 1 error."));
    }

    @Test
    void testParseErrorIsReported() throws IOException {
        Files.writeString(script, "f(\n");
        assertEquals(1, run(tempDir.toString()));
        assertTrue(out().contains("Error: "));
    }

    @Test
    void testConfigurationErrors() {
        assertEquals(2, run("--fix-only", "--diff", tempDir.toString()));
        assertEquals(2, run("--threads", "0", tempDir.toString()));
        assertEquals(2, run("--statistics", "--output-format", "json", tempDir.toString()));
        assertEquals(2, run("--statistics", "--output-format", "github", tempDir.toString()));
        assertEquals(2, run("--config", tempDir.resolve("missing.toml").toString(), tempDir.toString()));
        assertEquals(2, run("--select", "no_such_rule", tempDir.toString()));
        assertTrue(picocliErr.toString().contains("Configuration error"));
    }

    @Test
    void testParameterErrors() {
        assertEquals(2, run("--bogus"));
        assertEquals(2, run("--output-format", "xml", tempDir.toString()));
    }

    @Test
    void testMissingPathIsAnIoError() {
        assertEquals(3, run(tempDir.resolve("nothing-here").toString()));
    }

    @Test
    void testExitCodeRules() {
        RLintCLI cli = new RLintCLI();
        FileOutcome clean = FileOutcome.success(script, List.of(), 0, 0, null, List.of());
        FileOutcome changed = FileOutcome.success(script, List.of(), 1, 0, "diff", List.of());

        assertEquals(0, cli.exitCode(List.of(clean), FixMode.NONE));
        assertEquals(1, cli.exitCode(List.of(clean, FileOutcome.failure(script, "boom")), FixMode.NONE));
        assertEquals(0, cli.exitCode(List.of(changed), FixMode.APPLY));
        assertEquals(1, cli.exitCode(List.of(changed), FixMode.DIFF));
    }

    @Test
    void testOutputFormatConverter() throws Exception {
        RLintCLI.OutputFormatConverter converter = new RLintCLI.OutputFormatConverter();
        assertEquals(OutputFormat.JSON, converter.convert("JSON"));
        assertEquals(OutputFormat.FULL, converter.convert("full"));
        assertEquals(OutputFormat.GITHUB, converter.convert("GitHub"));
        assertThrows(IllegalArgumentException.class, () -> converter.convert("xml"));
    }

    @Property(tries = 100)
    void outputFormatParsingIgnoresCase(@ForAll OutputFormat format, @ForAll boolean upper) {
        String text = upper ? format.name() : format.name().toLowerCase();
        RLintCLI cli = new RLintCLI();
        new CommandLine(cli).parseArgs("--output-format", text, "a.R");
        assertEquals(format, cli.outputFormat);
        assertEquals(List.of(Path.of("a.R")), cli.paths);
    }
}
