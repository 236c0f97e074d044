package com.raditha.rlint.discovery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDiscoveryTest {

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toAbsolutePath().normalize();
        write("R/utils.R");
        write("R/RcppExports.R");
        write("R/import-standalone-purrr.R");
        write("tests/testthat/test-utils.r");
        write("renv/library/pkg/R/code.R");
        write("scratch/notes.R");
        write("README.md");
    }

    private Path write(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x <- 1\n");
        return file;
    }

    @Test
    void testDefaultExcludes() throws IOException {
        List<Path> files = new FileDiscovery(List.of(), true).discover(List.of(root));

        assertEquals(List.of(
                root.resolve("R/utils.R"),
                root.resolve("scratch/notes.R"),
                root.resolve("tests/testthat/test-utils.r")), files);
    }

    @Test
    void testDefaultExcludesCanBeDisabled() throws IOException {
        List<Path> files = new FileDiscovery(List.of(), false).discover(List.of(root));
        assertEquals(6, files.size());
    }

    @Test
    void testCustomPathGlob() throws IOException {
        List<Path> files = new FileDiscovery(List.of("scratch/**", "tests/"), true).discover(List.of(root));
        assertEquals(List.of(root.resolve("R/utils.R")), files);
    }

    @Test
    void testExplicitFileIsAlwaysLinted() throws IOException {
        Path generated = root.resolve("R/RcppExports.R");
        List<Path> files = new FileDiscovery(List.of(), true).discover(List.of(generated, root.resolve("README.md")));
        assertEquals(List.of(generated), files);
    }

    @Test
    void testOverlappingRootsAreDeduplicated() throws IOException {
        List<Path> files = new FileDiscovery(List.of(), true).discover(List.of(root.resolve("R"), root));
        assertEquals(3, files.size());
    }

    @Test
    void testMissingRoot() {
        FileDiscovery discovery = new FileDiscovery(List.of(), true);
        assertThrows(IOException.class, () -> discovery.discover(List.of(root.resolve("nope"))));
    }

    @Test
    void testShouldExclude() {
        FileDiscovery discovery = new FileDiscovery(List.of("data-raw/*.R"), true);
        assertTrue(discovery.shouldExclude(Path.of("R", "cpp11.R")));
        assertTrue(discovery.shouldExclude(Path.of("data-raw", "make.R")));
        assertFalse(discovery.shouldExclude(Path.of("data-raw", "sub", "make.R")));
        assertFalse(discovery.shouldExclude(Path.of("R", "cpp11_helpers.R")));
    }

    @Test
    void testGlobToRegex() {
        assertTrue(FileDiscovery.globToRegex("a/**/b.R").matcher("a/x/y/b.R").matches());
        assertFalse(FileDiscovery.globToRegex("a/*.R").matcher("a/x/b.R").matches());
        assertTrue(FileDiscovery.globToRegex("f?.R").matcher("f1.R").matches());
        assertFalse(FileDiscovery.globToRegex("f.R").matcher("fxR").matches());
        assertTrue(FileDiscovery.isRFile(Path.of("a.r")));
        assertFalse(FileDiscovery.isRFile(Path.of("a.Rmd")));
    }
}
