package com.raditha.rlint.discovery;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VersionControlGuardTest {

    private static final PersonIdent AUTHOR = new PersonIdent("Test", "test@example.com");

    @TempDir
    Path tempDir;

    private Path committedRepository() throws Exception {
        Path file = tempDir.resolve("a.R");
        Files.writeString(file, "x <- 1\n");
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            git.add().addFilepattern("a.R").call();
            git.commit().setMessage("initial").setAuthor(AUTHOR).setCommitter(AUTHOR).call();
        }
        return file;
    }

    @Test
    void testCleanRepositoryIsAccepted() throws Exception {
        Path file = committedRepository();
        assertEquals(Optional.empty(), new VersionControlGuard(false, false).refusal(List.of(file)));
    }

    @Test
    void testDirtyRepositoryIsRefused() throws Exception {
        Path file = committedRepository();
        Files.writeString(file, "x <- 2\n");
        Files.writeString(tempDir.resolve("b.R"), "y <- 1\n");

        String refusal = new VersionControlGuard(false, false).refusal(List.of(tempDir)).orElseThrow();

        assertTrue(refusal.contains("--allow-dirty"));
        assertTrue(refusal.contains("* a.R (dirty)"));
        assertTrue(refusal.contains("* b.R (dirty)"));
    }

    @Test
    void testAllowDirty() throws Exception {
        Path file = committedRepository();
        Files.writeString(file, "x <- 2\n");
        assertTrue(new VersionControlGuard(true, false).refusal(List.of(file)).isEmpty());
    }

    @Test
    void testNoRepositoryIsRefused() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.R"), "x <- 1\n");
        String refusal = new VersionControlGuard(false, false).refusal(List.of(file)).orElseThrow();
        assertTrue(refusal.contains("--allow-no-vcs"));
    }

    @Test
    void testAllowNoVcs() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.R"), "x <- 1\n");
        assertTrue(new VersionControlGuard(true, true).refusal(List.of(file)).isEmpty());
        assertTrue(new VersionControlGuard(false, true).refusal(List.of(file)).isEmpty());
    }
}
