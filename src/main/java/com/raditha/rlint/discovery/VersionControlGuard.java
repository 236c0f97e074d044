package com.raditha.rlint.discovery;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Refuses to rewrite files that git could not restore.
 * <p>
 * Fixing is refused when a path is outside every git work tree, unless
 * {@code allowNoVcs} is set, and when a work tree has uncommitted or untracked
 * changes, unless {@code allowDirty} is set.
 */
public class VersionControlGuard {

    private static final Logger logger = LoggerFactory.getLogger(VersionControlGuard.class);

    private final boolean allowDirty;
    private final boolean allowNoVcs;

    public VersionControlGuard(boolean allowDirty, boolean allowNoVcs) {
        this.allowDirty = allowDirty;
        this.allowNoVcs = allowNoVcs;
    }

    /**
     * Check the work trees holding {@code paths}.
     *
     * @return why fixing must not proceed, or empty when it may
     * @throws IOException if a repository cannot be read
     */
    public Optional<String> refusal(List<Path> paths) throws IOException {
        if (allowNoVcs) {
            return Optional.empty();
        }

        Map<File, Path> repositories = new LinkedHashMap<>();
        for (Path path : paths) {
            Path absolute = path.toAbsolutePath().normalize();
            Path dir = Files.isDirectory(absolute) ? absolute : absolute.getParent();
            FileRepositoryBuilder builder = new FileRepositoryBuilder();
            builder.findGitDir(dir.toFile());
            if (builder.getGitDir() == null) {
                return Optional.of("Fixing can perform destructive changes but no git repository was found for "
                        + path + ", so no fixes were applied. Add `--allow-no-vcs` to apply the fixes.");
            }
            repositories.putIfAbsent(builder.getGitDir(), path);
        }

        if (allowDirty) {
            return Optional.empty();
        }

        TreeSet<String> dirty = new TreeSet<>();
        for (File gitDir : repositories.keySet()) {
            dirty.addAll(dirtyFiles(gitDir));
        }
        if (dirty.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder message = new StringBuilder(
                "Fixing can perform destructive changes but the work tree has uncommitted changes, "
                        + "so no fixes were applied. Add `--allow-dirty` or commit these files:");
        for (String file : dirty) {
            message.append(System.lineSeparator()).append("  * ").append(file).append(" (dirty)");
        }
        return Optional.of(message.toString());
    }

    private static TreeSet<String> dirtyFiles(File gitDir) throws IOException {
        try (Repository repository = new FileRepositoryBuilder().setGitDir(gitDir).readEnvironment().build();
                Git git = new Git(repository)) {
            Status status = git.status().call();
            TreeSet<String> files = new TreeSet<>(status.getUncommittedChanges());
            files.addAll(status.getUntracked());
            logger.debug("{}: {} dirty files", gitDir, files.size());
            return files;
        } catch (GitAPIException e) {
            throw new IOException("Cannot read git status of " + gitDir + ": " + e.getMessage(), e);
        }
    }
}
