package com.raditha.rlint.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Collects the R files to lint under a set of paths.
 * <p>
 * Exclude patterns are globs supporting {@code *} and {@code **}:
 * <ul>
 * <li>{@code renv/} (trailing slash) skips every directory of that name;</li>
 * <li>{@code RcppExports.R} (no slash) is matched against file names;</li>
 * <li>{@code scratch/**} (inner slash) is matched against the path relative
 * to the searched directory.</li>
 * </ul>
 * Files named explicitly on the command line are always linted.
 */
public class FileDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(FileDiscovery.class);

    public static final List<String> DEFAULT_EXCLUDES = List.of(
            ".git/",
            "renv/",
            "revdep/",
            "cpp11.R",
            "RcppExports.R",
            "extendr-wrappers.R",
            "import-standalone-*.R");

    private final List<Pattern> directoryPatterns = new ArrayList<>();
    private final List<Pattern> namePatterns = new ArrayList<>();
    private final List<Pattern> pathPatterns = new ArrayList<>();

    public FileDiscovery(List<String> excludePatterns, boolean useDefaultExcludes) {
        List<String> all = new ArrayList<>();
        if (useDefaultExcludes) {
            all.addAll(DEFAULT_EXCLUDES);
        }
        all.addAll(excludePatterns);
        for (String pattern : all) {
            String trimmed = pattern.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.endsWith("/") && trimmed.indexOf('/') == trimmed.length() - 1) {
                directoryPatterns.add(globToRegex(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.contains("/")) {
                pathPatterns.add(globToRegex(trimmed.endsWith("/") ? trimmed + "**" : trimmed));
            } else {
                namePatterns.add(globToRegex(trimmed));
            }
        }
    }

    /**
     * Find R files under {@code roots}.
     *
     * @return absolute, normalized paths without duplicates, sorted
     * @throws IOException if a root does not exist or cannot be walked
     */
    public List<Path> discover(List<Path> roots) throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        for (Path root : roots) {
            Path start = root.toAbsolutePath().normalize();
            if (!Files.exists(start)) {
                throw new IOException("No such file or directory: " + root);
            }
            if (Files.isRegularFile(start)) {
                if (isRFile(start)) {
                    files.add(start);
                } else {
                    logger.warn("Skipping {}: not an R file", root);
                }
                continue;
            }
            walk(start, files);
        }
        logger.info("Found {} R files", files.size());
        return new ArrayList<>(files);
    }

    private void walk(Path start, TreeSet<Path> files) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(start) && isExcludedDirectory(start.relativize(dir))) {
                    logger.debug("Excluding directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isRFile(file) && !shouldExclude(start.relativize(file))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Whether a file, given relative to the searched directory, is excluded.
     */
    public boolean shouldExclude(Path relative) {
        String name = relative.getFileName().toString();
        for (Pattern pattern : namePatterns) {
            if (pattern.matcher(name).matches()) {
                return true;
            }
        }
        String path = toSlashes(relative);
        for (Pattern pattern : pathPatterns) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean isExcludedDirectory(Path relative) {
        String name = relative.getFileName().toString();
        for (Pattern pattern : directoryPatterns) {
            if (pattern.matcher(name).matches()) {
                return true;
            }
        }
        String path = toSlashes(relative) + "/";
        for (Pattern pattern : pathPatterns) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    static boolean isRFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".R") || name.endsWith(".r");
    }

    private static String toSlashes(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Convert a glob to a regex: {@code **} matches across directories,
     * {@code *} and {@code ?} stay within one path segment.
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
