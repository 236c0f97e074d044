package com.raditha.rlint.config;

import com.raditha.rlint.model.RVersion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the minimum R version from a package's {@code DESCRIPTION} file.
 */
public final class DescriptionFile {

    public static final String FILE_NAME = "DESCRIPTION";
    private static final Pattern R_DEPENDENCY = Pattern.compile("(?:^|[\\s,])R\\s*\\(\\s*>=?\\s*([0-9][0-9.]*)\\s*\\)");

    private DescriptionFile() {
    }

    /**
     * Look for the nearest DESCRIPTION in {@code start} or its ancestors and read
     * {@code Depends: R (>= x.y)} from it.
     */
    public static Optional<RVersion> minimumRVersion(Path start) throws IOException {
        Path current = start.toAbsolutePath().normalize();
        if (Files.isRegularFile(current)) {
            current = current.getParent();
        }
        while (current != null) {
            Path candidate = current.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return parseDepends(Files.readAllLines(candidate));
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Extract the R version from the {@code Depends} field. Continuation lines
     * (indented) belong to the preceding field.
     */
    static Optional<RVersion> parseDepends(List<String> lines) {
        StringBuilder depends = null;
        for (String line : lines) {
            if (depends != null) {
                if (!line.isEmpty() && Character.isWhitespace(line.charAt(0))) {
                    depends.append(' ').append(line.trim());
                    continue;
                }
                break;
            }
            if (line.startsWith("Depends:")) {
                depends = new StringBuilder(line.substring("Depends:".length()));
            }
        }
        if (depends == null) {
            return Optional.empty();
        }
        Matcher matcher = R_DEPENDENCY.matcher(depends);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String version = matcher.group(1);
        if (!version.contains(".")) {
            version = version + ".0";
        }
        return Optional.of(RVersion.parse(version));
    }
}
