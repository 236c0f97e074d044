package com.raditha.rlint.model;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An R version such as {@code 4.3} or {@code 4.3.1}.
 *
 * @param major major component
 * @param minor minor component
 * @param patch patch component, 0 when not given
 */
public record RVersion(int major, int minor, int patch) implements Comparable<RVersion> {

    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\.(\\d+)(?:\\.(\\d+))?");
    private static final Comparator<RVersion> ORDER = Comparator.comparingInt(RVersion::major)
            .thenComparingInt(RVersion::minor)
            .thenComparingInt(RVersion::patch);

    public RVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be >= 0");
        }
    }

    /**
     * Parses {@code major.minor[.patch]}.
     *
     * @throws IllegalArgumentException if the text is not a version
     */
    public static RVersion parse(String text) {
        Matcher matcher = FORMAT.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid R version: '" + text + "'. Expected a version such as 4.3 or 4.3.1");
        }
        int patch = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
        return new RVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), patch);
    }

    public boolean isAtLeast(RVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(RVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
