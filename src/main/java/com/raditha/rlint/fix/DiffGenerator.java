package com.raditha.rlint.fix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for {@code --diff} previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and fixed text of a file.
     *
     * @param fileName name shown in the {@code ---}/{@code +++} headers
     * @param original text before fixing
     * @param fixed    text after fixing
     * @return unified diff, empty when both texts are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String fixed) {
        return generateUnifiedDiff(fileName, original, fixed, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String fixed, int contextLines) {
        if (original.equals(fixed)) {
            return "";
        }
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(fixed);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
