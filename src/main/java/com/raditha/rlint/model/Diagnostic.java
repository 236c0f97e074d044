package com.raditha.rlint.model;

import com.raditha.rlint.syntax.LineIndex;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.TextRange;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * A rule violation found in a file.
 *
 * @param rule       the rule that reported it
 * @param message    what is wrong
 * @param suggestion how to resolve it, or null
 * @param range      the flagged source range
 * @param fix        the proposed rewrite, or null when none is offered
 * @param file       the file it was found in, null until attached
 * @param location   row and column of {@code range.start()}, null until attached
 */
public record Diagnostic(
        Rule rule,
        String message,
        @Nullable String suggestion,
        TextRange range,
        @Nullable Fix fix,
        @Nullable Path file,
        @Nullable Location location) {

    public Diagnostic {
        if (rule == null || message == null || range == null) {
            throw new IllegalArgumentException("rule, message and range are required");
        }
        if (fix != null && !range.contains(fix.range())) {
            throw new IllegalArgumentException(
                    "Fix range " + fix.range() + " of " + rule + " escapes the diagnostic range " + range);
        }
    }

    /**
     * A finding on {@code node} without a rewrite.
     */
    public static Diagnostic report(Rule rule, String message, @Nullable String suggestion, SyntaxNode node) {
        return new Diagnostic(rule, message, suggestion, node.textRange(), null, null, null);
    }

    /**
     * A finding that replaces the whole of {@code node} with {@code replacement}.
     * The fix is marked as skipped when the node carries comments.
     */
    public static Diagnostic replace(Rule rule, String message, @Nullable String suggestion, SyntaxNode node,
            String replacement) {
        return replace(rule, message, suggestion, node.textRange(), node.containsComments(), replacement);
    }

    public static Diagnostic replace(Rule rule, String message, @Nullable String suggestion, TextRange range,
            boolean hasComments, String replacement) {
        FixSafety safety = rule.fixStatus() == FixStatus.UNSAFE ? FixSafety.UNSAFE : FixSafety.SAFE;
        Fix fix = new Fix(replacement, range.start(), range.end(), hasComments, safety);
        return new Diagnostic(rule, message, suggestion, range, fix, null, null);
    }

    public boolean hasFix() {
        return fix != null;
    }

    /**
     * True when the diagnostic carries a fix that the patch engine may apply.
     */
    public boolean isFixable() {
        return fix != null && !fix.skip();
    }

    public Diagnostic withoutFix() {
        return fix == null ? this : new Diagnostic(rule, message, suggestion, range, null, file, location);
    }

    public Diagnostic withFile(@Nullable Path path, LineIndex lines) {
        LineIndex.Position position = lines.position(range.start());
        return new Diagnostic(rule, message, suggestion, range, fix, path,
                new Location(position.line(), position.column()));
    }
}
