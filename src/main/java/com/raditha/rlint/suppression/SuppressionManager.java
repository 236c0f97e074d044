package com.raditha.rlint.suppression;

import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.LineIndex;
import com.raditha.rlint.syntax.SyntaxToken;
import com.raditha.rlint.syntax.SyntaxTree;
import com.raditha.rlint.syntax.TextRange;
import com.raditha.rlint.syntax.Trivia;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers whether a rule is disabled for a range by {@code # nolint} comments.
 * <p>
 * Supported directives:
 * <ul>
 * <li>{@code x == NA # nolint} disables all rules for code starting on that line;</li>
 * <li>{@code # nolint} alone on a line disables them for the next line;</li>
 * <li>{@code # nolint start} ... {@code # nolint end} disables them for every
 * line in between (to the end of the file when {@code end} is missing).</li>
 * </ul>
 * Each form accepts a rule list, as in {@code # nolint: equals_na, repeat}.
 * <p>
 * Only the line a range starts on is consulted. A call that opens above a
 * {@code # nolint start} line stays reported even when its arguments run into
 * the block, and a directive inside a multi-line function does not silence the
 * assignment enclosing it.
 */
public class SuppressionManager {

    private static final Logger logger = LoggerFactory.getLogger(SuppressionManager.class);

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^#+\\s*nolint(?:\\s+(start|end))?\\s*(?::\\s*([A-Za-z0-9_.,\\s]*?))?\\s*\\.?\\s*$");

    /**
     * Lines {@code fromLine..toLine} (inclusive) on which {@code rules} are
     * disabled; null rules disable every rule.
     *
     * @param fromLine first suppressed line
     * @param toLine   last suppressed line
     * @param rules    suppressed rules, null for all
     */
    record Directive(int fromLine, int toLine, @Nullable Set<Rule> rules) {
        boolean covers(int line, Rule rule) {
            return fromLine <= line && line <= toLine && (rules == null || rules.contains(rule));
        }
    }

    private final LineIndex lines;
    private final List<Directive> directives;

    private SuppressionManager(LineIndex lines, List<Directive> directives) {
        this.lines = lines;
        this.directives = List.copyOf(directives);
    }

    /**
     * A manager that never suppresses anything.
     */
    public static SuppressionManager none(LineIndex lines) {
        return new SuppressionManager(lines, List.of());
    }

    public static SuppressionManager fromTree(SyntaxTree tree) {
        LineIndex lines = tree.lineIndex();
        List<Directive> directives = new ArrayList<>();
        Directive openBlock = null;
        for (SyntaxToken token : tree.root().tokens()) {
            for (int pass = 0; pass < 2; pass++) {
                boolean trailing = pass == 1;
                for (Trivia trivia : trailing ? token.trailingTrivia() : token.leadingTrivia()) {
                    if (!trivia.isComment()) {
                        continue;
                    }
                    Matcher matcher = DIRECTIVE.matcher(trivia.text().trim());
                    if (!matcher.matches()) {
                        continue;
                    }
                    int line = lines.lineOf(trivia.offset());
                    String mode = matcher.group(1);
                    Set<Rule> rules = parseRules(matcher.group(2));
                    if ("start".equals(mode)) {
                        if (openBlock != null) {
                            directives.add(new Directive(openBlock.fromLine(), line, openBlock.rules()));
                        }
                        openBlock = new Directive(line, Integer.MAX_VALUE, rules);
                    } else if ("end".equals(mode)) {
                        if (openBlock != null) {
                            directives.add(new Directive(openBlock.fromLine(), line, openBlock.rules()));
                            openBlock = null;
                        }
                    } else if (trailing) {
                        directives.add(new Directive(line, line, rules));
                    } else {
                        directives.add(new Directive(line + 1, line + 1, rules));
                    }
                }
            }
        }
        if (openBlock != null) {
            directives.add(openBlock);
        }
        return new SuppressionManager(lines, directives);
    }

    private static @Nullable Set<Rule> parseRules(@Nullable String list) {
        if (list == null || list.isBlank()) {
            return null;
        }
        Set<Rule> rules = EnumSet.noneOf(Rule.class);
        for (String name : list.split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Rule.fromId(trimmed).ifPresentOrElse(rules::add,
                    () -> logger.debug("Ignoring unknown rule '{}' in nolint directive", trimmed));
        }
        return rules;
    }

    /**
     * True when {@code rule} is disabled on the line where {@code range} starts.
     */
    public boolean shouldSkip(TextRange range, Rule rule) {
        if (directives.isEmpty()) {
            return false;
        }
        int line = lines.lineOf(range.start());
        for (Directive directive : directives) {
            if (directive.covers(line, rule)) {
                return true;
            }
        }
        return false;
    }

    public int directiveCount() {
        return directives.size();
    }
}
