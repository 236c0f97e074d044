package com.raditha.rlint.suppression;

import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RParser;
import com.raditha.rlint.syntax.SyntaxTree;
import com.raditha.rlint.syntax.TextRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SuppressionManagerTest {

    private static SuppressionManager manager(String source) {
        return SuppressionManager.fromTree(RParser.parse(source));
    }

    private static TextRange lineStart(String source, int line) {
        int offset = 0;
        for (int i = 1; i < line; i++) {
            offset = source.indexOf('\n', offset) + 1;
        }
        return TextRange.empty(offset);
    }

    @Test
    void testTrailingDirectiveCoversItsLine() {
        String source = "x == NA # nolint\ny == NA\n";
        SuppressionManager suppressions = manager(source);
        assertTrue(suppressions.shouldSkip(lineStart(source, 1), Rule.EQUALS_NA));
        assertFalse(suppressions.shouldSkip(lineStart(source, 2), Rule.EQUALS_NA));
    }

    @Test
    void testOwnLineDirectiveCoversNextLine() {
        String source = "# nolint\nx == NA\ny == NA\n";
        SuppressionManager suppressions = manager(source);
        assertTrue(suppressions.shouldSkip(lineStart(source, 2), Rule.EQUALS_NA));
        assertFalse(suppressions.shouldSkip(lineStart(source, 3), Rule.EQUALS_NA));
    }

    @Test
    void testRuleListLimitsDirective() {
        String source = "x == NA # nolint: equals_null, repeat.\n";
        SuppressionManager suppressions = manager(source);
        assertTrue(suppressions.shouldSkip(lineStart(source, 1), Rule.EQUALS_NULL));
        assertTrue(suppressions.shouldSkip(lineStart(source, 1), Rule.REPEAT));
        assertFalse(suppressions.shouldSkip(lineStart(source, 1), Rule.EQUALS_NA));
    }

    @Test
    void testUnknownRuleNamesSuppressNothing() {
        String source = "x == NA # nolint: no_such_rule\n";
        assertFalse(manager(source).shouldSkip(lineStart(source, 1), Rule.EQUALS_NA));
    }

    @Test
    void testBlockDirective() {
        String source = """
                a == NA
                # nolint start
                b == NA
                c == NA
                # nolint end
                d == NA
                """;
        SuppressionManager suppressions = manager(source);
        assertFalse(suppressions.shouldSkip(lineStart(source, 1), Rule.EQUALS_NA));
        assertTrue(suppressions.shouldSkip(lineStart(source, 3), Rule.EQUALS_NA));
        assertTrue(suppressions.shouldSkip(lineStart(source, 4), Rule.EQUALS_NA));
        assertFalse(suppressions.shouldSkip(lineStart(source, 6), Rule.EQUALS_NA));
    }

    @Test
    void testUnterminatedBlockRunsToEndOfFile() {
        String source = "# nolint start: repeat\nwhile (TRUE) 1\n\n\nwhile (TRUE) 2\n";
        SuppressionManager suppressions = manager(source);
        assertTrue(suppressions.shouldSkip(lineStart(source, 5), Rule.REPEAT));
        assertFalse(suppressions.shouldSkip(lineStart(source, 5), Rule.EQUALS_NA));
    }

    @Test
    void testOrdinaryCommentsAreIgnored() {
        SyntaxTree tree = RParser.parse("# no lint here\nx == NA # nolintish\n");
        SuppressionManager suppressions = SuppressionManager.fromTree(tree);
        assertEquals(0, suppressions.directiveCount());
    }

    @Test
    void testNoneSkipsNothing() {
        SyntaxTree tree = RParser.parse("x == NA # nolint\n");
        SuppressionManager suppressions = SuppressionManager.none(tree.lineIndex());
        assertFalse(suppressions.shouldSkip(TextRange.empty(0), Rule.EQUALS_NA));
    }

    @Test
    void testStartLineDecidesForMultiLineRanges() {
        String source = """
                f(
                  # nolint start
                  x == NA
                )
                # nolint end
                """;
        SuppressionManager suppressions = manager(source);
        TextRange call = new TextRange(0, source.indexOf(')') + 1);
        assertFalse(suppressions.shouldSkip(call, Rule.EQUALS_NA));
        assertTrue(suppressions.shouldSkip(lineStart(source, 3), Rule.EQUALS_NA));
    }

    @Test
    void testDirectiveInsideFunctionDoesNotCoverEnclosingAssignment() {
        String source = "f <- function() {\n  x == NA # nolint\n}\n";
        SuppressionManager suppressions = manager(source);
        assertFalse(suppressions.shouldSkip(new TextRange(0, source.length() - 1), Rule.EQUALS_NA));
        assertTrue(suppressions.shouldSkip(lineStart(source, 2), Rule.EQUALS_NA));
    }
}
