package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class OuterNegationTest {

    @Test
    void testAnyOfNegation() throws Exception {
        Diagnostic diagnostic = single(Rule.OUTER_NEGATION, "any(!x)");
        assertEquals("`any(!x)` may be hard to read.", diagnostic.message());
        assertEquals("Use `!all(x)` instead.", diagnostic.suggestion());
        assertEquals("!all(x)", diagnostic.fix().content());
    }

    @Test
    void testAllOfNegation() throws Exception {
        assertEquals("!any(x)", fix(Rule.OUTER_NEGATION, "all(!x)"));
        assertEquals("!any(is.na(x))", fix(Rule.OUTER_NEGATION, "all(!is.na(x))"));
    }

    @Test
    void testOtherShapesAreIgnored() throws Exception {
        assertClean(Rule.OUTER_NEGATION, "any(x)");
        assertClean(Rule.OUTER_NEGATION, "any(!x, y)");
        assertClean(Rule.OUTER_NEGATION, "any(!x, na.rm = TRUE)");
        assertClean(Rule.OUTER_NEGATION, "all(!!x)");
        assertClean(Rule.OUTER_NEGATION, "!any(!x)");
        assertClean(Rule.OUTER_NEGATION, "sum(!x)");
    }
}
