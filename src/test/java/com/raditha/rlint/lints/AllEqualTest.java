package com.raditha.rlint.lints;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.FixSafety;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class AllEqualTest {

    @Test
    void testIsFalseOfAllEqual() throws Exception {
        Diagnostic diagnostic = single(Rule.ALL_EQUAL, "isFALSE(all.equal(a, b))");
        assertEquals("`isFALSE(all.equal())` always returns `FALSE`", diagnostic.message());
        assertEquals("Use `!isTRUE()` to check for differences instead.", diagnostic.suggestion());
        assertEquals("!isTRUE(all.equal(a, b))", diagnostic.fix().content());
        assertEquals(FixSafety.UNSAFE, diagnostic.fix().safety());
    }

    @Test
    void testConditionIsWrapped() throws Exception {
        assertEquals("if (isTRUE(all.equal(a, b))) 1", fix(Rule.ALL_EQUAL, "if (all.equal(a, b)) 1"));
        assertEquals("while (isTRUE(all.equal(x, y))) x <- f(x)",
                fix(Rule.ALL_EQUAL, "while (all.equal(x, y)) x <- f(x)"));
    }

    @Test
    void testNegationIsReplaced() throws Exception {
        Diagnostic diagnostic = single(Rule.ALL_EQUAL, "if (!all.equal(a, b)) 1");
        assertEquals(AllEqual.MESSAGE, diagnostic.message());
        assertEquals(AllEqual.SUGGESTION, diagnostic.suggestion());
        assertEquals("if (!isTRUE(all.equal(a, b))) 1", fix(Rule.ALL_EQUAL, "if (!all.equal(a, b)) 1"));
    }

    @Test
    void testFixedCodeIsClean() throws Exception {
        assertClean(Rule.ALL_EQUAL, "!isTRUE(all.equal(a, b))");
        assertClean(Rule.ALL_EQUAL, "if (isTRUE(all.equal(a, b))) 1");
        assertClean(Rule.ALL_EQUAL, "same <- all.equal(a, b)");
    }

    @Test
    void testFixIsDroppedWithoutUnsafeFixes() throws Exception {
        List<Diagnostic> diagnostics = check(LinterConfig.only(Rule.ALL_EQUAL), "if (all.equal(a, b)) 1");
        assertEquals(1, diagnostics.size());
        assertFalse(diagnostics.get(0).hasFix());
    }
}
