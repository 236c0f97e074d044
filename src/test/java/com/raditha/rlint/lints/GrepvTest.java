package com.raditha.rlint.lints;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class GrepvTest {

    @Test
    void testNamedValue() throws Exception {
        Diagnostic diagnostic = single(Rule.GREPV, "grep(\"a\", x, value = TRUE)");
        assertEquals("Use `grepv(...)` instead of `grep(..., value = TRUE)`.", diagnostic.message());
        assertEquals("grepv(\"a\", x)", diagnostic.fix().content());
    }

    @Test
    void testPositionalValue() throws Exception {
        assertEquals("grepv(\"a\", x, FALSE, TRUE)", fix(Rule.GREPV, "grep(\"a\", x, FALSE, TRUE, T)"));
    }

    @Test
    void testOtherArgumentsAreKept() throws Exception {
        assertEquals("grepv(\"a\", x, ignore.case = TRUE)",
                fix(Rule.GREPV, "grep(\"a\", value = TRUE, x, ignore.case = TRUE)"));
    }

    @Test
    void testValueFalseOrMissingIsIgnored() throws Exception {
        assertClean(Rule.GREPV, "grep(\"a\", x, value = FALSE)");
        assertClean(Rule.GREPV, "grep(\"a\", x)");
        assertClean(Rule.GREPV, "grepl(\"a\", x, value = TRUE)");
    }

    @Test
    void testNotSelectedByDefault() {
        assertFalse(LinterConfig.defaults().isEnabled(Rule.GREPV));
    }
}
