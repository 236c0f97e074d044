package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class SprintfTest {

    @Test
    void testFormatWithoutConversions() throws Exception {
        Diagnostic diagnostic = single(Rule.SPRINTF, "sprintf(\"hello\")");
        assertEquals("`sprintf()` without special characters is useless.", diagnostic.message());
        assertEquals("\"hello\"", diagnostic.fix().content());
        assertEquals("\"100%\"", fix(Rule.SPRINTF, "sprintf(\"100%%\")"));
    }

    @Test
    void testInvalidPercent() throws Exception {
        Diagnostic diagnostic = single(Rule.SPRINTF, "sprintf(\"%y\", x)");
        assertEquals("`sprintf()` contains some invalid `%`.", diagnostic.message());
        assertFalse(diagnostic.hasFix());
    }

    @Test
    void testArgumentCountMismatch() throws Exception {
        Diagnostic diagnostic = single(Rule.SPRINTF, "sprintf(\"%s and %d\", x)");
        assertEquals("Mismatch between number of special characters and number of arguments.",
                diagnostic.message());
        assertEquals("Found 2 special character(s) and 1 argument(s).", diagnostic.suggestion());
        assertFalse(diagnostic.hasFix());
    }

    @Test
    void testValidCallsAreClean() throws Exception {
        assertClean(Rule.SPRINTF, "sprintf(\"%s\", x)");
        assertClean(Rule.SPRINTF, "sprintf(\"%5.2f%%\", x)");
        assertClean(Rule.SPRINTF, "sprintf(\"%*d\", 5, x)");
        assertClean(Rule.SPRINTF, "sprintf(\"%2$s %1$s\", a, b)");
        assertClean(Rule.SPRINTF, "sprintf(x = a, fmt = \"%s\")");
        assertClean(Rule.SPRINTF, "sprintf(fmt, x)");
        assertClean(Rule.SPRINTF, "sprintf(\"%s %s\", ...)");
        assertClean(Rule.SPRINTF, "x |> sprintf(\"%s\")");
    }
}
