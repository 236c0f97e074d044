package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class VectorLogicTest {

    @Test
    void testVectorAndInIf() throws Exception {
        Diagnostic diagnostic = single(Rule.VECTOR_LOGIC, "if (x & y) 1");
        assertEquals("`&` in `if()` statements can be inefficient.", diagnostic.message());
        assertFalse(diagnostic.hasFix());
    }

    @Test
    void testVectorOrInWhile() throws Exception {
        Diagnostic diagnostic = single(Rule.VECTOR_LOGIC, "while (x | y) f()");
        assertEquals("`|` in `while()` statements can be inefficient.", diagnostic.message());
    }

    @Test
    void testOtherUsesAreIgnored() throws Exception {
        assertClean(Rule.VECTOR_LOGIC, "if (x && y) 1");
        assertClean(Rule.VECTOR_LOGIC, "z <- x & y");
        assertClean(Rule.VECTOR_LOGIC, "if (any(x & y)) 1");
        assertClean(Rule.VECTOR_LOGIC, "if (as.raw(x) & y) 1");
        assertClean(Rule.VECTOR_LOGIC, "if (x | as.hexmode(\"ff\")) 1");
        assertClean(Rule.VECTOR_LOGIC, "if (\"a\" | y) 1");
    }

    @Test
    void testOnlyTheWholeConditionIsReported() throws Exception {
        Diagnostic diagnostic = single(Rule.VECTOR_LOGIC, "if (a & b & c) 1");
        assertEquals(4, diagnostic.range().start());
        assertEquals(13, diagnostic.range().end());
    }
}
