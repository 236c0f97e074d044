package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class SampleIntTest {

    @Test
    void testSampleOfRange() throws Exception {
        Diagnostic diagnostic = single(Rule.SAMPLE_INT, "sample(1:10, 2)");
        assertEquals("`sample(1:n, m, ...)` is less readable than `sample.int(n, m, ...)`.", diagnostic.message());
        assertEquals("sample.int(10, 2)", diagnostic.fix().content());
    }

    @Test
    void testIntegerStartAndNamedArguments() throws Exception {
        assertEquals("sample.int(n, replace = TRUE)", fix(Rule.SAMPLE_INT, "sample(1L:n, replace = TRUE)"));
        assertEquals("sample.int(length(v), size = 1)", fix(Rule.SAMPLE_INT, "sample(size = 1, x = 1:length(v))"));
    }

    @Test
    void testOtherRangesAreIgnored() throws Exception {
        assertClean(Rule.SAMPLE_INT, "sample(2:10, 1)");
        assertClean(Rule.SAMPLE_INT, "sample(x, 1)");
        assertClean(Rule.SAMPLE_INT, "sample(seq_len(n))");
    }
}
