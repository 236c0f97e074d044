package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class SeqTest {

    @Test
    void testOneToLength() throws Exception {
        Diagnostic diagnostic = single(Rule.SEQ, "1:length(x)");
        assertEquals("`1:length(...)` can be wrong if the RHS is 0.", diagnostic.message());
        assertEquals("Use `seq_along(...)` instead.", diagnostic.suggestion());
        assertEquals("seq_along(x)", diagnostic.fix().content());
    }

    @Test
    void testDimensions() throws Exception {
        assertEquals("seq_len(nrow(df))", fix(Rule.SEQ, "1:nrow(df)"));
        assertEquals("seq_len(NCOL(df))", fix(Rule.SEQ, "1L:NCOL(df)"));
        assertEquals("Use `seq_len(ncol(...))` instead.", single(Rule.SEQ, "1:ncol(x)").suggestion());
    }

    @Test
    void testOtherRangesAreIgnored() throws Exception {
        assertClean(Rule.SEQ, "1:10");
        assertClean(Rule.SEQ, "2:length(x)");
        assertClean(Rule.SEQ, "1:(length(x) || 1)");
        assertClean(Rule.SEQ, "1:foo(x)");
        assertClean(Rule.SEQ, "1:dim(x)[1]");
    }
}
