package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.TextRange;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class AnyDuplicatedTest {

    @Test
    void testFlagsAnyOfDuplicated() throws Exception {
        Diagnostic diagnostic = single(Rule.ANY_DUPLICATED, "any(duplicated(x))");
        assertEquals("`any(duplicated(...))` is inefficient.", diagnostic.message());
        assertEquals("Use `anyDuplicated(...) > 0` instead.", diagnostic.suggestion());
        assertEquals(new TextRange(0, 18), diagnostic.range());
        assertEquals("anyDuplicated(x) > 0", diagnostic.fix().content());
        assertEquals(diagnostic.range(), diagnostic.fix().range());
    }

    @Test
    void testFixKeepsInnerArguments() throws Exception {
        assertEquals("y <- anyDuplicated(df$a, fromLast = TRUE) > 0\n",
                fix(Rule.ANY_DUPLICATED, "y <- any(duplicated(df$a, fromLast = TRUE))\n"));
    }

    @Test
    void testOtherShapesAreIgnored() throws Exception {
        assertClean(Rule.ANY_DUPLICATED, "any(duplicated(x), na.rm = TRUE)");
        assertClean(Rule.ANY_DUPLICATED, "any(x)");
        assertClean(Rule.ANY_DUPLICATED, "all(duplicated(x))");
        assertClean(Rule.ANY_DUPLICATED, "anyDuplicated(x) > 0");
    }
}
