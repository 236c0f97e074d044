package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpectNamedTest {

    @Test
    void testNamesComparison() throws Exception {
        Diagnostic diagnostic = single(Rule.EXPECT_NAMED, "expect_equal(names(x), c(\"a\", \"b\"))");
        assertEquals("`expect_named(x, n)` is better than `expect_equal(names(x), n)`.", diagnostic.message());
        assertEquals("expect_named(x, c(\"a\", \"b\"))", diagnostic.fix().content());
        assertEquals("expect_named(x, n)", fix(Rule.EXPECT_NAMED, "expect_identical(n, names(x))"));
    }

    @Test
    void testOtherNameFunctionsAreIgnored() throws Exception {
        assertClean(Rule.EXPECT_NAMED, "expect_equal(colnames(x), \"a\")");
        assertClean(Rule.EXPECT_NAMED, "expect_equal(rownames(x), names(y))");
        assertClean(Rule.EXPECT_NAMED, "expect_equal(names(x), names(y))");
        assertClean(Rule.EXPECT_NAMED, "expect_equal(x, \"a\")");
    }
}
