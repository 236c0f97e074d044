package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpectLengthTest {

    @Test
    void testLengthOnEitherSide() throws Exception {
        Diagnostic diagnostic = single(Rule.EXPECT_LENGTH, "expect_equal(length(x), 2L)");
        assertEquals("`expect_length(x, n)` is better than `expect_equal(length(x), n)`.", diagnostic.message());
        assertEquals("expect_length(x, 2L)", diagnostic.fix().content());
        assertEquals("expect_length(x, n)", fix(Rule.EXPECT_LENGTH, "expect_identical(n, length(x))"));
        assertEquals("expect_length(foo(y), 3)", fix(Rule.EXPECT_LENGTH,
                "testthat::expect_equal(expected = 3, object = length(foo(y)))"));
    }

    @Test
    void testOtherShapesAreIgnored() throws Exception {
        assertClean(Rule.EXPECT_LENGTH, "expect_equal(nchar(x), 2)");
        assertClean(Rule.EXPECT_LENGTH, "expect_equal(length(x), length(y))");
        assertClean(Rule.EXPECT_LENGTH, "expect_equal(length(x), 2, tolerance = 1)");
        assertClean(Rule.EXPECT_LENGTH, "expect_true(length(x) == 2)");
        assertClean(Rule.EXPECT_LENGTH, "expect_equal(length(x))");
        assertClean(Rule.EXPECT_LENGTH, "expect_equal(length(), 1)");
    }
}
