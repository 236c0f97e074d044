package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class MatrixApplyTest {

    @Test
    void testRowSums() throws Exception {
        Diagnostic diagnostic = single(Rule.MATRIX_APPLY, "apply(x, 1, sum)");
        assertEquals("`apply(x, 1, sum)` is inefficient.", diagnostic.message());
        assertEquals("Use `rowSums(x)` instead.", diagnostic.suggestion());
        assertEquals("rowSums(x)", diagnostic.fix().content());
    }

    @Test
    void testVariants() throws Exception {
        assertEquals("rowMeans(x)", fix(Rule.MATRIX_APPLY, "apply(x, 1L, mean)"));
        assertEquals("colSums(x)", fix(Rule.MATRIX_APPLY, "apply(x, 2, sum)"));
        assertEquals("colMeans(m)", fix(Rule.MATRIX_APPLY, "apply(FUN = mean, MARGIN = 2L, X = m)"));
        assertEquals("rowSums(x, na.rm = TRUE)", fix(Rule.MATRIX_APPLY, "apply(x, 1, sum, na.rm = TRUE)"));
    }

    @Test
    void testOtherShapesAreIgnored() throws Exception {
        assertClean(Rule.MATRIX_APPLY, "apply(x, 1, prod)");
        assertClean(Rule.MATRIX_APPLY, "apply(x, 1, f, sum)");
        assertClean(Rule.MATRIX_APPLY, "apply(x, 1, mean, trim = 0.2)");
        assertClean(Rule.MATRIX_APPLY, "apply(x, c(2, 4), sum)");
        assertClean(Rule.MATRIX_APPLY, "apply(x, m, sum)");
        assertClean(Rule.MATRIX_APPLY, "apply(X =, 1, sum)");
    }
}
