package com.raditha.rlint.lints;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.workflow.FileLinter;
import com.raditha.rlint.workflow.FileOutcome;
import com.raditha.rlint.workflow.FixMode;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class EqualsNullTest {

    @Test
    void testEqualityWithNull() throws Exception {
        Diagnostic diagnostic = single(Rule.EQUALS_NULL, "x == NULL");
        assertEquals("Comparing to NULL with `==`, `!=` or `%in%` is problematic.", diagnostic.message());
        assertEquals("Use `is.null()` instead.", diagnostic.suggestion());
        assertEquals("is.null(x)", diagnostic.fix().content());
    }

    @Test
    void testNullOnEitherSide() throws Exception {
        assertEquals("!is.null(y$z)", fix(Rule.EQUALS_NULL, "NULL != y$z"));
        assertEquals("is.null(x)", fix(Rule.EQUALS_NULL, "x %in% NULL"));
    }

    @Test
    void testCommentKeepsDiagnosticButSkipsFix() throws Exception {
        String source = "# c\nx == NULL";
        Diagnostic diagnostic = single(Rule.EQUALS_NULL, source);
        assertTrue(diagnostic.hasFix());
        assertTrue(diagnostic.fix().skip());
        assertFalse(diagnostic.isFixable());

        FileOutcome outcome = new FileLinter().lintSource(FILE, source, LinterConfig.only(Rule.EQUALS_NULL),
                FixMode.APPLY);
        assertEquals(0, outcome.fixesApplied());
        assertEquals(1, outcome.fixesSkipped());
        assertEquals(1, outcome.diagnostics().size());
        assertEquals(source, fix(Rule.EQUALS_NULL, source));
    }

    @Test
    void testOtherComparisonsAreIgnored() throws Exception {
        assertClean(Rule.EQUALS_NULL, "NULL == NULL");
        assertClean(Rule.EQUALS_NULL, "x > NULL");
        assertClean(Rule.EQUALS_NULL, "is.null(x)");
    }
}
