package com.raditha.rlint.lints;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import static com.raditha.rlint.lints.LintTester.*;
import static org.junit.jupiter.api.Assertions.*;

class DuplicatedArgumentsTest {

    @Test
    void testDuplicatedNames() throws Exception {
        Diagnostic diagnostic = single(Rule.DUPLICATED_ARGUMENTS, "list(b = 1, a = 2, b = 3, a = 4, c = 5)");
        assertEquals("Avoid duplicate arguments in function calls. Duplicated argument(s): \"b\", \"a\".",
                diagnostic.message());
        assertFalse(diagnostic.hasFix());
    }

    @Test
    void testQuotedNamesMatchPlainNames() throws Exception {
        single(Rule.DUPLICATED_ARGUMENTS, "list(`a` = 1, \"a\" = 2)");
    }

    @Test
    void testAllowedFunctions() throws Exception {
        assertClean(Rule.DUPLICATED_ARGUMENTS, "c(a = 1, a = 2)");
        assertClean(Rule.DUPLICATED_ARGUMENTS, "dplyr::mutate(df, x = 1, x = x + 1)");
        assertClean(Rule.DUPLICATED_ARGUMENTS, "cli_bullets(x = \"a\", x = \"b\")");
    }

    @Test
    void testDistinctNames() throws Exception {
        assertClean(Rule.DUPLICATED_ARGUMENTS, "list(a = 1, b = 2, 3, 3)");
    }
}
