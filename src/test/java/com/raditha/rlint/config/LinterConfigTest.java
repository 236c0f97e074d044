package com.raditha.rlint.config;

import com.raditha.rlint.model.FixStatus;
import com.raditha.rlint.model.Rule;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LinterConfigTest {

    @Test
    void testDefaultsPreset() {
        LinterConfig config = LinterConfig.defaults();
        assertTrue(config.isEnabled(Rule.EQUALS_NA));
        assertFalse(config.isEnabled(Rule.GREPV));
        assertFalse(config.unsafeFixes());
        assertEquals(AssignmentOperator.LEFT_ARROW, config.assignment());
    }

    @Test
    void testStrictPreset() {
        LinterConfig config = LinterConfig.strict();
        assertEquals(EnumSet.allOf(Rule.class), config.enabledRules());
        assertTrue(config.isFixAllowed(Rule.ALL_EQUAL));
    }

    @Test
    void testUnsafeFixNeedsOptIn() {
        assertFalse(LinterConfig.only(Rule.ALL_EQUAL).isFixAllowed(Rule.ALL_EQUAL));
        assertTrue(LinterConfig.only(Rule.ALL_EQUAL).withUnsafeFixes(true).isFixAllowed(Rule.ALL_EQUAL));
    }

    @Test
    void testReportOnlyRulesNeverFix() {
        assertFalse(LinterConfig.strict().isFixAllowed(Rule.TRUE_FALSE_SYMBOL));
    }

    @Test
    void testUnfixableWinsOverFixable() {
        LinterConfig config = new LinterConfig(EnumSet.of(Rule.REPEAT), AssignmentOperator.LEFT_ARROW, false,
                EnumSet.of(Rule.REPEAT), EnumSet.of(Rule.REPEAT), null, null);
        assertFalse(config.isFixAllowed(Rule.REPEAT));
    }

    @Test
    void testRequiredFields() {
        assertThrows(IllegalArgumentException.class,
                () -> new LinterConfig(null, AssignmentOperator.LEFT_ARROW, false, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new LinterConfig(Set.of(), null, false, null, null, null, null));
    }

    @Test
    void testAssignmentOperatorFromString() {
        assertEquals(AssignmentOperator.LEFT_ARROW, AssignmentOperator.fromString(" <- "));
        assertEquals(AssignmentOperator.EQUALS, AssignmentOperator.fromString("="));
        assertThrows(IllegalArgumentException.class, () -> AssignmentOperator.fromString("->"));
    }

    @Property(tries = 50)
    void onlyEnablesExactlyTheGivenRule(@ForAll Rule rule) {
        LinterConfig config = LinterConfig.only(rule);
        assertEquals(Set.of(rule), config.enabledRules());
        assertEquals(rule.hasFix() && rule.fixStatus() != FixStatus.UNSAFE,
                config.isFixAllowed(rule));
    }
}
