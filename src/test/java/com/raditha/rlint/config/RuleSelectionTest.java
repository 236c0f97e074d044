package com.raditha.rlint.config;

import com.raditha.rlint.model.Category;
import com.raditha.rlint.model.FixStatus;
import com.raditha.rlint.model.RVersion;
import com.raditha.rlint.model.Rule;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleSelectionTest {

    private static RuleSelection selection(List<String> cliSelect, List<String> tomlSelect, List<String> extend,
            List<String> ignore, RVersion version) {
        return new RuleSelection(cliSelect, tomlSelect, extend, ignore, version, false, false, false);
    }

    @Test
    void testDefaultsAreEnabledByDefaultRules() {
        Set<Rule> rules = RuleSelection.defaults().resolve();
        assertTrue(rules.contains(Rule.EQUALS_NA));
        assertTrue(rules.contains(Rule.REPEAT));
        assertFalse(rules.contains(Rule.ASSIGNMENT), "assignment is opt-in");
        assertFalse(rules.contains(Rule.UNUSED_OBJECT), "semantic rules are opt-in");
        assertFalse(rules.contains(Rule.GREPV), "grepv needs R 4.5 to be known");
        assertFalse(rules.contains(Rule.EXPECT_NULL), "testthat rules are opt-in");
        assertTrue(rules.contains(Rule.UNREACHABLE_CODE));
    }

    @Test
    void testCliSelectReplacesFileSelect() {
        Set<Rule> rules = selection(List.of("repeat"), List.of("equals_na"), List.of(), List.of(), null).resolve();
        assertEquals(EnumSet.of(Rule.REPEAT), rules);
    }

    @Test
    void testFileSelectUsedWithoutCliSelect() {
        Set<Rule> rules = selection(null, List.of("equals_na"), List.of(), List.of(), null).resolve();
        assertEquals(EnumSet.of(Rule.EQUALS_NA), rules);
    }

    @Test
    void testCategoryExpansionAndIgnore() {
        Set<Rule> rules = selection(List.of("CORR"), null, List.of(), List.of("equals_null"), null).resolve();
        assertTrue(rules.contains(Rule.EQUALS_NA));
        assertTrue(rules.contains(Rule.UNDEFINED_OBJECT));
        assertFalse(rules.contains(Rule.EQUALS_NULL));
        for (Rule rule : rules) {
            assertTrue(rule.categories().contains(Category.CORR));
        }
    }

    @Test
    void testTestthatCategorySelectsExpectationRules() {
        Set<Rule> rules = selection(List.of("TESTTHAT"), null, List.of(), List.of(), null).resolve();
        assertEquals(EnumSet.of(Rule.EXPECT_LENGTH, Rule.EXPECT_NAMED, Rule.EXPECT_NULL), rules);
    }

    @Test
    void testExtendSelectAddsToDefaults() {
        Set<Rule> rules = selection(null, null, List.of("assignment"), List.of(), null).resolve();
        assertTrue(rules.contains(Rule.ASSIGNMENT));
        assertTrue(rules.contains(Rule.ANY_IS_NA));
    }

    @Test
    void testAllSelectsEveryVersionCompatibleRule() {
        Set<Rule> old = selection(List.of("ALL"), null, List.of(), List.of(), RVersion.parse("4.1")).resolve();
        assertFalse(old.contains(Rule.GREPV));
        assertFalse(old.contains(Rule.COALESCE), "coalesce needs R 4.4");
        assertTrue(old.contains(Rule.LIST2DF));
        assertEquals(Rule.values().length - 2, old.size());

        Set<Rule> recent = selection(List.of("ALL"), null, List.of(), List.of(), RVersion.parse("4.5.0")).resolve();
        assertEquals(EnumSet.allOf(Rule.class), recent);
    }

    @Test
    void testFixOnlyDropsRulesWithoutFix() {
        RuleSelection selection = new RuleSelection(List.of("ALL"), null, List.of(), List.of(), null, true, true,
                false);
        Set<Rule> rules = selection.resolve();
        assertTrue(rules.contains(Rule.ANY_IS_NA));
        assertFalse(rules.contains(Rule.TRUE_FALSE_SYMBOL));
        assertFalse(rules.contains(Rule.ALL_EQUAL), "unsafe fixes were not allowed");
    }

    @Test
    void testFixKeepsReportOnlyRules() {
        RuleSelection selection = new RuleSelection(List.of("ALL"), null, List.of(), List.of(), null, true, false,
                true);
        Set<Rule> rules = selection.resolve();
        assertTrue(rules.contains(Rule.TRUE_FALSE_SYMBOL));
        assertTrue(rules.contains(Rule.ALL_EQUAL));
    }

    @Test
    void testUnknownNameIsRejected() {
        RuleSelection selection = selection(List.of("no_such_rule"), null, List.of(), List.of(), null);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, selection::resolve);
        assertTrue(e.getMessage().contains("no_such_rule"));
    }

    @Test
    void testLowercaseCategoryIsNotACategory() {
        assertThrows(IllegalArgumentException.class, () -> RuleSelection.expand(List.of("corr")));
    }

    @Test
    void testAnyWithFix() {
        assertTrue(RuleSelection.anyWithFix(EnumSet.of(Rule.ALL_EQUAL), FixStatus.UNSAFE));
        assertFalse(RuleSelection.anyWithFix(EnumSet.of(Rule.REPEAT), FixStatus.UNSAFE));
    }
}
