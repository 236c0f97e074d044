package com.raditha.rlint.config;

import com.raditha.rlint.model.FixStatus;
import com.raditha.rlint.model.Rule;

import java.util.EnumSet;
import java.util.Set;

/**
 * Resolved configuration for one lint run.
 *
 * @param enabledRules rules to run
 * @param assignment   preferred assignment operator for the {@code assignment} rule
 * @param unsafeFixes  whether fixes classified as unsafe may be applied
 * @param fixable      rules whose fixes may be applied
 * @param unfixable    rules whose fixes are never applied; wins over {@code fixable}
 * @param globals      names treated as defined in every file, on top of base R
 * @param exports      names never reported as unused
 */
public record LinterConfig(
        Set<Rule> enabledRules,
        AssignmentOperator assignment,
        boolean unsafeFixes,
        Set<Rule> fixable,
        Set<Rule> unfixable,
        Set<String> globals,
        Set<String> exports) {

    /**
     * Validate configuration.
     */
    public LinterConfig {
        if (enabledRules == null) {
            throw new IllegalArgumentException("enabledRules cannot be null");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("assignment cannot be null");
        }
        enabledRules = Set.copyOf(enabledRules);
        fixable = fixable == null ? EnumSet.allOf(Rule.class) : Set.copyOf(fixable);
        unfixable = unfixable == null ? Set.of() : Set.copyOf(unfixable);
        globals = globals == null ? Set.of() : Set.copyOf(globals);
        exports = exports == null ? Set.of() : Set.copyOf(exports);
    }

    /**
     * Default preset: the rules enabled by default, safe fixes only.
     */
    public static LinterConfig defaults() {
        EnumSet<Rule> rules = EnumSet.noneOf(Rule.class);
        for (Rule rule : Rule.values()) {
            if (rule.isEnabledByDefault() && rule.minRVersion().isEmpty()) {
                rules.add(rule);
            }
        }
        return new LinterConfig(rules, AssignmentOperator.LEFT_ARROW, false, null, null, null, null);
    }

    /**
     * Strict preset: every rule, including the semantic ones, with unsafe fixes allowed.
     */
    public static LinterConfig strict() {
        return new LinterConfig(EnumSet.allOf(Rule.class), AssignmentOperator.LEFT_ARROW, true, null, null, null,
                null);
    }

    /**
     * A configuration that runs exactly {@code rules}.
     */
    public static LinterConfig only(Rule... rules) {
        Set<Rule> set = rules.length == 0 ? EnumSet.noneOf(Rule.class) : EnumSet.of(rules[0], rules);
        return new LinterConfig(set, AssignmentOperator.LEFT_ARROW, false, null, null, null, null);
    }

    public LinterConfig withAssignment(AssignmentOperator operator) {
        return new LinterConfig(enabledRules, operator, unsafeFixes, fixable, unfixable, globals, exports);
    }

    public LinterConfig withUnsafeFixes(boolean allowed) {
        return new LinterConfig(enabledRules, assignment, allowed, fixable, unfixable, globals, exports);
    }

    public LinterConfig withGlobals(Set<String> names) {
        return new LinterConfig(enabledRules, assignment, unsafeFixes, fixable, unfixable, names, exports);
    }

    public LinterConfig withExports(Set<String> names) {
        return new LinterConfig(enabledRules, assignment, unsafeFixes, fixable, unfixable, globals, names);
    }

    public boolean isEnabled(Rule rule) {
        return enabledRules.contains(rule);
    }

    /**
     * Whether a fix produced by {@code rule} may be kept for the patch engine.
     */
    public boolean isFixAllowed(Rule rule) {
        if (rule.fixStatus() == FixStatus.NONE) {
            return false;
        }
        if (rule.fixStatus() == FixStatus.UNSAFE && !unsafeFixes) {
            return false;
        }
        return fixable.contains(rule) && !unfixable.contains(rule);
    }
}
