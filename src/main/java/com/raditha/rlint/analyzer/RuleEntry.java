package com.raditha.rlint.analyzer;

import com.raditha.rlint.model.Rule;

/**
 * A rule together with the function that implements it.
 *
 * @param rule     the rule reported by {@code function}
 * @param function the rule body
 */
public record RuleEntry(Rule rule, RuleFunction function) {

    public RuleEntry {
        if (rule == null || function == null) {
            throw new IllegalArgumentException("rule and function are required");
        }
    }
}
