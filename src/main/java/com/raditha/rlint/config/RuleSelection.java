package com.raditha.rlint.config;

import com.raditha.rlint.model.Category;
import com.raditha.rlint.model.FixStatus;
import com.raditha.rlint.model.RVersion;
import com.raditha.rlint.model.Rule;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the set of rules to run from command-line and file selections.
 *
 * @param cliSelect        {@code --select} names, null when not given
 * @param tomlSelect       {@code select} from the configuration file, null when absent
 * @param extendSelect     {@code --extend-select} and {@code extend-select} names
 * @param ignore           {@code --ignore} and {@code ignore} names, unioned
 * @param minRVersion      oldest R version the code must run on, null when unknown
 * @param fix              fixes were requested
 * @param fixOnly          fixes were requested without reporting
 * @param unsafeFixes      unsafe fixes were allowed
 */
public record RuleSelection(
        @Nullable List<String> cliSelect,
        @Nullable List<String> tomlSelect,
        List<String> extendSelect,
        List<String> ignore,
        @Nullable RVersion minRVersion,
        boolean fix,
        boolean fixOnly,
        boolean unsafeFixes) {

    public static final String ALL = "ALL";

    public RuleSelection {
        extendSelect = extendSelect == null ? List.of() : List.copyOf(extendSelect);
        ignore = ignore == null ? List.of() : List.copyOf(ignore);
    }

    public static RuleSelection defaults() {
        return new RuleSelection(null, null, List.of(), List.of(), null, false, false, false);
    }

    /**
     * Resolve the selection to concrete rules.
     *
     * @throws IllegalArgumentException if a name is neither a rule, a category nor {@code ALL}
     */
    public Set<Rule> resolve() {
        Set<Rule> rules;
        if (cliSelect != null && !cliSelect.isEmpty()) {
            rules = expand(cliSelect);
        } else if (tomlSelect != null && !tomlSelect.isEmpty()) {
            rules = expand(tomlSelect);
        } else {
            rules = EnumSet.noneOf(Rule.class);
            for (Rule rule : Rule.values()) {
                if (rule.isEnabledByDefault()) {
                    rules.add(rule);
                }
            }
        }
        rules.addAll(expand(extendSelect));
        rules.removeAll(expand(ignore));

        rules.removeIf(rule -> !supportsVersion(rule));
        if (fix || fixOnly) {
            rules.removeIf(rule -> !appliesUnderFix(rule));
        }
        return rules;
    }

    private boolean supportsVersion(Rule rule) {
        Optional<RVersion> required = rule.minRVersion();
        if (required.isEmpty()) {
            return true;
        }
        return minRVersion != null && minRVersion.isAtLeast(required.get());
    }

    private boolean appliesUnderFix(Rule rule) {
        return switch (rule.fixStatus()) {
            case SAFE -> true;
            case UNSAFE -> unsafeFixes;
            case NONE -> !fixOnly;
        };
    }

    /**
     * Expand rule names, category names and {@code ALL}.
     *
     * @throws IllegalArgumentException on an unknown name
     */
    public static Set<Rule> expand(Collection<String> names) {
        Set<Rule> rules = EnumSet.noneOf(Rule.class);
        for (String raw : names) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (name.equals(ALL)) {
                rules.addAll(EnumSet.allOf(Rule.class));
                continue;
            }
            Optional<Rule> rule = Rule.fromId(name);
            if (rule.isPresent()) {
                rules.add(rule.get());
                continue;
            }
            Optional<Category> category = name.equals(name.toUpperCase()) ? Category.fromName(name) : Optional.empty();
            if (category.isEmpty()) {
                throw new IllegalArgumentException("Unknown rule or category: '" + name + "'");
            }
            for (Rule candidate : Rule.values()) {
                if (candidate.categories().contains(category.get())) {
                    rules.add(candidate);
                }
            }
        }
        return rules;
    }

    /**
     * Whether any rule in the set produces fixes of the given status.
     */
    public static boolean anyWithFix(Set<Rule> rules, FixStatus status) {
        return rules.stream().anyMatch(rule -> rule.fixStatus() == status);
    }
}
