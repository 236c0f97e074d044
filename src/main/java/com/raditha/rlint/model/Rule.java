package com.raditha.rlint.model;

import java.util.List;
import java.util.Optional;

/**
 * Every rule the linter knows, with the metadata used to select it.
 */
public enum Rule {
    ALL_EQUAL("all_equal", List.of(Category.SUSP), true, FixStatus.UNSAFE, null),
    ANY_DUPLICATED("any_duplicated", List.of(Category.PERF), true, FixStatus.SAFE, null),
    ANY_IS_NA("any_is_na", List.of(Category.PERF), true, FixStatus.SAFE, null),
    ASSIGNMENT("assignment", List.of(Category.READ), false, FixStatus.SAFE, null),
    CLASS_EQUALS("class_equals", List.of(Category.SUSP), true, FixStatus.SAFE, null),
    COALESCE("coalesce", List.of(Category.READ), true, FixStatus.SAFE, "4.4.0"),
    COMPARISON_NEGATION("comparison_negation", List.of(Category.READ), true, FixStatus.SAFE, null),
    DUPLICATED_ARGUMENTS("duplicated_arguments", List.of(Category.SUSP), true, FixStatus.NONE, null),
    EQUALS_NA("equals_na", List.of(Category.CORR), true, FixStatus.SAFE, null),
    EQUALS_NULL("equals_null", List.of(Category.CORR), true, FixStatus.SAFE, null),
    EXPECT_LENGTH("expect_length", List.of(Category.TESTTHAT), false, FixStatus.SAFE, null),
    EXPECT_NAMED("expect_named", List.of(Category.TESTTHAT), false, FixStatus.SAFE, null),
    EXPECT_NULL("expect_null", List.of(Category.TESTTHAT), false, FixStatus.SAFE, null),
    GREPV("grepv", List.of(Category.READ), true, FixStatus.SAFE, "4.5.0"),
    IMPLICIT_ASSIGNMENT("implicit_assignment", List.of(Category.READ), true, FixStatus.NONE, null),
    LENGTHS("lengths", List.of(Category.PERF, Category.READ), true, FixStatus.SAFE, null),
    LIST2DF("list2df", List.of(Category.PERF, Category.READ), true, FixStatus.SAFE, "4.0.0"),
    MATRIX_APPLY("matrix_apply", List.of(Category.PERF), true, FixStatus.SAFE, null),
    OUTER_NEGATION("outer_negation", List.of(Category.PERF, Category.READ), true, FixStatus.SAFE, null),
    REPEAT("repeat", List.of(Category.READ), true, FixStatus.SAFE, null),
    SAMPLE_INT("sample_int", List.of(Category.READ), false, FixStatus.SAFE, null),
    SEQ("seq", List.of(Category.SUSP), true, FixStatus.SAFE, null),
    SEQ2("seq2", List.of(Category.SUSP), true, FixStatus.SAFE, null),
    SORT("sort", List.of(Category.PERF, Category.READ), true, FixStatus.SAFE, null),
    SPRINTF("sprintf", List.of(Category.CORR, Category.SUSP), true, FixStatus.SAFE, null),
    TRUE_FALSE_SYMBOL("true_false_symbol", List.of(Category.READ), true, FixStatus.NONE, null),
    UNREACHABLE_CODE("unreachable_code", List.of(Category.SUSP), true, FixStatus.NONE, null),
    VECTOR_LOGIC("vector_logic", List.of(Category.PERF), true, FixStatus.NONE, null),
    WHICH_GREPL("which_grepl", List.of(Category.PERF, Category.READ), true, FixStatus.SAFE, null),
    UNDEFINED_OBJECT("undefined_object", List.of(Category.CORR), false, FixStatus.NONE, null),
    UNUSED_OBJECT("unused_object", List.of(Category.SUSP), false, FixStatus.NONE, null);

    private final String id;
    private final List<Category> categories;
    private final boolean enabledByDefault;
    private final FixStatus fixStatus;
    private final RVersion minRVersion;

    Rule(String id, List<Category> categories, boolean enabledByDefault, FixStatus fixStatus, String minRVersion) {
        this.id = id;
        this.categories = categories;
        this.enabledByDefault = enabledByDefault;
        this.fixStatus = fixStatus;
        this.minRVersion = minRVersion == null ? null : RVersion.parse(minRVersion);
    }

    /**
     * The snake_case name used in configuration, directives and reports.
     */
    public String id() {
        return id;
    }

    public List<Category> categories() {
        return categories;
    }

    public boolean isEnabledByDefault() {
        return enabledByDefault;
    }

    public FixStatus fixStatus() {
        return fixStatus;
    }

    public boolean hasFix() {
        return fixStatus != FixStatus.NONE;
    }

    public Optional<RVersion> minRVersion() {
        return Optional.ofNullable(minRVersion);
    }

    public static Optional<Rule> fromId(String id) {
        for (Rule rule : values()) {
            if (rule.id.equals(id)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
