package com.raditha.rlint.analyzer;

import com.raditha.rlint.lints.AllEqual;
import com.raditha.rlint.lints.AnyDuplicated;
import com.raditha.rlint.lints.AnyIsNa;
import com.raditha.rlint.lints.Assignment;
import com.raditha.rlint.lints.ClassEquals;
import com.raditha.rlint.lints.Coalesce;
import com.raditha.rlint.lints.ComparisonNegation;
import com.raditha.rlint.lints.DuplicatedArguments;
import com.raditha.rlint.lints.EqualsNa;
import com.raditha.rlint.lints.EqualsNull;
import com.raditha.rlint.lints.ExpectLength;
import com.raditha.rlint.lints.ExpectNamed;
import com.raditha.rlint.lints.ExpectNull;
import com.raditha.rlint.lints.Grepv;
import com.raditha.rlint.lints.ImplicitAssignment;
import com.raditha.rlint.lints.Lengths;
import com.raditha.rlint.lints.List2Df;
import com.raditha.rlint.lints.MatrixApply;
import com.raditha.rlint.lints.OuterNegation;
import com.raditha.rlint.lints.Repeat;
import com.raditha.rlint.lints.SampleInt;
import com.raditha.rlint.lints.Seq;
import com.raditha.rlint.lints.Seq2;
import com.raditha.rlint.lints.Sort;
import com.raditha.rlint.lints.Sprintf;
import com.raditha.rlint.lints.TrueFalseSymbol;
import com.raditha.rlint.lints.UndefinedObject;
import com.raditha.rlint.lints.UnreachableCode;
import com.raditha.rlint.lints.UnusedObject;
import com.raditha.rlint.lints.VectorLogic;
import com.raditha.rlint.lints.WhichGrepl;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RSyntaxKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each node kind to the rules that inspect nodes of that kind.
 * <p>
 * Entries for a kind run in registration order, which is also the order their
 * diagnostics are discovered in.
 */
public final class RuleDispatchTable {

    private static final RuleDispatchTable DEFAULT = createDefault();

    private final Map<RSyntaxKind, List<RuleEntry>> entries;
    private final List<SemanticRule> semanticRules;

    public RuleDispatchTable(Map<RSyntaxKind, List<RuleEntry>> entries, List<SemanticRule> semanticRules) {
        EnumMap<RSyntaxKind, List<RuleEntry>> copy = new EnumMap<>(RSyntaxKind.class);
        entries.forEach((kind, list) -> copy.put(kind, List.copyOf(list)));
        this.entries = Collections.unmodifiableMap(copy);
        this.semanticRules = List.copyOf(semanticRules);
    }

    /**
     * The table holding every built-in rule.
     */
    public static RuleDispatchTable defaultTable() {
        return DEFAULT;
    }

    private static RuleDispatchTable createDefault() {
        Map<RSyntaxKind, List<RuleEntry>> map = new EnumMap<>(RSyntaxKind.class);
        register(map, RSyntaxKind.R_CALL, Rule.ALL_EQUAL, new AllEqual());
        register(map, RSyntaxKind.R_CALL, Rule.ANY_DUPLICATED, new AnyDuplicated());
        register(map, RSyntaxKind.R_CALL, Rule.ANY_IS_NA, new AnyIsNa());
        register(map, RSyntaxKind.R_CALL, Rule.DUPLICATED_ARGUMENTS, new DuplicatedArguments());
        register(map, RSyntaxKind.R_CALL, Rule.EXPECT_LENGTH, new ExpectLength());
        register(map, RSyntaxKind.R_CALL, Rule.EXPECT_NAMED, new ExpectNamed());
        register(map, RSyntaxKind.R_CALL, Rule.EXPECT_NULL, new ExpectNull());
        register(map, RSyntaxKind.R_CALL, Rule.GREPV, new Grepv());
        register(map, RSyntaxKind.R_CALL, Rule.LENGTHS, new Lengths());
        register(map, RSyntaxKind.R_CALL, Rule.LIST2DF, new List2Df());
        register(map, RSyntaxKind.R_CALL, Rule.MATRIX_APPLY, new MatrixApply());
        register(map, RSyntaxKind.R_CALL, Rule.OUTER_NEGATION, new OuterNegation());
        register(map, RSyntaxKind.R_CALL, Rule.SAMPLE_INT, new SampleInt());
        register(map, RSyntaxKind.R_CALL, Rule.SEQ2, new Seq2());
        register(map, RSyntaxKind.R_CALL, Rule.SPRINTF, new Sprintf());
        register(map, RSyntaxKind.R_CALL, Rule.WHICH_GREPL, new WhichGrepl());

        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.ASSIGNMENT, new Assignment());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.CLASS_EQUALS, new ClassEquals());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.EQUALS_NA, new EqualsNa());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.EQUALS_NULL, new EqualsNull());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.IMPLICIT_ASSIGNMENT, new ImplicitAssignment());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.SEQ, new Seq());
        register(map, RSyntaxKind.R_BINARY_EXPRESSION, Rule.VECTOR_LOGIC, new VectorLogic());

        register(map, RSyntaxKind.R_IF_STATEMENT, Rule.COALESCE, new Coalesce());
        register(map, RSyntaxKind.R_SUBSET, Rule.SORT, new Sort());

        register(map, RSyntaxKind.R_UNARY_EXPRESSION, Rule.COMPARISON_NEGATION, new ComparisonNegation());
        register(map, RSyntaxKind.R_WHILE_STATEMENT, Rule.REPEAT, new Repeat());
        register(map, RSyntaxKind.R_IDENTIFIER, Rule.TRUE_FALSE_SYMBOL, new TrueFalseSymbol());

        return new RuleDispatchTable(map, List.of(new UnusedObject(), new UndefinedObject(), new UnreachableCode()));
    }

    private static void register(Map<RSyntaxKind, List<RuleEntry>> map, RSyntaxKind kind, Rule rule,
            RuleFunction function) {
        map.computeIfAbsent(kind, k -> new ArrayList<>()).add(new RuleEntry(rule, function));
    }

    public List<RuleEntry> entriesFor(RSyntaxKind kind) {
        return entries.getOrDefault(kind, List.of());
    }

    public List<SemanticRule> semanticRules() {
        return semanticRules;
    }

    /**
     * Every rule this table can report.
     */
    public Set<Rule> rules() {
        Set<Rule> rules = EnumSet.noneOf(Rule.class);
        entries.values().forEach(list -> list.forEach(entry -> rules.add(entry.rule())));
        semanticRules.forEach(rule -> rules.add(rule.rule()));
        return rules;
    }
}
