package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code x[order(x)]} becomes {@code sort(x)}, keeping the {@code na.last},
 * {@code decreasing} and {@code method} arguments of {@code order()}.
 */
public class Sort implements RuleFunction {

    private static final Set<String> KEPT_ARGUMENTS = Set.of("na.last", "decreasing", "method");

    @Override
    public Optional<Diagnostic> check(SyntaxNode subset, CheckContext context) {
        if (!(subset.childAt(0) instanceof SyntaxNode object)) {
            return Optional.empty();
        }
        boolean severalIndices = subset.findChild(RSyntaxKind.R_SUBSET_ARGUMENTS)
                .map(arguments -> arguments.children().stream().anyMatch(child -> child.kind() == RSyntaxKind.COMMA))
                .orElse(true);
        List<SyntaxNode> indices = RAst.arguments(subset);
        if (severalIndices || indices.size() != 1 || RAst.argumentName(indices.get(0)).isPresent()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> order = RAst.argumentValue(indices.get(0))
                .filter(value -> LintUtils.isCallTo(value, "order"));
        if (order.isEmpty()) {
            return Optional.empty();
        }

        List<SyntaxNode> sorted = new ArrayList<>();
        List<SyntaxNode> options = new ArrayList<>();
        for (SyntaxNode argument : RAst.arguments(order.get())) {
            Optional<String> name = RAst.argumentName(argument);
            if (name.isEmpty()) {
                sorted.add(argument);
            } else if (KEPT_ARGUMENTS.contains(name.get())) {
                options.add(argument);
            } else {
                return Optional.empty();
            }
        }
        if (sorted.size() != 1 || !sorted.get(0).text().equals(object.text())) {
            return Optional.empty();
        }

        StringBuilder replacement = new StringBuilder("sort(").append(object.text());
        for (SyntaxNode option : options) {
            replacement.append(", ").append(option.text());
        }
        replacement.append(')');
        return Optional.of(Diagnostic.replace(Rule.SORT,
                "`x[order(x)]` is inefficient.",
                "Use `sort(x)` instead.",
                subset, replacement.toString()));
    }
}
