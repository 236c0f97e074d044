package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code sample(1:n, m)} becomes {@code sample.int(n, m)}.
 */
public class SampleInt implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) throws RuleException {
        if (!"sample".equals(RAst.functionName(call))) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> x = RAst.argumentByNameOrPosition(arguments, "x", 0);
        if (x.isEmpty()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> range = RAst.argumentValue(x.get());
        if (range.isEmpty() || range.get().kind() != RSyntaxKind.R_BINARY_EXPRESSION
                || LintUtils.operator(range.get()).kind() != RSyntaxKind.COLON) {
            return Optional.empty();
        }
        String from = LintUtils.left(range.get()).text();
        if (!from.equals("1") && !from.equals("1L")) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        parts.add(LintUtils.right(range.get()).text());
        for (SyntaxNode argument : arguments) {
            if (argument != x.get()) {
                parts.add(argument.text());
            }
        }
        return Optional.of(Diagnostic.replace(Rule.SAMPLE_INT,
                "`sample(1:n, m, ...)` is less readable than `sample.int(n, m, ...)`.",
                "Use `sample.int(n, m, ...)` instead.",
                call, "sample.int(" + String.join(", ", parts) + ")"));
    }
}
