package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code apply(x, 1, sum)} and its {@code mean} and column variants become
 * {@code rowSums(x)}, {@code rowMeans(x)}, {@code colSums(x)} or
 * {@code colMeans(x)}. An {@code na.rm} argument is carried over.
 */
public class MatrixApply implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        if (!RAst.functionName(call).equals("apply")) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> naRm = arguments.stream()
                .filter(argument -> RAst.argumentName(argument).filter("na.rm"::equals).isPresent())
                .findFirst();
        if (arguments.size() > (naRm.isPresent() ? 4 : 3)) {
            return Optional.empty();
        }

        Optional<SyntaxNode> x = RAst.argumentByNameOrPosition(arguments, "X", 0).flatMap(RAst::argumentValue);
        Optional<SyntaxNode> margin = RAst.argumentByNameOrPosition(arguments, "MARGIN", 1)
                .flatMap(RAst::argumentValue);
        Optional<SyntaxNode> fun = RAst.argumentByNameOrPosition(arguments, "FUN", 2).flatMap(RAst::argumentValue);
        if (x.isEmpty() || margin.isEmpty() || fun.isEmpty()) {
            return Optional.empty();
        }

        String statistic = switch (fun.get().text()) {
            case "mean" -> "Means";
            case "sum" -> "Sums";
            default -> null;
        };
        String direction = switch (margin.get().text()) {
            case "1", "1L" -> "row";
            case "2", "2L" -> "col";
            default -> null;
        };
        if (statistic == null || direction == null) {
            return Optional.empty();
        }

        String replacement = direction + statistic;
        String naRmText = naRm.map(argument -> ", " + argument.text()).orElse("");
        String index = direction.equals("row") ? "1" : "2";
        return Optional.of(Diagnostic.replace(Rule.MATRIX_APPLY,
                "`apply(x, " + index + ", " + fun.get().text() + ")` is inefficient.",
                "Use `" + replacement + "(x)` instead.",
                call, replacement + "(" + x.get().text() + naRmText + ")"));
    }
}
