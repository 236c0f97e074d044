package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code sapply(x, length)} and its {@code vapply} and {@code purrr} cousins
 * become {@code lengths(x)}.
 */
public class Lengths implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) throws RuleException {
        String function = RAst.functionName(call);
        String dataName;
        String functionArgName;
        switch (function) {
            case "sapply", "vapply" -> {
                dataName = "X";
                functionArgName = "FUN";
            }
            case "map_int", "map_dbl" -> {
                dataName = ".x";
                functionArgName = ".f";
            }
            default -> {
                return Optional.empty();
            }
        }

        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> fun = RAst.argumentByNameOrPosition(arguments, functionArgName, 1);
        Optional<SyntaxNode> data = RAst.argumentByNameOrPosition(arguments, dataName, 0);
        if (fun.isEmpty() || data.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode funValue = RAst.argumentValue(fun.get())
                .orElseThrow(() -> new RuleException("Named argument without value at " + fun.get().textRange()));
        if (!funValue.text().equals("length")) {
            return Optional.empty();
        }
        Optional<SyntaxNode> dataValue = RAst.argumentValue(data.get());
        if (dataValue.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.replace(Rule.LENGTHS,
                "Using `length()` on each element of a list is inefficient.",
                "Use `lengths()` instead.",
                call, "lengths(" + dataValue.get().text() + ")"));
    }
}
