package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code grep(pattern, x, value = TRUE)} becomes {@code grepv(pattern, x)}.
 * {@code grepv()} exists since R 4.5.0.
 */
public class Grepv implements RuleFunction {

    /**
     * Position of {@code value} in {@code grep(pattern, x, ignore.case, perl, value, ...)}.
     */
    private static final int VALUE_POSITION = 4;

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        if (!"grep".equals(RAst.functionName(call))) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> value = RAst.argumentByNameOrPosition(arguments, "value", VALUE_POSITION);
        if (value.isEmpty() || !isTrue(value.get())) {
            return Optional.empty();
        }
        List<SyntaxNode> rest = new ArrayList<>(arguments);
        rest.remove(value.get());
        return Optional.of(Diagnostic.replace(Rule.GREPV,
                "Use `grepv(...)` instead of `grep(..., value = TRUE)`.", null,
                call, "grepv(" + LintUtils.joinArguments(rest) + ")"));
    }

    private static boolean isTrue(SyntaxNode argument) {
        return RAst.argumentValue(argument)
                .map(SyntaxNode::text)
                .filter(text -> text.equals("TRUE") || text.equals("T"))
                .isPresent();
    }
}
