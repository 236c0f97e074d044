package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code do.call(cbind.data.frame, x)} becomes {@code list2DF(x)}.
 */
public class List2Df implements RuleFunction {

    private static final Set<String> CBIND_DATA_FRAME = Set.of(
            "cbind.data.frame", "\"cbind.data.frame\"", "'cbind.data.frame'");

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        if (!RAst.functionName(call).equals("do.call")) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        if (arguments.size() != 2) {
            return Optional.empty();
        }
        Optional<SyntaxNode> what = RAst.argumentByNameOrPosition(arguments, "what", 0).flatMap(RAst::argumentValue);
        Optional<SyntaxNode> args = RAst.argumentByNameOrPosition(arguments, "args", 1).flatMap(RAst::argumentValue);
        if (what.isEmpty() || args.isEmpty() || !CBIND_DATA_FRAME.contains(what.get().text())) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.replace(Rule.LIST2DF,
                "`do.call(cbind.data.frame, x)` is inefficient and can be hard to read.",
                "Use `list2DF(x)` instead.",
                call, "list2DF(" + args.get().text() + ")"));
    }
}
