package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code seq(length(x))} becomes {@code seq_along(x)} and
 * {@code seq(nrow(x))} becomes {@code seq_len(nrow(x))}.
 */
public class Seq2 implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        if (!RAst.functionName(call).equals("seq")) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        if (arguments.size() != 1 || RAst.argumentName(arguments.get(0)).isPresent()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> inner = RAst.argumentValue(arguments.get(0))
                .filter(value -> value.kind() == RSyntaxKind.R_CALL);
        if (inner.isEmpty()) {
            return Optional.empty();
        }
        String size = RAst.functionName(inner.get());
        if (!LintUtils.SIZE_FUNCTIONS.contains(size)) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.replace(Rule.SEQ2,
                "`seq(" + size + "(...))` can be wrong if the argument has length 0.",
                LintUtils.sequenceSuggestion(size),
                call, LintUtils.sequenceReplacement(size, LintUtils.joinArguments(RAst.arguments(inner.get())))));
    }
}
