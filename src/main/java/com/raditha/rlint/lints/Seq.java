package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code 1:length(x)} becomes {@code seq_along(x)} and {@code 1:nrow(x)}
 * becomes {@code seq_len(nrow(x))}; both count down to 0 on empty input.
 */
public class Seq implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        if (LintUtils.operator(binary).kind() != RSyntaxKind.COLON) {
            return Optional.empty();
        }
        String from = LintUtils.left(binary).text();
        SyntaxNode to = LintUtils.right(binary);
        if (!from.equals("1") && !from.equals("1L") || to.kind() != RSyntaxKind.R_CALL) {
            return Optional.empty();
        }
        String size = RAst.functionName(to);
        if (!LintUtils.SIZE_FUNCTIONS.contains(size)) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.replace(Rule.SEQ,
                "`1:" + size + "(...)` can be wrong if the RHS is 0.",
                LintUtils.sequenceSuggestion(size),
                binary, LintUtils.sequenceReplacement(size, LintUtils.joinArguments(RAst.arguments(to)))));
    }
}
