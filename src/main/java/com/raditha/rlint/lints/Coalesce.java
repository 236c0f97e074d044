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
 * {@code if (is.null(x)) y else x} and {@code if (!is.null(x)) x else y}
 * become {@code x %||% y}.
 * <p>
 * Branches may be braced around a single expression. A branch holding several
 * expressions is still reported but not rewritten.
 */
public class Coalesce implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode statement, CheckContext context) {
        Optional<SyntaxNode> condition = RAst.condition(statement);
        Optional<SyntaxNode> consequence = RAst.body(statement);
        Optional<SyntaxNode> alternative = RAst.alternative(statement);
        if (condition.isEmpty() || consequence.isEmpty() || alternative.isEmpty()) {
            return Optional.empty();
        }

        SyntaxNode test = condition.get();
        boolean negated = RAst.unaryOperator(test).filter(op -> op.kind() == RSyntaxKind.BANG).isPresent();
        if (negated) {
            Optional<SyntaxNode> argument = RAst.unaryArgument(test);
            if (argument.isEmpty()) {
                return Optional.empty();
            }
            test = argument.get();
        }
        if (!LintUtils.isCallTo(test, "is.null")) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(test);
        if (arguments.size() != 1) {
            return Optional.empty();
        }
        Optional<SyntaxNode> tested = RAst.argumentValue(arguments.get(0));
        if (tested.isEmpty()) {
            return Optional.empty();
        }

        SyntaxNode value = negated ? consequence.get() : alternative.get();
        SyntaxNode fallback = negated ? alternative.get() : consequence.get();
        if (!tested.get().text().equals(singleExpression(value).text())) {
            return Optional.empty();
        }

        String message = negated
                ? "`if (!is.null(x)) x else y` can be simplified."
                : "`if (is.null(x)) y else x` can be simplified.";
        boolean skipFix = statement.containsComments() || hasSeveralExpressions(value)
                || hasSeveralExpressions(fallback);
        return Optional.of(Diagnostic.replace(Rule.COALESCE, message, "Use `x %||% y` instead.",
                statement.textRange(), skipFix,
                tested.get().text() + " %||% " + singleExpression(fallback).text()));
    }

    private static boolean hasSeveralExpressions(SyntaxNode branch) {
        return branch.kind() == RSyntaxKind.R_BRACED_EXPRESSIONS && branch.childNodes().size() > 1;
    }

    /**
     * The only expression of a braced branch, or the branch itself.
     */
    private static SyntaxNode singleExpression(SyntaxNode branch) {
        if (branch.kind() == RSyntaxKind.R_BRACED_EXPRESSIONS && branch.childNodes().size() == 1) {
            return branch.childNodes().get(0);
        }
        return branch;
    }
}
