package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.Optional;

/**
 * {@code x == NULL} returns {@code logical(0)}. It becomes {@code is.null(x)},
 * and {@code x != NULL} becomes {@code !is.null(x)}.
 */
public class EqualsNull implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        Optional<SyntaxToken> operator = LintUtils.equalityOperator(binary);
        if (operator.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode left = LintUtils.left(binary);
        SyntaxNode right = LintUtils.right(binary);
        boolean leftIsNull = left.kind() == RSyntaxKind.R_NULL_EXPRESSION;
        boolean rightIsNull = right.kind() == RSyntaxKind.R_NULL_EXPRESSION;
        if (leftIsNull == rightIsNull) {
            return Optional.empty();
        }
        String operand = leftIsNull ? right.text() : left.text();
        String replacement = operator.get().kind() == RSyntaxKind.NOT_EQUAL
                ? "!is.null(" + operand + ")"
                : "is.null(" + operand + ")";
        return Optional.of(Diagnostic.replace(Rule.EQUALS_NULL,
                "Comparing to NULL with `==`, `!=` or `%in%` is problematic.",
                "Use `is.null()` instead.",
                binary, replacement));
    }
}
