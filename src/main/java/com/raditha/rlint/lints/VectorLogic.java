package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.Optional;

/**
 * Reports {@code &} and {@code |} used as the whole condition of an
 * {@code if} or {@code while}, where the scalar {@code &&} and {@code ||}
 * stop early. Bitwise operations on raw, octal or hex values and on strings
 * are allowed.
 */
public class VectorLogic implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        SyntaxToken operator = LintUtils.operator(binary);
        if (operator.kind() != RSyntaxKind.AND && operator.kind() != RSyntaxKind.OR) {
            return Optional.empty();
        }
        if (!RAst.isIfOrWhileCondition(binary)) {
            return Optional.empty();
        }
        if (isBitwiseOperand(LintUtils.left(binary)) || isBitwiseOperand(LintUtils.right(binary))) {
            return Optional.empty();
        }
        String statement = binary.parent().kind() == RSyntaxKind.R_IF_STATEMENT ? "if" : "while";
        return Optional.of(Diagnostic.report(Rule.VECTOR_LOGIC,
                "`" + operator.text() + "` in `" + statement + "()` statements can be inefficient.",
                null, binary));
    }

    private static boolean isBitwiseOperand(SyntaxNode operand) {
        return operand.kind() == RSyntaxKind.R_STRING_VALUE
                || LintUtils.isCallTo(operand, "as.raw", "as.octmode", "as.hexmode");
    }
}
