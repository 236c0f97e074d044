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
import java.util.Set;

/**
 * Comparing with {@code NA} always yields {@code NA}. {@code x == NA} becomes
 * {@code is.na(x)} and {@code x != NA} becomes {@code !is.na(x)}.
 */
public class EqualsNa implements RuleFunction {

    private static final Set<String> NA_CONSTANTS = Set.of(
            "NA", "NA_character_", "NA_integer_", "NA_real_", "NA_logical_", "NA_complex_");

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        Optional<SyntaxToken> operator = LintUtils.equalityOperator(binary);
        if (operator.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode left = LintUtils.left(binary);
        SyntaxNode right = LintUtils.right(binary);
        boolean leftIsNa = isNa(left);
        boolean rightIsNa = isNa(right);
        if (leftIsNa == rightIsNa) {
            return Optional.empty();
        }
        String operand = leftIsNa ? right.text() : left.text();
        String replacement = operator.get().kind() == RSyntaxKind.NOT_EQUAL
                ? "!is.na(" + operand + ")"
                : "is.na(" + operand + ")";
        return Optional.of(Diagnostic.replace(Rule.EQUALS_NA,
                "Use `is.na()` instead of comparing to NA with ==, != or %in%.",
                null, binary, replacement));
    }

    static boolean isNa(SyntaxNode node) {
        return node.kind() == RSyntaxKind.R_NA_EXPRESSION && NA_CONSTANTS.contains(node.text());
    }
}
