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
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * {@code !(x > y)} becomes {@code x <= y}, and likewise for the other
 * comparison operators.
 */
public class ComparisonNegation implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode unary, CheckContext context) throws RuleException {
        Optional<SyntaxToken> bang = RAst.unaryOperator(unary).filter(op -> op.kind() == RSyntaxKind.BANG);
        Optional<SyntaxNode> argument = RAst.unaryArgument(unary);
        if (bang.isEmpty() || argument.isEmpty() || argument.get().kind() != RSyntaxKind.R_PARENTHESIZED_EXPRESSION) {
            return Optional.empty();
        }
        List<SyntaxNode> inner = argument.get().childNodes();
        if (inner.size() != 1 || inner.get(0).kind() != RSyntaxKind.R_BINARY_EXPRESSION) {
            return Optional.empty();
        }
        SyntaxNode comparison = inner.get(0);
        SyntaxToken operator = LintUtils.operator(comparison);
        String negated = negate(operator.kind());
        if (negated == null) {
            return Optional.empty();
        }
        String replacement = LintUtils.left(comparison).text() + " " + negated + " "
                + LintUtils.right(comparison).text();
        return Optional.of(Diagnostic.replace(Rule.COMPARISON_NEGATION,
                "Do not use `!(x " + operator.text() + " y)`.",
                "Use `x " + negated + " y` instead.",
                unary, replacement));
    }

    private static @Nullable String negate(RSyntaxKind operator) {
        return switch (operator) {
            case GREATER_THAN -> "<=";
            case GREATER_THAN_OR_EQUAL_TO -> "<";
            case LESS_THAN -> ">=";
            case LESS_THAN_OR_EQUAL_TO -> ">";
            case EQUAL2 -> "!=";
            case NOT_EQUAL -> "==";
            default -> null;
        };
    }
}
