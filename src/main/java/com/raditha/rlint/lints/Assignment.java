package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.config.AssignmentOperator;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.Optional;

/**
 * Enforces the configured assignment operator. Right assignments
 * ({@code value -> x}) are always reported.
 */
public class Assignment implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        AssignmentOperator preferred = context.config().assignment();
        SyntaxToken operator = LintUtils.operator(binary);
        RSyntaxKind discouraged = preferred == AssignmentOperator.LEFT_ARROW ? RSyntaxKind.EQUAL : RSyntaxKind.ASSIGN;
        if (operator.kind() != discouraged && operator.kind() != RSyntaxKind.ASSIGN_RIGHT) {
            return Optional.empty();
        }

        SyntaxNode left = LintUtils.left(binary);
        SyntaxNode right = LintUtils.right(binary);
        String symbol = preferred.symbol();
        String replacement = operator.kind() == RSyntaxKind.ASSIGN_RIGHT
                ? right.text() + " " + symbol + " " + left.text()
                : left.text() + " " + symbol + " " + right.text();
        return Optional.of(Diagnostic.replace(Rule.ASSIGNMENT,
                "Use `" + symbol + "` for assignment.", null, binary, replacement));
    }
}
