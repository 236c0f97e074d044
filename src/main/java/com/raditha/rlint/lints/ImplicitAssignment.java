package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Reports assignments hidden in {@code if}, {@code while} and {@code for}
 * headers or in call arguments, such as {@code if (x <- f()) ...}.
 * An enclosing pair of braces ends the search.
 */
public class ImplicitAssignment implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        RSyntaxKind operator = LintUtils.operator(binary).kind();
        if (operator != RSyntaxKind.ASSIGN && operator != RSyntaxKind.SUPER_ASSIGN
                && operator != RSyntaxKind.ASSIGN_RIGHT && operator != RSyntaxKind.SUPER_ASSIGN_RIGHT) {
            return Optional.empty();
        }

        String where;
        if (!isDirectChild(binary, RSyntaxKind.R_IF_STATEMENT, 4)
                && !isDirectChild(binary, RSyntaxKind.R_ELSE_CLAUSE, 1)
                && hasUnbracedAncestor(binary, RSyntaxKind.R_IF_STATEMENT)) {
            where = "`if()` statements";
        } else if (!isDirectChild(binary, RSyntaxKind.R_WHILE_STATEMENT, 4)
                && hasUnbracedAncestor(binary, RSyntaxKind.R_WHILE_STATEMENT)) {
            where = "`while()` statements";
        } else if (!isDirectChild(binary, RSyntaxKind.R_FOR_STATEMENT, 6)
                && hasUnbracedAncestor(binary, RSyntaxKind.R_FOR_STATEMENT)) {
            where = "`for()` statements";
        } else if (hasUnbracedAncestor(binary, RSyntaxKind.R_ARGUMENT)) {
            where = "function calls";
        } else {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.report(Rule.IMPLICIT_ASSIGNMENT,
                "Avoid implicit assignments in " + where + ".", null, binary));
    }

    private static boolean isDirectChild(SyntaxNode node, RSyntaxKind parentKind, int index) {
        return LintUtils.parentAt(node, parentKind, index).isPresent();
    }

    private static boolean hasUnbracedAncestor(SyntaxNode node, RSyntaxKind kind) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.kind() == RSyntaxKind.R_BRACED_EXPRESSIONS) {
                return false;
            }
            if (ancestor.kind() == kind) {
                return true;
            }
        }
        return false;
    }
}
