package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.Optional;

/**
 * Reports {@code T} and {@code F} used as values. Calls such as {@code T()},
 * field names after {@code $}, namespaced names and formula terms are left alone.
 */
public class TrueFalseSymbol implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode identifier, CheckContext context) {
        String name = identifier.text();
        if (!name.equals("T") && !name.equals("F")) {
            return Optional.empty();
        }
        SyntaxNode parent = identifier.parent();
        if (parent == null) {
            return Optional.empty();
        }
        boolean exempt = switch (parent.kind()) {
            case R_CALL -> identifier.index() == 0;
            case R_EXTRACT_EXPRESSION -> identifier.index() == 2;
            case R_NAMESPACE_EXPRESSION -> true;
            case R_BINARY_EXPRESSION -> isTilde(RAst.binaryOperator(parent));
            case R_UNARY_EXPRESSION -> isTilde(RAst.unaryOperator(parent));
            default -> false;
        };
        if (exempt) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.report(Rule.TRUE_FALSE_SYMBOL,
                "`T` and `F` can be confused with variable names. Spell `TRUE` and `FALSE` entirely instead.",
                null, identifier));
    }

    private static boolean isTilde(Optional<SyntaxToken> operator) {
        return operator.filter(op -> op.kind() == RSyntaxKind.TILDE).isPresent();
    }
}
