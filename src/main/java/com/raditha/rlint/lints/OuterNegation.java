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
 * {@code any(!x)} becomes {@code !all(x)} and {@code all(!x)} becomes
 * {@code !any(x)}. Calls that are themselves negated are left alone.
 */
public class OuterNegation implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        boolean negatedCall = LintUtils.parentAt(call, RSyntaxKind.R_UNARY_EXPRESSION, 1)
                .flatMap(RAst::unaryOperator)
                .filter(op -> op.kind() == RSyntaxKind.BANG)
                .isPresent();
        if (negatedCall) {
            return Optional.empty();
        }
        String function = RAst.functionName(call);
        String opposite = switch (function) {
            case "any" -> "all";
            case "all" -> "any";
            default -> null;
        };
        if (opposite == null) {
            return Optional.empty();
        }

        List<SyntaxNode> arguments = RAst.arguments(call);
        if (arguments.size() != 1 || RAst.argumentName(arguments.get(0)).isPresent()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> value = RAst.argumentValue(arguments.get(0));
        boolean negatedArgument = value.flatMap(RAst::unaryOperator)
                .filter(op -> op.kind() == RSyntaxKind.BANG)
                .isPresent();
        if (!negatedArgument) {
            return Optional.empty();
        }
        Optional<SyntaxNode> inner = RAst.unaryArgument(value.get());
        if (inner.isEmpty() || inner.get().kind() == RSyntaxKind.R_UNARY_EXPRESSION) {
            return Optional.empty();
        }
        return Optional.of(Diagnostic.replace(Rule.OUTER_NEGATION,
                "`" + function + "(!x)` may be hard to read.",
                "Use `!" + opposite + "(x)` instead.",
                call, "!" + opposite + "(" + inner.get().text() + ")"));
    }
}
