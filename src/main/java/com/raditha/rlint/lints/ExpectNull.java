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
 * {@code expect_equal(x, NULL)}, {@code expect_identical(x, NULL)} and
 * {@code expect_true(is.null(x))} become {@code expect_null(x)}.
 */
public class ExpectNull implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        String function = RAst.functionName(call);
        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> tested = switch (function) {
            case "expect_equal", "expect_identical" -> comparedWithNull(arguments);
            case "expect_true" -> testedForNull(arguments);
            default -> Optional.empty();
        };
        if (tested.isEmpty()) {
            return Optional.empty();
        }
        String pattern = function.equals("expect_true") ? "expect_true(is.null(x))" : function + "(x, NULL)";
        return Optional.of(Diagnostic.replace(Rule.EXPECT_NULL,
                "`" + pattern + "` is not as clear as `expect_null(x)`.",
                "Use `expect_null(x)` instead.",
                call, "expect_null(" + tested.get().text() + ")"));
    }

    private static Optional<SyntaxNode> comparedWithNull(List<SyntaxNode> arguments) {
        if (arguments.size() != 2) {
            return Optional.empty();
        }
        Optional<SyntaxNode> object = RAst.argumentByNameOrPosition(arguments, "object", 0)
                .flatMap(RAst::argumentValue);
        Optional<SyntaxNode> expected = RAst.argumentByNameOrPosition(arguments, "expected", 1)
                .flatMap(RAst::argumentValue);
        if (object.isEmpty() || expected.isEmpty()) {
            return Optional.empty();
        }
        boolean objectIsNull = object.get().kind() == RSyntaxKind.R_NULL_EXPRESSION;
        boolean expectedIsNull = expected.get().kind() == RSyntaxKind.R_NULL_EXPRESSION;
        if (objectIsNull == expectedIsNull) {
            return Optional.empty();
        }
        return objectIsNull ? expected : object;
    }

    private static Optional<SyntaxNode> testedForNull(List<SyntaxNode> arguments) {
        if (arguments.size() != 1) {
            return Optional.empty();
        }
        Optional<SyntaxNode> object = RAst.argumentByNameOrPosition(arguments, "object", 0)
                .flatMap(RAst::argumentValue)
                .filter(value -> LintUtils.isCallTo(value, "is.null"));
        if (object.isEmpty()) {
            return Optional.empty();
        }
        List<SyntaxNode> inner = RAst.arguments(object.get());
        if (inner.size() != 1) {
            return Optional.empty();
        }
        return RAst.argumentByNameOrPosition(inner, "x", 0).flatMap(RAst::argumentValue);
    }
}
