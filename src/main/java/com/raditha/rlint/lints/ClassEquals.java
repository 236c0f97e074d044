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

import java.util.List;
import java.util.Optional;

/**
 * {@code class(x) == "foo"} used as an {@code if} or {@code while} condition
 * breaks for objects with several classes. It becomes {@code inherits(x, "foo")}.
 */
public class ClassEquals implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode binary, CheckContext context) throws RuleException {
        Optional<SyntaxToken> operator = LintUtils.equalityOperator(binary);
        if (operator.isEmpty() || !RAst.isIfOrWhileCondition(binary)) {
            return Optional.empty();
        }
        SyntaxNode left = LintUtils.left(binary);
        SyntaxNode right = LintUtils.right(binary);

        SyntaxNode classCall;
        SyntaxNode className;
        if (isClassCall(left) && right.kind() == RSyntaxKind.R_STRING_VALUE) {
            classCall = left;
            className = right;
        } else if (isClassCall(right) && left.kind() == RSyntaxKind.R_STRING_VALUE) {
            classCall = right;
            className = left;
        } else {
            return Optional.empty();
        }

        List<SyntaxNode> arguments = RAst.arguments(classCall);
        if (arguments.isEmpty()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> object = RAst.argumentValue(arguments.get(0));
        if (object.isEmpty()) {
            throw new RuleException("class() argument without value at " + arguments.get(0).textRange());
        }

        String function = operator.get().kind() == RSyntaxKind.NOT_EQUAL ? "!inherits" : "inherits";
        return Optional.of(Diagnostic.replace(Rule.CLASS_EQUALS,
                "Comparing `class(x)` with `==` or `%in%` can be problematic.",
                "Use `inherits(x, 'class')` instead.",
                binary, function + "(" + object.get().text() + ", " + className.text() + ")"));
    }

    private static boolean isClassCall(SyntaxNode node) {
        return node.kind() == RSyntaxKind.R_CALL
                && RAst.callFunction(node).filter(f -> f.text().equals("class")).isPresent();
    }
}
