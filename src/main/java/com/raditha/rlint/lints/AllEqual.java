package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code all.equal()} returns a character vector describing the differences
 * rather than {@code FALSE}, so it must not be used as a condition directly.
 * <ul>
 * <li>{@code isFALSE(all.equal(a, b))} becomes {@code !isTRUE(all.equal(a, b))}</li>
 * <li>{@code if (all.equal(a, b))} becomes {@code if (isTRUE(all.equal(a, b)))}</li>
 * <li>{@code !all.equal(a, b)} becomes {@code !isTRUE(all.equal(a, b))}</li>
 * </ul>
 */
public class AllEqual implements RuleFunction {

    static final String MESSAGE = "`all.equal()` can return a string instead of FALSE.";
    static final String SUGGESTION =
            "Wrap `all.equal()` in `isTRUE()`, or replace it by `identical()` if no tolerance is required.";

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        Optional<String> inner = LintUtils.nestedCallArguments(call, "isFALSE", "all.equal");
        if (inner.isPresent()) {
            return Optional.of(Diagnostic.replace(Rule.ALL_EQUAL,
                    "`isFALSE(all.equal())` always returns `FALSE`",
                    "Use `!isTRUE()` to check for differences instead.",
                    call, "!isTRUE(all.equal(" + inner.get() + "))"));
        }

        if (!"all.equal".equals(RAst.functionName(call))) {
            return Optional.empty();
        }

        Optional<SyntaxNode> negation = LintUtils.parentAt(call, RSyntaxKind.R_UNARY_EXPRESSION, 1)
                .filter(unary -> RAst.unaryOperator(unary).filter(op -> op.kind() == RSyntaxKind.BANG).isPresent());
        if (negation.isPresent()) {
            return Optional.of(Diagnostic.replace(Rule.ALL_EQUAL, MESSAGE, SUGGESTION,
                    negation.get(), "!isTRUE(" + call.text() + ")"));
        }
        if (RAst.isIfOrWhileCondition(call)) {
            return Optional.of(Diagnostic.replace(Rule.ALL_EQUAL, MESSAGE, SUGGESTION,
                    call, "isTRUE(" + call.text() + ")"));
        }
        return Optional.empty();
    }
}
