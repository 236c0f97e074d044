package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code expect_equal(names(x), n)} becomes {@code expect_named(x, n)}.
 * Comparisons of {@code colnames()}, {@code rownames()} or {@code dimnames()}
 * are left alone.
 */
public class ExpectNamed implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        boolean otherNames = RAst.argumentByNameOrPosition(RAst.arguments(call), "object", 0)
                .flatMap(RAst::argumentValue)
                .filter(object -> LintUtils.isCallTo(object, "colnames", "rownames", "dimnames"))
                .isPresent();
        if (otherNames) {
            return Optional.empty();
        }
        return LintUtils.wrappedExpectation(call, "names").map(expectation -> Diagnostic.replace(
                Rule.EXPECT_NAMED,
                "`expect_named(x, n)` is better than `" + expectation.function() + "(names(x), n)`.",
                "Use `expect_named(x, n)` instead.",
                call,
                "expect_named(" + expectation.inner().text() + ", " + expectation.other().text() + ")"));
    }
}
