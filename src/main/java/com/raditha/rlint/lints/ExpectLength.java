package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code expect_equal(length(x), n)} becomes {@code expect_length(x, n)}.
 */
public class ExpectLength implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        return LintUtils.wrappedExpectation(call, "length").map(expectation -> Diagnostic.replace(
                Rule.EXPECT_LENGTH,
                "`expect_length(x, n)` is better than `" + expectation.function() + "(length(x), n)`.",
                "Use `expect_length(x, n)` instead.",
                call,
                "expect_length(" + expectation.inner().text() + ", " + expectation.other().text() + ")"));
    }
}
