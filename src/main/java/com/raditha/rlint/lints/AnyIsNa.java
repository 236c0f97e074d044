package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code any(is.na(x))} becomes {@code anyNA(x)}.
 */
public class AnyIsNa implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        return LintUtils.nestedCallArguments(call, "any", "is.na")
                .map(inner -> Diagnostic.replace(Rule.ANY_IS_NA,
                        "`any(is.na(...))` is inefficient.",
                        "Use `anyNA(...)` instead.",
                        call, "anyNA(" + inner + ")"));
    }
}
