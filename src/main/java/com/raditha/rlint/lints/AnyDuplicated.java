package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code any(duplicated(x))} becomes {@code anyDuplicated(x) > 0}.
 */
public class AnyDuplicated implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        return LintUtils.nestedCallArguments(call, "any", "duplicated")
                .map(inner -> Diagnostic.replace(Rule.ANY_DUPLICATED,
                        "`any(duplicated(...))` is inefficient.",
                        "Use `anyDuplicated(...) > 0` instead.",
                        call, "anyDuplicated(" + inner + ") > 0"));
    }
}
