package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * {@code which(grepl(pattern, x))} becomes {@code grep(pattern, x)}.
 */
public class WhichGrepl implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        return LintUtils.nestedCallArguments(call, "which", "grepl")
                .map(inner -> Diagnostic.replace(Rule.WHICH_GREPL,
                        "`which(grepl(pattern, x))` is less efficient than `grep(pattern, x)`.",
                        "Use `grep(pattern, x)` instead.",
                        call, "grep(" + inner + ")"));
    }
}
