package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.SemanticRule;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.semantic.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports names that are read but neither bound in an enclosing scope nor
 * known globals. Called names are skipped since they usually come from
 * attached packages.
 */
public class UndefinedObject implements SemanticRule {

    @Override
    public Rule rule() {
        return Rule.UNDEFINED_OBJECT;
    }

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Reference reference : context.model().unresolvedReferences()) {
            if (reference.callee()) {
                continue;
            }
            diagnostics.add(new Diagnostic(Rule.UNDEFINED_OBJECT,
                    "`" + reference.name() + "` is not defined.",
                    "Define it before use or add it to `globals`.",
                    reference.range(), null, null, null));
        }
        return diagnostics;
    }
}
