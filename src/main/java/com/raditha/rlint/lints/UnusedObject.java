package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.SemanticRule;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.semantic.Binding;
import com.raditha.rlint.semantic.BindingKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports assignments and loop variables whose value is never read.
 * Function parameters and configured exports are not reported.
 */
public class UnusedObject implements SemanticRule {

    @Override
    public Rule rule() {
        return Rule.UNUSED_OBJECT;
    }

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Binding binding : context.model().unusedBindings(context.config().exports())) {
            if (binding.kind() == BindingKind.PARAMETER || binding.kind() == BindingKind.SUPER_ASSIGNMENT) {
                continue;
            }
            diagnostics.add(new Diagnostic(Rule.UNUSED_OBJECT,
                    "`" + binding.name() + "` is assigned but never used.",
                    "Remove the assignment or use the value.",
                    binding.range(), null, null, null));
        }
        return diagnostics;
    }
}
