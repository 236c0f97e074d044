package com.raditha.rlint.analyzer;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;

import java.util.List;

/**
 * A rule that runs once per file, over the semantic model or the whole tree,
 * instead of per node.
 */
public interface SemanticRule {

    Rule rule();

    List<Diagnostic> check(CheckContext context) throws RuleException;
}
