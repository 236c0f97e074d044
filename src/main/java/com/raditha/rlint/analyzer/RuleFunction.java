package com.raditha.rlint.analyzer;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * A syntactic rule body, invoked once per node of the kind it is registered for.
 */
@FunctionalInterface
public interface RuleFunction {

    /**
     * Inspect {@code node}.
     *
     * @return the finding for this node, or empty when the node does not match
     * @throws RuleException if the node is malformed
     */
    Optional<Diagnostic> check(SyntaxNode node, CheckContext context) throws RuleException;
}
