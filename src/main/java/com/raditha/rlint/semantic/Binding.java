package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.TextRange;

import java.util.List;

/**
 * A name bound in a scope.
 *
 * @param id           index of the binding in {@link SemanticModel#bindings()}
 * @param scopeId      the owning scope
 * @param name         the bound name
 * @param range        the declaring identifier
 * @param kind         how the binding was introduced
 * @param referenceIds ids of the references resolved to this binding
 */
public record Binding(int id, int scopeId, String name, TextRange range, BindingKind kind,
        List<Integer> referenceIds) {
}
