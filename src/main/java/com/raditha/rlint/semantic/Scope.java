package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.TextRange;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lexical scope: the file or a function body.
 *
 * @param id             index of the scope in {@link SemanticModel#scopes()}
 * @param parentId       id of the enclosing scope, null for the file scope
 * @param range          the source covered by the scope
 * @param bindingsByName binding ids per name, in declaration order; a name may be
 *                       bound several times
 */
public record Scope(int id, @Nullable Integer parentId, TextRange range, Map<String, List<Integer>> bindingsByName) {

    public Optional<Integer> parent() {
        return Optional.ofNullable(parentId);
    }
}
