package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.TextRange;
import org.jspecify.annotations.Nullable;

/**
 * A use of a name.
 *
 * @param id         index of the reference in {@link SemanticModel#references()}
 * @param scopeId    the innermost scope enclosing the use
 * @param name       the referenced name
 * @param range      the referencing identifier
 * @param kind       read or write
 * @param callee     true when the name is called as a function
 * @param resolution whether the name matched a binding, a global or nothing
 * @param bindingId  the matched binding, null unless {@code resolution} is {@link Resolution#BOUND}
 */
public record Reference(int id, int scopeId, String name, TextRange range, ReferenceKind kind, boolean callee,
        Resolution resolution, @Nullable Integer bindingId) {

    public boolean isRead() {
        return kind == ReferenceKind.READ;
    }
}
