package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.TextRange;

/**
 * Events emitted by {@link SemanticEventExtractor} in traversal order and
 * consumed by {@link SemanticModelBuilder}.
 */
public interface SemanticEvent {

    /**
     * A new lexical scope starts.
     *
     * @param range the source covered by the scope
     */
    record OpenScope(TextRange range) implements SemanticEvent {
    }

    /**
     * The innermost open scope ends.
     *
     * @param range the source covered by the scope
     */
    record CloseScope(TextRange range) implements SemanticEvent {
    }

    /**
     * A name is bound in the innermost open scope.
     *
     * @param name  the bound name
     * @param range the declaring identifier
     * @param kind  how the binding was introduced
     */
    record DeclareBinding(String name, TextRange range, BindingKind kind) implements SemanticEvent {
    }

    /**
     * A name is used.
     *
     * @param name             the referenced name
     * @param range            the referencing identifier
     * @param kind             read or write
     * @param callee           true when the identifier is the function position of a call
     * @param superAssignment  true for targets of {@code <<-} and {@code ->>}, which resolve
     *                         from the parent of the innermost scope
     */
    record Reference(String name, TextRange range, ReferenceKind kind, boolean callee, boolean superAssignment)
            implements SemanticEvent {

        public static Reference read(String name, TextRange range, boolean callee) {
            return new Reference(name, range, ReferenceKind.READ, callee, false);
        }

        public static Reference write(String name, TextRange range, boolean superAssignment) {
            return new Reference(name, range, ReferenceKind.WRITE, false, superAssignment);
        }
    }
}
