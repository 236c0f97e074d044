package com.raditha.rlint.syntax;

import org.jspecify.annotations.Nullable;

/**
 * Either a {@link SyntaxNode} or a {@link SyntaxToken}: the children of a node.
 */
public interface SyntaxElement {

    RSyntaxKind kind();

    /**
     * Range of the element without the leading trivia of its first token and the
     * trailing trivia of its last token.
     */
    TextRange textRange();

    /**
     * Range of the element including all attached trivia.
     */
    TextRange fullRange();

    @Nullable
    SyntaxNode parent();

    /**
     * Position of this element among its parent's children, or -1 for the root.
     */
    default int index() {
        SyntaxNode parent = parent();
        if (parent == null) {
            return -1;
        }
        return parent.children().indexOf(this);
    }
}
