package com.raditha.rlint.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An interior node of the syntax tree.
 * <p>
 * Nodes are created bottom-up by {@link RParser} and never change afterwards.
 * Children are kept in source order and include the tokens of the node itself
 * (keywords, operators, delimiters), so a node's text can always be rebuilt
 * exactly from its tokens.
 */
public final class SyntaxNode implements SyntaxElement {

    private final RSyntaxKind kind;
    private final List<SyntaxElement> children;
    private SyntaxNode parent;
    private String cachedText;

    public SyntaxNode(RSyntaxKind kind, List<SyntaxElement> children) {
        if (!kind.isNode()) {
            throw new IllegalArgumentException("Not a node kind: " + kind);
        }
        this.kind = kind;
        this.children = List.copyOf(children);
        for (SyntaxElement child : this.children) {
            if (child instanceof SyntaxNode node) {
                node.setParent(this);
            } else {
                ((SyntaxToken) child).setParent(this);
            }
        }
    }

    @Override
    public RSyntaxKind kind() {
        return kind;
    }

    @Override
    public @Nullable SyntaxNode parent() {
        return parent;
    }

    private void setParent(SyntaxNode parent) {
        if (this.parent != null) {
            throw new IllegalStateException("Node " + kind + " already has a parent");
        }
        this.parent = parent;
    }

    public List<SyntaxElement> children() {
        return children;
    }

    public List<SyntaxNode> childNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * The child element at {@code index}, or null when the node has fewer children.
     */
    public @Nullable SyntaxElement childAt(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public Optional<SyntaxNode> findChild(RSyntaxKind nodeKind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node && node.kind() == nodeKind) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public @Nullable SyntaxToken firstToken() {
        for (SyntaxElement child : children) {
            SyntaxToken token = child instanceof SyntaxNode node ? node.firstToken() : (SyntaxToken) child;
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    public @Nullable SyntaxToken lastToken() {
        for (int i = children.size() - 1; i >= 0; i--) {
            SyntaxElement child = children.get(i);
            SyntaxToken token = child instanceof SyntaxNode node ? node.lastToken() : (SyntaxToken) child;
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    /**
     * All tokens below this node in source order.
     */
    public List<SyntaxToken> tokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        collectTokens(this, tokens);
        return tokens;
    }

    private static void collectTokens(SyntaxNode node, List<SyntaxToken> out) {
        for (SyntaxElement child : node.children) {
            if (child instanceof SyntaxNode inner) {
                collectTokens(inner, out);
            } else {
                out.add((SyntaxToken) child);
            }
        }
    }

    @Override
    public TextRange textRange() {
        SyntaxToken first = firstToken();
        SyntaxToken last = lastToken();
        if (first == null || last == null) {
            return TextRange.empty(0);
        }
        return new TextRange(first.offset(), last.textRange().end());
    }

    @Override
    public TextRange fullRange() {
        SyntaxToken first = firstToken();
        SyntaxToken last = lastToken();
        if (first == null || last == null) {
            return TextRange.empty(0);
        }
        return new TextRange(first.fullRange().start(), last.fullRange().end());
    }

    /**
     * The source text of this node without surrounding trivia. Interior comments
     * and whitespace are kept.
     */
    public String text() {
        if (cachedText == null) {
            List<SyntaxToken> tokens = tokens();
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < tokens.size(); i++) {
                tokens.get(i).appendFullText(out, i > 0, i < tokens.size() - 1);
            }
            cachedText = out.toString();
        }
        return cachedText;
    }

    /**
     * The source text of this node including leading and trailing trivia.
     */
    public String fullText() {
        StringBuilder out = new StringBuilder();
        for (SyntaxToken token : tokens()) {
            token.appendFullText(out, true, true);
        }
        return out.toString();
    }

    /**
     * True when any token of the node, including the leading trivia of the first
     * token and the trailing trivia of the last one, carries a comment.
     */
    public boolean containsComments() {
        for (SyntaxToken token : tokens()) {
            if (token.hasComments()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ancestors from the parent up to the root.
     */
    public List<SyntaxNode> ancestors() {
        List<SyntaxNode> result = new ArrayList<>();
        SyntaxNode current = parent;
        while (current != null) {
            result.add(current);
            current = current.parent;
        }
        return result;
    }

    public @Nullable SyntaxElement prevSibling() {
        if (parent == null) {
            return null;
        }
        return parent.childAt(index() - 1);
    }

    public @Nullable SyntaxElement nextSibling() {
        if (parent == null) {
            return null;
        }
        return parent.childAt(index() + 1);
    }

    /**
     * This node and every node below it, in pre-order.
     */
    public List<SyntaxNode> descendants() {
        List<SyntaxNode> result = new ArrayList<>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(SyntaxNode node, List<SyntaxNode> out) {
        out.add(node);
        for (SyntaxElement child : node.children) {
            if (child instanceof SyntaxNode inner) {
                collectDescendants(inner, out);
            }
        }
    }

    @Override
    public String toString() {
        return kind + "@" + textRange();
    }
}
