package com.raditha.rlint.syntax;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A leaf of the syntax tree. Trivia before the token (up to and including line
 * breaks) is leading, trivia after it on the same line is trailing.
 */
public final class SyntaxToken implements SyntaxElement {

    private final RSyntaxKind kind;
    private final String text;
    private final int offset;
    private final List<Trivia> leadingTrivia;
    private final List<Trivia> trailingTrivia;
    private SyntaxNode parent;

    public SyntaxToken(RSyntaxKind kind, String text, int offset, List<Trivia> leadingTrivia,
            List<Trivia> trailingTrivia) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
        this.leadingTrivia = List.copyOf(leadingTrivia);
        this.trailingTrivia = List.copyOf(trailingTrivia);
    }

    @Override
    public RSyntaxKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    public int offset() {
        return offset;
    }

    public List<Trivia> leadingTrivia() {
        return leadingTrivia;
    }

    public List<Trivia> trailingTrivia() {
        return trailingTrivia;
    }

    @Override
    public TextRange textRange() {
        return new TextRange(offset, offset + text.length());
    }

    @Override
    public TextRange fullRange() {
        int start = leadingTrivia.isEmpty() ? offset : leadingTrivia.get(0).offset();
        int end = trailingTrivia.isEmpty()
                ? offset + text.length()
                : trailingTrivia.get(trailingTrivia.size() - 1).range().end();
        return new TextRange(start, end);
    }

    @Override
    public @Nullable SyntaxNode parent() {
        return parent;
    }

    void setParent(SyntaxNode parent) {
        if (this.parent != null) {
            throw new IllegalStateException("Token " + this + " already has a parent");
        }
        this.parent = parent;
    }

    /**
     * True when a line break separates this token from the previous one.
     */
    public boolean hasNewlineBefore() {
        for (Trivia trivia : leadingTrivia) {
            if (trivia.isNewline()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasComments() {
        for (Trivia trivia : leadingTrivia) {
            if (trivia.isComment()) {
                return true;
            }
        }
        for (Trivia trivia : trailingTrivia) {
            if (trivia.isComment()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends the token text with its trivia to {@code out}.
     */
    void appendFullText(StringBuilder out, boolean withLeading, boolean withTrailing) {
        if (withLeading) {
            leadingTrivia.forEach(t -> out.append(t.text()));
        }
        out.append(text);
        if (withTrailing) {
            trailingTrivia.forEach(t -> out.append(t.text()));
        }
    }

    @Override
    public String toString() {
        return kind + "@" + textRange() + " \"" + text + "\"";
    }
}
