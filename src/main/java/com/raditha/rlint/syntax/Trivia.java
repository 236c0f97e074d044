package com.raditha.rlint.syntax;

/**
 * A piece of whitespace, a line break or a comment attached to a token.
 *
 * @param kind   what sort of trivia this is
 * @param text   the exact source text
 * @param offset offset of the first character in the source
 */
public record Trivia(TriviaKind kind, String text, int offset) {

    public TextRange range() {
        return new TextRange(offset, offset + text.length());
    }

    public boolean isComment() {
        return kind == TriviaKind.COMMENT;
    }

    public boolean isNewline() {
        return kind == TriviaKind.NEWLINE;
    }
}
