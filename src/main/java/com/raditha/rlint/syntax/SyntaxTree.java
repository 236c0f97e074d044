package com.raditha.rlint.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of parsing one R source text: the root node, the source it was
 * built from and any syntax errors met on the way.
 */
public class SyntaxTree {

    private final String source;
    private final SyntaxNode root;
    private final List<ParseError> errors;
    private final LineIndex lineIndex;

    public SyntaxTree(String source, SyntaxNode root, List<ParseError> errors) {
        this.source = source;
        this.root = root;
        this.errors = List.copyOf(errors);
        this.lineIndex = new LineIndex(source);
    }

    public String source() {
        return source;
    }

    public SyntaxNode root() {
        return root;
    }

    public List<ParseError> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    /**
     * Every comment in the file, in source order.
     */
    public List<Trivia> comments() {
        List<Trivia> comments = new ArrayList<>();
        for (SyntaxToken token : root.tokens()) {
            for (Trivia trivia : token.leadingTrivia()) {
                if (trivia.isComment()) {
                    comments.add(trivia);
                }
            }
            for (Trivia trivia : token.trailingTrivia()) {
                if (trivia.isComment()) {
                    comments.add(trivia);
                }
            }
        }
        return comments;
    }

    /**
     * Throws if the tree carries syntax errors.
     */
    public SyntaxTree requireValid() throws ParseException {
        if (hasErrors()) {
            throw new ParseException(errors, lineIndex);
        }
        return this;
    }
}
