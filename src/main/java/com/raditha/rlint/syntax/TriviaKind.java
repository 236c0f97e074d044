package com.raditha.rlint.syntax;

/**
 * Kinds of source text that carry no syntactic meaning but are kept in the tree.
 */
public enum TriviaKind {
    WHITESPACE,
    NEWLINE,
    COMMENT
}
