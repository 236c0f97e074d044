package com.raditha.rlint.syntax;

/**
 * Kind tags for every token and node of an R syntax tree.
 * <p>
 * Token kinds come first, node kinds (prefixed {@code R_}) after.
 */
public enum RSyntaxKind {
    // Literals and names
    IDENT,
    STRING,
    NUMBER,

    // Keywords
    FUNCTION_KW,
    BACKSLASH,
    IF_KW,
    ELSE_KW,
    FOR_KW,
    IN_KW,
    WHILE_KW,
    REPEAT_KW,
    BREAK_KW,
    NEXT_KW,
    TRUE_KW,
    FALSE_KW,
    NULL_KW,
    NA_KW,

    // Delimiters
    L_PAREN,
    R_PAREN,
    L_CURLY,
    R_CURLY,
    L_BRACK,
    L_BRACK2,
    R_BRACK,
    COMMA,
    SEMICOLON,

    // Operators
    ASSIGN,
    SUPER_ASSIGN,
    ASSIGN_RIGHT,
    SUPER_ASSIGN_RIGHT,
    WALRUS,
    EQUAL,
    EQUAL2,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL_TO,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL_TO,
    BANG,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    SPECIAL,
    PIPE,
    OR,
    OR2,
    AND,
    AND2,
    TILDE,
    COLON,
    DOUBLE_COLON,
    TRIPLE_COLON,
    DOLLAR,
    AT,
    QUESTION,

    ERROR_TOKEN,
    EOF,

    // Nodes
    R_ROOT,
    R_IDENTIFIER,
    R_STRING_VALUE,
    R_NUMERIC_VALUE,
    R_TRUE_EXPRESSION,
    R_FALSE_EXPRESSION,
    R_NULL_EXPRESSION,
    R_NA_EXPRESSION,
    R_BINARY_EXPRESSION,
    R_UNARY_EXPRESSION,
    R_PARENTHESIZED_EXPRESSION,
    R_BRACED_EXPRESSIONS,
    R_CALL,
    R_CALL_ARGUMENTS,
    R_SUBSET,
    R_SUBSET2,
    R_SUBSET_ARGUMENTS,
    R_ARGUMENT,
    R_ARGUMENT_NAME_CLAUSE,
    R_FUNCTION_DEFINITION,
    R_PARAMETERS,
    R_PARAMETER,
    R_IF_STATEMENT,
    R_ELSE_CLAUSE,
    R_FOR_STATEMENT,
    R_WHILE_STATEMENT,
    R_REPEAT_STATEMENT,
    R_BREAK_EXPRESSION,
    R_NEXT_EXPRESSION,
    R_EXTRACT_EXPRESSION,
    R_NAMESPACE_EXPRESSION,
    R_BOGUS;

    public boolean isNode() {
        return name().startsWith("R_");
    }
}
