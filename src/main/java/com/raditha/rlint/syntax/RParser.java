package com.raditha.rlint.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Error-tolerant recursive descent parser for R.
 * <p>
 * Binary operators are handled by precedence climbing. Line breaks end an
 * expression at the top level and inside braces but are ignored inside
 * parentheses and brackets, which is tracked with a stack of contexts.
 * Syntax errors never abort parsing: unexpected tokens are wrapped in
 * {@link RSyntaxKind#R_BOGUS} nodes and recorded as {@link ParseError}s.
 */
public class RParser {

    static final int PREC_HELP = 1;
    static final int PREC_EQ_ASSIGN = 2;
    static final int PREC_LEFT_ASSIGN = 3;
    static final int PREC_RIGHT_ASSIGN = 4;
    static final int PREC_TILDE = 5;
    static final int PREC_OR = 6;
    static final int PREC_AND = 7;
    static final int PREC_NOT = 8;
    static final int PREC_COMPARE = 9;
    static final int PREC_ADD = 10;
    static final int PREC_MUL = 11;
    static final int PREC_SPECIAL = 12;
    static final int PREC_COLON = 13;
    static final int PREC_UNARY = 14;
    static final int PREC_POWER = 15;

    private final List<SyntaxToken> tokens;
    private final List<ParseError> errors = new ArrayList<>();
    private final Deque<Boolean> newlineSensitive = new ArrayDeque<>();
    private int pos;

    private RParser(String source) {
        this.tokens = new RLexer(source).tokenize();
    }

    /**
     * Parses a complete R file. Never throws; check {@link SyntaxTree#hasErrors()}.
     */
    public static SyntaxTree parse(String source) {
        RParser parser = new RParser(source);
        SyntaxNode root = parser.parseRoot();
        return new SyntaxTree(source, root, parser.errors);
    }

    private SyntaxNode parseRoot() {
        List<SyntaxElement> children = new ArrayList<>();
        newlineSensitive.push(true);
        parseExpressionList(children, RSyntaxKind.EOF);
        newlineSensitive.pop();
        children.add(bump());
        return new SyntaxNode(RSyntaxKind.R_ROOT, children);
    }

    private void parseExpressionList(List<SyntaxElement> out, RSyntaxKind terminator) {
        while (!at(terminator) && !at(RSyntaxKind.EOF)) {
            if (at(RSyntaxKind.SEMICOLON)) {
                out.add(bump());
                continue;
            }
            int start = pos;
            SyntaxNode expression = parseExpression(0);
            if (expression != null) {
                out.add(expression);
            }
            if (pos == start) {
                out.add(bogus(bump(), "Unexpected token"));
                continue;
            }
            if (!at(RSyntaxKind.SEMICOLON) && !at(terminator) && !at(RSyntaxKind.EOF) && !peek().hasNewlineBefore()) {
                error("Expected a line break or ';' between expressions", peek());
            }
        }
    }

    private @Nullable SyntaxNode parseExpression(int minPrecedence) {
        SyntaxNode left = parseUnary();
        if (left == null) {
            return null;
        }
        return parseBinaryTail(left, minPrecedence);
    }

    private @Nullable SyntaxNode parseUnary() {
        int operandPrecedence = switch (peek().kind()) {
            case MINUS, PLUS -> PREC_UNARY;
            case BANG -> PREC_NOT;
            case TILDE -> PREC_TILDE;
            case QUESTION -> PREC_HELP;
            default -> -1;
        };
        if (operandPrecedence < 0) {
            SyntaxNode primary = parsePrimary();
            return primary == null ? null : parsePostfix(primary);
        }
        SyntaxToken operator = bump();
        SyntaxNode operand = parseExpression(operandPrecedence);
        if (operand == null) {
            error("Expected an operand after '" + operator.text() + "'", peek());
        }
        return node(RSyntaxKind.R_UNARY_EXPRESSION, operator, operand);
    }

    private SyntaxNode parseBinaryTail(SyntaxNode left, int minPrecedence) {
        SyntaxNode result = left;
        while (true) {
            SyntaxToken next = peek();
            if (sensitive() && next.hasNewlineBefore()) {
                return result;
            }
            int precedence = binaryPrecedence(next.kind());
            if (precedence < 0 || precedence < minPrecedence) {
                return result;
            }
            SyntaxToken operator = bump();
            int rightMin = isRightAssociative(operator.kind()) ? precedence : precedence + 1;
            SyntaxNode right = parseExpression(rightMin);
            if (right == null) {
                error("Expected an expression after '" + operator.text() + "'", peek());
            }
            result = node(RSyntaxKind.R_BINARY_EXPRESSION, result, operator, right);
        }
    }

    private static int binaryPrecedence(RSyntaxKind kind) {
        return switch (kind) {
            case QUESTION -> PREC_HELP;
            case EQUAL -> PREC_EQ_ASSIGN;
            case ASSIGN, SUPER_ASSIGN, WALRUS -> PREC_LEFT_ASSIGN;
            case ASSIGN_RIGHT, SUPER_ASSIGN_RIGHT -> PREC_RIGHT_ASSIGN;
            case TILDE -> PREC_TILDE;
            case OR, OR2 -> PREC_OR;
            case AND, AND2 -> PREC_AND;
            case EQUAL2, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL_TO, GREATER_THAN, GREATER_THAN_OR_EQUAL_TO ->
                    PREC_COMPARE;
            case PLUS, MINUS -> PREC_ADD;
            case STAR, SLASH -> PREC_MUL;
            case SPECIAL, PIPE -> PREC_SPECIAL;
            case COLON -> PREC_COLON;
            case CARET -> PREC_POWER;
            default -> -1;
        };
    }

    private static boolean isRightAssociative(RSyntaxKind kind) {
        return switch (kind) {
            case EQUAL, ASSIGN, SUPER_ASSIGN, WALRUS, CARET -> true;
            default -> false;
        };
    }

    private SyntaxNode parsePostfix(SyntaxNode primary) {
        SyntaxNode result = primary;
        while (true) {
            SyntaxToken next = peek();
            if (sensitive() && next.hasNewlineBefore()) {
                return result;
            }
            switch (next.kind()) {
                case L_PAREN -> result = node(RSyntaxKind.R_CALL, result,
                        parseArguments(RSyntaxKind.R_CALL_ARGUMENTS, RSyntaxKind.R_PAREN, 1));
                case L_BRACK -> result = node(RSyntaxKind.R_SUBSET, result,
                        parseArguments(RSyntaxKind.R_SUBSET_ARGUMENTS, RSyntaxKind.R_BRACK, 1));
                case L_BRACK2 -> result = node(RSyntaxKind.R_SUBSET2, result,
                        parseArguments(RSyntaxKind.R_SUBSET_ARGUMENTS, RSyntaxKind.R_BRACK, 2));
                case DOLLAR, AT -> {
                    SyntaxToken operator = bump();
                    result = node(RSyntaxKind.R_EXTRACT_EXPRESSION, result, operator, parseName());
                }
                case DOUBLE_COLON, TRIPLE_COLON -> {
                    SyntaxToken operator = bump();
                    result = node(RSyntaxKind.R_NAMESPACE_EXPRESSION, result, operator, parseName());
                }
                default -> {
                    return result;
                }
            }
        }
    }

    private @Nullable SyntaxNode parseName() {
        return switch (peek().kind()) {
            case IDENT -> node(RSyntaxKind.R_IDENTIFIER, bump());
            case STRING -> node(RSyntaxKind.R_STRING_VALUE, bump());
            default -> {
                error("Expected a name", peek());
                yield null;
            }
        };
    }

    private @Nullable SyntaxNode parsePrimary() {
        SyntaxToken token = peek();
        return switch (token.kind()) {
            case IDENT -> node(RSyntaxKind.R_IDENTIFIER, bump());
            case STRING -> node(RSyntaxKind.R_STRING_VALUE, bump());
            case NUMBER -> node(RSyntaxKind.R_NUMERIC_VALUE, bump());
            case TRUE_KW -> node(RSyntaxKind.R_TRUE_EXPRESSION, bump());
            case FALSE_KW -> node(RSyntaxKind.R_FALSE_EXPRESSION, bump());
            case NULL_KW -> node(RSyntaxKind.R_NULL_EXPRESSION, bump());
            case NA_KW -> node(RSyntaxKind.R_NA_EXPRESSION, bump());
            case BREAK_KW -> node(RSyntaxKind.R_BREAK_EXPRESSION, bump());
            case NEXT_KW -> node(RSyntaxKind.R_NEXT_EXPRESSION, bump());
            case L_PAREN -> parseParenthesized();
            case L_CURLY -> parseBraced();
            case FUNCTION_KW, BACKSLASH -> parseFunction();
            case IF_KW -> parseIf();
            case FOR_KW -> parseFor();
            case WHILE_KW -> parseWhile();
            case REPEAT_KW -> node(RSyntaxKind.R_REPEAT_STATEMENT, bump(), parseBody());
            case R_PAREN, R_CURLY, R_BRACK, COMMA, SEMICOLON, EOF -> {
                error("Expected an expression", token);
                yield null;
            }
            default -> bogus(bump(), "Unexpected token '" + token.text() + "'");
        };
    }

    private SyntaxNode parseParenthesized() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        newlineSensitive.push(false);
        children.add(parseExpression(0));
        expect(RSyntaxKind.R_PAREN, children);
        newlineSensitive.pop();
        return node(RSyntaxKind.R_PARENTHESIZED_EXPRESSION, children);
    }

    private SyntaxNode parseBraced() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        newlineSensitive.push(true);
        parseExpressionList(children, RSyntaxKind.R_CURLY);
        expect(RSyntaxKind.R_CURLY, children);
        newlineSensitive.pop();
        return node(RSyntaxKind.R_BRACED_EXPRESSIONS, children);
    }

    private @Nullable SyntaxNode parseBody() {
        SyntaxNode body = parseExpression(PREC_EQ_ASSIGN);
        if (body == null) {
            error("Expected a body expression", peek());
        }
        return body;
    }

    private SyntaxNode parseFunction() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        children.add(parseParameters());
        children.add(parseBody());
        return node(RSyntaxKind.R_FUNCTION_DEFINITION, children);
    }

    private SyntaxNode parseParameters() {
        List<SyntaxElement> children = new ArrayList<>();
        newlineSensitive.push(false);
        expect(RSyntaxKind.L_PAREN, children);
        while (!at(RSyntaxKind.R_PAREN) && !at(RSyntaxKind.EOF)) {
            if (at(RSyntaxKind.IDENT)) {
                List<SyntaxElement> parameter = new ArrayList<>();
                parameter.add(bump());
                if (at(RSyntaxKind.EQUAL)) {
                    parameter.add(bump());
                    parameter.add(parseExpression(PREC_LEFT_ASSIGN));
                }
                children.add(node(RSyntaxKind.R_PARAMETER, parameter));
            } else {
                children.add(bogus(bump(), "Expected a parameter name"));
            }
            if (at(RSyntaxKind.COMMA)) {
                children.add(bump());
            } else if (!at(RSyntaxKind.R_PAREN)) {
                error("Expected ',' or ')' in parameter list", peek());
            }
        }
        expect(RSyntaxKind.R_PAREN, children);
        newlineSensitive.pop();
        return node(RSyntaxKind.R_PARAMETERS, children);
    }

    private SyntaxNode parseArguments(RSyntaxKind kind, RSyntaxKind close, int closeCount) {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        newlineSensitive.push(false);
        while (!at(close) && !at(RSyntaxKind.EOF)) {
            if (at(RSyntaxKind.COMMA)) {
                children.add(bump());
                continue;
            }
            int start = pos;
            SyntaxNode argument = parseArgument(close);
            if (argument != null) {
                children.add(argument);
            }
            if (pos == start) {
                children.add(bogus(bump(), "Unexpected token in argument list"));
            } else if (!at(RSyntaxKind.COMMA) && !at(close)) {
                error("Expected ',' or closing delimiter in argument list", peek());
            }
        }
        for (int i = 0; i < closeCount; i++) {
            expect(close, children);
        }
        newlineSensitive.pop();
        return node(kind, children);
    }

    private @Nullable SyntaxNode parseArgument(RSyntaxKind close) {
        List<SyntaxElement> children = new ArrayList<>();
        RSyntaxKind kind = peek().kind();
        boolean named = (kind == RSyntaxKind.IDENT || kind == RSyntaxKind.STRING || kind == RSyntaxKind.NULL_KW)
                && peekAt(1).kind() == RSyntaxKind.EQUAL;
        if (named) {
            SyntaxToken name = bump();
            children.add(node(RSyntaxKind.R_ARGUMENT_NAME_CLAUSE, name, bump()));
            if (at(RSyntaxKind.COMMA) || at(close)) {
                return node(RSyntaxKind.R_ARGUMENT, children);
            }
        }
        SyntaxNode value = parseExpression(PREC_LEFT_ASSIGN);
        if (value != null) {
            children.add(value);
        }
        return children.isEmpty() ? null : node(RSyntaxKind.R_ARGUMENT, children);
    }

    private SyntaxNode parseIf() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        parseCondition(children);
        children.add(parseBody());
        boolean elseAllowed = !peek().hasNewlineBefore() || newlineSensitive.size() > 1;
        if (at(RSyntaxKind.ELSE_KW) && elseAllowed) {
            SyntaxToken elseKeyword = bump();
            children.add(node(RSyntaxKind.R_ELSE_CLAUSE, elseKeyword, parseBody()));
        }
        return node(RSyntaxKind.R_IF_STATEMENT, children);
    }

    private SyntaxNode parseWhile() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        parseCondition(children);
        children.add(parseBody());
        return node(RSyntaxKind.R_WHILE_STATEMENT, children);
    }

    private void parseCondition(List<SyntaxElement> children) {
        newlineSensitive.push(false);
        expect(RSyntaxKind.L_PAREN, children);
        SyntaxNode condition = parseExpression(0);
        if (condition == null) {
            error("Expected a condition", peek());
        }
        children.add(condition);
        expect(RSyntaxKind.R_PAREN, children);
        newlineSensitive.pop();
    }

    private SyntaxNode parseFor() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(bump());
        newlineSensitive.push(false);
        expect(RSyntaxKind.L_PAREN, children);
        if (at(RSyntaxKind.IDENT)) {
            children.add(node(RSyntaxKind.R_IDENTIFIER, bump()));
        } else {
            error("Expected a loop variable", peek());
        }
        expect(RSyntaxKind.IN_KW, children);
        children.add(parseExpression(0));
        expect(RSyntaxKind.R_PAREN, children);
        newlineSensitive.pop();
        children.add(parseBody());
        return node(RSyntaxKind.R_FOR_STATEMENT, children);
    }

    private boolean sensitive() {
        Boolean top = newlineSensitive.peek();
        return top != null && top;
    }

    private SyntaxToken peek() {
        return tokens.get(pos);
    }

    private SyntaxToken peekAt(int lookahead) {
        return tokens.get(Math.min(pos + lookahead, tokens.size() - 1));
    }

    private boolean at(RSyntaxKind kind) {
        return peek().kind() == kind;
    }

    private SyntaxToken bump() {
        SyntaxToken token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private void expect(RSyntaxKind kind, List<SyntaxElement> children) {
        if (at(kind)) {
            children.add(bump());
        } else {
            error("Expected " + kind, peek());
        }
    }

    private void error(String message, SyntaxToken at) {
        errors.add(new ParseError(message, at.textRange()));
    }

    private SyntaxNode bogus(SyntaxToken token, String message) {
        error(message, token);
        return new SyntaxNode(RSyntaxKind.R_BOGUS, List.of(token));
    }

    private static SyntaxNode node(RSyntaxKind kind, SyntaxElement... children) {
        List<SyntaxElement> list = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child != null) {
                list.add(child);
            }
        }
        return new SyntaxNode(kind, list);
    }

    private static SyntaxNode node(RSyntaxKind kind, List<SyntaxElement> children) {
        children.removeIf(child -> child == null);
        return new SyntaxNode(kind, children);
    }
}
