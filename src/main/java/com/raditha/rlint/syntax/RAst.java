package com.raditha.rlint.syntax;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed accessors over untyped {@link SyntaxNode}s.
 * <p>
 * Each accessor checks the node kind and returns empty (or null) when the node
 * is of another kind or misses the requested part because of a syntax error.
 */
public final class RAst {

    private RAst() {
    }

    public static boolean is(@Nullable SyntaxElement element, RSyntaxKind kind) {
        return element != null && element.kind() == kind;
    }

    // Binary and unary expressions

    public static Optional<SyntaxNode> binaryLeft(SyntaxNode binary) {
        return nodeAt(binary, RSyntaxKind.R_BINARY_EXPRESSION, 0);
    }

    public static Optional<SyntaxToken> binaryOperator(SyntaxNode binary) {
        if (binary.kind() != RSyntaxKind.R_BINARY_EXPRESSION) {
            return Optional.empty();
        }
        for (SyntaxElement child : binary.children()) {
            if (child instanceof SyntaxToken token) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    public static Optional<SyntaxNode> binaryRight(SyntaxNode binary) {
        if (binary.kind() != RSyntaxKind.R_BINARY_EXPRESSION || binary.children().size() < 3) {
            return Optional.empty();
        }
        return binary.children().get(2) instanceof SyntaxNode node ? Optional.of(node) : Optional.empty();
    }

    public static Optional<SyntaxToken> unaryOperator(SyntaxNode unary) {
        if (unary.kind() != RSyntaxKind.R_UNARY_EXPRESSION) {
            return Optional.empty();
        }
        return unary.children().get(0) instanceof SyntaxToken token ? Optional.of(token) : Optional.empty();
    }

    public static Optional<SyntaxNode> unaryArgument(SyntaxNode unary) {
        return nodeAt(unary, RSyntaxKind.R_UNARY_EXPRESSION, 1);
    }

    // Calls and arguments

    public static Optional<SyntaxNode> callFunction(SyntaxNode call) {
        return nodeAt(call, RSyntaxKind.R_CALL, 0);
    }

    /**
     * The argument nodes of a call or subset, skipping empty positions.
     */
    public static List<SyntaxNode> arguments(SyntaxNode callOrSubset) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : callOrSubset.childNodes()) {
            if (child.kind() == RSyntaxKind.R_CALL_ARGUMENTS || child.kind() == RSyntaxKind.R_SUBSET_ARGUMENTS) {
                for (SyntaxNode argument : child.childNodes()) {
                    if (argument.kind() == RSyntaxKind.R_ARGUMENT) {
                        result.add(argument);
                    }
                }
            }
        }
        return result;
    }

    /**
     * The name of a named argument with quotes and backticks removed.
     */
    public static Optional<String> argumentName(SyntaxNode argument) {
        return argument.findChild(RSyntaxKind.R_ARGUMENT_NAME_CLAUSE)
                .map(clause -> unquote(((SyntaxToken) clause.children().get(0)).text()));
    }

    public static Optional<SyntaxNode> argumentValue(SyntaxNode argument) {
        for (SyntaxNode child : argument.childNodes()) {
            if (child.kind() != RSyntaxKind.R_ARGUMENT_NAME_CLAUSE) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds an argument by name, or else by its position among the unnamed
     * arguments (0-based).
     */
    public static Optional<SyntaxNode> argumentByNameOrPosition(List<SyntaxNode> arguments, String name,
            int position) {
        for (SyntaxNode argument : arguments) {
            if (argumentName(argument).filter(name::equals).isPresent()) {
                return Optional.of(argument);
            }
        }
        int unnamed = 0;
        for (SyntaxNode argument : arguments) {
            if (argumentName(argument).isEmpty()) {
                if (unnamed == position) {
                    return Optional.of(argument);
                }
                unnamed++;
            }
        }
        return Optional.empty();
    }

    /**
     * The called function's name: {@code f} for {@code f(x)} and for
     * {@code pkg::f(x)}, empty for anonymous calls such as {@code g()(x)}.
     */
    public static String functionName(SyntaxNode call) {
        Optional<SyntaxNode> function = callFunction(call);
        if (function.isEmpty()) {
            return "";
        }
        SyntaxNode target = function.get();
        if (target.kind() == RSyntaxKind.R_NAMESPACE_EXPRESSION && target.children().size() == 3
                && target.children().get(2) instanceof SyntaxNode symbol) {
            target = symbol;
        }
        if (target.kind() == RSyntaxKind.R_IDENTIFIER || target.kind() == RSyntaxKind.R_STRING_VALUE) {
            return unquote(target.text());
        }
        return "";
    }

    // Control flow

    /**
     * The condition of an {@code if} or {@code while} statement.
     */
    public static Optional<SyntaxNode> condition(SyntaxNode statement) {
        if (statement.kind() != RSyntaxKind.R_IF_STATEMENT && statement.kind() != RSyntaxKind.R_WHILE_STATEMENT) {
            return Optional.empty();
        }
        return statement.childAt(2) instanceof SyntaxNode node ? Optional.of(node) : Optional.empty();
    }

    /**
     * The body of a {@code while}, {@code for}, {@code repeat} statement or the
     * consequence of an {@code if}.
     */
    public static Optional<SyntaxNode> body(SyntaxNode statement) {
        int index = switch (statement.kind()) {
            case R_IF_STATEMENT, R_WHILE_STATEMENT -> 4;
            case R_FOR_STATEMENT -> 6;
            case R_REPEAT_STATEMENT -> 1;
            case R_FUNCTION_DEFINITION -> 2;
            default -> -1;
        };
        return statement.childAt(index) instanceof SyntaxNode node ? Optional.of(node) : Optional.empty();
    }

    /**
     * The expression after {@code else} in an {@code if} statement.
     */
    public static Optional<SyntaxNode> alternative(SyntaxNode ifStatement) {
        if (ifStatement.kind() != RSyntaxKind.R_IF_STATEMENT) {
            return Optional.empty();
        }
        return ifStatement.findChild(RSyntaxKind.R_ELSE_CLAUSE)
                .flatMap(clause -> clause.childNodes().stream().findFirst());
    }

    public static boolean isIfOrWhileCondition(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        return parent != null && condition(parent).filter(c -> c == node).isPresent();
    }

    /**
     * Strips matching quotes or backticks from a name or string literal.
     */
    public static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static Optional<SyntaxNode> nodeAt(SyntaxNode node, RSyntaxKind kind, int index) {
        if (node.kind() != kind) {
            return Optional.empty();
        }
        return node.childAt(index) instanceof SyntaxNode child ? Optional.of(child) : Optional.empty();
    }
}
