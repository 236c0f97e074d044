package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxElement;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shape checks shared by several rules.
 */
final class LintUtils {

    /**
     * Functions whose result is a length or a dimension, as used in
     * {@code 1:length(x)} and {@code seq(nrow(x))}.
     */
    static final Set<String> SIZE_FUNCTIONS = Set.of("length", "nrow", "ncol", "NROW", "NCOL");

    private LintUtils() {
    }

    static boolean isCallTo(SyntaxNode node, String... names) {
        if (node.kind() != RSyntaxKind.R_CALL) {
            return false;
        }
        String function = RAst.functionName(node);
        for (String name : names) {
            if (name.equals(function)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The safe sequence over {@code size(arguments)}: {@code seq_along()} for
     * lengths and {@code seq_len()} for dimensions.
     */
    static String sequenceReplacement(String size, String arguments) {
        return size.equals("length")
                ? "seq_along(" + arguments + ")"
                : "seq_len(" + size + "(" + arguments + "))";
    }

    static String sequenceSuggestion(String size) {
        return "Use `" + sequenceReplacement(size, "...") + "` instead.";
    }

    /**
     * An {@code expect_equal()} or {@code expect_identical()} call with at most
     * two arguments, one of which calls {@code wrapper}: the {@code x} of
     * {@code expect_equal(length(x), n)} or {@code expect_equal(n, length(x))}.
     */
    static Optional<WrappedExpectation> wrappedExpectation(SyntaxNode call, String wrapper) {
        String function = RAst.functionName(call);
        if (!function.equals("expect_equal") && !function.equals("expect_identical")) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        if (arguments.size() > 2) {
            return Optional.empty();
        }
        Optional<SyntaxNode> object = RAst.argumentByNameOrPosition(arguments, "object", 0)
                .flatMap(RAst::argumentValue);
        Optional<SyntaxNode> expected = RAst.argumentByNameOrPosition(arguments, "expected", 1)
                .flatMap(RAst::argumentValue);
        if (object.isEmpty() || expected.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode wrapped;
        SyntaxNode other;
        if (isCallTo(object.get(), wrapper)) {
            wrapped = object.get();
            other = expected.get();
        } else if (isCallTo(expected.get(), wrapper)) {
            wrapped = expected.get();
            other = object.get();
        } else {
            return Optional.empty();
        }
        if (isCallTo(other, wrapper)) {
            return Optional.empty();
        }
        return RAst.argumentByNameOrPosition(RAst.arguments(wrapped), "x", 0)
                .flatMap(RAst::argumentValue)
                .map(inner -> new WrappedExpectation(function, inner, other));
    }

    /**
     * @param function the expectation called
     * @param inner    the argument of the wrapping call
     * @param other    the operand compared against it
     */
    record WrappedExpectation(String function, SyntaxNode inner, SyntaxNode other) {
    }

    /**
     * For {@code outer(inner(a, b))} returns {@code "a, b"}; empty when the call
     * has another shape. The outer call must have exactly one unnamed argument.
     */
    static Optional<String> nestedCallArguments(SyntaxNode call, String outer, String inner) {
        if (!outer.equals(RAst.functionName(call))) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        if (arguments.size() != 1 || RAst.argumentName(arguments.get(0)).isPresent()) {
            return Optional.empty();
        }
        Optional<SyntaxNode> value = RAst.argumentValue(arguments.get(0));
        if (value.isEmpty() || value.get().kind() != RSyntaxKind.R_CALL
                || !inner.equals(RAst.functionName(value.get()))) {
            return Optional.empty();
        }
        return Optional.of(joinArguments(RAst.arguments(value.get())));
    }

    static String joinArguments(List<SyntaxNode> arguments) {
        return arguments.stream().map(SyntaxNode::text).collect(Collectors.joining(", "));
    }

    /**
     * The operator token of a binary expression.
     *
     * @throws RuleException if the node has no operator token
     */
    static SyntaxToken operator(SyntaxNode binary) throws RuleException {
        return RAst.binaryOperator(binary)
                .orElseThrow(() -> new RuleException("Binary expression without operator at " + binary.textRange()));
    }

    static SyntaxNode left(SyntaxNode binary) throws RuleException {
        return RAst.binaryLeft(binary)
                .orElseThrow(() -> new RuleException("Binary expression without left operand at " + binary.textRange()));
    }

    static SyntaxNode right(SyntaxNode binary) throws RuleException {
        return RAst.binaryRight(binary)
                .orElseThrow(() -> new RuleException("Binary expression without right operand at " + binary.textRange()));
    }

    /**
     * The operator of a binary expression when it is {@code ==}, {@code !=} or
     * {@code %in%}.
     */
    static Optional<SyntaxToken> equalityOperator(SyntaxNode binary) {
        return RAst.binaryOperator(binary).filter(op -> op.kind() == RSyntaxKind.EQUAL2
                || op.kind() == RSyntaxKind.NOT_EQUAL
                || (op.kind() == RSyntaxKind.SPECIAL && op.text().equals("%in%")));
    }

    /**
     * The parent when {@code node} sits at {@code index} in a node of {@code kind}.
     */
    static Optional<SyntaxNode> parentAt(SyntaxElement node, RSyntaxKind kind, int index) {
        SyntaxNode parent = node.parent();
        if (parent == null || parent.kind() != kind || node.index() != index) {
            return Optional.empty();
        }
        return Optional.of(parent);
    }

    /**
     * Whether any token from the first up to and including {@code last}
     * carries a comment.
     */
    static boolean hasCommentsUpTo(SyntaxNode node, SyntaxToken last) {
        for (SyntaxToken token : node.tokens()) {
            if (token.hasComments()) {
                return true;
            }
            if (token == last) {
                break;
            }
        }
        return false;
    }
}
