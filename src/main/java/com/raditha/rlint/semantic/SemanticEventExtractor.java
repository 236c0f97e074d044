package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxElement;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;
import com.raditha.rlint.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a syntax tree once and records the scoping events of the file.
 * <p>
 * Only the file itself and function definitions open scopes; braces and loops
 * do not, as in R. The value of an assignment is visited before its target is
 * declared, so {@code x <- x + 1} reads the previous {@code x}.
 * Identifiers inside formulas, field names after {@code $} or {@code @} and
 * both sides of {@code pkg::name} produce no references.
 */
public class SemanticEventExtractor {

    private final List<SemanticEvent> events = new ArrayList<>();

    public static List<SemanticEvent> extract(SyntaxTree tree) {
        SemanticEventExtractor extractor = new SemanticEventExtractor();
        SyntaxNode root = tree.root();
        extractor.events.add(new SemanticEvent.OpenScope(root.fullRange()));
        extractor.visitChildren(root);
        // The root has no enclosing node whose exit could close its scope.
        extractor.events.add(new SemanticEvent.CloseScope(root.fullRange()));
        return List.copyOf(extractor.events);
    }

    private void visit(SyntaxNode node) {
        switch (node.kind()) {
            case R_FUNCTION_DEFINITION -> visitFunction(node);
            case R_BINARY_EXPRESSION -> visitBinary(node);
            case R_UNARY_EXPRESSION -> {
                if (!RAst.unaryOperator(node).map(op -> op.kind() == RSyntaxKind.TILDE).orElse(false)) {
                    visitChildren(node);
                }
            }
            case R_IDENTIFIER -> {
                SyntaxNode parent = node.parent();
                boolean callee = parent != null && parent.kind() == RSyntaxKind.R_CALL && node.index() == 0;
                events.add(SemanticEvent.Reference.read(name(node), node.textRange(), callee));
            }
            case R_EXTRACT_EXPRESSION -> {
                if (node.childAt(0) instanceof SyntaxNode object) {
                    visit(object);
                }
            }
            case R_NAMESPACE_EXPRESSION -> {
                // pkg::name refers to another namespace
            }
            case R_FOR_STATEMENT -> visitFor(node);
            default -> visitChildren(node);
        }
    }

    private void visitChildren(SyntaxNode node) {
        for (SyntaxNode child : node.childNodes()) {
            visit(child);
        }
    }

    private void visitFunction(SyntaxNode function) {
        events.add(new SemanticEvent.OpenScope(function.textRange()));
        List<SyntaxNode> defaults = new ArrayList<>();
        function.findChild(RSyntaxKind.R_PARAMETERS).ifPresent(parameters -> {
            for (SyntaxNode parameter : parameters.childNodes()) {
                if (parameter.kind() != RSyntaxKind.R_PARAMETER) {
                    continue;
                }
                SyntaxToken name = (SyntaxToken) parameter.children().get(0);
                events.add(new SemanticEvent.DeclareBinding(RAst.unquote(name.text()), name.textRange(),
                        BindingKind.PARAMETER));
                defaults.addAll(parameter.childNodes());
            }
        });
        defaults.forEach(this::visit);
        RAst.body(function).ifPresent(this::visit);
        events.add(new SemanticEvent.CloseScope(function.textRange()));
    }

    private void visitBinary(SyntaxNode binary) {
        RSyntaxKind operator = RAst.binaryOperator(binary).map(SyntaxToken::kind).orElse(RSyntaxKind.R_BOGUS);
        SyntaxNode left = RAst.binaryLeft(binary).orElse(null);
        SyntaxNode right = RAst.binaryRight(binary).orElse(null);
        switch (operator) {
            case ASSIGN, EQUAL, WALRUS -> visitAssignment(left, right, false);
            case SUPER_ASSIGN -> visitAssignment(left, right, true);
            case ASSIGN_RIGHT -> visitAssignment(right, left, false);
            case SUPER_ASSIGN_RIGHT -> visitAssignment(right, left, true);
            case TILDE -> {
                // formulas are evaluated lazily, in a data context
            }
            default -> visitChildren(binary);
        }
    }

    private void visitAssignment(SyntaxNode target, SyntaxNode value, boolean superAssignment) {
        if (value != null) {
            visit(value);
        }
        if (target == null) {
            return;
        }
        if (target.kind() == RSyntaxKind.R_IDENTIFIER || target.kind() == RSyntaxKind.R_STRING_VALUE) {
            if (superAssignment) {
                events.add(SemanticEvent.Reference.write(name(target), target.textRange(), true));
            } else {
                events.add(new SemanticEvent.DeclareBinding(name(target), target.textRange(), BindingKind.ASSIGNMENT));
            }
        } else {
            visitReplacementTarget(target, superAssignment);
        }
    }

    /**
     * Targets such as {@code x[i]}, {@code x$a} or {@code names(x)} modify an
     * existing object: the object is written, everything else is read.
     */
    private void visitReplacementTarget(SyntaxNode target, boolean superAssignment) {
        switch (target.kind()) {
            case R_IDENTIFIER, R_STRING_VALUE ->
                    events.add(SemanticEvent.Reference.write(name(target), target.textRange(), superAssignment));
            case R_SUBSET, R_SUBSET2 -> {
                for (SyntaxElement child : target.children()) {
                    if (child instanceof SyntaxNode node) {
                        if (node.index() == 0) {
                            visitReplacementTarget(node, superAssignment);
                        } else {
                            visit(node);
                        }
                    }
                }
            }
            case R_EXTRACT_EXPRESSION -> {
                if (target.childAt(0) instanceof SyntaxNode object) {
                    visitReplacementTarget(object, superAssignment);
                }
            }
            case R_CALL -> {
                List<SyntaxNode> arguments = RAst.arguments(target);
                for (int i = 0; i < arguments.size(); i++) {
                    SyntaxNode value = RAst.argumentValue(arguments.get(i)).orElse(null);
                    if (value == null) {
                        continue;
                    }
                    if (i == 0) {
                        visitReplacementTarget(value, superAssignment);
                    } else {
                        visit(value);
                    }
                }
            }
            default -> visit(target);
        }
    }

    private void visitFor(SyntaxNode statement) {
        SyntaxElement variable = statement.childAt(2);
        SyntaxElement sequence = statement.childAt(4);
        if (sequence instanceof SyntaxNode node) {
            visit(node);
        }
        if (variable instanceof SyntaxNode node && node.kind() == RSyntaxKind.R_IDENTIFIER) {
            events.add(new SemanticEvent.DeclareBinding(name(node), node.textRange(), BindingKind.LOOP_VARIABLE));
        }
        RAst.body(statement).ifPresent(this::visit);
    }

    private static String name(SyntaxNode identifier) {
        return RAst.unquote(identifier.text());
    }
}
