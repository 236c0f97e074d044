package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.SemanticRule;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.TextRange;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reports code in function bodies that can never run.
 * <p>
 * Statements following a {@code return()}, a {@code stop()}-like call, a
 * {@code break} or a {@code next} in the same block are reported together as
 * one range, as are statements after an {@code if}/{@code else} whose branches
 * all leave the block. A branch of {@code if (TRUE)} or {@code if (FALSE)} that
 * cannot be taken is reported on its own. Loops never end the enclosing block,
 * and {@code T} and {@code F} are not treated as constants.
 */
public class UnreachableCode implements SemanticRule {

    private static final Set<String> STOP_FUNCTIONS = Set.of("stop", "abort", "cli_abort", ".Defunct");

    /** Why control leaves a statement. */
    enum Exit {
        RETURN("it appears after a return statement"),
        STOP("it appears after a `stop()` statement (or equivalent)"),
        BREAK("it appears after a break statement"),
        NEXT("it appears after a next statement"),
        BRANCHES("the preceding if/else terminates in all branches");

        private final String reason;

        Exit(String reason) {
            this.reason = reason;
        }
    }

    @Override
    public Rule rule() {
        return Rule.UNREACHABLE_CODE;
    }

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SyntaxNode node : context.tree().root().descendants()) {
            if (node.kind() == RSyntaxKind.R_FUNCTION_DEFINITION) {
                RAst.body(node).ifPresent(body -> exit(body, diagnostics));
            }
        }
        return diagnostics;
    }

    /**
     * How {@code statement} leaves its block, or null when control falls
     * through. Unreachable code found inside is added to {@code diagnostics}.
     */
    private static @Nullable Exit exit(SyntaxNode statement, List<Diagnostic> diagnostics) {
        return switch (statement.kind()) {
            case R_BRACED_EXPRESSIONS -> block(statement.childNodes(), diagnostics);
            case R_PARENTHESIZED_EXPRESSION -> statement.childNodes().isEmpty()
                    ? null : exit(statement.childNodes().get(0), diagnostics);
            case R_IF_STATEMENT -> ifStatement(statement, diagnostics);
            case R_FOR_STATEMENT, R_WHILE_STATEMENT, R_REPEAT_STATEMENT -> {
                RAst.body(statement).ifPresent(body -> exit(body, diagnostics));
                yield null;
            }
            case R_BREAK_EXPRESSION -> Exit.BREAK;
            case R_NEXT_EXPRESSION -> Exit.NEXT;
            case R_CALL -> {
                String function = RAst.functionName(statement);
                if (function.equals("return")) {
                    yield Exit.RETURN;
                }
                yield STOP_FUNCTIONS.contains(function) ? Exit.STOP : null;
            }
            default -> null;
        };
    }

    private static @Nullable Exit block(List<SyntaxNode> statements, List<Diagnostic> diagnostics) {
        for (int i = 0; i < statements.size(); i++) {
            Exit exit = exit(statements.get(i), diagnostics);
            if (exit == null) {
                continue;
            }
            if (i + 1 < statements.size()) {
                TextRange range = new TextRange(statements.get(i + 1).textRange().start(),
                        statements.get(statements.size() - 1).textRange().end());
                diagnostics.add(unreachable("This code is unreachable because " + exit.reason + ".", range));
            }
            return exit;
        }
        return null;
    }

    private static @Nullable Exit ifStatement(SyntaxNode statement, List<Diagnostic> diagnostics) {
        Optional<SyntaxNode> condition = RAst.condition(statement);
        Optional<SyntaxNode> consequence = RAst.body(statement);
        Optional<SyntaxNode> alternative = RAst.alternative(statement);
        if (consequence.isEmpty()) {
            return null;
        }
        RSyntaxKind constant = condition.map(SyntaxNode::kind).orElse(RSyntaxKind.R_BOGUS);
        if (constant == RSyntaxKind.R_TRUE_EXPRESSION) {
            alternative.ifPresent(dead -> diagnostics.add(deadBranch(dead)));
            return exit(consequence.get(), diagnostics);
        }
        if (constant == RSyntaxKind.R_FALSE_EXPRESSION) {
            diagnostics.add(deadBranch(consequence.get()));
            return alternative.map(branch -> exit(branch, diagnostics)).orElse(null);
        }
        Exit then = exit(consequence.get(), diagnostics);
        Exit otherwise = alternative.map(branch -> exit(branch, diagnostics)).orElse(null);
        return then != null && otherwise != null ? Exit.BRANCHES : null;
    }

    private static Diagnostic deadBranch(SyntaxNode branch) {
        return unreachable("This code is in a branch that can never be executed.", branch.textRange());
    }

    private static Diagnostic unreachable(String message, TextRange range) {
        return new Diagnostic(Rule.UNREACHABLE_CODE, message, null, range, null, null, null);
    }
}
