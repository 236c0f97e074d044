package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleException;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxElement;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxToken;

import java.util.Optional;

/**
 * {@code while (TRUE) body} becomes {@code repeat body}.
 * <p>
 * The body text is carried over with its comments, so only comments in the
 * {@code while (TRUE)} header hold the fix back.
 */
public class Repeat implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode loop, CheckContext context) throws RuleException {
        Optional<SyntaxNode> condition = RAst.condition(loop);
        if (condition.isEmpty() || condition.get().kind() != RSyntaxKind.R_TRUE_EXPRESSION) {
            return Optional.empty();
        }
        SyntaxNode body = RAst.body(loop)
                .orElseThrow(() -> new RuleException("while loop without body at " + loop.textRange()));
        SyntaxElement closing = loop.childAt(3);
        if (!(closing instanceof SyntaxToken closingParen)) {
            throw new RuleException("while loop without closing parenthesis at " + loop.textRange());
        }

        String replacement = body.kind() == RSyntaxKind.R_BRACED_EXPRESSIONS
                ? "repeat " + body.text()
                : "repeat { " + body.text() + " }";
        return Optional.of(Diagnostic.replace(Rule.REPEAT,
                "Use `repeat` instead of `while (TRUE)` for infinite loops.", null,
                loop.textRange(), LintUtils.hasCommentsUpTo(loop, closingParen), replacement));
    }
}
