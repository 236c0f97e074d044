package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.RSyntaxKind;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Checks {@code sprintf()} calls whose format is a string literal: a stray
 * {@code %}, a format without conversions (rewritten to the string itself) and
 * a conversion count that differs from the argument count.
 * <p>
 * Calls on the right of a pipe and calls forwarding {@code ...} are skipped
 * since their argument count is unknown.
 */
public class Sprintf implements RuleFunction {

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        if (!RAst.functionName(call).equals("sprintf") || isPipeTarget(call)) {
            return Optional.empty();
        }
        List<SyntaxNode> arguments = RAst.arguments(call);
        Optional<SyntaxNode> fmt = RAst.argumentByNameOrPosition(arguments, "fmt", 0);
        Optional<SyntaxNode> fmtValue = fmt.flatMap(RAst::argumentValue)
                .filter(value -> value.kind() == RSyntaxKind.R_STRING_VALUE);
        if (fmtValue.isEmpty()) {
            return Optional.empty();
        }

        SprintfFormat format = SprintfFormat.parse(fmtValue.get().text());
        if (format.invalid()) {
            return Optional.of(Diagnostic.report(Rule.SPRINTF, "`sprintf()` contains some invalid `%`.", null, call));
        }
        if (format.conversions() == 0) {
            return Optional.of(Diagnostic.replace(Rule.SPRINTF,
                    "`sprintf()` without special characters is useless.",
                    "Use directly the input of `sprintf()` instead.",
                    call, format.literal()));
        }

        int values = 0;
        for (SyntaxNode argument : arguments) {
            if (RAst.argumentValue(argument).filter(value -> value.text().equals("...")).isPresent()) {
                return Optional.empty();
            }
            if (argument != fmt.get()) {
                values++;
            }
        }
        if (format.expectedArguments() != values) {
            return Optional.of(Diagnostic.report(Rule.SPRINTF,
                    "Mismatch between number of special characters and number of arguments.",
                    "Found " + format.expectedArguments() + " special character(s) and " + values
                            + " argument(s).",
                    call));
        }
        return Optional.empty();
    }

    private static boolean isPipeTarget(SyntaxNode call) {
        return LintUtils.parentAt(call, RSyntaxKind.R_BINARY_EXPRESSION, 2)
                .flatMap(RAst::binaryOperator)
                .filter(op -> op.kind() == RSyntaxKind.PIPE
                        || op.kind() == RSyntaxKind.SPECIAL && op.text().equals("%>%"))
                .isPresent();
    }
}
