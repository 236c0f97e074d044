package com.raditha.rlint.lints;

import com.raditha.rlint.analyzer.CheckContext;
import com.raditha.rlint.analyzer.RuleFunction;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Rule;
import com.raditha.rlint.syntax.RAst;
import com.raditha.rlint.syntax.SyntaxNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports calls that pass the same argument name twice, such as
 * {@code list(a = 1, a = 2)}.
 */
public class DuplicatedArguments implements RuleFunction {

    /**
     * Functions where repeated names are legitimate.
     */
    private static final Set<String> ALLOWED = Set.of("c", "mutate", "summarize", "transmute");
    private static final String ALLOWED_PREFIX = "cli_";

    @Override
    public Optional<Diagnostic> check(SyntaxNode call, CheckContext context) {
        String name = RAst.functionName(call);
        if (name.isEmpty()) {
            name = RAst.callFunction(call).map(SyntaxNode::text).orElse("");
        }
        if (ALLOWED.contains(name) || name.startsWith(ALLOWED_PREFIX)) {
            return Optional.empty();
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SyntaxNode argument : RAst.arguments(call)) {
            RAst.argumentName(argument).ifPresent(n -> counts.merge(n, 1, Integer::sum));
        }
        List<String> duplicated = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (duplicated.isEmpty()) {
            return Optional.empty();
        }
        String names = duplicated.stream().map(n -> "\"" + n + "\"").collect(Collectors.joining(", "));
        return Optional.of(Diagnostic.report(Rule.DUPLICATED_ARGUMENTS,
                "Avoid duplicate arguments in function calls. Duplicated argument(s): " + names + ".",
                null, call));
    }
}
