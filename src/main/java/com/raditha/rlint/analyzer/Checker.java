package com.raditha.rlint.analyzer;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.suppression.SuppressionManager;
import com.raditha.rlint.syntax.SyntaxNode;
import com.raditha.rlint.syntax.SyntaxTree;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Runs the enabled rules over a parsed file.
 * <p>
 * Every node is visited once, in pre-order, and handed to the rules registered
 * for its kind. The semantic rules then run over the file's model. Finally,
 * fixes the configuration does not allow are stripped from the diagnostics.
 */
public class Checker {

    private static final Logger logger = LoggerFactory.getLogger(Checker.class);

    private final RuleDispatchTable table;

    public Checker() {
        this(RuleDispatchTable.defaultTable());
    }

    public Checker(RuleDispatchTable table) {
        this.table = table;
    }

    public List<Diagnostic> check(SyntaxTree tree, LinterConfig config) throws RuleException {
        return check(new CheckContext(config, tree), null);
    }

    /**
     * Check one file.
     *
     * @param context the file and run configuration
     * @param file    path attached to each diagnostic, may be null
     * @return diagnostics ordered by start offset, ties in discovery order
     * @throws RuleException if a rule meets a malformed node
     */
    public List<Diagnostic> check(CheckContext context, @Nullable Path file) throws RuleException {
        LinterConfig config = context.config();
        SuppressionManager suppressions = context.suppressions();
        List<Diagnostic> found = new ArrayList<>();

        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(context.tree().root());
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            for (RuleEntry entry : table.entriesFor(node.kind())) {
                if (!config.isEnabled(entry.rule()) || suppressions.shouldSkip(node.textRange(), entry.rule())) {
                    continue;
                }
                Optional<Diagnostic> diagnostic = entry.function().check(node, context);
                diagnostic.ifPresent(found::add);
            }
            List<SyntaxNode> children = node.childNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        for (SemanticRule rule : table.semanticRules()) {
            if (!config.isEnabled(rule.rule())) {
                continue;
            }
            for (Diagnostic diagnostic : rule.check(context)) {
                if (!suppressions.shouldSkip(diagnostic.range(), diagnostic.rule())) {
                    found.add(diagnostic);
                }
            }
        }

        List<Diagnostic> result = new ArrayList<>(found.size());
        for (Diagnostic diagnostic : found) {
            if (diagnostic.hasFix() && !config.isFixAllowed(diagnostic.rule())) {
                diagnostic = diagnostic.withoutFix();
            }
            result.add(diagnostic.withFile(file, context.tree().lineIndex()));
        }
        result.sort(Comparator.comparingInt(d -> d.range().start()));
        logger.debug("{}: {} diagnostics", file, result.size());
        return result;
    }
}
