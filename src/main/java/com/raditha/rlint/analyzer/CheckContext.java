package com.raditha.rlint.analyzer;

import com.raditha.rlint.config.LinterConfig;
import com.raditha.rlint.semantic.Globals;
import com.raditha.rlint.semantic.SemanticModel;
import com.raditha.rlint.semantic.SemanticModelBuilder;
import com.raditha.rlint.suppression.SuppressionManager;
import com.raditha.rlint.syntax.SyntaxTree;

/**
 * Everything a rule may look at while checking one file.
 * <p>
 * The semantic model is built on first use, so files checked only by
 * syntactic rules never pay for name resolution.
 */
public class CheckContext {

    private final LinterConfig config;
    private final SyntaxTree tree;
    private final SuppressionManager suppressions;
    private SemanticModel model;

    public CheckContext(LinterConfig config, SyntaxTree tree, SuppressionManager suppressions) {
        this.config = config;
        this.tree = tree;
        this.suppressions = suppressions;
    }

    public CheckContext(LinterConfig config, SyntaxTree tree) {
        this(config, tree, SuppressionManager.fromTree(tree));
    }

    public LinterConfig config() {
        return config;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public SuppressionManager suppressions() {
        return suppressions;
    }

    public SemanticModel model() {
        if (model == null) {
            model = SemanticModelBuilder.build(tree, Globals.base().with(config.globals()));
        }
        return model;
    }
}
