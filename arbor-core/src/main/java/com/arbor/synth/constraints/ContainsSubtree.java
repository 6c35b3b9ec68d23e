package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.TemplateNode;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.Objects;
import java.util.Optional;

/**
 * Every program must contain a subtree matching {@code template}.
 */
public record ContainsSubtree(TemplateNode template) implements GrammarConstraint {

    public ContainsSubtree {
        Objects.requireNonNull(template, "template");
    }

    @Override
    public void onNewNode(ISolver solver, TreePath path) {
        if (path.isRoot()) {
            solver.post(new LocalContainsSubtree(path, template));
        }
    }

    @Override
    public Domain referencedRules() {
        return template.referencedRules();
    }

    @Override
    public boolean isDomainValid(GrammarDefinition grammar) {
        return GrammarConstraint.super.isDomainValid(grammar) && template.fits(grammar);
    }

    @Override
    public boolean isSame(GrammarConstraint other) {
        return equals(other);
    }

    @Override
    public Optional<GrammarConstraint> remap(Int2IntFunction mapping) {
        return template.remap(mapping).map(ContainsSubtree::new);
    }
}
