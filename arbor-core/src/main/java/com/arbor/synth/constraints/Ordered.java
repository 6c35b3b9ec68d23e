package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.PatternMatchResult;
import com.arbor.synth.tree.template.PatternMatcher;
import com.arbor.synth.tree.template.TemplateNode;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wherever {@code template} matches, the subtrees bound to consecutive
 * variables of {@code order} must be non-decreasing in the canonical tree
 * order. Used to drop commuted duplicates such as {@code b + a} next to
 * {@code a + b}.
 */
public record Ordered(TemplateNode template, List<String> order) implements GrammarConstraint {

    public Ordered {
        Objects.requireNonNull(template, "template");
        order = List.copyOf(order);
        for (String variable : order) {
            if (!template.variableCounts().containsKey(variable)) {
                throw new IllegalArgumentException("Variable " + variable + " does not occur in " + template);
            }
        }
    }

    @Override
    public void onNewNode(ISolver solver, TreePath path) {
        PatternMatchResult result = PatternMatcher.match(template, solver.getNodeAt(path), path);
        if (!(result instanceof PatternMatchResult.NoMatch)) {
            solver.post(new LocalOrdered(path, template, order));
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
        return template.remap(mapping).map(remapped -> new Ordered(remapped, order));
    }
}
