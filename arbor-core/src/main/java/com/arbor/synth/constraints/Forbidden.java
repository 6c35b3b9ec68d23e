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

import java.util.Objects;
import java.util.Optional;

/**
 * No subtree of a program may match {@code template}.
 *
 * <pre>{@code
 * // forbid 1 * A
 * new Forbidden(TemplateNode.rule(TIMES, TemplateNode.rule(ONE), TemplateNode.var("A")));
 * }</pre>
 */
public record Forbidden(TemplateNode template) implements GrammarConstraint {

    public Forbidden {
        Objects.requireNonNull(template, "template");
    }

    @Override
    public void onNewNode(ISolver solver, TreePath path) {
        PatternMatchResult result = PatternMatcher.match(template, solver.getNodeAt(path), path);
        if (!(result instanceof PatternMatchResult.NoMatch)) {
            solver.post(new LocalForbidden(path, template));
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
        return template.remap(mapping).map(Forbidden::new);
    }
}
