package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.Optional;

/**
 * Every program must use {@code rule} at least once.
 */
public record Contains(int rule) implements GrammarConstraint {

    public Contains {
        if (rule < 0) {
            throw new IllegalArgumentException("Rule index must be non-negative: " + rule);
        }
    }

    @Override
    public void onNewNode(ISolver solver, TreePath path) {
        if (path.isRoot()) {
            solver.post(new LocalContains(path, rule));
        }
    }

    @Override
    public Domain referencedRules() {
        return Domain.of(rule);
    }

    @Override
    public boolean isSame(GrammarConstraint other) {
        return equals(other);
    }

    @Override
    public Optional<GrammarConstraint> remap(Int2IntFunction mapping) {
        int mapped = mapping.get(rule);
        return mapped < 0 ? Optional.empty() : Optional.of(new Contains(mapped));
    }
}
