package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Forbids {@code sequence} as a subsequence of the rules on any path from the
 * root down to a node, unless a rule of {@code ignoreIf} lies between the
 * first and the last matched node.
 *
 * <pre>{@code
 * // forbid x + 1, allow x + (x * 1)
 * new ForbiddenSequence(IntList.of(PLUS, ONE), Domain.of(TIMES));
 * }</pre>
 */
public record ForbiddenSequence(IntList sequence, Domain ignoreIf) implements GrammarConstraint {

    public ForbiddenSequence {
        if (sequence.isEmpty()) {
            throw new IllegalArgumentException("Forbidden sequence must not be empty");
        }
        for (int rule : sequence) {
            if (rule < 0) {
                throw new IllegalArgumentException("Rule index must be non-negative: " + rule);
            }
        }
        sequence = IntLists.unmodifiable(new IntArrayList(sequence));
    }

    public ForbiddenSequence(IntList sequence) {
        this(sequence, Domain.empty());
    }

    @Override
    public void onNewNode(ISolver solver, TreePath path) {
        if (path.length() >= sequence.size() - 1) {
            solver.post(new LocalForbiddenSequence(path, sequence, ignoreIf));
        }
    }

    @Override
    public Domain referencedRules() {
        return Domain.of(sequence.toIntArray()).union(ignoreIf);
    }

    @Override
    public boolean isSame(GrammarConstraint other) {
        return equals(other);
    }

    @Override
    public Optional<GrammarConstraint> remap(Int2IntFunction mapping) {
        IntList remapped = new IntArrayList(sequence.size());
        for (int rule : sequence) {
            int mapped = mapping.get(rule);
            if (mapped < 0) {
                return Optional.empty();
            }
            remapped.add(mapped);
        }
        List<Integer> ignored = new ArrayList<>();
        for (int rule : ignoreIf.toArray()) {
            int mapped = mapping.get(rule);
            if (mapped >= 0) {
                ignored.add(mapped);
            }
        }
        return Optional.of(new ForbiddenSequence(remapped, Domain.of(ignored)));
    }
}
