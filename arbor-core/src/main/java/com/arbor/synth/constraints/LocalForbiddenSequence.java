package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Checks the forbidden sequence on the vertical path ending at {@code path},
 * with the node at {@code path} as the last element.
 *
 * <p>Ancestors of a node are always filled, so one propagation decides the
 * constraint for good.
 */
public record LocalForbiddenSequence(TreePath path, IntList sequence, Domain ignoreIf) implements LocalConstraint {

    @Override
    public void propagate(ISolver solver) {
        AbstractRuleNode node = solver.getNodeAt(path);
        int last = sequence.getInt(sequence.size() - 1);
        boolean canBeLast = node instanceof Hole hole ? hole.domain().contains(last) : node.rule() == last;
        if (!canBeLast) {
            solver.deactivate(this);
            return;
        }

        int needed = sequence.size() - 2;
        for (int length = path.length() - 1; length >= 0 && needed >= 0; length--) {
            AbstractRuleNode ancestor = solver.getNodeAt(path.prefix(length));
            if (ancestor instanceof Hole) {
                return;
            }
            int rule = ancestor.rule();
            if (rule == sequence.getInt(needed)) {
                needed--;
            } else if (ignoreIf.contains(rule)) {
                solver.deactivate(this);
                return;
            }
        }
        solver.deactivate(this);
        if (needed >= 0) {
            return;
        }
        if (node instanceof Hole) {
            solver.remove(path, last);
        } else {
            solver.setInfeasible();
        }
    }
}
