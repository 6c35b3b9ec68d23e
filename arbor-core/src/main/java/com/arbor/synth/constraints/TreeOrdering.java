package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;

/**
 * Enforces {@code tree(first) <= tree(second)} in the canonical order: root
 * rule index first, then children left to right.
 */
final class TreeOrdering {

    enum Outcome {
        /** Decided strictly smaller. */
        LESS,
        /** Both complete and identical. */
        EQUAL,
        /** Domains were narrowed as far as possible; holes still decide. */
        UNDECIDED,
        /** No completion satisfies the order. */
        VIOLATED
    }

    private TreeOrdering() {
        throw new AssertionError("No instances");
    }

    static Outcome makeLessThanOrEqual(ISolver solver, TreePath first, TreePath second) {
        if (first.equals(second)) {
            return Outcome.EQUAL;
        }
        AbstractRuleNode a = solver.getNodeAt(first);
        AbstractRuleNode b = solver.getNodeAt(second);

        if (a instanceof Hole holeA && b instanceof Hole) {
            solver.removeBelow(second, holeA.domain().first());
            if (!solver.isFeasible()) {
                return Outcome.VIOLATED;
            }
            AbstractRuleNode narrowedB = solver.getNodeAt(second);
            int maxB = narrowedB instanceof Hole holeB ? holeB.domain().last() : narrowedB.rule();
            solver.removeAbove(first, maxB);
            if (!solver.isFeasible()) {
                return Outcome.VIOLATED;
            }
            return decideOrWait(solver, first, second);
        }
        if (a instanceof Hole) {
            solver.removeAbove(first, b.rule());
            if (!solver.isFeasible()) {
                return Outcome.VIOLATED;
            }
            return decideOrWait(solver, first, second);
        }
        if (b instanceof Hole) {
            solver.removeBelow(second, a.rule());
            if (!solver.isFeasible()) {
                return Outcome.VIOLATED;
            }
            return decideOrWait(solver, first, second);
        }

        if (a.rule() < b.rule()) {
            return Outcome.LESS;
        }
        if (a.rule() > b.rule()) {
            return Outcome.VIOLATED;
        }
        for (int i = 0; i < a.children().size(); i++) {
            Outcome child = makeLessThanOrEqual(solver, first.child(i), second.child(i));
            if (child != Outcome.EQUAL) {
                return child;
            }
        }
        return Outcome.EQUAL;
    }

    private static Outcome decideOrWait(ISolver solver, TreePath first, TreePath second) {
        if (solver.getNodeAt(first) instanceof Hole || solver.getNodeAt(second) instanceof Hole) {
            return Outcome.UNDECIDED;
        }
        return makeLessThanOrEqual(solver, first, second);
    }
}
