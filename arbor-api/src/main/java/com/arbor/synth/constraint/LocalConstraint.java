package com.arbor.synth.constraint;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.tree.TreePath;

/**
 * A constraint rooted at one position of one search branch.
 *
 * <p>Implementations are value objects: two local constraints that are equal
 * enforce the same thing at the same place, and the solver keeps only one.
 */
public interface LocalConstraint {

    TreePath path();

    /**
     * Inspects the tree and narrows domains, deactivates itself, or marks the
     * branch infeasible.
     */
    void propagate(ISolver solver);

    /**
     * Whether a change at {@code changed} can affect this constraint.
     * By default any change inside the constraint's subtree does.
     */
    default boolean shouldSchedule(TreePath changed) {
        return path().isPrefixOf(changed);
    }
}
