package com.arbor.synth.constraint;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.Optional;

/**
 * A constraint declared once on a grammar, independent of any position.
 *
 * <p>The solver announces every node it creates through
 * {@link #onNewNode(ISolver, TreePath)}; the constraint reacts by posting
 * {@link LocalConstraint}s rooted where they are relevant.
 */
public interface GrammarConstraint {

    /**
     * Called once for every node the solver creates, the root included.
     */
    void onNewNode(ISolver solver, TreePath path);

    /**
     * Every rule index this constraint refers to.
     */
    Domain referencedRules();

    default boolean isDomainValid(int ruleCount) {
        Domain referenced = referencedRules();
        return referenced.isEmpty() || referenced.last() < ruleCount;
    }

    /**
     * Checks rule indices against the grammar: they must exist and must not
     * have been removed.
     */
    default boolean isDomainValid(GrammarDefinition grammar) {
        if (!isDomainValid(grammar.ruleCount())) {
            return false;
        }
        for (int rule : referencedRules().toArray()) {
            if (grammar.isRemoved(rule)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when {@code other} enforces exactly what this constraint enforces.
     */
    default boolean isSame(GrammarConstraint other) {
        return false;
    }

    /**
     * Rewrites rule indices after the grammar was compacted. The mapping
     * returns -1 for removed rules.
     *
     * @return the rewritten constraint, or empty if it cannot survive the removal
     */
    Optional<GrammarConstraint> remap(Int2IntFunction mapping);
}
