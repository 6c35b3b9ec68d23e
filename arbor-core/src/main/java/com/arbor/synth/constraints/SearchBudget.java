package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.grammar.ContainmentProfile;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.Trees;

/**
 * Depth and size left for growing a rule's subtree at a hole, given the
 * rest of the tree.
 */
final class SearchBudget {

    private final Grammar grammar;
    private final long maxDepth;
    private final long maxSize;
    private final long treeMinSize;

    SearchBudget(ISolver solver) {
        this.grammar = solver.getGrammar();
        this.maxDepth = solver.getMaxDepth();
        this.maxSize = solver.getMaxSize();
        this.treeMinSize = Trees.minCompletionSize(solver.getTree(), grammar);
    }

    /**
     * True when {@code rule} at the hole can contain the profile's target
     * without exceeding the depth or size bound.
     */
    boolean fits(ContainmentProfile profile, int rule, TreePath holePath, Hole hole) {
        return profile.canContain(rule)
                && fits(profile.minHeight(rule), profile.minSize(rule), holePath, hole);
    }

    /**
     * True when {@code rule} at the hole can contain the target strictly
     * below itself without exceeding the depth or size bound.
     */
    boolean fitsBelow(ContainmentProfile profile, int rule, TreePath holePath, Hole hole) {
        return profile.canContainBelow(rule)
                && fits(profile.minHeightBelow(rule), profile.minSizeBelow(rule), holePath, hole);
    }

    private boolean fits(int height, int size, TreePath holePath, Hole hole) {
        long depth = (long) holePath.depth() - 1 + height;
        if (depth > maxDepth) {
            return false;
        }
        return treeMinSize - grammar.minSize(hole.domain()) + size <= maxSize;
    }
}
