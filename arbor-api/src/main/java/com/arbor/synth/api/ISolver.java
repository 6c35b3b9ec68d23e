/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.api;

import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;

/**
 * One search branch: a partial tree, the local constraints active on it and a
 * feasibility flag.
 *
 * <p>All domain primitives address nodes by {@link TreePath}. A primitive
 * applied to a filled node only checks consistency: asking a filled node to
 * drop its own rule makes the branch infeasible, anything else is a no-op.
 * A domain narrowed to nothing makes the branch infeasible; a domain
 * narrowed to a single rule is filled immediately, with fresh holes for the
 * rule's children. Every primitive returns after propagation reached a
 * fixpoint, unless it was called from inside a propagation.
 */
public interface ISolver {

    Grammar getGrammar();

    AbstractRuleNode getTree();

    boolean isFeasible();

    int getMaxDepth();

    int getMaxSize();

    AbstractRuleNode getNodeAt(TreePath path);

    /**
     * Returns the hole at {@code path}.
     *
     * @throws IllegalStateException if the node is filled
     */
    Hole getHoleAt(TreePath path);

    /**
     * Locates a node of the current tree by identity.
     *
     * @throws IllegalArgumentException if the node is not part of the tree
     */
    TreePath getPath(AbstractRuleNode node);

    void remove(TreePath path, int rule);

    void remove(TreePath path, Domain rules);

    /**
     * Narrows the domain at {@code path} to its intersection with {@code domain}.
     */
    void removeAllBut(TreePath path, Domain domain);

    /**
     * Removes every rule with an index greater than {@code rule}.
     */
    void removeAbove(TreePath path, int rule);

    /**
     * Removes every rule with an index less than {@code rule}.
     */
    void removeBelow(TreePath path, int rule);

    /**
     * Decides the hole at {@code path} to be {@code rule}.
     */
    void fill(TreePath path, int rule);

    /**
     * Makes the subtrees at both paths structurally identical, now and after
     * every later change to either of them.
     */
    void makeEqual(TreePath first, TreePath second);

    /**
     * Forces the subtree at {@code path} to have the shape of {@code structure}.
     */
    void makeEqual(TreePath path, RuleNode structure);

    void setInfeasible();

    /**
     * Activates a local constraint and propagates it once before returning.
     * Posting a constraint that is already active does nothing.
     */
    void post(LocalConstraint constraint);

    /**
     * Removes a constraint from the active set. Used by constraints that can
     * no longer be violated.
     */
    void deactivate(LocalConstraint constraint);

    boolean isActive(LocalConstraint constraint);
}
