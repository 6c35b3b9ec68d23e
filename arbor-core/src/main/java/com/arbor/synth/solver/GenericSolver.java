/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.solver;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.Trees;
import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solver for one search branch over an immutable tree.
 *
 * <p>Every change replaces the tree root through path copying, so
 * {@link #fork()} only copies the root reference, the active constraints and
 * the hole equivalences. A hole narrowed to one rule is filled at once: the
 * rule's children are created as holes restricted to rules that fit the
 * remaining depth, and every grammar constraint is told about each new node.
 *
 * <p>Changes schedule the active constraints that ask for them. The schedule
 * is a FIFO without duplicates, drained by the fixpoint that ends every
 * public primitive. Primitives called while the fixpoint runs only schedule.
 */
public final class GenericSolver implements ISolver {

    private static final Logger logger = Logger.getLogger(GenericSolver.class.getName());

    private final Grammar grammar;
    private final int maxDepth;
    private final int maxSize;

    private AbstractRuleNode tree;
    private final ObjectLinkedOpenHashSet<LocalConstraint> activeConstraints;
    private final ObjectLinkedOpenHashSet<LocalConstraint> schedule = new ObjectLinkedOpenHashSet<>();
    private final ObjectArrayFIFOQueue<TreePath> newNodes = new ObjectArrayFIFOQueue<>();
    private final HoleEquivalence equivalence;
    private boolean feasible = true;
    private boolean fixpointRunning;

    /**
     * Creates a solver whose tree is a single hole of {@code startCategory}.
     *
     * @throws GrammarStructureException if the grammar has no such category
     */
    public GenericSolver(Grammar grammar, String startCategory, int maxDepth, int maxSize) {
        if (maxDepth < 1 || maxSize < 1) {
            throw new IllegalArgumentException("Depth and size bounds must be positive");
        }
        if (!grammar.hasCategory(startCategory)) {
            throw new GrammarStructureException("Unknown start category '" + startCategory + "'");
        }
        this.grammar = grammar;
        this.maxDepth = maxDepth;
        this.maxSize = maxSize;
        this.activeConstraints = new ObjectLinkedOpenHashSet<>();
        this.equivalence = new HoleEquivalence();

        Hole root = newHole(startCategory, 1);
        this.tree = root;
        if (root.domain().isEmpty()) {
            logger.fine(() -> "No tree of category " + startCategory + " fits depth " + maxDepth);
            setInfeasible();
            return;
        }
        checkSize();
        newNodes.enqueue(TreePath.ROOT);
        settle();
    }

    private GenericSolver(GenericSolver other) {
        this.grammar = other.grammar;
        this.maxDepth = other.maxDepth;
        this.maxSize = other.maxSize;
        this.tree = other.tree;
        this.activeConstraints = other.activeConstraints.clone();
        this.equivalence = other.equivalence.copy();
        this.feasible = other.feasible;
    }

    /**
     * Copies this branch. The tree is shared; later changes to either solver
     * are invisible to the other.
     *
     * @throws IllegalStateException if called during propagation
     */
    public GenericSolver fork() {
        if (fixpointRunning || !schedule.isEmpty() || !newNodes.isEmpty()) {
            throw new IllegalStateException("Cannot fork a solver while it propagates");
        }
        return new GenericSolver(this);
    }

    @Override
    public Grammar getGrammar() {
        return grammar;
    }

    @Override
    public AbstractRuleNode getTree() {
        return tree;
    }

    @Override
    public boolean isFeasible() {
        return feasible;
    }

    @Override
    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public AbstractRuleNode getNodeAt(TreePath path) {
        return Trees.getNodeAt(tree, path);
    }

    @Override
    public Hole getHoleAt(TreePath path) {
        AbstractRuleNode node = getNodeAt(path);
        if (!(node instanceof Hole hole) || hole.domain().size() < 2) {
            throw new IllegalStateException("Node at " + path + " is not an undecided hole: " + node);
        }
        return hole;
    }

    @Override
    public TreePath getPath(AbstractRuleNode node) {
        return Trees.pathOf(tree, node)
                .orElseThrow(() -> new IllegalArgumentException("Node " + node + " is not part of the tree"));
    }

    /**
     * Smallest size any completion of the current tree can have.
     */
    public long minCompletionSize() {
        return Trees.minCompletionSize(tree, grammar);
    }

    public int activeConstraintCount() {
        return activeConstraints.size();
    }

    @Override
    public boolean isActive(LocalConstraint constraint) {
        return activeConstraints.contains(constraint);
    }

    // ---- domain primitives ----

    @Override
    public void remove(TreePath path, int rule) {
        AbstractRuleNode node = getNodeAt(path);
        if (node instanceof Hole hole) {
            narrow(path, hole.domain().without(rule));
        } else if (node.rule() == rule) {
            setInfeasible();
        }
        settle();
    }

    @Override
    public void remove(TreePath path, Domain rules) {
        AbstractRuleNode node = getNodeAt(path);
        if (node instanceof Hole hole) {
            narrow(path, hole.domain().without(rules));
        } else if (rules.contains(node.rule())) {
            setInfeasible();
        }
        settle();
    }

    @Override
    public void removeAllBut(TreePath path, Domain domain) {
        AbstractRuleNode node = getNodeAt(path);
        if (node instanceof Hole hole) {
            narrow(path, hole.domain().intersect(domain));
        } else if (!domain.contains(node.rule())) {
            setInfeasible();
        }
        settle();
    }

    @Override
    public void removeAbove(TreePath path, int rule) {
        AbstractRuleNode node = getNodeAt(path);
        if (node instanceof Hole hole) {
            narrow(path, hole.domain().retainAtMost(rule));
        } else if (node.rule() > rule) {
            setInfeasible();
        }
        settle();
    }

    @Override
    public void removeBelow(TreePath path, int rule) {
        AbstractRuleNode node = getNodeAt(path);
        if (node instanceof Hole hole) {
            narrow(path, hole.domain().retainAtLeast(rule));
        } else if (node.rule() < rule) {
            setInfeasible();
        }
        settle();
    }

    @Override
    public void fill(TreePath path, int rule) {
        removeAllBut(path, Domain.of(rule));
    }

    @Override
    public void makeEqual(TreePath first, TreePath second) {
        unify(first, second);
        settle();
    }

    @Override
    public void makeEqual(TreePath path, RuleNode structure) {
        impose(path, structure);
        settle();
    }

    @Override
    public void setInfeasible() {
        if (feasible) {
            logger.finer(() -> "Branch became infeasible: " + tree);
        }
        feasible = false;
        schedule.clear();
        newNodes.clear();
    }

    // ---- constraint management ----

    @Override
    public void post(LocalConstraint constraint) {
        if (!feasible || !activeConstraints.add(constraint)) {
            return;
        }
        constraint.propagate(this);
        settle();
    }

    @Override
    public void deactivate(LocalConstraint constraint) {
        activeConstraints.remove(constraint);
        schedule.remove(constraint);
    }

    // ---- internals ----

    private Hole newHole(String category, int depth) {
        long remainingHeight = (long) maxDepth - depth + 1;
        return new Hole(category, grammar.rulesWithinHeight(category, remainingHeight));
    }

    /**
     * Sets the domain of the hole at {@code path} and of every hole equal to
     * it. Filling one member fills the whole class and unifies the children.
     */
    private void narrow(TreePath path, Domain domain) {
        if (!feasible) {
            return;
        }
        AbstractRuleNode node = getNodeAt(path);
        if (!(node instanceof Hole hole)) {
            if (!domain.contains(node.rule())) {
                setInfeasible();
            }
            return;
        }
        if (domain.equals(hole.domain()) && !domain.isSingleton()) {
            return;
        }
        if (domain.isEmpty()) {
            setInfeasible();
            return;
        }
        List<TreePath> members = equivalence.members(path);
        if (domain.isSingleton()) {
            equivalence.removeClass(path);
        }
        for (TreePath member : members) {
            applyDomain(member, domain);
            if (!feasible) {
                return;
            }
        }
        if (domain.isSingleton()) {
            for (int i = 1; i < members.size() && feasible; i++) {
                unify(members.get(0), members.get(i));
            }
        }
    }

    private void applyDomain(TreePath path, Domain domain) {
        AbstractRuleNode node = getNodeAt(path);
        if (!(node instanceof Hole hole)) {
            if (!domain.contains(node.rule())) {
                setInfeasible();
            }
            return;
        }
        Domain narrowed = hole.domain().intersect(domain);
        if (narrowed.isEmpty()) {
            setInfeasible();
            return;
        }
        if (narrowed.isSingleton()) {
            materialize(path, narrowed.first());
        } else if (!narrowed.equals(hole.domain())) {
            tree = Trees.replaceAt(tree, path, hole.withDomain(narrowed));
            notifyTreeManipulation(path);
            checkSize();
        }
    }

    private void materialize(TreePath path, int rule) {
        List<String> childTypes = grammar.childTypes(rule);
        int childDepth = path.depth() + 1;
        List<AbstractRuleNode> children = new ArrayList<>(childTypes.size());
        for (String childType : childTypes) {
            Hole child = newHole(childType, childDepth);
            if (child.domain().isEmpty()) {
                setInfeasible();
                return;
            }
            children.add(child);
        }
        tree = Trees.replaceAt(tree, path, new RuleNode(rule, children));
        notifyTreeManipulation(path);
        checkSize();
        for (int i = 0; i < children.size(); i++) {
            newNodes.enqueue(path.child(i));
        }
    }

    private void unify(TreePath first, TreePath second) {
        if (!feasible || first.equals(second)) {
            return;
        }
        AbstractRuleNode a = getNodeAt(first);
        AbstractRuleNode b = getNodeAt(second);
        if (a instanceof RuleNode && b instanceof RuleNode) {
            if (a.rule() != b.rule()) {
                setInfeasible();
                return;
            }
            for (int i = 0; i < a.children().size() && feasible; i++) {
                unify(first.child(i), second.child(i));
            }
        } else if (a instanceof Hole holeA && b instanceof Hole holeB) {
            Domain common = holeA.domain().intersect(holeB.domain());
            narrow(first, common);
            narrow(second, common);
            if (!feasible) {
                return;
            }
            if (getNodeAt(first) instanceof Hole && getNodeAt(second) instanceof Hole) {
                equivalence.union(first, second);
            } else {
                unify(first, second);
            }
        } else if (a instanceof Hole) {
            narrow(first, Domain.of(b.rule()));
            unify(first, second);
        } else {
            narrow(second, Domain.of(a.rule()));
            unify(first, second);
        }
    }

    private void impose(TreePath path, AbstractRuleNode structure) {
        if (!feasible) {
            return;
        }
        AbstractRuleNode node = getNodeAt(path);
        if (structure instanceof Hole shape) {
            if (node instanceof Hole hole) {
                narrow(path, hole.domain().intersect(shape.domain()));
            } else if (!shape.domain().contains(node.rule())) {
                setInfeasible();
            }
            return;
        }
        if (node instanceof Hole) {
            narrow(path, Domain.of(structure.rule()));
            if (!feasible) {
                return;
            }
            node = getNodeAt(path);
        }
        if (node.rule() != structure.rule() || node.children().size() != structure.children().size()) {
            setInfeasible();
            return;
        }
        for (int i = 0; i < structure.children().size() && feasible; i++) {
            impose(path.child(i), structure.children().get(i));
        }
    }

    private void notifyTreeManipulation(TreePath path) {
        for (LocalConstraint constraint : activeConstraints) {
            if (constraint.shouldSchedule(path)) {
                schedule.add(constraint);
            }
        }
    }

    private void checkSize() {
        if (maxSize != Integer.MAX_VALUE && feasible && minCompletionSize() > maxSize) {
            setInfeasible();
        }
    }

    /**
     * Announces new nodes, fills holes created with a single option and runs
     * the fixpoint. Nested calls return at once; the outermost call finishes
     * the work.
     */
    private void settle() {
        if (fixpointRunning) {
            return;
        }
        fixpointRunning = true;
        try {
            while (feasible && (!newNodes.isEmpty() || !schedule.isEmpty())) {
                if (!newNodes.isEmpty()) {
                    announce(newNodes.dequeue());
                } else {
                    LocalConstraint constraint = schedule.removeFirst();
                    if (activeConstraints.contains(constraint)) {
                        constraint.propagate(this);
                    }
                }
            }
        } finally {
            fixpointRunning = false;
        }
        if (!feasible) {
            schedule.clear();
            newNodes.clear();
        }
    }

    private void announce(TreePath path) {
        for (GrammarConstraint constraint : grammar.constraints()) {
            constraint.onNewNode(this, path);
            if (!feasible) {
                return;
            }
        }
        if (getNodeAt(path) instanceof Hole hole && hole.domain().isSingleton()) {
            materialize(path, hole.domain().first());
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Announced node " + path + " of " + tree);
        }
    }

    @Override
    public String toString() {
        return "GenericSolver{tree=" + tree + ", feasible=" + feasible
                + ", activeConstraints=" + activeConstraints.size() + "}";
    }
}
