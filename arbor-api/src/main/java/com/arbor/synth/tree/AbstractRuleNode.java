package com.arbor.synth.tree;

import java.util.List;

/**
 * A node of a (possibly partial) program tree.
 *
 * <p>A node is either a {@link RuleNode}, whose rule is fixed, or a
 * {@link Hole}, which only knows its category and the rules it may still
 * become. Nodes are immutable: a tree is changed by building a new spine
 * with {@link Trees#replaceAt} and sharing every untouched subtree.
 */
public abstract class AbstractRuleNode {

    AbstractRuleNode() {
    }

    /**
     * True when the rule of this node is decided.
     */
    public abstract boolean isFilled();

    /**
     * The rule of a filled node.
     *
     * @throws IllegalStateException if the rule is not decided yet
     */
    public abstract int rule();

    public abstract List<AbstractRuleNode> children();

    /**
     * Number of nodes in the subtree, holes included.
     */
    public abstract int size();

    /**
     * Height of the subtree; a leaf has height 1.
     */
    public abstract int height();

    /**
     * True when the subtree contains no hole.
     */
    public abstract boolean isComplete();

    public AbstractRuleNode child(int index) {
        List<AbstractRuleNode> children = children();
        if (index < 0 || index >= children.size()) {
            throw new IllegalArgumentException(
                    "Child index " + index + " out of range for node with " + children.size() + " children");
        }
        return children.get(index);
    }
}
