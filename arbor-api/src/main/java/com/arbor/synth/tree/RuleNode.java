package com.arbor.synth.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A node whose rule is decided. Children follow the rule's child categories.
 */
public final class RuleNode extends AbstractRuleNode {

    private final int rule;
    private final List<AbstractRuleNode> children;
    private final int size;
    private final int height;
    private final boolean complete;
    private final int hash;

    public RuleNode(int rule) {
        this(rule, List.of());
    }

    public RuleNode(int rule, List<? extends AbstractRuleNode> children) {
        if (rule < 0) {
            throw new IllegalArgumentException("Rule index must be non-negative: " + rule);
        }
        this.rule = rule;
        this.children = List.copyOf(children);

        int totalSize = 1;
        int maxChildHeight = 0;
        boolean allComplete = true;
        int h = 31 + rule;
        for (AbstractRuleNode child : this.children) {
            totalSize += child.size();
            maxChildHeight = Math.max(maxChildHeight, child.height());
            allComplete &= child.isComplete();
            h = 31 * h + child.hashCode();
        }
        this.size = totalSize;
        this.height = maxChildHeight + 1;
        this.complete = allComplete;
        this.hash = h;
    }

    public static RuleNode of(int rule, AbstractRuleNode... children) {
        return new RuleNode(rule, List.of(children));
    }

    /**
     * Returns a copy of this node with child {@code index} replaced.
     */
    public RuleNode withChild(int index, AbstractRuleNode child) {
        List<AbstractRuleNode> replaced = new ArrayList<>(children);
        replaced.set(index, child);
        return new RuleNode(rule, replaced);
    }

    @Override
    public boolean isFilled() {
        return true;
    }

    @Override
    public int rule() {
        return rule;
    }

    @Override
    public List<AbstractRuleNode> children() {
        return children;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleNode other)) return false;
        return rule == other.rule && hash == other.hash && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return Integer.toString(rule);
        }
        StringBuilder sb = new StringBuilder().append(rule).append('{');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(children.get(i));
        }
        return sb.append('}').toString();
    }
}
