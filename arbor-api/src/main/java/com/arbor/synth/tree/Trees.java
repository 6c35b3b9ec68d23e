package com.arbor.synth.tree;

import com.arbor.synth.grammar.Grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Static helpers over immutable trees.
 */
public final class Trees {

    private Trees() {
        throw new AssertionError("No instances");
    }

    /**
     * @throws IllegalArgumentException if the path leaves the tree
     */
    public static AbstractRuleNode getNodeAt(AbstractRuleNode root, TreePath path) {
        AbstractRuleNode node = root;
        for (int i = 0; i < path.length(); i++) {
            int index = path.get(i);
            if (index >= node.children().size()) {
                throw new IllegalArgumentException("Path " + path + " does not address a node of " + root);
            }
            node = node.children().get(index);
        }
        return node;
    }

    /**
     * Returns a new root in which the node at {@code path} is {@code replacement}.
     * Only the nodes on the path are copied.
     */
    public static AbstractRuleNode replaceAt(AbstractRuleNode root, TreePath path, AbstractRuleNode replacement) {
        return replaceAt(root, path, 0, replacement);
    }

    private static AbstractRuleNode replaceAt(AbstractRuleNode node, TreePath path, int position,
                                              AbstractRuleNode replacement) {
        if (position == path.length()) {
            return replacement;
        }
        if (!(node instanceof RuleNode ruleNode) || path.get(position) >= node.children().size()) {
            throw new IllegalArgumentException("Path " + path + " does not address a node");
        }
        int index = path.get(position);
        AbstractRuleNode updated = replaceAt(ruleNode.children().get(index), path, position + 1, replacement);
        return ruleNode.withChild(index, updated);
    }

    public static int size(AbstractRuleNode root) {
        return root.size();
    }

    public static int depth(AbstractRuleNode root) {
        return root.height();
    }

    public static boolean containsHole(AbstractRuleNode root) {
        return !root.isComplete();
    }

    public static int holeCount(AbstractRuleNode root) {
        if (root instanceof Hole) {
            return 1;
        }
        int count = 0;
        for (AbstractRuleNode child : root.children()) {
            count += holeCount(child);
        }
        return count;
    }

    /**
     * Visits every node in pre-order together with its path.
     */
    public static void forEachNode(AbstractRuleNode root, BiConsumer<TreePath, AbstractRuleNode> visitor) {
        visit(root, TreePath.ROOT, visitor);
    }

    private static void visit(AbstractRuleNode node, TreePath path, BiConsumer<TreePath, AbstractRuleNode> visitor) {
        visitor.accept(path, node);
        List<AbstractRuleNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            visit(children.get(i), path.child(i), visitor);
        }
    }

    public static List<TreePath> pathsInPreOrder(AbstractRuleNode root) {
        List<TreePath> paths = new ArrayList<>(root.size());
        forEachNode(root, (path, node) -> paths.add(path));
        return paths;
    }

    public static List<TreePath> holePaths(AbstractRuleNode root) {
        List<TreePath> paths = new ArrayList<>();
        forEachNode(root, (path, node) -> {
            if (node instanceof Hole) {
                paths.add(path);
            }
        });
        return paths;
    }

    /**
     * True when a filled node of the tree uses {@code rule}.
     */
    public static boolean containsRule(AbstractRuleNode root, int rule) {
        if (root instanceof RuleNode ruleNode) {
            if (ruleNode.rule() == rule) {
                return true;
            }
            for (AbstractRuleNode child : ruleNode.children()) {
                if (containsRule(child, rule)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Finds the path of a node by identity.
     */
    public static Optional<TreePath> pathOf(AbstractRuleNode root, AbstractRuleNode target) {
        return Optional.ofNullable(search(root, target, TreePath.ROOT));
    }

    private static TreePath search(AbstractRuleNode node, AbstractRuleNode target, TreePath path) {
        if (node == target) {
            return path;
        }
        List<AbstractRuleNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            TreePath found = search(children.get(i), target, path.child(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Smallest size any completion of the tree can have: one per filled node
     * plus the cheapest rule of every hole.
     */
    public static long minCompletionSize(AbstractRuleNode root, Grammar grammar) {
        if (root instanceof Hole hole) {
            return grammar.minSize(hole.domain());
        }
        long total = 1;
        for (AbstractRuleNode child : root.children()) {
            total += minCompletionSize(child, grammar);
        }
        return total;
    }

    /**
     * Canonical order of complete trees: root rule index first, then the
     * children left to right.
     *
     * @throws IllegalArgumentException if either tree contains a hole
     */
    public static int compare(AbstractRuleNode a, AbstractRuleNode b) {
        if (!(a instanceof RuleNode) || !(b instanceof RuleNode)) {
            throw new IllegalArgumentException("Only complete trees have a canonical order");
        }
        int byRule = Integer.compare(a.rule(), b.rule());
        if (byRule != 0) {
            return byRule;
        }
        int arity = Math.min(a.children().size(), b.children().size());
        for (int i = 0; i < arity; i++) {
            int byChild = compare(a.children().get(i), b.children().get(i));
            if (byChild != 0) {
                return byChild;
            }
        }
        return Integer.compare(a.children().size(), b.children().size());
    }
}
