package com.arbor.synth.search;

import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;

/**
 * Chooses which open hole of a partial tree is branched on next.
 */
public enum HoleHeuristic {

    /** Shallowest hole first, ties broken left to right. */
    LEVEL_ORDER {
        @Override
        public Optional<TreePath> select(AbstractRuleNode tree) {
            ArrayDeque<TreePath> paths = new ArrayDeque<>();
            ArrayDeque<AbstractRuleNode> nodes = new ArrayDeque<>();
            paths.add(TreePath.ROOT);
            nodes.add(tree);
            while (!nodes.isEmpty()) {
                TreePath path = paths.poll();
                AbstractRuleNode node = nodes.poll();
                if (isOpen(node)) {
                    return Optional.of(path);
                }
                List<AbstractRuleNode> children = node.children();
                for (int i = 0; i < children.size(); i++) {
                    paths.add(path.child(i));
                    nodes.add(children.get(i));
                }
            }
            return Optional.empty();
        }
    },

    /** First hole in pre-order. */
    LEFTMOST {
        @Override
        public Optional<TreePath> select(AbstractRuleNode tree) {
            return firstInPreOrder(tree, TreePath.ROOT, false);
        }
    },

    /** First hole in pre-order visiting children right to left. */
    RIGHTMOST {
        @Override
        public Optional<TreePath> select(AbstractRuleNode tree) {
            return firstInPreOrder(tree, TreePath.ROOT, true);
        }
    };

    /**
     * Path of the chosen hole, empty when the tree has none.
     */
    public abstract Optional<TreePath> select(AbstractRuleNode tree);

    private static boolean isOpen(AbstractRuleNode node) {
        return node instanceof Hole hole && !hole.isFilled();
    }

    private static Optional<TreePath> firstInPreOrder(AbstractRuleNode node, TreePath path, boolean reversed) {
        if (isOpen(node)) {
            return Optional.of(path);
        }
        if (node.isComplete()) {
            return Optional.empty();
        }
        List<AbstractRuleNode> children = node.children();
        int n = children.size();
        for (int k = 0; k < n; k++) {
            int i = reversed ? n - 1 - k : k;
            Optional<TreePath> found = firstInPreOrder(children.get(i), path.child(i), reversed);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
