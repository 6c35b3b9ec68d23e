package com.arbor.synth.solver;

import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Union-find over hole positions that were made equal while still undecided.
 *
 * <p>Members of a class always share one domain and are filled together.
 * Once filled, a class is dropped and its children are unified pairwise.
 */
final class HoleEquivalence {

    private final Object2ObjectLinkedOpenHashMap<TreePath, TreePath> parent;

    HoleEquivalence() {
        this.parent = new Object2ObjectLinkedOpenHashMap<>();
    }

    private HoleEquivalence(HoleEquivalence other) {
        this.parent = other.parent.clone();
    }

    HoleEquivalence copy() {
        return new HoleEquivalence(this);
    }

    boolean isEmpty() {
        return parent.isEmpty();
    }

    TreePath find(TreePath path) {
        TreePath root = path;
        TreePath next = parent.get(root);
        while (next != null && !next.equals(root)) {
            root = next;
            next = parent.get(root);
        }
        TreePath current = path;
        while (!current.equals(root)) {
            TreePath up = parent.get(current);
            parent.put(current, root);
            current = up;
        }
        return root;
    }

    void union(TreePath a, TreePath b) {
        TreePath rootA = find(a);
        TreePath rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        parent.putIfAbsent(rootA, rootA);
        if (rootA.compareTo(rootB) <= 0) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootA, rootB);
            parent.putIfAbsent(rootB, rootB);
        }
    }

    /**
     * Every position equal to {@code path}, itself first.
     */
    List<TreePath> members(TreePath path) {
        List<TreePath> members = new ArrayList<>();
        members.add(path);
        if (!parent.containsKey(path)) {
            return members;
        }
        TreePath root = find(path);
        for (TreePath candidate : new ArrayList<>(parent.keySet())) {
            if (!candidate.equals(path) && find(candidate).equals(root)) {
                members.add(candidate);
            }
        }
        return members;
    }

    /**
     * Forgets the class of {@code path}.
     */
    void removeClass(TreePath path) {
        List<TreePath> members = members(path);
        for (TreePath member : members) {
            parent.remove(member);
        }
    }
}
