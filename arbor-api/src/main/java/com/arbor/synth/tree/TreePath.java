package com.arbor.synth.tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;

/**
 * Address of a node: the sequence of 0-based child indices from the root.
 *
 * <p>The empty path addresses the root. Paths are immutable value objects and
 * are the only way the solver and constraints refer to positions in a tree.
 * Natural ordering is lexicographic, which is pre-order position.
 */
public final class TreePath implements Comparable<TreePath> {

    public static final TreePath ROOT = new TreePath(new int[0]);

    private final int[] indices;
    private final int hash;

    private TreePath(int[] indices) {
        this.indices = indices;
        this.hash = Arrays.hashCode(indices);
    }

    public static TreePath of(int... indices) {
        if (indices.length == 0) {
            return ROOT;
        }
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("Child index must be non-negative: " + index);
            }
        }
        return new TreePath(indices.clone());
    }

    public TreePath child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Child index must be non-negative: " + index);
        }
        int[] extended = Arrays.copyOf(indices, indices.length + 1);
        extended[indices.length] = index;
        return new TreePath(extended);
    }

    /**
     * Appends a path relative to this one.
     */
    public TreePath resolve(TreePath relative) {
        if (relative.isRoot()) {
            return this;
        }
        int[] joined = Arrays.copyOf(indices, indices.length + relative.indices.length);
        System.arraycopy(relative.indices, 0, joined, indices.length, relative.indices.length);
        return new TreePath(joined);
    }

    /**
     * @throws IllegalStateException when called on the root path
     */
    public TreePath parent() {
        if (indices.length == 0) {
            throw new IllegalStateException("Root path has no parent");
        }
        return indices.length == 1 ? ROOT : new TreePath(Arrays.copyOf(indices, indices.length - 1));
    }

    public TreePath prefix(int length) {
        if (length < 0 || length > indices.length) {
            throw new IllegalArgumentException("Invalid prefix length " + length + " for " + this);
        }
        return length == 0 ? ROOT : new TreePath(Arrays.copyOf(indices, length));
    }

    public boolean isRoot() {
        return indices.length == 0;
    }

    public int length() {
        return indices.length;
    }

    /**
     * Depth of the addressed node, the root being at depth 1.
     */
    public int depth() {
        return indices.length + 1;
    }

    public int get(int position) {
        return indices[position];
    }

    public int last() {
        if (indices.length == 0) {
            throw new IllegalStateException("Root path has no last index");
        }
        return indices[indices.length - 1];
    }

    /**
     * True when this path equals {@code other} or is one of its ancestors.
     */
    public boolean isPrefixOf(TreePath other) {
        if (indices.length > other.indices.length) {
            return false;
        }
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] != other.indices[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when this path lies in the subtree rooted at {@code ancestor}.
     */
    public boolean isWithin(TreePath ancestor) {
        return ancestor.isPrefixOf(this);
    }

    public IntList asList() {
        return IntLists.unmodifiable(IntArrayList.wrap(indices));
    }

    @Override
    public int compareTo(TreePath other) {
        return Arrays.compare(indices, other.indices);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreePath other)) return false;
        return hash == other.hash && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(indices);
    }
}
