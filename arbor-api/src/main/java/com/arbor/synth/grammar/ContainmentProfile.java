package com.arbor.synth.grammar;

import com.arbor.synth.tree.Domain;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.roaringbitmap.IntIterator;

import java.util.Arrays;
import java.util.List;

/**
 * For one target rule: the smallest size and height of a tree headed by each
 * rule that contains the target somewhere, and of one that contains it
 * strictly below its head. All minima are lower bounds taken independently,
 * so a rule passes a budget check only if it can meet each.
 */
public final class ContainmentProfile {

    private final int target;
    private final int[] minSize;
    private final int[] minHeight;
    private final int[] minSizeBelow;
    private final int[] minHeightBelow;

    private ContainmentProfile(int target, int[] minSize, int[] minHeight,
                               int[] minSizeBelow, int[] minHeightBelow) {
        this.target = target;
        this.minSize = minSize;
        this.minHeight = minHeight;
        this.minSizeBelow = minSizeBelow;
        this.minHeightBelow = minHeightBelow;
    }

    static ContainmentProfile compute(Grammar grammar, int target) {
        int n = grammar.ruleCount();
        int[] sizes = new int[n];
        int[] heights = new int[n];
        Arrays.fill(sizes, Grammar.UNBOUNDED);
        Arrays.fill(heights, Grammar.UNBOUNDED);
        if (target >= 0 && target < n && !grammar.isRemoved(target) && grammar.isProductive(target)) {
            sizes[target] = grammar.minSize(target);
            heights[target] = grammar.minHeight(target);
        }

        int[] sizesBelow = new int[n];
        int[] heightsBelow = new int[n];
        boolean changed = true;
        while (changed) {
            changed = false;
            Object2IntMap<String> categorySize = categoryMinima(grammar, sizes);
            Object2IntMap<String> categoryHeight = categoryMinima(grammar, heights);
            for (int rule = 0; rule < n; rule++) {
                below(grammar, rule, categorySize, categoryHeight, sizesBelow, heightsBelow);
                if (sizesBelow[rule] < sizes[rule]) {
                    sizes[rule] = sizesBelow[rule];
                    changed = true;
                }
                if (heightsBelow[rule] < heights[rule]) {
                    heights[rule] = heightsBelow[rule];
                    changed = true;
                }
            }
        }
        return new ContainmentProfile(target, sizes, heights, sizesBelow, heightsBelow);
    }

    /**
     * Smallest size and height of a tree headed by {@code rule} with the
     * target inside one of its children, given the current per-category
     * minima.
     */
    private static void below(Grammar grammar, int rule,
                              Object2IntMap<String> categorySize, Object2IntMap<String> categoryHeight,
                              int[] sizesBelow, int[] heightsBelow) {
        sizesBelow[rule] = Grammar.UNBOUNDED;
        heightsBelow[rule] = Grammar.UNBOUNDED;
        Rule r = grammar.rule(rule);
        if (r.removed() || r.isTerminal() || !grammar.isProductive(rule)) {
            return;
        }
        List<String> children = r.childTypes();
        for (int i = 0; i < children.size(); i++) {
            String child = children.get(i);
            int childSize = categorySize.getInt(child);
            if (childSize == Grammar.UNBOUNDED) {
                continue;
            }
            long size = (long) grammar.minSize(rule) - grammar.minSize(child) + childSize;
            sizesBelow[rule] = (int) Math.min(sizesBelow[rule], size);
            int height = categoryHeight.getInt(child);
            for (int j = 0; j < children.size(); j++) {
                if (j != i) {
                    height = Math.max(height, grammar.minHeight(children.get(j)));
                }
            }
            if (height != Grammar.UNBOUNDED) {
                heightsBelow[rule] = Math.min(heightsBelow[rule], height + 1);
            }
        }
    }

    private static Object2IntMap<String> categoryMinima(Grammar grammar, int[] perRule) {
        Object2IntMap<String> minima = new Object2IntOpenHashMap<>();
        minima.defaultReturnValue(Grammar.UNBOUNDED);
        for (String category : grammar.categories()) {
            int min = Grammar.UNBOUNDED;
            IntIterator it = grammar.rulesFor(category).iterator();
            while (it.hasNext()) {
                min = Math.min(min, perRule[it.next()]);
            }
            minima.put(category, min);
        }
        return minima;
    }

    public int target() {
        return target;
    }

    public boolean canContain(int rule) {
        return minSize[rule] != Grammar.UNBOUNDED;
    }

    /**
     * True when some proper descendant of a node headed by {@code rule} can
     * contain the target.
     */
    public boolean canContainBelow(int rule) {
        return minSizeBelow[rule] != Grammar.UNBOUNDED;
    }

    public int minSize(int rule) {
        return minSize[rule];
    }

    public int minHeight(int rule) {
        return minHeight[rule];
    }

    /**
     * Smallest size of a tree headed by {@code rule} whose target occurrence
     * sits strictly below the head.
     */
    public int minSizeBelow(int rule) {
        return minSizeBelow[rule];
    }

    public int minHeightBelow(int rule) {
        return minHeightBelow[rule];
    }

    /**
     * Rules of {@code domain} that can contain the target.
     */
    public Domain hostsIn(Domain domain) {
        return domain.filter(this::canContain);
    }
}
