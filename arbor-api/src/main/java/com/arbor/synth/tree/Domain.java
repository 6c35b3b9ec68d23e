package com.arbor.synth.tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.function.IntPredicate;

/**
 * Immutable set of rule indices.
 *
 * <p>Every mutating operation returns a new instance; the backing
 * {@link RoaringBitmap} is never exposed. Iteration is in ascending rule order,
 * which is the order the solver and the enumerators rely on for determinism.
 */
public final class Domain {

    private static final Domain EMPTY = new Domain(new RoaringBitmap());

    private final RoaringBitmap bits;
    private final int hash;

    private Domain(RoaringBitmap bits) {
        bits.runOptimize();
        this.bits = bits;
        this.hash = contentHash(bits);
    }

    private static int contentHash(RoaringBitmap bits) {
        int h = 1;
        IntIterator it = bits.getIntIterator();
        while (it.hasNext()) {
            h = 31 * h + it.next();
        }
        return h;
    }

    public static Domain empty() {
        return EMPTY;
    }

    public static Domain of(int... rules) {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (int rule : rules) {
            bitmap.add(checkRule(rule));
        }
        return new Domain(bitmap);
    }

    public static Domain of(Iterable<Integer> rules) {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (int rule : rules) {
            bitmap.add(checkRule(rule));
        }
        return new Domain(bitmap);
    }

    /**
     * Returns the domain {@code [fromInclusive, toExclusive)}.
     */
    public static Domain range(int fromInclusive, int toExclusive) {
        RoaringBitmap bitmap = new RoaringBitmap();
        if (toExclusive > fromInclusive) {
            bitmap.add((long) checkRule(fromInclusive), (long) toExclusive);
        }
        return new Domain(bitmap);
    }

    private static int checkRule(int rule) {
        if (rule < 0) {
            throw new IllegalArgumentException("Rule index must be non-negative: " + rule);
        }
        return rule;
    }

    public boolean contains(int rule) {
        return rule >= 0 && bits.contains(rule);
    }

    public int size() {
        return bits.getCardinality();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public boolean isSingleton() {
        return bits.getCardinality() == 1;
    }

    /**
     * Lowest rule index of the domain.
     *
     * @throws IllegalStateException if the domain is empty
     */
    public int first() {
        if (bits.isEmpty()) {
            throw new IllegalStateException("Empty domain has no first rule");
        }
        return bits.first();
    }

    /**
     * Highest rule index of the domain.
     *
     * @throws IllegalStateException if the domain is empty
     */
    public int last() {
        if (bits.isEmpty()) {
            throw new IllegalStateException("Empty domain has no last rule");
        }
        return bits.last();
    }

    public Domain with(int rule) {
        if (contains(rule)) {
            return this;
        }
        RoaringBitmap copy = bits.clone();
        copy.add(checkRule(rule));
        return new Domain(copy);
    }

    public Domain without(int rule) {
        if (!contains(rule)) {
            return this;
        }
        RoaringBitmap copy = bits.clone();
        copy.remove(rule);
        return new Domain(copy);
    }

    public Domain without(Domain rules) {
        if (!intersects(rules)) {
            return this;
        }
        return new Domain(RoaringBitmap.andNot(bits, rules.bits));
    }

    public Domain intersect(Domain other) {
        return new Domain(RoaringBitmap.and(bits, other.bits));
    }

    public Domain union(Domain other) {
        return new Domain(RoaringBitmap.or(bits, other.bits));
    }

    public boolean intersects(Domain other) {
        return RoaringBitmap.intersects(bits, other.bits);
    }

    public boolean isSubsetOf(Domain other) {
        return other.bits.contains(bits);
    }

    /**
     * Keeps the rules with index less than or equal to {@code rule}.
     */
    public Domain retainAtMost(int rule) {
        if (rule < 0) {
            return EMPTY;
        }
        if (bits.isEmpty() || bits.last() <= rule) {
            return this;
        }
        RoaringBitmap copy = bits.clone();
        copy.remove((long) rule + 1, 0x1_0000_0000L);
        return new Domain(copy);
    }

    /**
     * Keeps the rules with index greater than or equal to {@code rule}.
     */
    public Domain retainAtLeast(int rule) {
        if (rule <= 0 || bits.isEmpty() || bits.first() >= rule) {
            return this;
        }
        RoaringBitmap copy = bits.clone();
        copy.remove(0L, (long) rule);
        return new Domain(copy);
    }

    public Domain filter(IntPredicate predicate) {
        RoaringBitmap result = new RoaringBitmap();
        IntIterator it = bits.getIntIterator();
        while (it.hasNext()) {
            int rule = it.next();
            if (predicate.test(rule)) {
                result.add(rule);
            }
        }
        return result.getCardinality() == bits.getCardinality() ? this : new Domain(result);
    }

    public IntIterator iterator() {
        return bits.getIntIterator();
    }

    public int[] toArray() {
        return bits.toArray();
    }

    public IntList toList() {
        return IntArrayList.wrap(bits.toArray());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Domain other)) return false;
        return hash == other.hash && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        IntIterator it = bits.getIntIterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        return sb.append('}').toString();
    }
}
