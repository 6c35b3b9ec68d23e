package com.arbor.synth.search;

import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.solver.GenericSolver;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Enumerates programs in non-decreasing size.
 *
 * <p>States are ordered by the smallest size any of their completions can
 * reach, then by insertion. A complete tree only leaves the frontier once no
 * pending state could still produce a smaller program.
 */
public class BFSIterator extends TopDownIterator {

    public BFSIterator(Grammar grammar, String startCategory, SearchConfig config) {
        super(grammar, startCategory, config);
    }

    public BFSIterator(Grammar grammar, String startCategory, SearchConfig config, MetricsRegistry metrics) {
        super(grammar, startCategory, config, metrics);
    }

    @Override
    protected Frontier newFrontier() {
        return new SizeOrderedFrontier();
    }

    @Override
    protected HoleHeuristic defaultHeuristic() {
        return HoleHeuristic.LEVEL_ORDER;
    }

    @Override
    protected String strategy() {
        return "bfs";
    }

    private record Entry(long minSize, long sequence, GenericSolver state) {
    }

    private static final class SizeOrderedFrontier implements Frontier {

        private final PriorityQueue<Entry> queue = new PriorityQueue<>(
                Comparator.comparingLong(Entry::minSize).thenComparingLong(Entry::sequence));
        private long sequence;

        @Override
        public void push(GenericSolver state) {
            queue.add(new Entry(state.minCompletionSize(), sequence++, state));
        }

        @Override
        public GenericSolver pop() {
            return queue.poll().state();
        }

        @Override
        public boolean isEmpty() {
            return queue.isEmpty();
        }

        @Override
        public int size() {
            return queue.size();
        }
    }
}
