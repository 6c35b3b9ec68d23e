package com.arbor.synth.search;

import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.solver.GenericSolver;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Enumerates programs depth first, lowest rule index first.
 */
public class DFSIterator extends TopDownIterator {

    public DFSIterator(Grammar grammar, String startCategory, SearchConfig config) {
        super(grammar, startCategory, config);
    }

    public DFSIterator(Grammar grammar, String startCategory, SearchConfig config, MetricsRegistry metrics) {
        super(grammar, startCategory, config, metrics);
    }

    @Override
    protected Frontier newFrontier() {
        return new StackFrontier();
    }

    @Override
    protected HoleHeuristic defaultHeuristic() {
        return HoleHeuristic.LEFTMOST;
    }

    @Override
    protected String strategy() {
        return "dfs";
    }

    private static final class StackFrontier implements Frontier {

        private final ArrayDeque<GenericSolver> stack = new ArrayDeque<>();

        @Override
        public void push(GenericSolver state) {
            stack.push(state);
        }

        // Reversed so the lowest rule ends on top.
        @Override
        public void pushAll(List<GenericSolver> states) {
            for (int i = states.size() - 1; i >= 0; i--) {
                stack.push(states.get(i));
            }
        }

        @Override
        public GenericSolver pop() {
            return stack.pop();
        }

        @Override
        public boolean isEmpty() {
            return stack.isEmpty();
        }

        @Override
        public int size() {
            return stack.size();
        }
    }
}
