package com.arbor.synth.search;

import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.arbor.synth.tree.RuleNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static com.arbor.synth.search.SearchGrammars.arithmetic;
import static com.arbor.synth.search.SearchGrammars.reals;
import static org.assertj.core.api.Assertions.assertThat;

class DFSIteratorTest {

    private static final RuleNode ONE = new RuleNode(0);
    private static final RuleNode TWO = new RuleNode(1);

    @Test
    @DisplayName("Should finish each branch before moving to the next rule")
    void shouldYieldInDepthFirstOrder() {
        DFSIterator iterator = new DFSIterator(reals(), "Real", SearchConfig.of(2, 5));

        assertThat(iterator.toList()).containsExactly(
                ONE,
                TWO,
                RuleNode.of(2, ONE, ONE),
                RuleNode.of(2, ONE, TWO),
                RuleNode.of(2, TWO, ONE),
                RuleNode.of(2, TWO, TWO));
    }

    @Test
    @DisplayName("Should branch on the configured hole first")
    void shouldUseConfiguredHeuristic() {
        SearchConfig config = SearchConfig.of(2, 5).toBuilder().holeHeuristic(HoleHeuristic.RIGHTMOST).build();

        DFSIterator iterator = new DFSIterator(reals(), "Real", config);

        assertThat(iterator.toList()).containsExactly(
                ONE,
                TWO,
                RuleNode.of(2, ONE, ONE),
                RuleNode.of(2, TWO, ONE),
                RuleNode.of(2, ONE, TWO),
                RuleNode.of(2, TWO, TWO));
    }

    @Test
    @DisplayName("Should find the same programs as breadth-first search")
    void shouldAgreeWithBreadthFirst() {
        SearchConfig config = SearchConfig.of(4, 6);

        assertThat(new HashSet<>(new DFSIterator(arithmetic(), "Int", config).toList()))
                .isEqualTo(new HashSet<>(new BFSIterator(arithmetic(), "Int", config).toList()));
    }

    @Test
    @DisplayName("Should tag its metrics with its strategy")
    void shouldTagMetrics() {
        InMemoryMetricsRegistry registry = new InMemoryMetricsRegistry();

        long count = new DFSIterator(arithmetic(), "Int", SearchConfig.builder().maxSize(3).build(), registry).count();

        assertThat(count).isEqualTo(14);
        assertThat(registry.counterValues())
                .containsEntry(MetricsRegistry.PROGRAMS_YIELDED + "{strategy=dfs}", 14L)
                .doesNotContainKey(MetricsRegistry.PROGRAMS_YIELDED + "{strategy=bfs}");
    }
}
