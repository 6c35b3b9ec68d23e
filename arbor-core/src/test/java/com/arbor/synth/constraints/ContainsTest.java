package com.arbor.synth.constraints;

import com.arbor.synth.solver.GenericSolver;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.arbor.synth.TestGrammars.NEG;
import static com.arbor.synth.TestGrammars.TIMES;
import static com.arbor.synth.TestGrammars.X;
import static com.arbor.synth.TestGrammars.arithmetic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainsTest {

    @Test
    @DisplayName("Should keep only root rules that can still reach the required rule")
    void shouldNarrowRootToHosts() {
        GenericSolver solver = new GenericSolver(arithmetic(new Contains(X)), "Int", 3, 2);

        assertThat(solver.getHoleAt(TreePath.ROOT).domain()).isEqualTo(Domain.of(X, NEG));
    }

    @Test
    @DisplayName("Should place the required rule when only one spot is left")
    void shouldPlaceRequiredRule() {
        GenericSolver solver = new GenericSolver(arithmetic(new Contains(X)), "Int", 3, 2);

        solver.fill(TreePath.ROOT, NEG);

        assertThat(solver.getTree()).isEqualTo(RuleNode.of(NEG, new RuleNode(X)));
    }

    @Test
    @DisplayName("Should mark the search infeasible when the required rule cannot fit")
    void shouldRejectUnreachableRule() {
        GenericSolver solver = new GenericSolver(arithmetic(new Contains(TIMES)), "Int", 3, 2);

        assertThat(solver.isFeasible()).isFalse();
    }

    @Test
    @DisplayName("Should reject negative rules and drop itself when the rule is removed")
    void shouldValidateAndRemap() {
        Int2IntOpenHashMap mapping = new Int2IntOpenHashMap(new int[]{X}, new int[]{0});
        mapping.defaultReturnValue(-1);

        assertThatThrownBy(() -> new Contains(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Contains(X).remap(mapping)).contains(new Contains(0));
        assertThat(new Contains(TIMES).remap(mapping)).isEmpty();
        assertThat(new Contains(X).isSame(new Contains(X))).isTrue();
    }
}
