package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.solver.GenericSolver;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.TemplateNode;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.arbor.synth.TestGrammars.NEG;
import static com.arbor.synth.TestGrammars.ONE;
import static com.arbor.synth.TestGrammars.PLUS;
import static com.arbor.synth.TestGrammars.TIMES;
import static com.arbor.synth.TestGrammars.X;
import static com.arbor.synth.TestGrammars.arithmetic;
import static com.arbor.synth.tree.template.TemplateNode.rule;
import static com.arbor.synth.tree.template.TemplateNode.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ForbiddenTest {

    private static final TemplateNode ONE_TIMES_A = rule(TIMES, rule(ONE), var("A"));
    private static final TemplateNode DOUBLE_NEGATION = rule(NEG, rule(NEG, var("A")));

    @Test
    @DisplayName("Should post a local constraint only where the template may match")
    void shouldPostWhereTemplateMayMatch() {
        // Given
        ISolver solver = mock(ISolver.class);
        when(solver.getNodeAt(TreePath.ROOT)).thenReturn(new Hole("Int", Domain.of(ONE, TIMES)));
        when(solver.getNodeAt(TreePath.of(0))).thenReturn(new Hole("Int", Domain.of(ONE, X)));
        Forbidden forbidden = new Forbidden(ONE_TIMES_A);

        // When
        forbidden.onNewNode(solver, TreePath.ROOT);
        forbidden.onNewNode(solver, TreePath.of(0));

        // Then
        verify(solver).post(new LocalForbidden(TreePath.ROOT, ONE_TIMES_A));
        verify(solver, never()).post(new LocalForbidden(TreePath.of(0), ONE_TIMES_A));
    }

    @Test
    @DisplayName("Should keep the deciding hole away from the forbidden rule")
    void shouldRemoveDecidingRule() {
        GenericSolver solver = new GenericSolver(arithmetic(new Forbidden(ONE_TIMES_A)), "Int", 3, 7);

        solver.fill(TreePath.ROOT, TIMES);

        assertThat(solver.getHoleAt(TreePath.of(0)).domain().contains(ONE)).isFalse();
        assertThat(solver.getHoleAt(TreePath.of(1)).domain().contains(ONE)).isTrue();
    }

    @Test
    @DisplayName("Should forbid nested shapes once their outer node is filled")
    void shouldForbidNestedShape() {
        GenericSolver solver = new GenericSolver(arithmetic(new Forbidden(DOUBLE_NEGATION)), "Int", 4, 7);

        solver.fill(TreePath.ROOT, NEG);

        assertThat(solver.getHoleAt(TreePath.of(0)).domain()).isEqualTo(Domain.of(ONE, X, PLUS, TIMES));
    }

    @Test
    @DisplayName("Should mark a complete match infeasible")
    void shouldRejectCompleteMatch() {
        // Given a forbidden shape with a repeated variable, which only a complete match decides
        TemplateNode same = rule(PLUS, var("A"), var("A"));
        GenericSolver solver = new GenericSolver(arithmetic(new Forbidden(same)), "Int", 3, 7);
        solver.fill(TreePath.ROOT, PLUS);
        solver.fill(TreePath.of(0), X);
        assertThat(solver.isFeasible()).isTrue();

        // When
        solver.fill(TreePath.of(1), X);

        // Then
        assertThat(solver.isFeasible()).isFalse();
    }

    @Test
    @DisplayName("Should keep enforcing below holes unified after the root constraint deactivated")
    void shouldEnforceAfterUnrelatedUnification() {
        // Given the root cannot match, so its local constraint is gone
        GenericSolver solver = new GenericSolver(arithmetic(new Forbidden(ONE_TIMES_A)), "Int", 4, 7);
        solver.fill(TreePath.ROOT, PLUS);
        assertThat(solver.isActive(new LocalForbidden(TreePath.ROOT, ONE_TIMES_A))).isFalse();

        // When both operands are made equal and one of them is filled
        solver.makeEqual(TreePath.of(0), TreePath.of(1));
        solver.fill(TreePath.of(0), TIMES);

        // Then the constraints posted below still narrow both copies
        assertThat(solver.isFeasible()).isTrue();
        assertThat(solver.getNodeAt(TreePath.of(1)).rule()).isEqualTo(TIMES);
        assertThat(solver.getHoleAt(TreePath.of(0, 0)).domain().contains(ONE)).isFalse();
        assertThat(solver.getHoleAt(TreePath.of(1, 0)).domain().contains(ONE)).isFalse();
    }

    @Test
    @DisplayName("Should treat constraints with equal templates as the same")
    void shouldDetectSameConstraint() {
        Forbidden forbidden = new Forbidden(ONE_TIMES_A);

        assertThat(forbidden.isSame(new Forbidden(rule(TIMES, rule(ONE), var("A"))))).isTrue();
        assertThat(forbidden.isSame(new Forbidden(DOUBLE_NEGATION))).isFalse();
        assertThat(forbidden.referencedRules()).isEqualTo(Domain.of(ONE, TIMES));
    }

    @Test
    @DisplayName("Should rewrite rule indices after compaction and drop templates over removed rules")
    void shouldRemap() {
        Int2IntOpenHashMap mapping = new Int2IntOpenHashMap(new int[]{ONE, TIMES}, new int[]{0, 3});
        mapping.defaultReturnValue(-1);

        assertThat(new Forbidden(ONE_TIMES_A).remap(mapping))
                .contains(new Forbidden(rule(3, rule(0), var("A"))));
        assertThat(new Forbidden(DOUBLE_NEGATION).remap(mapping)).isEmpty();
    }

    @Test
    @DisplayName("Should not post anything for a filled node that cannot match")
    void shouldIgnoreFilledMismatch() {
        ISolver solver = mock(ISolver.class);
        when(solver.getNodeAt(TreePath.ROOT)).thenReturn(RuleNode.of(PLUS, new RuleNode(ONE), new RuleNode(X)));

        new Forbidden(ONE_TIMES_A).onNewNode(solver, TreePath.ROOT);

        verify(solver, never()).post(any());
    }
}
