package com.arbor.synth.solver;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.arbor.synth.TestGrammars.NEG;
import static com.arbor.synth.TestGrammars.ONE;
import static com.arbor.synth.TestGrammars.PLUS;
import static com.arbor.synth.TestGrammars.TIMES;
import static com.arbor.synth.TestGrammars.X;
import static com.arbor.synth.TestGrammars.arithmetic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenericSolverTest {

    private static final TreePath LEFT = TreePath.of(0);
    private static final TreePath RIGHT = TreePath.of(1);

    private Grammar grammar;

    @BeforeEach
    void setUp() {
        grammar = arithmetic();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should start from one hole holding every rule of the category")
        void shouldStartFromRootHole() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);

            assertThat(solver.isFeasible()).isTrue();
            assertThat(solver.getHoleAt(TreePath.ROOT).domain()).isEqualTo(Domain.range(0, 5));
            assertThat(solver.minCompletionSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should restrict holes to rules that fit the remaining depth")
        void shouldRestrictByDepth() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 1, 5);

            assertThat(solver.getHoleAt(TreePath.ROOT).domain()).isEqualTo(Domain.of(ONE, X));
        }

        @Test
        @DisplayName("Should reject unknown categories and non-positive bounds")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> new GenericSolver(grammar, "Bool", 3, 5))
                    .isInstanceOf(GrammarStructureException.class)
                    .hasMessageContaining("Bool");
            assertThatThrownBy(() -> new GenericSolver(grammar, "Int", 0, 5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new GenericSolver(grammar, "Int", 3, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Domain primitives")
    class Primitives {

        @Test
        @DisplayName("Should create child holes when a hole is filled")
        void shouldMaterializeChildren() {
            // Given
            GenericSolver solver = new GenericSolver(grammar, "Int", 2, 5);

            // When
            solver.fill(TreePath.ROOT, TIMES);

            // Then
            assertThat(solver.getTree().rule()).isEqualTo(TIMES);
            assertThat(solver.getHoleAt(LEFT).domain()).isEqualTo(Domain.of(ONE, X));
            assertThat(solver.getHoleAt(RIGHT).category()).isEqualTo("Int");
            assertThat(solver.minCompletionSize()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should fill a hole once a single rule remains")
        void shouldFillSingletonDomain() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 2, 5);
            solver.fill(TreePath.ROOT, NEG);

            solver.remove(LEFT, ONE);

            assertThat(solver.getTree()).isEqualTo(RuleNode.of(NEG, new RuleNode(X)));
            assertThat(solver.getTree().isComplete()).isTrue();
        }

        @Test
        @DisplayName("Should narrow holes from above and from below")
        void shouldNarrowByBounds() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 7);

            solver.removeAbove(TreePath.ROOT, TIMES - 1);
            solver.removeBelow(TreePath.ROOT, X);

            assertThat(solver.getHoleAt(TreePath.ROOT).domain()).isEqualTo(Domain.of(X, NEG, PLUS));
            solver.remove(TreePath.ROOT, Domain.of(X, PLUS));
            assertThat(solver.getTree().rule()).isEqualTo(NEG);
        }

        @Test
        @DisplayName("Should mark the branch infeasible when a domain empties")
        void shouldDetectEmptyDomain() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);

            solver.removeAllBut(TreePath.ROOT, Domain.empty());

            assertThat(solver.isFeasible()).isFalse();
        }

        @Test
        @DisplayName("Should check primitives on filled nodes against their rule")
        void shouldCheckFilledNodes() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);
            solver.fill(TreePath.ROOT, TIMES);

            solver.remove(TreePath.ROOT, PLUS);
            solver.removeAbove(TreePath.ROOT, TIMES);
            assertThat(solver.isFeasible()).isTrue();

            solver.removeBelow(TreePath.ROOT, TIMES + 1);
            assertThat(solver.isFeasible()).isFalse();
        }

        @Test
        @DisplayName("Should prune a branch whose smallest completion exceeds the size bound")
        void shouldEnforceSizeBound() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 5, 3);
            solver.fill(TreePath.ROOT, NEG);
            assertThat(solver.isFeasible()).isTrue();

            solver.fill(LEFT, PLUS);

            assertThat(solver.isFeasible()).isFalse();
        }

        @Test
        @DisplayName("Should reject hole lookups on filled nodes")
        void shouldRejectHoleLookupOnFilledNode() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);
            solver.fill(TreePath.ROOT, NEG);

            assertThatThrownBy(() -> solver.getHoleAt(TreePath.ROOT))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(solver.getPath(solver.getNodeAt(LEFT))).isEqualTo(LEFT);
        }
    }

    @Nested
    @DisplayName("Equality")
    class Equality {

        @Test
        @DisplayName("Should keep holes made equal in step with later changes")
        void shouldKeepEqualHolesInStep() {
            // Given
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 7);
            solver.fill(TreePath.ROOT, PLUS);

            // When
            solver.makeEqual(LEFT, RIGHT);
            solver.remove(LEFT, Domain.of(ONE, PLUS, TIMES));

            // Then
            assertThat(solver.getHoleAt(RIGHT).domain()).isEqualTo(Domain.of(X, NEG));

            // When
            solver.fill(RIGHT, NEG);
            solver.fill(TreePath.of(0, 0), X);

            // Then
            AbstractRuleNode negX = RuleNode.of(NEG, new RuleNode(X));
            assertThat(solver.getTree()).isEqualTo(RuleNode.of(PLUS, negX, negX));
        }

        @Test
        @DisplayName("Should copy a structure onto a hole")
        void shouldImposeStructure() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 7);
            solver.fill(TreePath.ROOT, TIMES);

            solver.makeEqual(LEFT, RuleNode.of(NEG, new RuleNode(ONE)));

            assertThat(solver.getNodeAt(LEFT)).isEqualTo(RuleNode.of(NEG, new RuleNode(ONE)));
            assertThat(solver.getHoleAt(RIGHT)).isNotNull();
        }

        @Test
        @DisplayName("Should fail when filled subtrees made equal differ")
        void shouldDetectDifferentSubtrees() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 7);
            solver.fill(TreePath.ROOT, TIMES);
            solver.fill(LEFT, ONE);
            solver.fill(RIGHT, X);

            solver.makeEqual(LEFT, RIGHT);

            assertThat(solver.isFeasible()).isFalse();
        }
    }

    @Nested
    @DisplayName("Forking")
    class Forking {

        @Test
        @DisplayName("Should keep forked branches independent")
        void shouldForkIndependently() {
            // Given
            GenericSolver original = new GenericSolver(grammar, "Int", 3, 5);
            original.fill(TreePath.ROOT, TIMES);
            AbstractRuleNode before = original.getTree();

            // When
            GenericSolver branch = original.fork();
            branch.fill(LEFT, ONE);
            branch.removeAllBut(RIGHT, Domain.empty());

            // Then
            assertThat(original.getTree()).isSameAs(before);
            assertThat(original.isFeasible()).isTrue();
            assertThat(branch.isFeasible()).isFalse();
        }

        @Test
        @DisplayName("Should refuse to fork while constraints propagate")
        void shouldRefuseForkDuringPropagation() {
            // Given a constraint that tries to fork when the subtree changes
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);
            solver.fill(TreePath.ROOT, TIMES);
            List<RuntimeException> failures = new ArrayList<>();
            LocalConstraint forking = new LocalConstraint() {
                private boolean posted;

                @Override
                public TreePath path() {
                    return TreePath.ROOT;
                }

                @Override
                public void propagate(ISolver s) {
                    if (!posted) {
                        posted = true;
                        return;
                    }
                    try {
                        ((GenericSolver) s).fork();
                    } catch (IllegalStateException e) {
                        failures.add(e);
                    }
                }
            };
            solver.post(forking);

            // When
            solver.fill(LEFT, X);

            // Then
            assertThat(failures).hasSize(1);
            assertThat(failures.get(0)).hasMessageContaining("propagates");
        }
    }

    @Nested
    @DisplayName("Constraint bookkeeping")
    class Bookkeeping {

        @Test
        @DisplayName("Should keep one copy of equal local constraints and drop deactivated ones")
        void shouldTrackActiveConstraints() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);
            Idle first = new Idle(TreePath.ROOT);

            solver.post(first);
            solver.post(new Idle(TreePath.ROOT));

            assertThat(solver.activeConstraintCount()).isEqualTo(1);
            assertThat(solver.isActive(first)).isTrue();

            solver.deactivate(first);

            assertThat(solver.isActive(first)).isFalse();
            assertThat(solver.activeConstraintCount()).isZero();
        }

        @Test
        @DisplayName("Should ignore constraints posted to an infeasible branch")
        void shouldIgnorePostOnInfeasibleBranch() {
            GenericSolver solver = new GenericSolver(grammar, "Int", 3, 5);
            solver.setInfeasible();

            solver.post(new Idle(TreePath.ROOT));

            assertThat(solver.activeConstraintCount()).isZero();
        }
    }

    private record Idle(TreePath path) implements LocalConstraint {
        @Override
        public void propagate(ISolver solver) {
            // stays active until removed by hand
        }
    }
}
