package com.arbor.synth.search;

import com.arbor.synth.api.IProgramEnumerator;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.constraints.Contains;
import com.arbor.synth.constraints.ContainsSubtree;
import com.arbor.synth.constraints.Forbidden;
import com.arbor.synth.constraints.ForbiddenSequence;
import com.arbor.synth.constraints.Ordered;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.Trees;
import com.arbor.synth.tree.template.TemplateNode;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.List;
import java.util.function.Predicate;

import static com.arbor.synth.search.SearchGrammars.DIGIT_PLUS;
import static com.arbor.synth.search.SearchGrammars.DIGIT_TIMES;
import static com.arbor.synth.search.SearchGrammars.NEG;
import static com.arbor.synth.search.SearchGrammars.ONE;
import static com.arbor.synth.search.SearchGrammars.PLUS;
import static com.arbor.synth.search.SearchGrammars.TIMES;
import static com.arbor.synth.search.SearchGrammars.X;
import static com.arbor.synth.search.SearchGrammars.arithmetic;
import static com.arbor.synth.search.SearchGrammars.digits;
import static com.arbor.synth.tree.template.TemplateNode.anyOf;
import static com.arbor.synth.tree.template.TemplateNode.rule;
import static com.arbor.synth.tree.template.TemplateNode.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Program counts and program sets shared by both search strategies.
 */
class EnumerationTest {

    private static final TemplateNode SAME_OPERANDS = anyOf(Domain.of(PLUS, TIMES), var("A"), var("A"));
    private static final TemplateNode COMMUTATIVE = anyOf(Domain.of(PLUS, TIMES), var("a"), var("b"));
    private static final Domain OPERATORS = Domain.of(NEG, PLUS, TIMES);

    enum Strategy {
        BFS {
            @Override
            IProgramEnumerator over(Grammar grammar, SearchConfig config) {
                return new BFSIterator(grammar, "Int", config);
            }
        },
        DFS {
            @Override
            IProgramEnumerator over(Grammar grammar, SearchConfig config) {
                return new DFSIterator(grammar, "Int", config);
            }
        };

        abstract IProgramEnumerator over(Grammar grammar, SearchConfig config);
    }

    private static SearchConfig sizeAtMost(int maxSize) {
        return SearchConfig.builder().maxSize(maxSize).build();
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should count every program within the size bound")
    void shouldCountUnconstrainedPrograms(Strategy strategy) {
        assertThat(strategy.over(arithmetic(), sizeAtMost(3)).count()).isEqualTo(14);
        assertThat(strategy.over(arithmetic(), sizeAtMost(5)).count()).isEqualTo(154);
        assertThat(strategy.over(digits(), sizeAtMost(5)).count()).isEqualTo(8210);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should drop programs containing forbidden shapes")
    void shouldDropForbiddenShapes(Strategy strategy) {
        // Given 1 * A and -(-A) are forbidden
        Grammar grammar = arithmetic(
                new Forbidden(rule(TIMES, rule(ONE), var("A"))),
                new Forbidden(rule(NEG, rule(NEG, var("A")))));

        // When
        List<RuleNode> programs = strategy.over(grammar, sizeAtMost(3)).toList();

        // Then
        assertThat(programs).hasSize(10)
                .doesNotContain(RuleNode.of(TIMES, new RuleNode(ONE), new RuleNode(X)))
                .doesNotContain(RuleNode.of(NEG, RuleNode.of(NEG, new RuleNode(ONE))))
                .contains(RuleNode.of(TIMES, new RuleNode(X), new RuleNode(ONE)));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should drop operations applied to two equal operands")
    void shouldDropOperationsOnEqualOperands(Strategy strategy) {
        Grammar grammar = arithmetic(new Forbidden(SAME_OPERANDS));

        assertThat(strategy.over(grammar, sizeAtMost(3)).count()).isEqualTo(10);
        assertThat(strategy.over(grammar, sizeAtMost(5)).count()).isEqualTo(106);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should keep one order of commutative operands")
    void shouldKeepOneOrderOfCommutativeOperands(Strategy strategy) {
        Grammar grammar = arithmetic(new Ordered(COMMUTATIVE, List.of("a", "b")));

        assertThat(strategy.over(grammar, sizeAtMost(3)).count()).isEqualTo(12);
        assertThat(strategy.over(grammar, sizeAtMost(5)).count()).isEqualTo(82);

        Grammar digitGrammar = digits(new Ordered(
                anyOf(Domain.of(DIGIT_PLUS, DIGIT_TIMES), var("a"), var("b")), List.of("a", "b")));
        assertThat(strategy.over(digitGrammar, sizeAtMost(3)).count()).isEqualTo(120);
        assertThat(strategy.over(digitGrammar, sizeAtMost(5)).count()).isEqualTo(2320);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should only yield programs containing the required rule or subtree")
    void shouldRequireRulesAndSubtrees(Strategy strategy) {
        assertThat(strategy.over(arithmetic(new Contains(X)), sizeAtMost(3)).count()).isEqualTo(9);
        assertThat(strategy.over(arithmetic(new Contains(TIMES)), sizeAtMost(2)).count()).isZero();

        List<RuleNode> withSubtree = strategy.over(
                arithmetic(new ContainsSubtree(rule(TIMES, rule(X), rule(X)))), sizeAtMost(4)).toList();
        RuleNode xTimesX = RuleNode.of(TIMES, new RuleNode(X), new RuleNode(X));
        assertThat(withSubtree).containsExactlyInAnyOrder(xTimesX, RuleNode.of(NEG, xTimesX));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should forbid rule sequences unless an ignored rule interrupts them")
    void shouldForbidSequencesUnlessInterrupted(Strategy strategy) {
        Grammar grammar = arithmetic(new ForbiddenSequence(IntArrayList.of(PLUS, ONE), Domain.of(TIMES)));

        assertThat(strategy.over(grammar, sizeAtMost(3)).count()).isEqualTo(11);
        List<RuleNode> programs = strategy.over(grammar, sizeAtMost(5)).toList();
        assertThat(programs).hasSize(90)
                .contains(RuleNode.of(PLUS, new RuleNode(X), RuleNode.of(TIMES, new RuleNode(X), new RuleNode(ONE))))
                .doesNotContain(RuleNode.of(PLUS, new RuleNode(X), RuleNode.of(NEG, new RuleNode(ONE))));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should respect the depth bound")
    void shouldRespectDepthBound(Strategy strategy) {
        SearchConfig shallow = SearchConfig.builder().maxDepth(3).maxSize(5).build();
        assertThat(strategy.over(arithmetic(), shallow).toList())
                .hasSize(110)
                .allSatisfy(program -> assertThat(program.height()).isLessThanOrEqualTo(3));

        SearchConfig depthOnly = SearchConfig.builder().maxDepth(2).build();
        assertThat(strategy.over(arithmetic(), depthOnly).count()).isEqualTo(12);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should enforce constraints written against the public interfaces")
    void shouldAcceptCustomConstraints(Strategy strategy) {
        Grammar grammar = arithmetic(new ForbidConsecutive(OPERATORS));

        assertThat(strategy.over(grammar, sizeAtMost(4)).count()).isEqualTo(36);
        assertThat(strategy.over(arithmetic(), sizeAtMost(4)).count()).isEqualTo(40);
        assertThat(strategy.over(grammar, sizeAtMost(6)).count()).isEqualTo(292);
        assertThat(strategy.over(arithmetic(), sizeAtMost(6)).count()).isEqualTo(556);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should enforce a repeated constraint once")
    void shouldIgnoreRepeatedConstraints(Strategy strategy) {
        Grammar grammar = arithmetic(new Forbidden(SAME_OPERANDS), new Forbidden(SAME_OPERANDS));

        assertThat(grammar.constraints()).hasSize(1);
        assertThat(strategy.over(grammar, sizeAtMost(5)).count()).isEqualTo(106);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should yield exactly the programs satisfying every constraint")
    void shouldProduceExactlyTheProgramsSatisfyingAllConstraints(Strategy strategy) {
        // Given several constraints acting on the same trees
        RuleNode xTimesX = RuleNode.of(TIMES, new RuleNode(X), new RuleNode(X));
        Grammar grammar = arithmetic(
                new Ordered(COMMUTATIVE, List.of("a", "b")),
                new ForbidConsecutive(OPERATORS),
                new ContainsSubtree(rule(TIMES, rule(X), rule(X))));
        Predicate<RuleNode> accept = program ->
                BruteForce.anyNode(program, xTimesX::equals)
                        && !BruteForce.anyNode(program, EnumerationTest::isUnordered)
                        && !BruteForce.anyNode(program, EnumerationTest::repeatsOperator);

        // When
        List<RuleNode> programs = strategy.over(grammar, sizeAtMost(6)).toList();

        // Then
        assertThat(programs).doesNotHaveDuplicates();
        assertThat(new HashSet<>(programs))
                .isNotEmpty()
                .isEqualTo(BruteForce.programs(arithmetic(), "Int", Integer.MAX_VALUE, 6, accept));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should yield every program exhaustive generation finds")
    void shouldMatchExhaustiveGenerationWithoutConstraints(Strategy strategy) {
        List<RuleNode> programs = strategy.over(arithmetic(), SearchConfig.of(3, 6)).toList();

        assertThat(programs).doesNotHaveDuplicates();
        assertThat(new HashSet<>(programs))
                .isEqualTo(BruteForce.programs(arithmetic(), "Int", 3, 6, program -> true));
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should produce the same sequence on every run")
    void shouldRepeatTheSameSequence(Strategy strategy) {
        IProgramEnumerator enumerator = strategy.over(
                arithmetic(new Ordered(COMMUTATIVE, List.of("a", "b"))), sizeAtMost(5));

        assertThat(enumerator.toList()).isEqualTo(enumerator.toList());
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(Strategy.class)
    @DisplayName("Should stop after the enumeration limit")
    void shouldStopAfterMaxEnumerations(Strategy strategy) {
        SearchConfig config = sizeAtMost(5).toBuilder().maxEnumerations(7).build();

        List<RuleNode> limited = strategy.over(arithmetic(), config).toList();

        assertThat(limited).hasSize(7);
        assertThat(limited).isEqualTo(strategy.over(arithmetic(), sizeAtMost(5)).toList().subList(0, 7));
    }

    @Test
    @DisplayName("Should reject an unknown start category")
    void shouldRejectUnknownStartCategory() {
        assertThatThrownBy(() -> new BFSIterator(arithmetic(), "Bool", sizeAtMost(3)))
                .isInstanceOf(GrammarStructureException.class)
                .hasMessageContaining("Bool");
        assertThatThrownBy(() -> new DFSIterator(arithmetic(), "Bool", sizeAtMost(3)))
                .isInstanceOf(GrammarStructureException.class);
    }

    private static boolean isUnordered(AbstractRuleNode node) {
        return (node.rule() == PLUS || node.rule() == TIMES)
                && Trees.compare(node.child(0), node.child(1)) > 0;
    }

    private static boolean repeatsOperator(AbstractRuleNode node) {
        if (!OPERATORS.contains(node.rule())) {
            return false;
        }
        for (AbstractRuleNode child : node.children()) {
            if (child.rule() == node.rule()) {
                return true;
            }
        }
        return false;
    }
}
