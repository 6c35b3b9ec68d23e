package com.arbor.synth.search;

import com.arbor.synth.api.IProgramEnumerator;
import com.arbor.synth.api.ProgramIterator;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.api.model.SearchStatistics;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.infra.metrics.Counter;
import com.arbor.synth.infra.metrics.Gauge;
import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.infra.metrics.internal.MetricsRegistryHolder;
import com.arbor.synth.solver.GenericSolver;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import org.roaringbitmap.IntIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Top-down enumeration of the complete trees of a grammar.
 *
 * <p>The frontier holds solver states. A state leaving the frontier is either
 * complete, and returned, or branched on one hole: each rule of the hole's
 * domain is tried on a fork of the solver and the feasible forks go back to
 * the frontier. Subclasses decide the frontier order and the default hole
 * heuristic.
 *
 * <p>Each call to {@link #iterator()} starts an independent search over the
 * same inputs, so the sequence produced is always the same.
 */
public abstract class TopDownIterator implements IProgramEnumerator {

    private static final Logger logger = Logger.getLogger(TopDownIterator.class.getName());

    protected final Grammar grammar;
    protected final String startCategory;
    protected final SearchConfig config;
    private final MetricsRegistry metrics;

    /**
     * @throws GrammarStructureException if the grammar has no {@code startCategory}
     */
    protected TopDownIterator(Grammar grammar, String startCategory, SearchConfig config, MetricsRegistry metrics) {
        if (!grammar.hasCategory(startCategory)) {
            throw new GrammarStructureException("Unknown start category '" + startCategory + "'");
        }
        this.grammar = grammar;
        this.startCategory = startCategory;
        this.config = config;
        this.metrics = metrics;
    }

    protected TopDownIterator(Grammar grammar, String startCategory, SearchConfig config) {
        this(grammar, startCategory, config, MetricsRegistryHolder.INSTANCE);
    }

    /**
     * Frontier of pending states for one search.
     */
    protected interface Frontier {

        void push(GenericSolver state);

        /**
         * Adds the children of one expansion, given in increasing rule order.
         */
        default void pushAll(List<GenericSolver> states) {
            for (GenericSolver state : states) {
                push(state);
            }
        }

        GenericSolver pop();

        boolean isEmpty();

        int size();
    }

    protected abstract Frontier newFrontier();

    protected abstract HoleHeuristic defaultHeuristic();

    /**
     * Tag value under which this strategy's metrics are recorded.
     */
    protected abstract String strategy();

    public Grammar getGrammar() {
        return grammar;
    }

    public SearchConfig getConfig() {
        return config;
    }

    @Override
    public ProgramIterator iterator() {
        return new Search();
    }

    private final class Search implements ProgramIterator {

        private final Frontier frontier = newFrontier();
        private final HoleHeuristic heuristic = config.holeHeuristicOr(defaultHeuristic());
        private final Counter expandedCounter = metrics.counter(MetricsRegistry.STATES_EXPANDED, "strategy", strategy());
        private final Counter prunedCounter = metrics.counter(MetricsRegistry.BRANCHES_PRUNED, "strategy", strategy());
        private final Counter yieldedCounter = metrics.counter(MetricsRegistry.PROGRAMS_YIELDED, "strategy", strategy());
        private final Gauge frontierGauge = metrics.gauge(MetricsRegistry.FRONTIER_SIZE, "strategy", strategy());

        private RuleNode next;
        private long expanded;
        private long pruned;
        private long yielded;

        Search() {
            GenericSolver root = new GenericSolver(grammar, startCategory, config.maxDepth(), config.maxSize());
            if (root.isFeasible()) {
                frontier.push(root);
            } else {
                pruned++;
                prunedCounter.increment();
                logger.fine(() -> "No " + startCategory + " program fits " + config);
            }
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Starting %s search for %s with %s, heuristic %s",
                        strategy(), startCategory, config, heuristic));
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public RuleNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Search exhausted");
            }
            RuleNode program = next;
            next = null;
            return program;
        }

        @Override
        public SearchStatistics statistics() {
            return new SearchStatistics(expanded, pruned, yielded);
        }

        private RuleNode advance() {
            if (yielded >= config.maxEnumerations()) {
                return null;
            }
            while (!frontier.isEmpty()) {
                GenericSolver state = frontier.pop();
                frontierGauge.set(frontier.size());
                AbstractRuleNode tree = state.getTree();
                if (tree.isComplete()) {
                    yielded++;
                    yieldedCounter.increment();
                    if (yielded == config.maxEnumerations()) {
                        logger.fine(() -> "Reached " + config.maxEnumerations() + " enumerations");
                    }
                    return (RuleNode) tree;
                }
                expand(state, tree);
            }
            logger.fine(() -> String.format("%s search finished: %s", strategy(), statistics()));
            return null;
        }

        private void expand(GenericSolver state, AbstractRuleNode tree) {
            Optional<TreePath> selected = heuristic.select(tree);
            if (selected.isEmpty()) {
                logger.warning("Incomplete tree without an open hole dropped: " + tree);
                pruned++;
                prunedCounter.increment();
                return;
            }
            TreePath path = selected.get();
            Domain domain = ((Hole) state.getNodeAt(path)).domain();
            expanded++;
            expandedCounter.increment();

            List<GenericSolver> children = new ArrayList<>(domain.size());
            IntIterator it = domain.iterator();
            while (it.hasNext()) {
                int rule = it.next();
                GenericSolver branch = state.fork();
                branch.fill(path, rule);
                if (branch.isFeasible()) {
                    children.add(branch);
                } else {
                    pruned++;
                    prunedCounter.increment();
                }
            }
            if (logger.isLoggable(Level.FINER)) {
                logger.finer(String.format("Expanded %s at %s: %d of %d rules feasible",
                        tree, path, children.size(), domain.size()));
            }
            frontier.pushAll(children);
            frontierGauge.set(frontier.size());
        }
    }
}
