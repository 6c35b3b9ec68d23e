package com.arbor.synth.compiler;

import com.arbor.synth.api.CompilationListener;
import com.arbor.synth.api.IGrammarCompiler;
import com.arbor.synth.api.exceptions.ConstraintDomainException;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.api.model.GrammarStats;
import com.arbor.synth.compiler.analysis.GrammarAnalyzer;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.grammar.Rule;
import com.arbor.synth.tree.Domain;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles a {@link GrammarDefinition} into an immutable {@link Grammar}.
 *
 * <p>Stages: VALIDATION, CATEGORY_INDEXING, ANALYSIS, MODEL_BUILDING. Each
 * stage runs in its own span and is reported to the compilation listener.
 */
public class GrammarCompiler implements IGrammarCompiler {

    private static final Logger logger = Logger.getLogger(GrammarCompiler.class.getName());
    private static final int TOTAL_STAGES = 4;

    private Tracer tracer;
    private CompilationListener listener;
    private final GrammarAnalyzer analyzer = new GrammarAnalyzer();

    public GrammarCompiler() {
        this(OpenTelemetry.noop().getTracer("arbor-compiler"));
    }

    public GrammarCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public Grammar compile(GrammarDefinition definition) {
        Span span = tracer.spanBuilder("compile-grammar").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("ruleCount", definition.ruleCount());

            List<Rule> liveRules = runStage("VALIDATION", 1, () -> validate(definition),
                    rules -> Map.of("liveRules", rules.size()));

            Map<String, Domain> categories = runStage("CATEGORY_INDEXING", 2,
                    () -> indexCategories(definition, liveRules),
                    index -> Map.of("categories", index.size()));

            GrammarAnalyzer.Analysis analysis = runStage("ANALYSIS", 3,
                    () -> analyzer.analyze(definition.rules(), categories.keySet()),
                    result -> Map.of(
                            "unproductiveCategories", result.unproductiveCategories().size(),
                            "duplicateRules", result.duplicateRules().size(),
                            "iterations", result.iterations()));
            reportAnalysis(analysis);

            Grammar grammar = runStage("MODEL_BUILDING", 4,
                    () -> buildGrammar(definition, liveRules, categories, analysis, startTime),
                    built -> Map.of("constraints", built.constraints().size()));

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            span.setAttribute("categoryCount", categories.size());
            logger.info(String.format("Compiled grammar: %d rules (%d live), %d categories, %d constraints in %d us",
                    definition.ruleCount(), liveRules.size(), categories.size(),
                    grammar.constraints().size(), TimeUnit.NANOSECONDS.toMicros(compilationTime)));
            return grammar;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T result = stage.get();
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private List<Rule> validate(GrammarDefinition definition) {
        List<Rule> live = new ArrayList<>();
        Set<String> defined = new LinkedHashSet<>(definition.declaredCategories());
        for (Rule rule : definition.rules()) {
            if (!rule.removed()) {
                live.add(rule);
                defined.add(rule.returnType());
            }
        }
        if (live.isEmpty()) {
            throw new GrammarStructureException("Grammar has no rules");
        }
        for (Rule rule : live) {
            for (String childType : rule.childTypes()) {
                if (!defined.contains(childType)) {
                    throw new GrammarStructureException(String.format(
                            "Rule %d of category '%s' refers to category '%s', which has no rules",
                            rule.index(), rule.returnType(), childType));
                }
            }
        }
        return live;
    }

    private Map<String, Domain> indexCategories(GrammarDefinition definition, List<Rule> liveRules) {
        Map<String, List<Integer>> byCategory = new LinkedHashMap<>();
        for (String category : definition.categories()) {
            byCategory.put(category, new ArrayList<>());
        }
        for (Rule rule : liveRules) {
            byCategory.computeIfAbsent(rule.returnType(), c -> new ArrayList<>()).add(rule.index());
        }
        Map<String, Domain> index = new LinkedHashMap<>();
        byCategory.forEach((category, rules) -> index.put(category, Domain.of(rules)));
        return index;
    }

    private void reportAnalysis(GrammarAnalyzer.Analysis analysis) {
        for (String category : analysis.unproductiveCategories()) {
            logger.warning("Category '" + category + "' cannot produce a finite tree");
        }
        for (int rule : analysis.duplicateRules()) {
            logger.warning("Rule " + rule + " duplicates an earlier rule");
        }
    }

    private Grammar buildGrammar(GrammarDefinition definition, List<Rule> liveRules, Map<String, Domain> categories,
                                 GrammarAnalyzer.Analysis analysis, long startTime) {
        List<GrammarConstraint> constraints = definition.constraints();
        for (GrammarConstraint constraint : constraints) {
            if (!constraint.isDomainValid(definition)) {
                throw new ConstraintDomainException("Constraint " + constraint + " no longer fits the grammar");
            }
        }

        List<Integer> terminals = new ArrayList<>();
        for (Rule rule : liveRules) {
            if (rule.isTerminal()) {
                terminals.add(rule.index());
            }
        }

        Grammar.Builder builder = Grammar.builder()
                .withRules(definition.rules())
                .withTerminals(Domain.of(terminals))
                .withRuleMinima(analysis.ruleMinSize(), analysis.ruleMinHeight())
                .withConstraints(constraints);
        categories.forEach((category, rules) -> builder
                .withCategory(category, rules)
                .withCategoryMinima(category,
                        analysis.categoryMinSize().getInt(category),
                        analysis.categoryMinHeight().getInt(category)));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("terminalRules", terminals.size());
        metadata.put("duplicateRules", analysis.duplicateRules().size());
        metadata.put("analysisIterations", analysis.iterations());

        int liveCategories = (int) categories.values().stream().filter(d -> !d.isEmpty()).count();
        GrammarStats stats = new GrammarStats(
                definition.ruleCount(),
                liveRules.size(),
                liveCategories,
                analysis.unproductiveCategories(),
                constraints.size(),
                System.nanoTime() - startTime,
                metadata);
        return builder.withStats(stats).build();
    }
}
