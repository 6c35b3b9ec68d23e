package com.arbor.synth.benchmark;

import com.arbor.synth.compiler.GrammarCompiler;
import com.arbor.synth.constraints.Forbidden;
import com.arbor.synth.constraints.ForbiddenSequence;
import com.arbor.synth.constraints.Ordered;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.search.BFSIterator;
import com.arbor.synth.search.DFSIterator;
import com.arbor.synth.search.SearchConfig;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.template.TemplateNode;
import io.opentelemetry.api.OpenTelemetry;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Enumeration throughput over an arithmetic grammar with ten digit terminals,
 * addition and multiplication.
 *
 * <p>USAGE:
 * <pre>
 * mvn clean package -pl arbor-benchmarks -am -DskipTests
 * java -cp "arbor-benchmarks/target/classes:..." com.arbor.synth.benchmark.EnumerationBenchmark
 * </pre>
 *
 * <p>CONFIGURATION:
 * <ul>
 *   <li>{@code -Dbench.quick} : fewer and shorter iterations</li>
 * </ul>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class EnumerationBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final int WARMUP_ITERATIONS = QUICK_MODE ? 2 : 5;
    private static final int MEASUREMENT_ITERATIONS = QUICK_MODE ? 3 : 10;

    @Param({"5", "7"})
    private int maxSize;

    @Param({"NONE", "SYMMETRY", "FULL"})
    private String constraintSet;

    private Grammar grammar;
    private SearchConfig config;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.arbor").setLevel(java.util.logging.Level.WARNING);

        GrammarDefinition definition = new GrammarDefinition();
        for (int digit = 0; digit < 10; digit++) {
            definition.addRule("Int", String.valueOf(digit));
        }
        int plus = definition.addRule("Int", "{0} + {1}", "Int", "Int");
        int times = definition.addRule("Int", "{0} * {1}", "Int", "Int");

        if (!"NONE".equals(constraintSet)) {
            Domain commutative = Domain.of(plus, times);
            definition.addConstraint(new Ordered(
                    TemplateNode.anyOf(commutative, TemplateNode.var("a"), TemplateNode.var("b")),
                    List.of("a", "b")));
        }
        if ("FULL".equals(constraintSet)) {
            definition.addConstraint(new Forbidden(
                    TemplateNode.rule(times, TemplateNode.rule(1), TemplateNode.var("A"))));
            definition.addConstraint(new Forbidden(
                    TemplateNode.rule(plus, TemplateNode.rule(0), TemplateNode.var("A"))));
            definition.addConstraint(new ForbiddenSequence(IntArrayList.of(times, 0)));
        }

        grammar = new GrammarCompiler(OpenTelemetry.noop().getTracer("noop")).compile(definition);
        config = SearchConfig.builder().maxSize(maxSize).build();
    }

    @Benchmark
    public void breadthFirst(Blackhole bh) {
        for (RuleNode program : new BFSIterator(grammar, "Int", config)) {
            bh.consume(program);
        }
    }

    @Benchmark
    public void depthFirst(Blackhole bh) {
        for (RuleNode program : new DFSIterator(grammar, "Int", config)) {
            bh.consume(program);
        }
    }

    @Benchmark
    public RuleNode firstHundred() {
        SearchConfig limited = config.toBuilder().maxEnumerations(100).build();
        RuleNode last = null;
        for (RuleNode program : new BFSIterator(grammar, "Int", limited)) {
            last = program;
        }
        return last;
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(EnumerationBenchmark.class.getSimpleName())
                .warmupIterations(WARMUP_ITERATIONS)
                .measurementIterations(MEASUREMENT_ITERATIONS)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}
