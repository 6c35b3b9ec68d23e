package com.arbor.synth.api;

import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.grammar.GrammarDefinition;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for turning an authored grammar into its immutable, indexed form.
 */
public interface IGrammarCompiler {

    /**
     * Compiles a grammar definition.
     *
     * @param definition the rules and constraints to compile
     * @return compiled grammar, safe to share between search branches
     * @throws com.arbor.synth.api.exceptions.GrammarStructureException if the rules are inconsistent
     * @throws com.arbor.synth.api.exceptions.ConstraintDomainException if a constraint no longer fits the rules
     */
    Grammar compile(GrammarDefinition definition);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
