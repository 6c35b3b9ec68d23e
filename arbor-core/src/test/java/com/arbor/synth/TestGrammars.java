package com.arbor.synth;

import com.arbor.synth.compiler.GrammarCompiler;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.grammar.GrammarDefinition;

/**
 * Grammars shared by the solver and constraint tests.
 */
public final class TestGrammars {

    public static final int ONE = 0;
    public static final int X = 1;
    public static final int NEG = 2;
    public static final int PLUS = 3;
    public static final int TIMES = 4;

    private TestGrammars() {
    }

    /**
     * {@code Int -> 1 | x | -Int | Int + Int | Int * Int}.
     */
    public static GrammarDefinition arithmeticDefinition() {
        GrammarDefinition definition = new GrammarDefinition();
        definition.addRule("Int", "1");
        definition.addRule("Int", "x");
        definition.addRule("Int", "-{0}", "Int");
        definition.addRule("Int", "{0} + {1}", "Int", "Int");
        definition.addRule("Int", "{0} * {1}", "Int", "Int");
        return definition;
    }

    public static Grammar arithmetic(GrammarConstraint... constraints) {
        GrammarDefinition definition = arithmeticDefinition();
        for (GrammarConstraint constraint : constraints) {
            definition.addConstraint(constraint);
        }
        return new GrammarCompiler().compile(definition);
    }
}
