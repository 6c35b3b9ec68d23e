package com.arbor.synth.tree.template;

import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.TreePath;

import java.util.List;
import java.util.Map;

/**
 * Outcome of matching a template against a (partial) tree.
 */
public interface PatternMatchResult {

    PatternMatchResult NO_MATCH = new NoMatch();

    /**
     * No completion of the tree can match the template.
     */
    record NoMatch() implements PatternMatchResult {
    }

    /**
     * The template matches whatever the remaining holes become.
     *
     * @param bindings variable name to the bound subtree and its position
     */
    record Match(Map<String, Binding> bindings) implements PatternMatchResult {
        public Match {
            bindings = Map.copyOf(bindings);
        }

        public Binding binding(String variable) {
            Binding binding = bindings.get(variable);
            if (binding == null) {
                throw new IllegalArgumentException("Variable " + variable + " is not bound");
            }
            return binding;
        }
    }

    /**
     * Whether the template matches depends on holes.
     *
     * @param requirements holes together with the rules they would need for a match
     * @param exact        true when meeting every requirement is enough for a match
     */
    record PartialMatch(List<HoleRequirement> requirements, boolean exact) implements PatternMatchResult {
        public PartialMatch {
            requirements = List.copyOf(requirements);
        }
    }

    record Binding(TreePath path, AbstractRuleNode node) {
    }

    record HoleRequirement(TreePath path, Domain rules) {
    }
}
