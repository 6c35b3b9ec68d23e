package com.arbor.synth.grammar;

import java.util.List;
import java.util.Objects;

/**
 * A production {@code returnType -> childTypes}.
 *
 * <p>The label renders the rule; placeholders {@code {0}}, {@code {1}}, ...
 * stand for the children in order. A removed rule keeps its index as a
 * tombstone until the grammar is compacted.
 *
 * @param index      position of the rule in its grammar
 * @param returnType category the rule derives
 * @param childTypes categories of the children, empty for terminals
 * @param label      rendering template, may be {@code null}
 * @param weight     relative weight, 1.0 unless given
 * @param removed    whether the rule was removed from the grammar
 */
public record Rule(int index, String returnType, List<String> childTypes, String label, double weight,
                   boolean removed) {

    public Rule {
        Objects.requireNonNull(returnType, "returnType");
        childTypes = List.copyOf(childTypes);
    }

    public boolean isTerminal() {
        return childTypes.isEmpty();
    }

    public int arity() {
        return childTypes.size();
    }

    Rule withIndex(int newIndex) {
        return new Rule(newIndex, returnType, childTypes, label, weight, removed);
    }

    Rule asRemoved() {
        return new Rule(index, returnType, childTypes, label, weight, true);
    }

    /**
     * Label used for rendering; rules without one render as {@code r<index>}.
     */
    public String displayLabel() {
        if (label != null) {
            return label;
        }
        if (childTypes.isEmpty()) {
            return "r" + index;
        }
        StringBuilder sb = new StringBuilder("r").append(index).append('(');
        for (int i = 0; i < childTypes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('{').append(i).append('}');
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return index + ": " + returnType + " = " + (label != null ? label : childTypes) + (removed ? " (removed)" : "");
    }
}
