package com.arbor.synth.tree.template;

import com.arbor.synth.tree.Domain;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.List;
import java.util.Optional;

/**
 * Matches a node filled with exactly {@code rule} whose children match {@code children}.
 */
public record RuleTemplate(int rule, List<TemplateNode> children) implements TemplateNode {

    public RuleTemplate {
        if (rule < 0) {
            throw new IllegalArgumentException("Rule index must be non-negative: " + rule);
        }
        children = List.copyOf(children);
    }

    @Override
    public Domain rootRules() {
        return Domain.of(rule);
    }

    @Override
    public Optional<TemplateNode> remap(Int2IntFunction mapping) {
        int mapped = mapping.get(rule);
        if (mapped < 0) {
            return Optional.empty();
        }
        return TemplateNode.remapAll(children, mapping).map(remapped -> new RuleTemplate(mapped, remapped));
    }
}
