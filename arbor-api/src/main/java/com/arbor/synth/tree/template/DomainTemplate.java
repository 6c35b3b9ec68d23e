package com.arbor.synth.tree.template;

import com.arbor.synth.tree.Domain;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches a node filled with any rule of {@code domain}.
 */
public record DomainTemplate(Domain domain, List<TemplateNode> children) implements TemplateNode {

    public DomainTemplate {
        Objects.requireNonNull(domain, "domain");
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("Domain template needs at least one rule");
        }
        children = List.copyOf(children);
    }

    @Override
    public Domain rootRules() {
        return domain;
    }

    /**
     * Removed rules are dropped from the domain; the template survives as
     * long as one rule is left.
     */
    @Override
    public Optional<TemplateNode> remap(Int2IntFunction mapping) {
        List<Integer> kept = new ArrayList<>();
        for (int rule : domain.toArray()) {
            int mapped = mapping.get(rule);
            if (mapped >= 0) {
                kept.add(mapped);
            }
        }
        if (kept.isEmpty()) {
            return Optional.empty();
        }
        return TemplateNode.remapAll(children, mapping)
                .map(remapped -> new DomainTemplate(Domain.of(kept), remapped));
    }
}
