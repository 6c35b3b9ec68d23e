package com.arbor.synth.tree.template;

import com.arbor.synth.tree.Domain;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;

import java.util.List;
import java.util.Optional;

/**
 * Matches any subtree. Every occurrence of the same name must match the
 * same subtree.
 */
public record VarTemplate(String name) implements TemplateNode {

    public VarTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    @Override
    public List<TemplateNode> children() {
        return List.of();
    }

    @Override
    public Domain rootRules() {
        return null;
    }

    @Override
    public Optional<TemplateNode> remap(Int2IntFunction mapping) {
        return Optional.of(this);
    }
}
