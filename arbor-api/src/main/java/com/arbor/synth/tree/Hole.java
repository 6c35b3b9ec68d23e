package com.arbor.synth.tree;

import java.util.List;
import java.util.Objects;

/**
 * An undecided position: the category it must derive and the rules it may
 * still become. A hole never has children; they are created when the hole
 * is filled.
 */
public final class Hole extends AbstractRuleNode {

    private final String category;
    private final Domain domain;

    public Hole(String category, Domain domain) {
        this.category = Objects.requireNonNull(category, "category");
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public String category() {
        return category;
    }

    public Domain domain() {
        return domain;
    }

    public Hole withDomain(Domain narrowed) {
        return narrowed.equals(domain) ? this : new Hole(category, narrowed);
    }

    /**
     * A hole is filled once only one rule remains.
     */
    @Override
    public boolean isFilled() {
        return domain.isSingleton();
    }

    @Override
    public int rule() {
        if (!domain.isSingleton()) {
            throw new IllegalStateException("Hole " + this + " has no decided rule");
        }
        return domain.first();
    }

    @Override
    public List<AbstractRuleNode> children() {
        return List.of();
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int height() {
        return 1;
    }

    @Override
    public boolean isComplete() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hole other)) return false;
        return category.equals(other.category) && domain.equals(other.domain);
    }

    @Override
    public int hashCode() {
        return 31 * category.hashCode() + domain.hashCode();
    }

    @Override
    public String toString() {
        return "Hole[" + category + "]" + domain;
    }
}
