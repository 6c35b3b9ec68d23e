/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.grammar;

import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.api.model.GrammarStats;
import com.arbor.synth.constraint.GrammarConstraint;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.roaringbitmap.IntIterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, indexed form of a {@link GrammarDefinition}.
 *
 * <p>Produced by the grammar compiler and shared by reference between all
 * search branches. Besides the rules it carries the analysis tables the
 * solver prunes with: the smallest size and height of a tree rooted at each
 * rule or category. Unproductive rules have both set to
 * {@link #UNBOUNDED}.
 */
public final class Grammar {

    /** Size or height of a rule from which no finite tree exists. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final List<Rule> rules;
    private final Map<String, Domain> rulesByCategory;
    private final Domain terminals;
    private final int[] ruleMinSize;
    private final int[] ruleMinHeight;
    private final Object2IntMap<String> categoryMinSize;
    private final Object2IntMap<String> categoryMinHeight;
    private final List<GrammarConstraint> constraints;
    private final GrammarStats stats;

    private final Cache<Integer, ContainmentProfile> containmentCache;

    private Grammar(Builder builder) {
        this.rules = List.copyOf(builder.rules);
        this.rulesByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rulesByCategory));
        this.terminals = Objects.requireNonNull(builder.terminals, "terminals");
        this.ruleMinSize = builder.ruleMinSize.clone();
        this.ruleMinHeight = builder.ruleMinHeight.clone();
        this.categoryMinSize = new Object2IntOpenHashMap<>(builder.categoryMinSize);
        this.categoryMinSize.defaultReturnValue(UNBOUNDED);
        this.categoryMinHeight = new Object2IntOpenHashMap<>(builder.categoryMinHeight);
        this.categoryMinHeight.defaultReturnValue(UNBOUNDED);
        this.constraints = List.copyOf(builder.constraints);
        this.stats = builder.stats;

        this.containmentCache = Caffeine.newBuilder()
                .maximumSize(Math.max(16, rules.size()))
                .build();
    }

    public int ruleCount() {
        return rules.size();
    }

    public Rule rule(int index) {
        if (index < 0 || index >= rules.size()) {
            throw new GrammarStructureException("Unknown rule index " + index);
        }
        return rules.get(index);
    }

    public List<Rule> rules() {
        return rules;
    }

    public boolean isRemoved(int index) {
        return rule(index).removed();
    }

    public boolean isTerminal(int index) {
        return rule(index).isTerminal();
    }

    public List<String> childTypes(int index) {
        return rule(index).childTypes();
    }

    public String returnType(int index) {
        return rule(index).returnType();
    }

    public boolean hasCategory(String category) {
        return rulesByCategory.containsKey(category);
    }

    public Set<String> categories() {
        return rulesByCategory.keySet();
    }

    /**
     * Live rules of a category.
     *
     * @throws GrammarStructureException if the grammar does not know the category
     */
    public Domain rulesFor(String category) {
        Domain domain = rulesByCategory.get(category);
        if (domain == null) {
            throw new GrammarStructureException("Unknown category '" + category + "'");
        }
        return domain;
    }

    /**
     * Live rules of a category that can head a tree of at most {@code maxHeight}.
     */
    public Domain rulesWithinHeight(String category, long maxHeight) {
        return rulesFor(category).filter(rule -> ruleMinHeight[rule] != UNBOUNDED && ruleMinHeight[rule] <= maxHeight);
    }

    public Domain terminals() {
        return terminals;
    }

    public int minSize(int rule) {
        return ruleMinSize[rule];
    }

    public int minHeight(int rule) {
        return ruleMinHeight[rule];
    }

    public int minSize(String category) {
        return categoryMinSize.getInt(category);
    }

    public int minHeight(String category) {
        return categoryMinHeight.getInt(category);
    }

    /**
     * Smallest tree size any rule of the domain can head; {@link #UNBOUNDED}
     * for an empty domain.
     */
    public int minSize(Domain domain) {
        int min = UNBOUNDED;
        IntIterator it = domain.iterator();
        while (it.hasNext()) {
            min = Math.min(min, ruleMinSize[it.next()]);
        }
        return min;
    }

    public boolean isProductive(int rule) {
        return ruleMinSize[rule] != UNBOUNDED;
    }

    /**
     * Minimal trees containing {@code target}, per rule. Computed on first
     * use and cached.
     */
    public ContainmentProfile containment(int target) {
        return containmentCache.get(target, t -> ContainmentProfile.compute(this, t));
    }

    /**
     * True when a finite tree headed by {@code rule} can contain {@code target}.
     */
    public boolean canDerive(int rule, int target) {
        return containment(target).canContain(rule);
    }

    public List<GrammarConstraint> constraints() {
        return constraints;
    }

    public GrammarStats stats() {
        return stats;
    }

    /**
     * Renders a tree with the rule labels. Holes render as {@code _}.
     */
    public String render(AbstractRuleNode node) {
        if (node instanceof Hole) {
            return "_";
        }
        Rule rule = rule(node.rule());
        String label = rule.displayLabel();
        List<AbstractRuleNode> children = node.children();
        if (children.isEmpty()) {
            return label;
        }
        List<String> rendered = new ArrayList<>(children.size());
        for (AbstractRuleNode child : children) {
            String text = render(child);
            rendered.add(child.children().isEmpty() || label.equals("{0}") ? text : "(" + text + ")");
        }
        if (!label.contains("{")) {
            return label + "(" + String.join(", ", rendered) + ")";
        }
        String result = label;
        for (int i = 0; i < rendered.size(); i++) {
            result = result.replace("{" + i + "}", rendered.get(i));
        }
        return result;
    }

    @Override
    public String toString() {
        return "Grammar{rules=" + rules.size() + ", categories=" + rulesByCategory.keySet()
                + ", constraints=" + constraints.size() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Rule> rules = new ArrayList<>();
        private final Map<String, Domain> rulesByCategory = new LinkedHashMap<>();
        private Domain terminals = Domain.empty();
        private int[] ruleMinSize = new int[0];
        private int[] ruleMinHeight = new int[0];
        private final Object2IntMap<String> categoryMinSize = new Object2IntOpenHashMap<>();
        private final Object2IntMap<String> categoryMinHeight = new Object2IntOpenHashMap<>();
        private final List<GrammarConstraint> constraints = new ArrayList<>();
        private GrammarStats stats;

        private Builder() {
        }

        public Builder withRules(List<Rule> rules) {
            this.rules.addAll(rules);
            return this;
        }

        public Builder withCategory(String category, Domain rules) {
            this.rulesByCategory.put(category, rules);
            return this;
        }

        public Builder withTerminals(Domain terminals) {
            this.terminals = terminals;
            return this;
        }

        public Builder withRuleMinima(int[] minSize, int[] minHeight) {
            this.ruleMinSize = minSize;
            this.ruleMinHeight = minHeight;
            return this;
        }

        public Builder withCategoryMinima(String category, int minSize, int minHeight) {
            this.categoryMinSize.put(category, minSize);
            this.categoryMinHeight.put(category, minHeight);
            return this;
        }

        public Builder withConstraints(List<GrammarConstraint> constraints) {
            this.constraints.addAll(constraints);
            return this;
        }

        public Builder withStats(GrammarStats stats) {
            this.stats = stats;
            return this;
        }

        public Grammar build() {
            if (ruleMinSize.length != rules.size() || ruleMinHeight.length != rules.size()) {
                throw new IllegalStateException("Rule minima must cover all " + rules.size() + " rules");
            }
            return new Grammar(this);
        }
    }
}
