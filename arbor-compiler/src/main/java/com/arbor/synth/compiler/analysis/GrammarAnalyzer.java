/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.compiler.analysis;

import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.grammar.Rule;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Computes the smallest size and height of a tree headed by each rule and
 * each category, by iterating to a fixpoint. Rules that never reach a finite
 * tree keep {@link Grammar#UNBOUNDED}.
 */
public final class GrammarAnalyzer {

    private static final Logger logger = Logger.getLogger(GrammarAnalyzer.class.getName());

    public Analysis analyze(List<Rule> rules, Collection<String> categories) {
        int n = rules.size();
        int[] minSize = new int[n];
        int[] minHeight = new int[n];
        Arrays.fill(minSize, Grammar.UNBOUNDED);
        Arrays.fill(minHeight, Grammar.UNBOUNDED);

        Object2IntMap<String> categorySize = newMinima(categories);
        Object2IntMap<String> categoryHeight = newMinima(categories);

        int iterations = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            iterations++;
            for (Rule rule : rules) {
                if (rule.removed()) {
                    continue;
                }
                long size = 1;
                int height = 0;
                for (String child : rule.childTypes()) {
                    int childSize = categorySize.getInt(child);
                    if (childSize == Grammar.UNBOUNDED) {
                        size = Grammar.UNBOUNDED;
                        break;
                    }
                    size += childSize;
                    height = Math.max(height, categoryHeight.getInt(child));
                }
                if (size >= Grammar.UNBOUNDED) {
                    continue;
                }
                int index = rule.index();
                if (size < minSize[index]) {
                    minSize[index] = (int) size;
                    changed = true;
                }
                if (height + 1 < minHeight[index]) {
                    minHeight[index] = height + 1;
                    changed = true;
                }
                String category = rule.returnType();
                if (minSize[index] < categorySize.getInt(category)) {
                    categorySize.put(category, minSize[index]);
                }
                if (minHeight[index] < categoryHeight.getInt(category)) {
                    categoryHeight.put(category, minHeight[index]);
                }
            }
        }

        List<String> unproductive = new ArrayList<>();
        for (String category : categories) {
            if (categorySize.getInt(category) == Grammar.UNBOUNDED) {
                unproductive.add(category);
            }
        }
        int rounds = iterations;
        logger.fine(() -> String.format("Grammar analysis converged after %d iterations", rounds));
        return new Analysis(minSize, minHeight, categorySize, categoryHeight, unproductive,
                findDuplicateRules(rules), iterations);
    }

    private static Object2IntMap<String> newMinima(Collection<String> categories) {
        Object2IntMap<String> minima = new Object2IntOpenHashMap<>();
        minima.defaultReturnValue(Grammar.UNBOUNDED);
        for (String category : categories) {
            minima.put(category, Grammar.UNBOUNDED);
        }
        return minima;
    }

    /**
     * Live rules that repeat an earlier rule's category, children and label.
     */
    private static List<Integer> findDuplicateRules(List<Rule> rules) {
        Map<List<Object>, Integer> seen = new HashMap<>();
        List<Integer> duplicates = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.removed()) {
                continue;
            }
            List<Object> key = Arrays.asList(rule.returnType(), rule.childTypes(), Objects.toString(rule.label()));
            if (seen.putIfAbsent(key, rule.index()) != null) {
                duplicates.add(rule.index());
            }
        }
        return duplicates;
    }

    /**
     * @param ruleMinSize            smallest tree size per rule
     * @param ruleMinHeight          smallest tree height per rule
     * @param categoryMinSize        smallest tree size per category
     * @param categoryMinHeight      smallest tree height per category
     * @param unproductiveCategories categories with no finite tree
     * @param duplicateRules         rules identical to an earlier one
     * @param iterations             fixpoint rounds
     */
    public record Analysis(
            int[] ruleMinSize,
            int[] ruleMinHeight,
            Object2IntMap<String> categoryMinSize,
            Object2IntMap<String> categoryMinHeight,
            List<String> unproductiveCategories,
            List<Integer> duplicateRules,
            int iterations
    ) {
    }
}
