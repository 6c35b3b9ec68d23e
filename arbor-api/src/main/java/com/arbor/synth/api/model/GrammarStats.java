package com.arbor.synth.api.model;

import java.util.List;
import java.util.Map;

/**
 * Summary of a compiled grammar.
 *
 * @param ruleCount              number of rule indices, tombstones included
 * @param liveRuleCount          rules that can be used in trees
 * @param categoryCount          number of categories with at least one live rule
 * @param unproductiveCategories categories from which no finite tree exists
 * @param constraintCount        attached grammar constraints
 * @param compilationTimeNanos   wall time of the compilation
 * @param metadata               stage specific details
 */
public record GrammarStats(
        int ruleCount,
        int liveRuleCount,
        int categoryCount,
        List<String> unproductiveCategories,
        int constraintCount,
        long compilationTimeNanos,
        Map<String, Object> metadata
) {
    public GrammarStats {
        unproductiveCategories = List.copyOf(unproductiveCategories);
        metadata = Map.copyOf(metadata);
    }
}
