package com.arbor.synth.api.model;

/**
 * Counters of one enumeration run.
 *
 * @param expandedStates  partial trees whose selected hole was branched on
 * @param prunedBranches  branches dropped because propagation made them infeasible
 * @param yieldedPrograms complete trees returned to the caller
 */
public record SearchStatistics(long expandedStates, long prunedBranches, long yieldedPrograms) {

    public static SearchStatistics empty() {
        return new SearchStatistics(0, 0, 0);
    }
}
