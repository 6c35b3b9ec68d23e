package com.arbor.synth.infra.metrics;

/**
 * Running total of search events for one strategy tag.
 *
 * <p>The enumerators keep three of these per iterator:
 * {@link MetricsRegistry#STATES_EXPANDED} counts partial trees whose hole was
 * branched on, {@link MetricsRegistry#BRANCHES_PRUNED} counts forks the solver
 * found infeasible, and {@link MetricsRegistry#PROGRAMS_YIELDED} counts complete
 * programs handed to the caller. Totals only grow and are safe to update from
 * several iterators at once.
 */
public interface Counter {

    void increment();

    /**
     * Adds {@code amount} events.
     *
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    void increment(long amount);

    long count();
}
