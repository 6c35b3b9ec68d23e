package com.arbor.synth.infra.metrics;

/**
 * Source of named search metrics.
 *
 * <p>Tags are alternating key/value pairs; the same name and tags always
 * return the same metric.
 */
public interface MetricsRegistry {

    String STATES_EXPANDED = "arbor.search.states.expanded";
    String BRANCHES_PRUNED = "arbor.search.branches.pruned";
    String PROGRAMS_YIELDED = "arbor.search.programs.yielded";
    String FRONTIER_SIZE = "arbor.search.frontier.size";

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);
}
