package com.arbor.synth.infra.metrics;

/**
 * Last observed value of a search quantity.
 *
 * <p>{@link MetricsRegistry#FRONTIER_SIZE} is the only gauge the enumerators
 * set: the number of partial trees waiting in the queue (BFS) or on the stack
 * (DFS) after each expansion.
 */
public interface Gauge {

    void set(double value);

    double value();
}
