package com.arbor.synth.infra.metrics.impl.inmemory;

import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.infra.metrics.api.MetricsRegistryProvider;

/**
 * Keeps search counters in memory so tests can read expansion, pruning and
 * yield totals back through {@link InMemoryMetricsRegistry#counterValues()}.
 *
 * <p>Registered for the search module's tests in
 * {@code META-INF/services/com.arbor.synth.infra.metrics.api.MetricsRegistryProvider}.
 * It outranks any production provider on the same class path.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    private static final int TEST_PRIORITY = 1000;

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return TEST_PRIORITY;
    }

    @Override
    public String name() {
        return "in-memory search metrics";
    }
}
