package com.arbor.synth.infra.metrics.api;

import com.arbor.synth.infra.metrics.MetricsRegistry;

/**
 * Plugs a {@link MetricsRegistry} into the enumerators.
 *
 * <p>Providers are found with {@link java.util.ServiceLoader} the first time a
 * search asks for its counters; the one with the highest {@link #priority()} supplies the
 * registry for the whole process. Without any provider the search counters
 * go to a no-op registry.
 */
public interface MetricsRegistryProvider {

    /**
     * Called once. The registry is shared by all concurrently running
     * iterators.
     */
    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    /**
     * Shown in the log line that reports the chosen provider.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
