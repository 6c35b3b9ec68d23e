package com.arbor.synth.infra.metrics.internal;


import com.arbor.synth.infra.metrics.MetricsRegistry;
import com.arbor.synth.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide MetricsRegistry.
 * Uses ServiceLoader for discovery.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE;

    static {
        ServiceLoader<MetricsRegistryProvider> loader =
                ServiceLoader.load(MetricsRegistryProvider.class);

        // Select highest-priority provider
        MetricsRegistryProvider provider = StreamSupport.stream(
                        loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info(String.format("Using metrics provider: %s (priority: %d)",
                    provider.name(), provider.priority()));
        } else {
            INSTANCE = new NoOpMetricsRegistry();
            logger.fine("No metrics provider found, using no-op implementation");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
