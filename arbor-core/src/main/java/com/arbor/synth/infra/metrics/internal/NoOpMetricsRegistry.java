package com.arbor.synth.infra.metrics.internal;


import com.arbor.synth.infra.metrics.Counter;
import com.arbor.synth.infra.metrics.Gauge;
import com.arbor.synth.infra.metrics.MetricsRegistry;

/**
 * No-op implementation.
 * Used as fallback when no provider is configured.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new NoOpCounter();
    private static final Gauge NO_OP_GAUGE = new NoOpGauge();

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return NO_OP_GAUGE;
    }

    private static final class NoOpCounter implements Counter {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    }

    private static final class NoOpGauge implements Gauge {
        public void set(double value) {}
        public double value() { return 0.0; }
    }
}
