package com.arbor.synth.infra.metrics.impl.inmemory;


import com.arbor.synth.infra.metrics.Counter;
import com.arbor.synth.infra.metrics.Gauge;
import com.arbor.synth.infra.metrics.MetricsRegistry;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every metric in memory so tests and benchmarks can read them back.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), InMemoryGauge::new);
    }

    /**
     * Current counter values by key, sorted.
     */
    public Map<String, Long> counterValues() {
        Map<String, Long> values = new TreeMap<>();
        counters.forEach((key, counter) -> values.put(key, counter.count()));
        return values;
    }

    private static String key(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + String.join(",", tags));
        }
        if (tags.length == 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
