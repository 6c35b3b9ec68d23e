package com.arbor.synth.infra.metrics.impl.inmemory;


import com.arbor.synth.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {
    private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final String name;

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double value) {
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }

    @Override
    public String toString() {
        return name + "=" + value();
    }
}
