/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.internal;

import com.sprig.grammar.infra.metrics.Counter;
import com.sprig.grammar.infra.metrics.Gauge;
import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.metrics.Timer;

import java.time.Duration;

/**
 * No-op implementation.
 * Used as fallback when no provider configured.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new NoOpCounter();
    private static final Gauge NO_OP_GAUGE = new NoOpGauge();
    private static final Timer NO_OP_TIMER = new NoOpTimer();

    @Override
    public Counter counter(String name) {
        return NO_OP_COUNTER;
    }

    @Override
    public Gauge gauge(String name) {
        return NO_OP_GAUGE;
    }

    @Override
    public Timer timer(String name) {
        return NO_OP_TIMER;
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

    private static final class NoOpTimer implements Timer {
        public void record(Duration duration) {}
    }
}
