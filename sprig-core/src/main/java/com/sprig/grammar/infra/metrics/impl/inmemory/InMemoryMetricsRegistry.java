/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.impl.inmemory;

import com.sprig.grammar.infra.metrics.Counter;
import com.sprig.grammar.infra.metrics.Gauge;
import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * Grammar<String> grammar = Grammar.forStrings(GrammarConfig.defaults(), metrics, tracer);
 *
 * grammar.generateSequence("sentence");
 *
 * assertThat(metrics.getCounterValue("grammar_sequences_generated")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name) {
        return counters.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name) {
        return gauges.computeIfAbsent(name, InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name) {
        return timers.computeIfAbsent(name, InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        Gauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
