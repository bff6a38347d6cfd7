/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics;

import com.sprig.grammar.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter errors = metrics.counter("grammar_compile_errors");
 * errors.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @return thread-safe counter instance
     */
    Counter counter(String name);

    /**
     * Creates or retrieves a gauge metric.
     *
     * @param name metric name
     * @return thread-safe gauge instance
     */
    Gauge gauge(String name);

    /**
     * Creates or retrieves a timer histogram.
     *
     * @param name metric name
     * @return thread-safe timer instance
     */
    Timer timer(String name);

    /**
     * Gets the singleton registry instance.
     *
     * <p>Falls back to no-op if no provider is found.
     *
     * @return global metrics registry
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
