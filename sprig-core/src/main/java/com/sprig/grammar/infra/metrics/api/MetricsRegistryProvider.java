/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.api;

import com.sprig.grammar.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Have a public no-arg constructor
 *   <li>Be thread-safe
 *   <li>Register themselves via ServiceLoader
 * </ul>
 */
public interface MetricsRegistryProvider {

    /**
     * Creates a new MetricsRegistry instance.
     *
     * @return registry instance (must be thread-safe)
     */
    MetricsRegistry create();

    /**
     * Provider priority for selection.
     * Higher values are preferred when multiple providers exist.
     *
     * @return priority (default: 0)
     */
    default int priority() {
        return 0;
    }

    /**
     * Provider name for logging.
     *
     * @return human-readable name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
