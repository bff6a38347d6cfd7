/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.impl.inmemory;

import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>To enable in tests, create:
 * <pre>
 * src/test/resources/META-INF/services/com.sprig.grammar.infra.metrics.api.MetricsRegistryProvider
 *
 * Contents:
 * com.sprig.grammar.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider
 * </pre>
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // Highest priority in test environment
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
