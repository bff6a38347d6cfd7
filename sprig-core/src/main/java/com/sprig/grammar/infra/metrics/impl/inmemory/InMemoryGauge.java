/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.impl.inmemory;

import com.sprig.grammar.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {
    // Double stored as raw long bits for atomic updates
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
        return "InMemoryGauge{name='" + name + "', value=" + value() + "}";
    }
}
