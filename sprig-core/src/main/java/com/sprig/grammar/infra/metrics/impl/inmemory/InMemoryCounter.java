/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.impl.inmemory;

import com.sprig.grammar.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong(0);
    private final String name;

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{name='" + name + "', count=" + value.get() + "}";
    }
}
