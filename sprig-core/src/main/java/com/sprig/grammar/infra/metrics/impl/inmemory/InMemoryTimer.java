/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics.impl.inmemory;

import com.sprig.grammar.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link Timer} for testing.
 * Stores all recorded durations for assertions.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    List<Duration> getRecordings() {
        return Collections.unmodifiableList(new ArrayList<>(recordings));
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d}", name, recordings.size());
    }
}
