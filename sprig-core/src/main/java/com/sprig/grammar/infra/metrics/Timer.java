/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics;

import java.time.Duration;

/**
 * Records latencies. Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);
}
