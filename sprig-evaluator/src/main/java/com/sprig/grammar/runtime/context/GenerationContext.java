/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.context;

import com.sprig.grammar.infra.config.GrammarConfig;

import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Per-call state of a generation: the random source plus a few counters.
 *
 * THREAD SAFETY: not thread-safe. Threads generating from the same grammar
 * must each pass their own context.
 */
public final class GenerationContext {

    private final RandomGenerator random;

    // Stats, accumulated until reset()
    private long nodesEvaluated;
    private int fallbackDiversions;
    private int maxDepthReached;

    public GenerationContext(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Context whose draws are fully determined by {@code seed}.
     */
    public static GenerationContext seeded(long seed) {
        return new GenerationContext(new Random(seed));
    }

    public static GenerationContext unseeded() {
        return new GenerationContext(new Random());
    }

    /**
     * Seeded context if the config carries a seed, unseeded otherwise.
     */
    public static GenerationContext fromConfig(GrammarConfig config) {
        return config.getSeed().isPresent()
                ? seeded(config.getSeed().getAsLong())
                : unseeded();
    }

    public RandomGenerator random() {
        return random;
    }

    public void recordNode(int depth) {
        nodesEvaluated++;
        if (depth > maxDepthReached) {
            maxDepthReached = depth;
        }
    }

    public void recordFallbackDiversion() {
        fallbackDiversions++;
    }

    public long getNodesEvaluated() {
        return nodesEvaluated;
    }

    public int getFallbackDiversions() {
        return fallbackDiversions;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    /**
     * Clears the stats. The random source keeps its state.
     */
    public void reset() {
        nodesEvaluated = 0;
        fallbackDiversions = 0;
        maxDepthReached = 0;
    }
}
