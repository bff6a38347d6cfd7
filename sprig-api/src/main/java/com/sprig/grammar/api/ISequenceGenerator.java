/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Contract for drawing output sequences from a compiled grammar.
 *
 * <p>Implementations are not thread-safe unless stated otherwise: the registry
 * they read from may be mutated by compilation, and the default random source
 * is shared.
 *
 * @param <T> payload type of leaf values
 */
public interface ISequenceGenerator<T> {

    /**
     * Evaluates the named rule from depth zero.
     *
     * @param ruleName entry rule
     * @return generated values in order, never null
     * @throws com.sprig.grammar.api.exceptions.RuleNotFoundException if no rule has that name
     */
    List<T> generateSequence(String ruleName);

    /**
     * Generates {@code count} independent sequences from the same rule.
     *
     * @param ruleName entry rule
     * @param count    number of sequences, not negative
     * @return one list per draw, in draw order
     */
    default List<List<T>> generateBatch(String ruleName, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<List<T>> batch = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            batch.add(generateSequence(ruleName));
        }
        return batch;
    }
}
