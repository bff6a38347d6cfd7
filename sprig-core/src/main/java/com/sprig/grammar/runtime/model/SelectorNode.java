/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.model.NodeType;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Weighted choice between options; evaluation draws exactly one.
 *
 * <p>{@code options.getInt(i)} is drawn with probability
 * {@code weights.getDouble(i) / totalWeight()}.
 */
public record SelectorNode<T>(IntList options, DoubleList weights) implements Node<T> {

    public SelectorNode {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("selector needs at least one option");
        }
        if (options.size() != weights.size()) {
            throw new IllegalArgumentException(
                    "selector has " + options.size() + " options but " + weights.size() + " weights");
        }
        double total = 0.0;
        for (int i = 0; i < weights.size(); i++) {
            double w = weights.getDouble(i);
            if (!(w > 0.0) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("selector weight must be positive and finite, got: " + w);
            }
            total += w;
        }
        if (Double.isInfinite(total)) {
            throw new IllegalArgumentException("selector weights overflow: total is infinite");
        }
        options = IntLists.unmodifiable(new IntArrayList(options));
        weights = DoubleLists.unmodifiable(new DoubleArrayList(weights));
    }

    public double totalWeight() {
        double total = 0.0;
        for (int i = 0; i < weights.size(); i++) {
            total += weights.getDouble(i);
        }
        return total;
    }

    /**
     * Index of the first option whose running cumulative weight exceeds
     * {@code sample}. A sample at or past the total (rounding) picks the last
     * option.
     *
     * @param sample value in {@code [0, totalWeight())}
     */
    public int pick(double sample) {
        double cumulative = 0.0;
        for (int i = 0; i < weights.size(); i++) {
            cumulative += weights.getDouble(i);
            if (cumulative > sample) {
                return i;
            }
        }
        return weights.size() - 1;
    }

    @Override
    public IntList children() {
        return options;
    }

    @Override
    public NodeType type() {
        return NodeType.SELECTOR;
    }
}
