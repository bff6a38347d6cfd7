/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.model.NodeType;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Concatenates the output of {@code child} {@code count} times.
 */
public record RepetitionNode<T>(int child, int count) implements Node<T> {

    public RepetitionNode {
        if (count < 0) {
            throw new IllegalArgumentException("repetition count must not be negative, got: " + count);
        }
    }

    @Override
    public NodeType type() {
        return NodeType.REPETITION;
    }

    @Override
    public IntList children() {
        return IntLists.singleton(child);
    }
}
