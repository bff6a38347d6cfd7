/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.model.NodeType;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;

/**
 * Terminal node; evaluation yields exactly {@link #value()}.
 */
public record LeafNode<T>(T value) implements Node<T> {

    public LeafNode {
        Objects.requireNonNull(value, "leaf value must not be null");
    }

    @Override
    public NodeType type() {
        return NodeType.LEAF;
    }

    @Override
    public IntList children() {
        return IntLists.emptyList();
    }
}
