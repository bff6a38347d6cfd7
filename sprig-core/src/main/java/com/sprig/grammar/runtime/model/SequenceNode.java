/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.model.NodeType;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Concatenates the output of its children, left to right.
 */
public record SequenceNode<T>(IntList children) implements Node<T> {

    public SequenceNode {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("sequence needs at least one child");
        }
        children = IntLists.unmodifiable(new IntArrayList(children));
    }

    @Override
    public NodeType type() {
        return NodeType.SEQUENCE;
    }
}
