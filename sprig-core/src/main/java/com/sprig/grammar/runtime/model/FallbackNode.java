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
 * Evaluates {@code primary} one level deeper while the depth limit allows,
 * {@code fallback} at the current depth once it does not.
 *
 * <p>The primary edge is the only edge along which a rule may refer back to
 * itself.
 */
public record FallbackNode<T>(int primary, int fallback) implements Node<T> {

    @Override
    public NodeType type() {
        return NodeType.FALLBACK;
    }

    @Override
    public IntList children() {
        return IntLists.unmodifiable(IntArrayList.wrap(new int[]{primary, fallback}));
    }
}
