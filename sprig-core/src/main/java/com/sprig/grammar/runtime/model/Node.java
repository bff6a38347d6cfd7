/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.model.NodeType;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A compiled grammar node.
 *
 * <p>Nodes are immutable. Composite nodes never hold other nodes directly:
 * they hold arena slot indices, and the slot is resolved at evaluation time.
 * Redefining a rule therefore rewrites one slot and every composite holding
 * that slot observes the change.
 *
 * @param <T> payload type of leaf values
 * @see NodeArena
 */
public sealed interface Node<T> permits LeafNode, SequenceNode, SelectorNode, RepetitionNode, FallbackNode {

    /**
     * Variant tag used by the evaluator for dispatch.
     */
    NodeType type();

    /**
     * Slots this node refers to, in evaluation order. Empty for leaves.
     */
    IntList children();
}
