/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.model;

/**
 * Variants of a compiled grammar node, used for evaluator dispatch.
 */
public enum NodeType {
    /** Terminal node yielding one literal value. */
    LEAF,
    /** Concatenation of its children in order. */
    SEQUENCE,
    /** Weighted random pick of exactly one child. */
    SELECTOR,
    /** Its child repeated a fixed number of times. */
    REPETITION,
    /** Primary child unless the depth limit diverts to the fallback child. */
    FALLBACK
}
