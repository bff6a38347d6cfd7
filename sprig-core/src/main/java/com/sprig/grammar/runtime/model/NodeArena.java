/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Slot storage for compiled nodes.
 *
 * <p>Every slot index is stable for the lifetime of the arena. A slot is in
 * one of three states:
 * <ul>
 *   <li><b>defined</b>: holds a {@link Node}</li>
 *   <li><b>forwarding</b>: holds no node and redirects to another slot</li>
 *   <li><b>reserved</b>: allocated for a rule whose body is still being
 *   compiled</li>
 * </ul>
 * Forward chains never form a cycle; {@link #forward(int, int)} refuses to
 * create one.
 *
 * <p>A slot nothing refers to any more can be handed back with
 * {@link #release(int)}; the next allocation reuses it before the arena grows.
 *
 * <p>Not thread-safe.
 */
public final class NodeArena<T> {

    static final int NO_FORWARD = -1;

    private final ObjectArrayList<Node<T>> nodes = new ObjectArrayList<>();
    private final IntArrayList forwards = new IntArrayList();
    private final IntArrayList released = new IntArrayList();

    /**
     * Allocates a defined slot, reusing a released one if there is any.
     *
     * @return the slot index
     */
    public int allocate(Node<T> node) {
        if (!released.isEmpty()) {
            int slot = released.popInt();
            nodes.set(slot, node);
            return slot;
        }
        nodes.add(node);
        forwards.add(NO_FORWARD);
        return nodes.size() - 1;
    }

    /**
     * Allocates a reserved slot, to be defined later via {@link #set(int, Node)}.
     */
    public int reserve() {
        return allocate(null);
    }

    /**
     * Appends a slot forwarding to {@code target}.
     */
    public int allocateForward(int target) {
        checkSlot(target);
        int slot = reserve();
        forwards.set(slot, target);
        return slot;
    }

    /**
     * Defines {@code slot} as {@code node}, dropping any forward it had.
     */
    public void set(int slot, Node<T> node) {
        checkSlot(slot);
        nodes.set(slot, node);
        forwards.set(slot, NO_FORWARD);
    }

    /**
     * Turns {@code slot} into a forward to {@code target}.
     *
     * @return false, leaving the slot untouched, if {@code target} already
     *         reaches {@code slot} (the forward would close a cycle)
     */
    public boolean forward(int slot, int target) {
        checkSlot(slot);
        checkSlot(target);
        if (reaches(target, slot)) {
            return false;
        }
        nodes.set(slot, null);
        forwards.set(slot, target);
        return true;
    }

    /**
     * Returns {@code slot} for reuse. The caller guarantees that no registered
     * name, composite node or forward still refers to it.
     */
    public void release(int slot) {
        checkSlot(slot);
        nodes.set(slot, null);
        forwards.set(slot, NO_FORWARD);
        released.push(slot);
    }

    /**
     * Follows forwards from {@code slot} to the slot that holds (or will hold)
     * a node.
     */
    public int resolve(int slot) {
        checkSlot(slot);
        int current = slot;
        int next;
        while ((next = forwards.getInt(current)) != NO_FORWARD) {
            current = next;
        }
        return current;
    }

    /**
     * Node that {@code slot} resolves to.
     *
     * @throws IllegalStateException if the resolved slot is only reserved
     */
    public Node<T> node(int slot) {
        int resolved = resolve(slot);
        Node<T> node = nodes.get(resolved);
        if (node == null) {
            throw new IllegalStateException("Slot " + resolved + " is reserved but not defined");
        }
        return node;
    }

    public boolean isDefined(int slot) {
        return nodes.get(resolve(slot)) != null;
    }

    public boolean isForward(int slot) {
        checkSlot(slot);
        return forwards.getInt(slot) != NO_FORWARD;
    }

    /**
     * Number of slots ever allocated, released ones included.
     */
    public int size() {
        return nodes.size();
    }

    public int releasedCount() {
        return released.size();
    }

    /**
     * True if the forward chain starting at {@code from} passes through
     * {@code slot} (including {@code from == slot}).
     */
    private boolean reaches(int from, int slot) {
        int current = from;
        while (true) {
            if (current == slot) {
                return true;
            }
            int next = forwards.getInt(current);
            if (next == NO_FORWARD) {
                return false;
            }
            current = next;
        }
    }

    private void checkSlot(int slot) {
        if (slot < 0 || slot >= nodes.size()) {
            throw new IndexOutOfBoundsException("No arena slot " + slot + " (size " + nodes.size() + ")");
        }
    }
}
