/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.model;

import com.sprig.grammar.api.exceptions.RuleNotFoundException;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import java.util.logging.Logger;

/**
 * Owns the mapping from rule name to compiled node.
 *
 * <p>Each name owns exactly one {@link NodeArena} slot for as long as it is
 * registered. Composite nodes refer to a rule through that slot, so
 * <b>redefinition is identity-preserving</b>: writing a new node into the
 * name's slot is observed by every existing referrer without recompiling it.
 *
 * <p>An alias ({@code name = other}) does not create a node. The name's slot
 * forwards to the other rule's slot, so the two names share one node and the
 * alias follows later redefinitions of its target.
 *
 * <p>Not thread-safe. Compilation and generation must not run concurrently
 * against the same registry.
 *
 * @param <T> payload type of leaf values
 */
public final class RuleRegistry<T> {
    private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

    private static final int NO_SLOT = -1;

    private final NodeArena<T> arena = new NodeArena<>();
    private final Object2IntLinkedOpenHashMap<String> slots = new Object2IntLinkedOpenHashMap<>();

    public RuleRegistry() {
        slots.defaultReturnValue(NO_SLOT);
    }

    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    /**
     * True if {@code name} is registered and resolves to a compiled node.
     */
    public boolean isDefined(String name) {
        int slot = slots.getInt(name);
        return slot != NO_SLOT && arena.isDefined(slot);
    }

    /**
     * The slot owned by {@code name}. Composites store this index.
     *
     * @throws RuleNotFoundException if the name is not registered
     */
    public int slotOf(String name) {
        int slot = slots.getInt(name);
        if (slot == NO_SLOT) {
            throw new RuleNotFoundException(name);
        }
        return slot;
    }

    /**
     * Node the name currently resolves to.
     *
     * @throws RuleNotFoundException if the name is not registered
     * @throws IllegalStateException if the name is reserved but its body is not compiled yet
     */
    public Node<T> get(String name) {
        return arena.node(slotOf(name));
    }

    /**
     * Node the slot currently resolves to.
     */
    public Node<T> nodeAt(int slot) {
        return arena.node(slot);
    }

    /**
     * True if {@code slot} resolves to a compiled node.
     */
    public boolean isDefinedSlot(int slot) {
        return arena.isDefined(slot);
    }

    /**
     * Slot holding the node that {@code slot} resolves to.
     */
    public int resolve(int slot) {
        return arena.resolve(slot);
    }

    /**
     * Returns the slot {@code name} will be (re)defined in, reserving one for a
     * new name. Self-references compiled before {@link #install(int, Node)}
     * resolve to this slot.
     */
    public int claim(String name) {
        Objects.requireNonNull(name, "rule name must not be null");
        int slot = slots.getInt(name);
        if (slot == NO_SLOT) {
            slot = arena.reserve();
            slots.put(name, slot);
        }
        return slot;
    }

    /**
     * Defines a claimed slot.
     */
    public void install(int slot, Node<T> node) {
        arena.set(slot, Objects.requireNonNull(node, "node must not be null"));
    }

    /**
     * Installs or replaces the node at {@code name}.
     *
     * @return true if the name already existed
     */
    public boolean put(String name, Node<T> node) {
        boolean existed = contains(name);
        install(claim(name), node);
        return existed;
    }

    /**
     * Registers a leaf wrapping an arbitrary payload, bypassing text
     * compilation. An existing name is redefined in place.
     *
     * @return true if the name already existed
     */
    public boolean registerLeaf(String name, T value) {
        boolean existed = put(name, new LeafNode<>(value));
        logger.fine(() -> (existed ? "Redefined" : "Registered") + " leaf rule '" + name + "'");
        return existed;
    }

    /**
     * Makes {@code name} a synonym of {@code target}. No node is created.
     *
     * <p>Aliasing a name to a rule that already resolves through it (itself,
     * or an alias of itself) changes nothing.
     *
     * @return true if the name already existed
     * @throws RuleNotFoundException if {@code target} is not registered
     */
    public boolean alias(String name, String target) {
        int targetSlot = slotOf(target);
        int slot = slots.getInt(name);
        if (slot == NO_SLOT) {
            slots.put(name, arena.allocateForward(targetSlot));
            return false;
        }
        if (!arena.forward(slot, targetSlot)) {
            logger.fine(() -> "Alias '" + name + "' -> '" + target + "' already holds, unchanged");
        }
        return true;
    }

    /**
     * Unregisters {@code name}. Its slot stays allocated, so composites that
     * still refer to it keep evaluating the last definition.
     */
    public void remove(String name) {
        slots.removeInt(name);
    }

    /**
     * Unregisters {@code name} and releases its slot for reuse. Only valid
     * when nothing outside the discarded names refers to the slot, as after a
     * rolled-back compilation.
     */
    public void discard(String name) {
        int slot = slots.removeInt(name);
        if (slot != NO_SLOT) {
            arena.release(slot);
        }
    }

    public int size() {
        return slots.size();
    }

    /**
     * Registered names in registration order.
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(slots.keySet()));
    }

    /**
     * Visits every (name, own slot) pair in registration order.
     */
    public void forEachRule(ObjIntConsumer<String> action) {
        for (Object2IntMap.Entry<String> entry : slots.object2IntEntrySet()) {
            action.accept(entry.getKey(), entry.getIntValue());
        }
    }

    /**
     * Names whose slot resolves to {@code resolvedSlot}.
     */
    public List<String> namesResolvingTo(int resolvedSlot) {
        List<String> names = new ArrayList<>();
        forEachRule((name, slot) -> {
            if (arena.resolve(slot) == resolvedSlot) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Total number of arena slots, including slots of removed names and
     * released slots awaiting reuse.
     */
    public int slotCount() {
        return arena.size();
    }
}
