/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.compiler.analysis;

import com.sprig.grammar.runtime.model.FallbackNode;
import com.sprig.grammar.runtime.model.Node;
import com.sprig.grammar.runtime.model.RepetitionNode;
import com.sprig.grammar.runtime.model.RuleRegistry;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds cycles in a compiled grammar that the recursion-depth limit does not
 * guard.
 *
 * <p>The generation engine only counts depth when it enters the primary branch
 * of a fallback, so that edge is the one way a rule may safely refer back to
 * itself. Every other edge (sequence children, selector options, repetitions
 * with a positive count and fallback branches) is followed. A strongly
 * connected set of nodes under those edges can expand forever.
 *
 * <h2>Usage</h2>
 * <pre>
 * CycleReport report = new CycleAnalyzer().analyze(registry);
 * if (report.hasUnguardedCycles()) {
 *     report.cycles().forEach(c -&gt; System.out.println(c.describe()));
 * }
 * </pre>
 *
 * <p>Runs in O(nodes + edges) using Tarjan's algorithm with an explicit stack.
 */
public class CycleAnalyzer {

    private static final int UNVISITED = -1;

    /**
     * Analyzes every rule currently registered.
     */
    public <T> CycleReport analyze(RuleRegistry<T> registry) {
        Tarjan<T> tarjan = new Tarjan<>(registry);
        IntSet roots = new IntOpenHashSet();
        registry.forEachRule((name, slot) -> roots.add(registry.resolve(slot)));
        for (int root : roots) {
            tarjan.visit(root);
        }

        List<Cycle> cycles = new ArrayList<>();
        for (IntList component : tarjan.components) {
            if (component.size() > 1 || tarjan.hasSelfEdge(component.getInt(0))) {
                Set<String> names = new LinkedHashSet<>();
                for (int slot : component) {
                    names.addAll(registry.namesResolvingTo(slot));
                }
                cycles.add(new Cycle(IntLists.unmodifiable(component), List.copyOf(names)));
            }
        }
        return new CycleReport(List.copyOf(cycles));
    }

    private static final class Tarjan<T> {
        private final RuleRegistry<T> registry;
        private final Int2IntOpenHashMap index = new Int2IntOpenHashMap();
        private final Int2IntOpenHashMap lowLink = new Int2IntOpenHashMap();
        private final IntArrayList stack = new IntArrayList();
        private final IntSet onStack = new IntOpenHashSet();
        private final List<IntList> components = new ArrayList<>();
        private int nextIndex;

        Tarjan(RuleRegistry<T> registry) {
            this.registry = registry;
            index.defaultReturnValue(UNVISITED);
        }

        void visit(int root) {
            if (index.get(root) != UNVISITED) {
                return;
            }
            // Frames are (slot, next successor position).
            List<IntList> successorsOf = new ArrayList<>();
            IntArrayList frames = new IntArrayList();
            open(root, successorsOf, frames);

            while (!frames.isEmpty()) {
                int top = frames.size() - 2;
                int slot = frames.getInt(top);
                int position = frames.getInt(top + 1);
                IntList successors = successorsOf.get(successorsOf.size() - 1);

                if (position < successors.size()) {
                    frames.set(top + 1, position + 1);
                    int next = successors.getInt(position);
                    if (index.get(next) == UNVISITED) {
                        open(next, successorsOf, frames);
                    } else if (onStack.contains(next)) {
                        lowLink.put(slot, Math.min(lowLink.get(slot), index.get(next)));
                    }
                    continue;
                }

                frames.size(top);
                successorsOf.remove(successorsOf.size() - 1);
                if (lowLink.get(slot) == index.get(slot)) {
                    IntArrayList component = new IntArrayList();
                    int member;
                    do {
                        member = stack.removeInt(stack.size() - 1);
                        onStack.remove(member);
                        component.add(member);
                    } while (member != slot);
                    components.add(component);
                }
                if (!frames.isEmpty()) {
                    int parent = frames.getInt(frames.size() - 2);
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(slot)));
                }
            }
        }

        private void open(int slot, List<IntList> successorsOf, IntArrayList frames) {
            index.put(slot, nextIndex);
            lowLink.put(slot, nextIndex);
            nextIndex++;
            stack.add(slot);
            onStack.add(slot);
            frames.add(slot);
            frames.add(0);
            successorsOf.add(successors(slot));
        }

        boolean hasSelfEdge(int slot) {
            return successors(slot).contains(slot);
        }

        private IntList successors(int slot) {
            if (!registry.isDefinedSlot(slot)) {
                return IntLists.emptyList();
            }
            Node<T> node = registry.nodeAt(slot);
            if (node instanceof FallbackNode<T> fallback) {
                return IntLists.singleton(registry.resolve(fallback.fallback()));
            }
            if (node instanceof RepetitionNode<T> repetition && repetition.count() == 0) {
                return IntLists.emptyList();
            }
            IntList children = node.children();
            IntArrayList resolved = new IntArrayList(children.size());
            for (int child : children) {
                resolved.add(registry.resolve(child));
            }
            return resolved;
        }
    }

    /**
     * Result of a cycle analysis.
     *
     * @param cycles unguarded cycles, one per strongly connected component
     */
    public record CycleReport(List<Cycle> cycles) implements Serializable {

        public boolean hasUnguardedCycles() {
            return !cycles.isEmpty();
        }

        public int cycleCount() {
            return cycles.size();
        }

        /**
         * True if {@code ruleName} takes part in any reported cycle.
         */
        public boolean involves(String ruleName) {
            return cycles.stream().anyMatch(c -> c.ruleNames().contains(ruleName));
        }
    }

    /**
     * One strongly connected set of nodes.
     *
     * @param slots     arena slots of the nodes in the cycle
     * @param ruleNames registered names bound to those nodes; auto-declared
     *                  sub-expressions appear under their text
     */
    public record Cycle(IntList slots, List<String> ruleNames) implements Serializable {

        public String describe() {
            return "Unguarded cycle through " + String.join(", ", ruleNames)
                    + " (" + slots.size() + " nodes)";
        }
    }
}
