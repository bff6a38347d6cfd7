/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.runtime.evaluation;

import com.sprig.grammar.api.ISequenceGenerator;
import com.sprig.grammar.api.exceptions.GenerationLimitExceededException;
import com.sprig.grammar.infra.config.GrammarConfig;
import com.sprig.grammar.infra.metrics.Counter;
import com.sprig.grammar.infra.metrics.GrammarMetrics;
import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.metrics.Timer;
import com.sprig.grammar.infra.telemetry.GrammarTelemetry;
import com.sprig.grammar.runtime.context.GenerationContext;
import com.sprig.grammar.runtime.model.FallbackNode;
import com.sprig.grammar.runtime.model.LeafNode;
import com.sprig.grammar.runtime.model.Node;
import com.sprig.grammar.runtime.model.RepetitionNode;
import com.sprig.grammar.runtime.model.RuleRegistry;
import com.sprig.grammar.runtime.model.SelectorNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Evaluates compiled rules into output sequences.
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li><b>Leaf:</b> emits its value</li>
 *   <li><b>Sequence:</b> evaluates the children left to right</li>
 *   <li><b>Selector:</b> draws {@code u} uniformly from {@code [0, totalWeight)}
 *   and evaluates the first option whose running weight exceeds {@code u}</li>
 *   <li><b>Repetition:</b> evaluates the child {@code count} times</li>
 *   <li><b>Fallback:</b> below the depth limit evaluates the primary branch one
 *   level deeper, otherwise the fallback branch at the same depth</li>
 * </ul>
 * Only the fallback primary branch increases the depth. A rule that reaches
 * itself through any other path expands without bound; see
 * {@code CycleAnalyzer} and {@link GrammarConfig#getMaxOutputSize()}. When the
 * cap is set it bounds both the emitted values and the pending work stack
 * ({@value #PENDING_FRAMES_PER_OUTPUT} frames per capped value), so left
 * recursion such as {@code a = a & x}, which emits nothing while its stack
 * grows, fails as well.
 *
 * <p>Evaluation runs on an explicit work stack, so deep grammars do not
 * consume Java stack. Each frame is three ints: slot, depth and the
 * remaining count of a repetition in progress ({@code -1} for a fresh node).
 *
 * <p>Nodes are read through the registry at evaluation time, so a
 * redefinition is visible to the next generation without rebuilding anything.
 */
public class GenerationEngine<T> implements ISequenceGenerator<T> {
    private static final Logger logger = Logger.getLogger(GenerationEngine.class.getName());

    private static final int FRESH = -1;

    /** Pending frames allowed per value of the output cap. */
    static final int PENDING_FRAMES_PER_OUTPUT = 16;

    private final RuleRegistry<T> registry;
    private final int maxDepth;
    private final int maxOutputSize;
    private final int maxPendingFrames;
    private final GenerationContext defaultContext;
    private final Counter sequencesGenerated;
    private final Counter fallbackDiversions;
    private final Timer generationTimer;
    private Tracer tracer;

    public GenerationEngine(RuleRegistry<T> registry, GrammarConfig config, MetricsRegistry metrics, Tracer tracer) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.maxDepth = config.getMaxDepth();
        this.maxOutputSize = config.getMaxOutputSize();
        this.maxPendingFrames = maxOutputSize == 0
                ? 0
                : (int) Math.min(Integer.MAX_VALUE / 3, (long) maxOutputSize * PENDING_FRAMES_PER_OUTPUT);
        this.defaultContext = GenerationContext.fromConfig(config);
        this.sequencesGenerated = metrics.counter(GrammarMetrics.SEQUENCES_GENERATED);
        this.fallbackDiversions = metrics.counter(GrammarMetrics.FALLBACK_DIVERSIONS);
        this.generationTimer = metrics.timer(GrammarMetrics.GENERATION_TIME);
        logger.fine(() -> "GenerationEngine created: maxDepth=" + maxDepth + ", maxOutputSize=" + maxOutputSize);
    }

    public GenerationEngine(RuleRegistry<T> registry, GrammarConfig config) {
        this(registry, config, MetricsRegistry.getInstance(), GrammarTelemetry.noopTracer());
    }

    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Generates with the engine's shared context, seeded from the config if it
     * carries a seed.
     */
    @Override
    public List<T> generateSequence(String ruleName) {
        return generateSequence(ruleName, defaultContext);
    }

    /**
     * Generates with a caller-owned context.
     *
     * @throws com.sprig.grammar.api.exceptions.RuleNotFoundException if no rule has that name
     * @throws GenerationLimitExceededException if the output cap is configured and the output
     *         or the pending work exceeds it
     */
    public List<T> generateSequence(String ruleName, GenerationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Span span = tracer.spanBuilder("generate-sequence").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleName", String.valueOf(ruleName));
            long startTime = System.nanoTime();
            int diversionsBefore = context.getFallbackDiversions();

            List<T> output = evaluate(registry.slotOf(ruleName), 0, context, ruleName);

            int diversions = context.getFallbackDiversions() - diversionsBefore;
            generationTimer.record(Duration.ofNanos(System.nanoTime() - startTime));
            sequencesGenerated.increment();
            if (diversions > 0) {
                fallbackDiversions.increment(diversions);
            }
            span.setAttribute("outputSize", output.size());
            span.setAttribute("fallbackDiversions", diversions);
            return output;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Evaluates the node at {@code slot} starting from {@code depth}.
     *
     * @param slot    arena slot, as returned by {@link RuleRegistry#slotOf(String)}
     * @param depth   starting recursion depth
     * @param context random source and stats
     * @return generated values in order
     */
    public List<T> evaluate(int slot, int depth, GenerationContext context) {
        return evaluate(slot, depth, context, "slot " + slot);
    }

    private List<T> evaluate(int rootSlot, int rootDepth, GenerationContext context, String ruleName) {
        List<T> output = new ArrayList<>();
        IntArrayList stack = new IntArrayList();
        push(stack, rootSlot, rootDepth, FRESH);

        while (!stack.isEmpty()) {
            checkPending(stack, ruleName);
            int top = stack.size() - 3;
            int slot = stack.getInt(top);
            int depth = stack.getInt(top + 1);
            int remaining = stack.getInt(top + 2);
            stack.size(top);

            Node<T> node = registry.nodeAt(slot);

            if (remaining != FRESH) {
                // Repetition in progress: schedule the rest, then one more child.
                if (remaining > 0) {
                    push(stack, slot, depth, remaining - 1);
                    push(stack, ((RepetitionNode<T>) node).child(), depth, FRESH);
                }
                continue;
            }

            context.recordNode(depth);
            switch (node.type()) {
                case LEAF -> {
                    output.add(((LeafNode<T>) node).value());
                    if (maxOutputSize > 0 && output.size() > maxOutputSize) {
                        throw new GenerationLimitExceededException(ruleName, maxOutputSize);
                    }
                }
                case SEQUENCE -> {
                    IntList children = node.children();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        push(stack, children.getInt(i), depth, FRESH);
                    }
                }
                case SELECTOR -> {
                    SelectorNode<T> selector = (SelectorNode<T>) node;
                    int picked = selector.pick(context.random().nextDouble(selector.totalWeight()));
                    push(stack, selector.options().getInt(picked), depth, FRESH);
                }
                case REPETITION -> push(stack, slot, depth, ((RepetitionNode<T>) node).count());
                case FALLBACK -> {
                    FallbackNode<T> fallback = (FallbackNode<T>) node;
                    if (depth < maxDepth) {
                        push(stack, fallback.primary(), depth + 1, FRESH);
                    } else {
                        context.recordFallbackDiversion();
                        push(stack, fallback.fallback(), depth, FRESH);
                    }
                }
                default -> throw new IllegalStateException("Unknown node type: " + node.type());
            }
        }
        return output;
    }

    private void checkPending(IntArrayList stack, String ruleName) {
        if (maxPendingFrames > 0 && stack.size() / 3 > maxPendingFrames) {
            throw new GenerationLimitExceededException(ruleName, maxOutputSize,
                    "Generation of rule '" + ruleName + "' exceeded " + maxPendingFrames
                            + " pending nodes under the output limit of " + maxOutputSize + " values");
        }
    }

    private static void push(IntArrayList stack, int slot, int depth, int remaining) {
        stack.add(slot);
        stack.add(depth);
        stack.add(remaining);
    }
}
