/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.compiler;

import com.sprig.grammar.api.CompilationListener;
import com.sprig.grammar.api.IGrammarCompiler;
import com.sprig.grammar.api.exceptions.CompilationException;
import com.sprig.grammar.api.exceptions.CompilationException.Reason;
import com.sprig.grammar.api.exceptions.RuleNotFoundException;
import com.sprig.grammar.api.model.NodeType;
import com.sprig.grammar.infra.metrics.Counter;
import com.sprig.grammar.infra.metrics.Gauge;
import com.sprig.grammar.infra.metrics.GrammarMetrics;
import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.telemetry.GrammarTelemetry;
import com.sprig.grammar.runtime.model.FallbackNode;
import com.sprig.grammar.runtime.model.LeafNode;
import com.sprig.grammar.runtime.model.Node;
import com.sprig.grammar.runtime.model.RepetitionNode;
import com.sprig.grammar.runtime.model.RuleRegistry;
import com.sprig.grammar.runtime.model.SelectorNode;
import com.sprig.grammar.runtime.model.SequenceNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Compiles rule text into nodes of a {@link RuleRegistry}.
 *
 * <p>Operators are recognised in a fixed order, the first one present wins and
 * the text is split at its leftmost occurrence:
 * <pre>
 *   A -> B          fallback
 *   A &amp; B &amp; C       sequence
 *   w1 A | w2 B     weighted selector
 *   A # n           repetition
 *   A               atomic reference
 * </pre>
 * There is no grouping. Operands are resolved through
 * {@link #resolveOrCompile(String)}: a registered name is referenced, anything
 * else is compiled as a rule named by its own text. Identical sub-expressions
 * therefore compile once and are shared.
 *
 * <p>A top-level {@link #compile(String, String)} is all or nothing. If it
 * fails, every name it registered is removed again, and an existing rule is
 * only replaced after the new body compiled.
 *
 * <p>Not thread-safe.
 *
 * @param <T> payload type of leaf values
 */
public class RuleCompiler<T> implements IGrammarCompiler {
    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    static final String FALLBACK = " -> ";
    static final String SEQUENCE = " & ";
    static final String SELECTOR = " | ";
    static final String REPETITION = " # ";

    private static final Pattern SEQUENCE_SPLIT = Pattern.compile(Pattern.quote(SEQUENCE));
    private static final Pattern SELECTOR_SPLIT = Pattern.compile(Pattern.quote(SELECTOR));

    private final RuleRegistry<T> registry;
    private final Function<String, ? extends T> literalFactory;
    private final Counter rulesCompiled;
    private final Counter compileErrors;
    private final Gauge registeredRules;
    private Tracer tracer;
    private CompilationListener listener;

    // Names registered by the running top-level compile; null when idle.
    private List<String> newNames;

    /**
     * @param registry       registry to compile into
     * @param literalFactory turns an unregistered token into a leaf payload, or
     *                       {@code null} to require every token to be registered
     * @param metrics        metrics sink
     * @param tracer         tracer for compile spans
     */
    public RuleCompiler(RuleRegistry<T> registry,
                        Function<String, ? extends T> literalFactory,
                        MetricsRegistry metrics,
                        Tracer tracer) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.literalFactory = literalFactory;
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.rulesCompiled = metrics.counter(GrammarMetrics.RULES_COMPILED);
        this.compileErrors = metrics.counter(GrammarMetrics.COMPILE_ERRORS);
        this.registeredRules = metrics.gauge(GrammarMetrics.REGISTERED_RULES);
    }

    /**
     * Compiler for string grammars: unregistered tokens become leaves holding
     * the token text.
     */
    public static RuleCompiler<String> forStrings(RuleRegistry<String> registry) {
        return new RuleCompiler<>(registry, Function.identity(),
                MetricsRegistry.getInstance(), GrammarTelemetry.noopTracer());
    }

    /**
     * Compiler for arbitrary payloads: every token must name a registered rule.
     */
    public static <T> RuleCompiler<T> forValues(RuleRegistry<T> registry) {
        return new RuleCompiler<>(registry, null,
                MetricsRegistry.getInstance(), GrammarTelemetry.noopTracer());
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public RuleRegistry<T> registry() {
        return registry;
    }

    @Override
    public void compile(String ruleName, String ruleText) {
        Span span = tracer.spanBuilder("compile-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleName", String.valueOf(ruleName));
            int before = registry.size();
            inTransaction(ruleName, () -> {
                compileRule(ruleName, ruleText);
                return null;
            });
            span.setAttribute("nodeType", registry.get(ruleName).type().name());
            span.setAttribute("rulesAdded", registry.size() - before);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the slot of {@code token}, compiling it as a rule named by its
     * own text if it is not registered yet.
     *
     * @param token trimmed operand text
     * @return the slot owned by {@code token}
     */
    public int resolveOrCompile(String token) {
        if (newNames != null) {
            return resolveOrCompileInSession(token);
        }
        return inTransaction(token, () -> resolveOrCompileInSession(token));
    }

    private int resolveOrCompileInSession(String token) {
        if (!registry.contains(token)) {
            logger.fine(() -> "Auto-declaring rule '" + token + "'");
            compileRule(token, token);
        }
        return registry.slotOf(token);
    }

    private <R> R inTransaction(String ruleName, Supplier<R> body) {
        newNames = new ArrayList<>();
        try {
            R result = body.get();
            registeredRules.set(registry.size());
            return result;
        } catch (RuntimeException e) {
            for (int i = newNames.size() - 1; i >= 0; i--) {
                registry.discard(newNames.get(i));
            }
            registeredRules.set(registry.size());
            compileErrors.increment();
            logger.log(Level.WARNING, "Failed to compile rule '" + ruleName + "': " + e.getMessage());
            if (listener != null) {
                listener.onError(ruleName, e);
            }
            throw e;
        } finally {
            newNames = null;
        }
    }

    private void compileRule(String ruleName, String ruleText) {
        if (ruleName == null || ruleName.isBlank()) {
            throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, ruleText, "Rule name is empty");
        }
        if (ruleText == null || ruleText.isBlank()) {
            throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, ruleText, "Rule text is empty");
        }

        boolean redefinition = registry.contains(ruleName);
        int slot = registry.claim(ruleName);
        if (!redefinition) {
            newNames.add(ruleName);
        }

        Node<T> node;
        if (ruleText.contains(FALLBACK)) {
            node = compileFallback(ruleName, ruleText);
        } else if (ruleText.contains(SEQUENCE)) {
            node = compileSequence(ruleName, ruleText);
        } else if (ruleText.contains(SELECTOR)) {
            node = compileSelector(ruleName, ruleText);
        } else if (ruleText.contains(REPETITION)) {
            node = compileRepetition(ruleName, ruleText);
        } else {
            compileAtomic(ruleName, ruleText.trim(), redefinition);
            return;
        }

        registry.install(slot, node);
        installed(ruleName, node.type(), redefinition);
    }

    private Node<T> compileFallback(String ruleName, String ruleText) {
        int at = ruleText.indexOf(FALLBACK);
        String primary = operand(ruleName, ruleText, ruleText.substring(0, at));
        String fallback = operand(ruleName, ruleText, ruleText.substring(at + FALLBACK.length()));
        int primarySlot = resolveOrCompileInSession(primary);
        int fallbackSlot = resolveOrCompileInSession(fallback);
        return new FallbackNode<>(primarySlot, fallbackSlot);
    }

    private Node<T> compileSequence(String ruleName, String ruleText) {
        String[] parts = SEQUENCE_SPLIT.split(ruleText, -1);
        IntArrayList children = new IntArrayList(parts.length);
        for (String part : parts) {
            children.add(resolveOrCompileInSession(operand(ruleName, ruleText, part)));
        }
        return new SequenceNode<>(children);
    }

    private Node<T> compileSelector(String ruleName, String ruleText) {
        String[] clauses = SELECTOR_SPLIT.split(ruleText, -1);
        IntArrayList options = new IntArrayList(clauses.length);
        DoubleArrayList weights = new DoubleArrayList(clauses.length);
        for (String rawClause : clauses) {
            String clause = rawClause.trim();
            int space = clause.indexOf(' ');
            if (space < 0) {
                throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, clause,
                        "Selector clause must be '<weight> <rule>'");
            }
            String weightText = clause.substring(0, space);
            String ref = clause.substring(space + 1).trim();
            if (weightText.isEmpty() || ref.isEmpty()) {
                throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, clause,
                        "Selector clause must be '<weight> <rule>'");
            }
            double weight = parseWeight(ruleName, clause, weightText);
            options.add(resolveOrCompileInSession(ref));
            weights.add(weight);
        }
        try {
            return new SelectorNode<>(options, weights);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(Reason.INVALID_WEIGHT, ruleName, ruleText, e.getMessage(), e);
        }
    }

    private static double parseWeight(String ruleName, String clause, String weightText) {
        double weight;
        try {
            weight = Double.parseDouble(weightText);
        } catch (NumberFormatException e) {
            throw new CompilationException(Reason.INVALID_WEIGHT, ruleName, clause,
                    "Weight '" + weightText + "' is not a number", e);
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new CompilationException(Reason.INVALID_WEIGHT, ruleName, clause,
                    "Weight '" + weightText + "' is not finite");
        }
        if (weight <= 0) {
            throw new CompilationException(Reason.NON_POSITIVE_WEIGHT, ruleName, clause,
                    "Weight must be positive, got " + weightText);
        }
        return weight;
    }

    private Node<T> compileRepetition(String ruleName, String ruleText) {
        int at = ruleText.indexOf(REPETITION);
        String child = operand(ruleName, ruleText, ruleText.substring(0, at));
        String countText = ruleText.substring(at + REPETITION.length()).trim();
        if (countText.isEmpty()) {
            throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, ruleText,
                    "Repetition must be '<rule> # <count>'");
        }
        int count = parseCount(ruleName, ruleText, countText);
        return new RepetitionNode<>(resolveOrCompileInSession(child), count);
    }

    private static int parseCount(String ruleName, String clause, String countText) {
        double count;
        try {
            count = Double.parseDouble(countText);
        } catch (NumberFormatException e) {
            throw new CompilationException(Reason.INVALID_REPETITION_COUNT, ruleName, clause,
                    "Repetition count '" + countText + "' is not a number", e);
        }
        if (Double.isNaN(count) || count < 0 || count > Integer.MAX_VALUE) {
            throw new CompilationException(Reason.INVALID_REPETITION_COUNT, ruleName, clause,
                    "Repetition count must be between 0 and " + Integer.MAX_VALUE + ", got " + countText);
        }
        return (int) count;
    }

    private void compileAtomic(String ruleName, String token, boolean redefinition) {
        if (token.equals(ruleName)) {
            // A name standing for itself: literal for string grammars, otherwise it must already exist.
            if (registry.isDefined(ruleName)) {
                installed(ruleName, registry.get(ruleName).type(), redefinition);
                return;
            }
            if (literalFactory == null) {
                throw new RuleNotFoundException(token);
            }
            Node<T> leaf = new LeafNode<>(literalFactory.apply(token));
            registry.install(registry.slotOf(ruleName), leaf);
            installed(ruleName, NodeType.LEAF, redefinition);
            return;
        }
        if (!registry.contains(token) && literalFactory == null) {
            throw new RuleNotFoundException(token);
        }
        resolveOrCompileInSession(token);
        registry.alias(ruleName, token);
        installed(ruleName, registry.get(ruleName).type(), redefinition);
    }

    private static String operand(String ruleName, String ruleText, String raw) {
        String token = raw.trim();
        if (token.isEmpty()) {
            throw new CompilationException(Reason.MALFORMED_CLAUSE, ruleName, ruleText, "Empty operand");
        }
        return token;
    }

    private void installed(String ruleName, NodeType type, boolean redefinition) {
        rulesCompiled.increment();
        logger.fine(() -> (redefinition ? "Redefined" : "Compiled") + " rule '" + ruleName + "' as " + type);
        if (listener != null) {
            listener.onRuleCompiled(ruleName, type, redefinition);
        }
    }
}
