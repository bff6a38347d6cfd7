/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar;

import com.sprig.grammar.api.CompilationListener;
import com.sprig.grammar.api.IGrammarCompiler;
import com.sprig.grammar.api.ISequenceGenerator;
import com.sprig.grammar.compiler.GrammarLoader;
import com.sprig.grammar.compiler.RuleCompiler;
import com.sprig.grammar.compiler.analysis.CycleAnalyzer;
import com.sprig.grammar.compiler.analysis.CycleAnalyzer.CycleReport;
import com.sprig.grammar.infra.config.GrammarConfig;
import com.sprig.grammar.infra.metrics.MetricsRegistry;
import com.sprig.grammar.infra.telemetry.GrammarTelemetry;
import com.sprig.grammar.runtime.context.GenerationContext;
import com.sprig.grammar.runtime.evaluation.GenerationEngine;
import com.sprig.grammar.runtime.model.RuleRegistry;
import io.opentelemetry.api.trace.Tracer;

import java.io.Reader;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * A stochastic grammar: one rule registry with the compiler and the
 * generation engine that work on it.
 *
 * <h2>Usage</h2>
 * <pre>
 * Grammar&lt;String&gt; grammar = Grammar.forStrings();
 * grammar.compile("animal", "3 cat | 1 dog");
 * grammar.compile("line", "the &amp; animal &amp; sleeps");
 * List&lt;String&gt; words = grammar.generateSequence("line"); // e.g. [the, cat, sleeps]
 * </pre>
 *
 * <p>String grammars turn any unregistered token into a literal. Grammars over
 * other payloads are built with {@link #forValues()}: leaves are registered
 * with {@link #registerLeaf(String, Object)} and rule text only combines them.
 *
 * <p>Not thread-safe. Compile first, then generate; concurrent generation
 * needs one {@link GenerationContext} per thread.
 *
 * @param <T> payload type of leaf values
 */
public final class Grammar<T> implements IGrammarCompiler, ISequenceGenerator<T> {
    private static final Logger logger = Logger.getLogger(Grammar.class.getName());

    private final GrammarConfig config;
    private final RuleRegistry<T> registry;
    private final RuleCompiler<T> compiler;
    private final GenerationEngine<T> engine;
    private final CycleAnalyzer cycleAnalyzer = new CycleAnalyzer();
    private Tracer tracer;

    private Grammar(GrammarConfig config, Function<String, ? extends T> literalFactory,
                    MetricsRegistry metrics, Tracer tracer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = new RuleRegistry<>();
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.compiler = new RuleCompiler<>(registry, literalFactory, metrics, tracer);
        this.engine = new GenerationEngine<>(registry, config, metrics, tracer);
        logger.info("Grammar created: " + config + (literalFactory == null ? "" : ", literal promotion on"));
    }

    public static Grammar<String> forStrings() {
        return forStrings(GrammarConfig.loadDefault());
    }

    public static Grammar<String> forStrings(GrammarConfig config) {
        return forStrings(config, MetricsRegistry.getInstance(), GrammarTelemetry.noopTracer());
    }

    public static Grammar<String> forStrings(GrammarConfig config, MetricsRegistry metrics, Tracer tracer) {
        return new Grammar<>(config, Function.identity(), metrics, tracer);
    }

    public static <T> Grammar<T> forValues() {
        return forValues(GrammarConfig.loadDefault());
    }

    public static <T> Grammar<T> forValues(GrammarConfig config) {
        return forValues(config, MetricsRegistry.getInstance(), GrammarTelemetry.noopTracer());
    }

    public static <T> Grammar<T> forValues(GrammarConfig config, MetricsRegistry metrics, Tracer tracer) {
        return new Grammar<>(config, null, metrics, tracer);
    }

    /**
     * {@inheritDoc}
     *
     * <p>With {@link GrammarConfig#isAnalyzeCyclesOnCompile()} on, a warning is
     * logged when the grammar afterwards contains a cycle the depth limit does
     * not guard.
     */
    @Override
    public void compile(String ruleName, String ruleText) {
        compiler.compile(ruleName, ruleText);
        if (config.isAnalyzeCyclesOnCompile()) {
            CycleReport report = cycleAnalyzer.analyze(registry);
            report.cycles().forEach(cycle ->
                    logger.warning("After compiling '" + ruleName + "': " + cycle.describe()));
        }
    }

    /**
     * Compiles every rule of a JSON grammar document, in document order.
     *
     * @return number of rules compiled
     */
    public int load(String json) {
        return new GrammarLoader(this, tracer).load(json);
    }

    public int load(Reader reader) {
        return new GrammarLoader(this, tracer).load(reader);
    }

    /**
     * Registers {@code value} as a leaf under {@code ruleName}, redefining the
     * rule in place if it exists.
     */
    public void registerLeaf(String ruleName, T value) {
        registry.registerLeaf(ruleName, value);
    }

    @Override
    public List<T> generateSequence(String ruleName) {
        return engine.generateSequence(ruleName);
    }

    public List<T> generateSequence(String ruleName, GenerationContext context) {
        return engine.generateSequence(ruleName, context);
    }

    public boolean contains(String ruleName) {
        return registry.contains(ruleName);
    }

    /**
     * Registered names in registration order, auto-declared subrules included.
     */
    public List<String> ruleNames() {
        return registry.names();
    }

    public CycleReport analyzeCycles() {
        return cycleAnalyzer.analyze(registry);
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        compiler.setCompilationListener(listener);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        compiler.setTracer(tracer);
        engine.setTracer(tracer);
    }

    public GrammarConfig config() {
        return config;
    }

    RuleRegistry<T> registry() {
        return registry;
    }
}
