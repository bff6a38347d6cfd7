/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.config;

import java.io.InputStream;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of a grammar's generation engine.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via an environment variable or a JVM
 * system property of the same name:
 * <pre>
 * GRAMMAR_MAX_DEPTH=32
 * GRAMMAR_SEED=42
 * GRAMMAR_MAX_OUTPUT_SIZE=100000
 * GRAMMAR_ANALYZE_CYCLES=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Built-in defaults, no environment lookup
 * GrammarConfig config = GrammarConfig.defaults();
 *
 * // Reproducible output with a deeper recursion limit
 * GrammarConfig config = GrammarConfig.builder()
 *     .maxDepth(32)
 *     .seed(42L)
 *     .build();
 *
 * // grammar.properties from the classpath, then environment overrides
 * GrammarConfig config = GrammarConfig.loadDefault();
 * }</pre>
 */
public final class GrammarConfig {

    private static final Logger logger = Logger.getLogger(GrammarConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_DEPTH = "GRAMMAR_MAX_DEPTH";
    static final String ENV_SEED = "GRAMMAR_SEED";
    static final String ENV_MAX_OUTPUT_SIZE = "GRAMMAR_MAX_OUTPUT_SIZE";
    static final String ENV_ANALYZE_CYCLES = "GRAMMAR_ANALYZE_CYCLES";

    public static final int DEFAULT_MAX_DEPTH = 16;

    private final int maxDepth;
    private final Long seed;
    private final int maxOutputSize;
    private final boolean analyzeCyclesOnCompile;

    private GrammarConfig(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.seed = builder.seed;
        this.maxOutputSize = builder.maxOutputSize;
        this.analyzeCyclesOnCompile = builder.analyzeCyclesOnCompile;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults; ignores the environment.
     */
    public static GrammarConfig defaults() {
        return new Builder().build();
    }

    /**
     * Defaults overridden by environment variables and system properties.
     */
    public static GrammarConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@code grammar.properties} from the classpath root, then applies
     * environment overrides. A missing file means defaults.
     *
     * <pre>
     * grammar.max.depth=24
     * grammar.seed=1234
     * grammar.max.output.size=50000
     * grammar.analyze.cycles=true
     * </pre>
     */
    public static GrammarConfig loadDefault() {
        return loadFromProperties("grammar.properties");
    }

    /**
     * Loads a properties resource from the classpath, then applies environment
     * overrides.
     *
     * @param resourceName classpath resource name
     */
    public static GrammarConfig loadFromProperties(String resourceName) {
        Properties props = new Properties();
        try (InputStream is = GrammarConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " grammar properties from classpath: " + resourceName);
            } else {
                logger.fine("No " + resourceName + " on classpath, using defaults");
            }
        } catch (Exception e) {
            logger.warning("Could not read " + resourceName + ": " + e.getMessage() + ". Using defaults.");
        }

        Builder builder = new Builder();
        parse(props.getProperty("grammar.max.depth"), "grammar.max.depth", Integer::parseInt)
                .ifPresent(builder::maxDepth);
        parse(props.getProperty("grammar.seed"), "grammar.seed", Long::parseLong)
                .ifPresent(builder::seed);
        parse(props.getProperty("grammar.max.output.size"), "grammar.max.output.size", Integer::parseInt)
                .ifPresent(builder::maxOutputSize);
        parse(props.getProperty("grammar.analyze.cycles"), "grammar.analyze.cycles", Boolean::parseBoolean)
                .ifPresent(builder::analyzeCyclesOnCompile);
        builder.applyEnvironmentVariables();
        return builder.build();
    }

    private void validate() {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got: " + maxDepth);
        }
        if (maxOutputSize < 0) {
            throw new IllegalArgumentException("maxOutputSize must not be negative, got: " + maxOutputSize);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /**
     * Number of Fallback primary branches that may be nested before
     * evaluation diverts to the fallback branch.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Seed of the default random source; empty for a nondeterministic seed.
     */
    public OptionalLong getSeed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    /**
     * Upper bound on the length of one generated sequence; 0 means unlimited.
     */
    public int getMaxOutputSize() {
        return maxOutputSize;
    }

    public boolean isAnalyzeCyclesOnCompile() {
        return analyzeCyclesOnCompile;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxDepth = this.maxDepth;
        builder.seed = this.seed;
        builder.maxOutputSize = this.maxOutputSize;
        builder.analyzeCyclesOnCompile = this.analyzeCyclesOnCompile;
        return builder;
    }

    @Override
    public String toString() {
        return "GrammarConfig{" +
                "maxDepth=" + maxDepth +
                ", seed=" + (seed == null ? "random" : seed) +
                ", maxOutputSize=" + (maxOutputSize == 0 ? "unlimited" : maxOutputSize) +
                ", analyzeCyclesOnCompile=" + analyzeCyclesOnCompile +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Builder seeded with defaults and environment overrides.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        builder.applyEnvironmentVariables();
        return builder;
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Long seed = null;
        private int maxOutputSize = 0;
        private boolean analyzeCyclesOnCompile = false;

        private Builder() {
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_MAX_DEPTH).flatMap(v -> parse(v, ENV_MAX_DEPTH, Integer::parseInt))
                    .ifPresent(v -> this.maxDepth = v);
            getEnv(ENV_SEED).flatMap(v -> parse(v, ENV_SEED, Long::parseLong))
                    .ifPresent(v -> this.seed = v);
            getEnv(ENV_MAX_OUTPUT_SIZE).flatMap(v -> parse(v, ENV_MAX_OUTPUT_SIZE, Integer::parseInt))
                    .ifPresent(v -> this.maxOutputSize = v);
            getEnv(ENV_ANALYZE_CYCLES).flatMap(v -> parse(v, ENV_ANALYZE_CYCLES, Boolean::parseBoolean))
                    .ifPresent(v -> this.analyzeCyclesOnCompile = v);
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder randomSeed() {
            this.seed = null;
            return this;
        }

        public Builder maxOutputSize(int maxOutputSize) {
            this.maxOutputSize = maxOutputSize;
            return this;
        }

        public Builder analyzeCyclesOnCompile(boolean enable) {
            this.analyzeCyclesOnCompile = enable;
            return this;
        }

        public GrammarConfig build() {
            return new GrammarConfig(this);
        }
    }

    // ========================================================================
    // ENVIRONMENT VARIABLE HELPERS
    // ========================================================================

    /**
     * Environment variable first, then system property.
     */
    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(key);
        }
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded override: " + key + "=" + value);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static <V> Optional<V> parse(String value, String key, Function<String, V> parser) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(value.trim()));
        } catch (NumberFormatException e) {
            logger.warning("Invalid value for " + key + ": " + value + ", ignoring");
            return Optional.empty();
        }
    }
}
