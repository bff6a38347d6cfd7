/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.exceptions;

/**
 * Exception thrown when rule text cannot be compiled.
 *
 * <p>The {@link Reason} identifies the grammar-shape problem; {@link #ruleName()}
 * is the rule being compiled and {@link #clause()} the offending fragment of
 * its text.
 */
public class CompilationException extends GrammarException {

    public enum Reason {
        /** Selector weight is not a finite number. */
        INVALID_WEIGHT,
        /** Selector weight parsed but is zero or negative. */
        NON_POSITIVE_WEIGHT,
        /** Repetition count is unparsable, negative or too large. */
        INVALID_REPETITION_COUNT,
        /** A clause is missing one of its required parts. */
        MALFORMED_CLAUSE,
        /** A grammar definition document could not be read. */
        MALFORMED_DOCUMENT
    }

    private final Reason reason;
    private final String ruleName;
    private final String clause;

    public CompilationException(Reason reason, String ruleName, String clause, String message) {
        super(format(reason, ruleName, clause, message));
        this.reason = reason;
        this.ruleName = ruleName;
        this.clause = clause;
    }

    public CompilationException(Reason reason, String ruleName, String clause, String message, Throwable cause) {
        super(format(reason, ruleName, clause, message), cause);
        this.reason = reason;
        this.ruleName = ruleName;
        this.clause = clause;
    }

    public Reason reason() {
        return reason;
    }

    public String ruleName() {
        return ruleName;
    }

    public String clause() {
        return clause;
    }

    private static String format(Reason reason, String ruleName, String clause, String message) {
        StringBuilder sb = new StringBuilder(reason.name()).append(": ").append(message);
        if (ruleName != null) {
            sb.append(" in rule '").append(ruleName).append('\'');
        }
        if (clause != null) {
            sb.append(" (clause: '").append(clause).append("')");
        }
        return sb.toString();
    }
}
