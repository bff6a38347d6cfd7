/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sprig.grammar.api.IGrammarCompiler;
import com.sprig.grammar.api.exceptions.CompilationException;
import com.sprig.grammar.api.exceptions.CompilationException.Reason;
import com.sprig.grammar.api.model.GrammarDefinition;
import com.sprig.grammar.infra.telemetry.GrammarTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads grammar definition documents.
 *
 * <p>A document is a JSON array of {@link GrammarDefinition} objects. Rules
 * are compiled in document order, so a later entry may redefine an earlier
 * one and every earlier reference observes the redefinition. Loading stops at
 * the first failing rule; rules compiled before it stay registered.
 */
public class GrammarLoader {
    private static final Logger logger = Logger.getLogger(GrammarLoader.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IGrammarCompiler compiler;
    private final Tracer tracer;

    public GrammarLoader(IGrammarCompiler compiler) {
        this(compiler, GrammarTelemetry.noopTracer());
    }

    public GrammarLoader(IGrammarCompiler compiler, Tracer tracer) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * Parses and compiles a document.
     *
     * @return number of rules compiled
     * @throws CompilationException {@code MALFORMED_DOCUMENT} if the JSON cannot be read,
     *         {@code MALFORMED_CLAUSE} if an entry lacks a name or rule, or any
     *         compilation failure of the rules themselves
     */
    public int load(String json) {
        return compileAll(parse(json));
    }

    public int load(Reader reader) {
        return compileAll(parse(reader));
    }

    /**
     * Parses a document without compiling it.
     */
    public List<GrammarDefinition> parse(String json) {
        try {
            return validate(objectMapper.readValue(json,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, GrammarDefinition.class)));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    public List<GrammarDefinition> parse(Reader reader) {
        try {
            return validate(objectMapper.readValue(reader,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, GrammarDefinition.class)));
        } catch (IOException e) {
            throw malformed(e);
        }
    }

    private int compileAll(List<GrammarDefinition> definitions) {
        Span span = tracer.spanBuilder("load-grammar").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("definitionCount", definitions.size());
            for (GrammarDefinition definition : definitions) {
                compiler.compile(definition.name(), definition.rule());
            }
            logger.info("Loaded grammar document with " + definitions.size() + " rules");
            return definitions.size();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<GrammarDefinition> validate(List<GrammarDefinition> definitions) {
        if (definitions == null) {
            throw new CompilationException(Reason.MALFORMED_DOCUMENT, null, null,
                    "Grammar document is empty");
        }
        for (int i = 0; i < definitions.size(); i++) {
            GrammarDefinition definition = definitions.get(i);
            if (definition == null) {
                throw new CompilationException(Reason.MALFORMED_CLAUSE, null, null,
                        "Entry " + i + " is null");
            }
            if (definition.name() == null || definition.name().isBlank()) {
                throw new CompilationException(Reason.MALFORMED_CLAUSE, null, definition.rule(),
                        "Entry " + i + " has no name");
            }
            if (definition.rule() == null || definition.rule().isBlank()) {
                throw new CompilationException(Reason.MALFORMED_CLAUSE, definition.name(), null,
                        "Entry " + i + " has no rule");
            }
        }
        return definitions;
    }

    private static CompilationException malformed(IOException e) {
        return new CompilationException(Reason.MALFORMED_DOCUMENT, null, null,
                "Cannot read grammar document: " + e.getMessage(), e);
    }
}
