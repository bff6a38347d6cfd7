/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.exceptions;

/**
 * Base type of every failure raised by the grammar compiler and generator.
 *
 * <p>Unchecked so that hosts which treat authoring errors as fatal are not
 * forced into checked exception handling at every call site.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
