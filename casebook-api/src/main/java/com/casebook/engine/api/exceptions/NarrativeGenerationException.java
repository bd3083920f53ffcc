/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.exceptions;

/**
 * Raised by a narrative generator that could not produce text. Callers recover with a
 * deterministic fallback.
 */
public class NarrativeGenerationException extends Exception {

    public NarrativeGenerationException(String message) {
        super(message);
    }

    public NarrativeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
