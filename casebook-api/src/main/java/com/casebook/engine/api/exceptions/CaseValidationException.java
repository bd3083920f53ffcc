/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.exceptions;

/**
 * Thrown when a case definition is malformed. The case is refused as a whole.
 */
public class CaseValidationException extends RuntimeException {

    public CaseValidationException(String message) {
        super(message);
    }

    public CaseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
