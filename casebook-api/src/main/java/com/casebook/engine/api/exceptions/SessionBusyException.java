/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.exceptions;

/**
 * Thrown when a session is still processing another request after the configured wait.
 */
public class SessionBusyException extends RuntimeException {

    public SessionBusyException(String message) {
        super(message);
    }

    public SessionBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
