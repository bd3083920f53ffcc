/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.exceptions;

/**
 * Thrown for an accusation that is incomplete. Rejected accusations do not consume an attempt.
 */
public class AccusationRejectedException extends RuntimeException {

    public AccusationRejectedException(String message) {
        super(message);
    }
}
