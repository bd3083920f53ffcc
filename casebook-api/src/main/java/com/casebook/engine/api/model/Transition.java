/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.Objects;

/**
 * Result of an engine operation paired with the state it produced.
 */
public record Transition<R>(R result, PlayerState state) {
    public Transition {
        Objects.requireNonNull(state, "state must not be null");
    }
}
