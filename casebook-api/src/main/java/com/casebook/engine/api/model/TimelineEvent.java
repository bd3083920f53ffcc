/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the case's authoritative timeline. Order in the case file is chronological order.
 */
public record TimelineEvent(String id, String time, String description, List<String> witnesses) {
    public TimelineEvent {
        Objects.requireNonNull(id, "id must not be null");
        witnesses = witnesses == null ? List.of() : List.copyOf(witnesses);
    }
}
