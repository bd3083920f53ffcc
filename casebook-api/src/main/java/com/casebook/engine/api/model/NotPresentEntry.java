/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Phrases a player may plausibly try at a location where nothing is to be found,
 * together with the id of the response the client should show.
 */
public record NotPresentEntry(List<String> triggers, String responseId) {
    public NotPresentEntry {
        Objects.requireNonNull(responseId, "responseId must not be null");
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }
}
