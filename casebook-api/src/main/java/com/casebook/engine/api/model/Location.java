/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A place the player can investigate.
 */
public record Location(
        String id,
        String name,
        String description,
        List<Evidence> evidence,
        List<NotPresentEntry> notPresent,
        List<String> witnessesPresent
) {
    public Location {
        Objects.requireNonNull(id, "id must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        notPresent = notPresent == null ? List.of() : List.copyOf(notPresent);
        witnessesPresent = witnessesPresent == null ? List.of() : List.copyOf(witnessesPresent);
    }

    public Location(String id, List<Evidence> evidence) {
        this(id, id, "", evidence, List.of(), List.of());
    }
}
