/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A discoverable piece of evidence placed in a {@link Location}.
 *
 * <p>Triggers are player-action phrases; an action containing one of them (case-insensitive)
 * discovers this evidence. Everything besides {@code id}, {@code locationId} and
 * {@code triggers} is presentation metadata passed through to clients and never evaluated.
 */
public record Evidence(
        String id,
        String name,
        String description,
        String type,
        String locationId,
        List<String> triggers,
        String significance,
        Integer strength,
        List<String> implicates,
        List<String> exonerates
) {
    public Evidence {
        Objects.requireNonNull(id, "id must not be null");
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        implicates = implicates == null ? List.of() : List.copyOf(implicates);
        exonerates = exonerates == null ? List.of() : List.copyOf(exonerates);
    }

    public static Evidence of(String id, String locationId, String... triggers) {
        return new Evidence(id, id, "", "physical", locationId, List.of(triggers), "", null, List.of(), List.of());
    }
}
