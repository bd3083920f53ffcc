/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A person the player can interrogate.
 */
public record Witness(
        String id,
        String name,
        String personality,
        int baseTrust,
        List<String> wants,
        List<String> fears,
        List<Secret> secrets
) {
    public static final int DEFAULT_BASE_TRUST = 50;

    public Witness {
        Objects.requireNonNull(id, "id must not be null");
        wants = wants == null ? List.of() : List.copyOf(wants);
        fears = fears == null ? List.of() : List.copyOf(fears);
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
    }

    /**
     * Something the witness withholds until {@link #trigger()} holds.
     */
    public record Secret(String id, String description, SecretTrigger trigger) {
        public Secret {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(trigger, "trigger must not be null");
        }
    }
}
