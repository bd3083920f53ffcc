/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.Objects;

/**
 * A deduction the player can make.
 *
 * <p>Tier-1 hypotheses are available from the start of a session. Tier-2 hypotheses carry a
 * {@link Requirement}; a tier-2 hypothesis without one stays locked.
 */
public record Hypothesis(
        String id,
        String label,
        String description,
        int tier,
        Requirement requirement
) {
    public static final int TIER_BASE = 1;
    public static final int TIER_DEDUCED = 2;

    public Hypothesis {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static Hypothesis base(String id) {
        return new Hypothesis(id, id, "", TIER_BASE, null);
    }

    public static Hypothesis deduced(String id, Requirement requirement) {
        return new Hypothesis(id, id, "", TIER_DEDUCED, requirement);
    }

    public boolean isBase() {
        return tier == TIER_BASE;
    }
}
