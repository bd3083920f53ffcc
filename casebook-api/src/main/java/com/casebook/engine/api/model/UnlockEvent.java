/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one hypothesis unlock.
 *
 * <p>Created once per unlocked hypothesis and never deleted. The only permitted change is
 * the one-way {@code pending -> acknowledged} transition via {@link #acknowledge()}.
 *
 * @param id            unique event id
 * @param hypothesisId  the hypothesis that unlocked
 * @param cause         what satisfied the unlock
 * @param timestamp     when the unlock was applied
 * @param acknowledged  whether the player has dismissed the notification
 */
public record UnlockEvent(
        String id,
        String hypothesisId,
        UnlockCause cause,
        Instant timestamp,
        boolean acknowledged
) {
    public UnlockEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(hypothesisId, "hypothesisId must not be null");
        Objects.requireNonNull(cause, "cause must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Returns this event marked acknowledged. Already acknowledged events are returned as-is.
     */
    public UnlockEvent acknowledge() {
        return acknowledged ? this : new UnlockEvent(id, hypothesisId, cause, timestamp, true);
    }
}
