/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;

/**
 * Effect of one question put to a witness.
 *
 * @param presentedEvidenceId discovered evidence the player showed the witness, or {@code null}
 */
public record InterrogationResult(
        String witnessId,
        int trustDelta,
        int trust,
        List<String> revealedSecretIds,
        String presentedEvidenceId
) {
    public InterrogationResult {
        revealedSecretIds = List.copyOf(revealedSecretIds);
    }

    public static InterrogationResult unknownWitness(String witnessId) {
        return new InterrogationResult(witnessId, 0, 0, List.of(), null);
    }
}
