/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.time.Instant;
import java.util.List;

/**
 * One recorded verdict submission. Appended to {@link PlayerState#getVerdictAttempts()}, never edited.
 */
public record VerdictAttempt(
        String accusedId,
        String reasoningText,
        List<String> citedEvidenceIds,
        boolean correct,
        int score,
        List<FallacyKind> fallacies,
        Instant timestamp
) {
    public VerdictAttempt {
        citedEvidenceIds = citedEvidenceIds == null ? List.of() : List.copyOf(citedEvidenceIds);
        fallacies = fallacies == null ? List.of() : List.copyOf(fallacies);
    }
}
