/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Set;

/**
 * Read-only projection of a {@link PlayerState} for presentation.
 */
public record StateView(
        String caseId,
        String playerId,
        String currentLocationId,
        Set<String> discoveredEvidenceIds,
        Set<String> unlockedHypothesisIds,
        List<UnlockEvent> pendingNotifications,
        int attemptsRemaining,
        int investigationPointsSpent,
        CaseStatus caseStatus
) {
    public StateView {
        discoveredEvidenceIds = Set.copyOf(discoveredEvidenceIds);
        unlockedHypothesisIds = Set.copyOf(unlockedHypothesisIds);
        pendingNotifications = List.copyOf(pendingNotifications);
    }
}
