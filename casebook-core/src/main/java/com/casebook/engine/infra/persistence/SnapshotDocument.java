/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * On-disk layout of a saved player state. Timestamps are ISO-8601 strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
record SnapshotDocument(
        @JsonProperty("version") int version,
        @JsonProperty("case_id") String caseId,
        @JsonProperty("player_id") String playerId,
        @JsonProperty("current_location") String currentLocation,
        @JsonProperty("visited_locations") List<String> visitedLocations,
        @JsonProperty("discovered_evidence") List<String> discoveredEvidence,
        @JsonProperty("unlocked_hypotheses") List<String> unlockedHypotheses,
        @JsonProperty("unlock_events") List<UnlockEventDoc> unlockEvents,
        @JsonProperty("pending_notifications") List<String> pendingNotifications,
        @JsonProperty("verdict_attempts") List<VerdictAttemptDoc> verdictAttempts,
        @JsonProperty("attempts_remaining") int attemptsRemaining,
        @JsonProperty("investigation_points_spent") int investigationPointsSpent,
        @JsonProperty("investigation_point_budget") int investigationPointBudget,
        @JsonProperty("witness_trust") Map<String, Integer> witnessTrust,
        @JsonProperty("revealed_secrets") Map<String, List<String>> revealedSecrets
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UnlockEventDoc(
            @JsonProperty("id") String id,
            @JsonProperty("hypothesis_id") String hypothesisId,
            @JsonProperty("cause") CauseDoc cause,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("acknowledged") boolean acknowledged
    ) {
    }

    /**
     * Flattened unlock cause; {@code type} selects which of the other fields apply.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CauseDoc(
            @JsonProperty("type") String type,
            @JsonProperty("evidence_id") String evidenceId,
            @JsonProperty("metric") String metric,
            @JsonProperty("observed_value") Integer observedValue,
            @JsonProperty("reason") String reason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record VerdictAttemptDoc(
            @JsonProperty("accused_id") String accusedId,
            @JsonProperty("reasoning") String reasoning,
            @JsonProperty("cited_evidence") List<String> citedEvidence,
            @JsonProperty("correct") boolean correct,
            @JsonProperty("score") int score,
            @JsonProperty("fallacies") List<String> fallacies,
            @JsonProperty("timestamp") String timestamp
    ) {
    }
}
