/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one player's progress through one case.
 *
 * <p>Engine operations never modify a snapshot; they derive a new one through
 * {@link #toBuilder()}. Sets keep insertion order so that snapshots serialize and compare
 * deterministically.
 */
public final class PlayerState {

    private final String caseId;
    private final String playerId;
    private final String currentLocationId;
    private final Set<String> visitedLocationIds;
    private final Set<String> discoveredEvidenceIds;
    private final Set<String> unlockedHypothesisIds;
    private final List<UnlockEvent> unlockEventLog;
    private final Set<String> pendingNotificationIds;
    private final List<VerdictAttempt> verdictAttempts;
    private final int attemptsRemaining;
    private final int investigationPointsSpent;
    private final int investigationPointBudget;
    private final Map<String, Integer> witnessTrust;
    private final Map<String, Set<String>> revealedSecrets;

    private PlayerState(Builder builder) {
        this.caseId = builder.caseId;
        this.playerId = builder.playerId;
        this.currentLocationId = builder.currentLocationId;
        this.visitedLocationIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.visitedLocationIds));
        this.discoveredEvidenceIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.discoveredEvidenceIds));
        this.unlockedHypothesisIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.unlockedHypothesisIds));
        this.unlockEventLog = List.copyOf(builder.unlockEventLog);
        this.pendingNotificationIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.pendingNotificationIds));
        this.verdictAttempts = List.copyOf(builder.verdictAttempts);
        this.attemptsRemaining = Math.max(0, builder.attemptsRemaining);
        this.investigationPointsSpent = builder.investigationPointsSpent;
        this.investigationPointBudget = builder.investigationPointBudget;
        this.witnessTrust = Collections.unmodifiableMap(new LinkedHashMap<>(builder.witnessTrust));
        Map<String, Set<String>> secrets = new LinkedHashMap<>();
        builder.revealedSecrets.forEach((witness, ids) ->
                secrets.put(witness, Collections.unmodifiableSet(new LinkedHashSet<>(ids))));
        this.revealedSecrets = Collections.unmodifiableMap(secrets);
    }

    public String getCaseId() {
        return caseId;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getCurrentLocationId() {
        return currentLocationId;
    }

    public Set<String> getVisitedLocationIds() {
        return visitedLocationIds;
    }

    public Set<String> getDiscoveredEvidenceIds() {
        return discoveredEvidenceIds;
    }

    public Set<String> getUnlockedHypothesisIds() {
        return unlockedHypothesisIds;
    }

    public List<UnlockEvent> getUnlockEventLog() {
        return unlockEventLog;
    }

    public Set<String> getPendingNotificationIds() {
        return pendingNotificationIds;
    }

    public List<VerdictAttempt> getVerdictAttempts() {
        return verdictAttempts;
    }

    public int getAttemptsRemaining() {
        return attemptsRemaining;
    }

    public int getInvestigationPointsSpent() {
        return investigationPointsSpent;
    }

    public int getInvestigationPointBudget() {
        return investigationPointBudget;
    }

    public Map<String, Integer> getWitnessTrust() {
        return witnessTrust;
    }

    public Map<String, Set<String>> getRevealedSecrets() {
        return revealedSecrets;
    }

    public boolean isEvidenceDiscovered(String evidenceId) {
        return discoveredEvidenceIds.contains(evidenceId);
    }

    public boolean isHypothesisUnlocked(String hypothesisId) {
        return unlockedHypothesisIds.contains(hypothesisId);
    }

    public int trustFor(String witnessId, int baseTrust) {
        return witnessTrust.getOrDefault(witnessId, baseTrust);
    }

    public Set<String> revealedSecretsFor(String witnessId) {
        return revealedSecrets.getOrDefault(witnessId, Set.of());
    }

    public Optional<UnlockEvent> findUnlockEvent(String eventId) {
        return unlockEventLog.stream().filter(e -> e.id().equals(eventId)).findFirst();
    }

    /**
     * SOLVED is sticky once any attempt was correct; otherwise running out of attempts
     * hands the case to the mentor.
     */
    public CaseStatus getCaseStatus() {
        if (verdictAttempts.stream().anyMatch(VerdictAttempt::correct)) {
            return CaseStatus.SOLVED;
        }
        return attemptsRemaining == 0 ? CaseStatus.FAILED_SOLVED_BY_MENTOR : CaseStatus.IN_PROGRESS;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(String caseId, String playerId) {
        return new Builder(caseId, playerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerState)) return false;
        PlayerState that = (PlayerState) o;
        return attemptsRemaining == that.attemptsRemaining
                && investigationPointsSpent == that.investigationPointsSpent
                && investigationPointBudget == that.investigationPointBudget
                && Objects.equals(caseId, that.caseId)
                && Objects.equals(playerId, that.playerId)
                && Objects.equals(currentLocationId, that.currentLocationId)
                && visitedLocationIds.equals(that.visitedLocationIds)
                && discoveredEvidenceIds.equals(that.discoveredEvidenceIds)
                && unlockedHypothesisIds.equals(that.unlockedHypothesisIds)
                && unlockEventLog.equals(that.unlockEventLog)
                && pendingNotificationIds.equals(that.pendingNotificationIds)
                && verdictAttempts.equals(that.verdictAttempts)
                && witnessTrust.equals(that.witnessTrust)
                && revealedSecrets.equals(that.revealedSecrets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseId, playerId, currentLocationId, discoveredEvidenceIds, unlockedHypothesisIds,
                unlockEventLog, pendingNotificationIds, verdictAttempts, attemptsRemaining, investigationPointsSpent);
    }

    @Override
    public String toString() {
        return "PlayerState{" + caseId + "/" + playerId
                + ", location=" + currentLocationId
                + ", evidence=" + discoveredEvidenceIds
                + ", hypotheses=" + unlockedHypothesisIds
                + ", pending=" + pendingNotificationIds.size()
                + ", attemptsRemaining=" + attemptsRemaining
                + ", ipSpent=" + investigationPointsSpent + "}";
    }

    /**
     * Mutable working copy used to derive the next snapshot.
     */
    public static final class Builder {
        private final String caseId;
        private final String playerId;
        private String currentLocationId;
        private final Set<String> visitedLocationIds = new LinkedHashSet<>();
        private final Set<String> discoveredEvidenceIds = new LinkedHashSet<>();
        private final Set<String> unlockedHypothesisIds = new LinkedHashSet<>();
        private final List<UnlockEvent> unlockEventLog = new ArrayList<>();
        private final Set<String> pendingNotificationIds = new LinkedHashSet<>();
        private final List<VerdictAttempt> verdictAttempts = new ArrayList<>();
        private int attemptsRemaining = CaseDefinition.DEFAULT_MAX_ATTEMPTS;
        private int investigationPointsSpent;
        private int investigationPointBudget = CaseDefinition.DEFAULT_INVESTIGATION_POINTS;
        private final Map<String, Integer> witnessTrust = new LinkedHashMap<>();
        private final Map<String, Set<String>> revealedSecrets = new LinkedHashMap<>();

        private Builder(String caseId, String playerId) {
            this.caseId = Objects.requireNonNull(caseId, "caseId must not be null");
            this.playerId = Objects.requireNonNull(playerId, "playerId must not be null");
        }

        private Builder(PlayerState state) {
            this(state.caseId, state.playerId);
            this.currentLocationId = state.currentLocationId;
            this.visitedLocationIds.addAll(state.visitedLocationIds);
            this.discoveredEvidenceIds.addAll(state.discoveredEvidenceIds);
            this.unlockedHypothesisIds.addAll(state.unlockedHypothesisIds);
            this.unlockEventLog.addAll(state.unlockEventLog);
            this.pendingNotificationIds.addAll(state.pendingNotificationIds);
            this.verdictAttempts.addAll(state.verdictAttempts);
            this.attemptsRemaining = state.attemptsRemaining;
            this.investigationPointsSpent = state.investigationPointsSpent;
            this.investigationPointBudget = state.investigationPointBudget;
            this.witnessTrust.putAll(state.witnessTrust);
            state.revealedSecrets.forEach((witness, ids) -> this.revealedSecrets.put(witness, new LinkedHashSet<>(ids)));
        }

        public Builder withCurrentLocation(String locationId) {
            this.currentLocationId = locationId;
            if (locationId != null) {
                this.visitedLocationIds.add(locationId);
            }
            return this;
        }

        public Builder addVisitedLocation(String locationId) {
            this.visitedLocationIds.add(locationId);
            return this;
        }

        public Builder addDiscoveredEvidence(String evidenceId) {
            this.discoveredEvidenceIds.add(evidenceId);
            return this;
        }

        public Builder addUnlockedHypothesis(String hypothesisId) {
            this.unlockedHypothesisIds.add(hypothesisId);
            return this;
        }

        /**
         * Applies one unlock: the event is logged, the hypothesis is marked unlocked and the
         * event becomes pending, together.
         */
        public Builder recordUnlock(UnlockEvent event) {
            this.unlockEventLog.add(event);
            this.unlockedHypothesisIds.add(event.hypothesisId());
            if (!event.acknowledged()) {
                this.pendingNotificationIds.add(event.id());
            }
            return this;
        }

        public Builder addUnlockEvent(UnlockEvent event) {
            this.unlockEventLog.add(event);
            return this;
        }

        public Builder addPendingNotification(String eventId) {
            this.pendingNotificationIds.add(eventId);
            return this;
        }

        /**
         * Removes the event from the pending set and flags the log entry acknowledged.
         */
        public Builder acknowledge(String eventId) {
            this.pendingNotificationIds.remove(eventId);
            this.unlockEventLog.replaceAll(e -> e.id().equals(eventId) ? e.acknowledge() : e);
            return this;
        }

        public Builder addVerdictAttempt(VerdictAttempt attempt) {
            this.verdictAttempts.add(attempt);
            return this;
        }

        public Builder withAttemptsRemaining(int attemptsRemaining) {
            this.attemptsRemaining = Math.max(0, attemptsRemaining);
            return this;
        }

        public Builder withInvestigationPointsSpent(int points) {
            this.investigationPointsSpent = points;
            return this;
        }

        public Builder withInvestigationPointBudget(int budget) {
            this.investigationPointBudget = budget;
            return this;
        }

        public Builder withWitnessTrust(String witnessId, int trust) {
            this.witnessTrust.put(witnessId, trust);
            return this;
        }

        public Builder addRevealedSecret(String witnessId, String secretId) {
            this.revealedSecrets.computeIfAbsent(witnessId, k -> new LinkedHashSet<>()).add(secretId);
            return this;
        }

        public PlayerState build() {
            return new PlayerState(this);
        }
    }
}
