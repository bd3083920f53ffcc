/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.persistence;

import com.casebook.engine.api.ISnapshotCodec;
import com.casebook.engine.api.exceptions.PersistenceException;
import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.api.model.UnlockEvent;
import com.casebook.engine.api.model.VerdictAttempt;
import com.casebook.engine.infra.persistence.SnapshotDocument.CauseDoc;
import com.casebook.engine.infra.persistence.SnapshotDocument.UnlockEventDoc;
import com.casebook.engine.infra.persistence.SnapshotDocument.VerdictAttemptDoc;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes player state as a versioned JSON document.
 *
 * <p>Every field of {@link PlayerState} is written, so {@code loadSnapshot(saveSnapshot(s))}
 * equals {@code s}. Documents from a newer format version are refused rather than partially read.
 */
public class JsonSnapshotCodec implements ISnapshotCodec {

    public static final int FORMAT_VERSION = 1;

    static final String CAUSE_EVIDENCE = "evidence_collected";
    static final String CAUSE_THRESHOLD = "threshold_met";
    static final String CAUSE_MANUAL = "manual_override";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public byte[] saveSnapshot(PlayerState state) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toDocument(state));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Could not encode snapshot for " + state.getCaseId() + "/" + state.getPlayerId(), e);
        }
    }

    @Override
    public PlayerState loadSnapshot(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new PersistenceException("Snapshot is empty");
        }
        SnapshotDocument document;
        try {
            document = mapper.readValue(blob, SnapshotDocument.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PersistenceException("Could not read snapshot: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new PersistenceException("Snapshot is empty");
        }
        if (document.version() < 1 || document.version() > FORMAT_VERSION) {
            throw new PersistenceException("Unsupported snapshot version " + document.version()
                    + " (supported: 1.." + FORMAT_VERSION + ")");
        }
        return fromDocument(document);
    }

    private SnapshotDocument toDocument(PlayerState state) {
        List<UnlockEventDoc> events = new ArrayList<>();
        for (UnlockEvent event : state.getUnlockEventLog()) {
            events.add(new UnlockEventDoc(event.id(), event.hypothesisId(), toCauseDoc(event.cause()),
                    event.timestamp().toString(), event.acknowledged()));
        }

        List<VerdictAttemptDoc> attempts = new ArrayList<>();
        for (VerdictAttempt attempt : state.getVerdictAttempts()) {
            attempts.add(new VerdictAttemptDoc(
                    attempt.accusedId(),
                    attempt.reasoningText(),
                    attempt.citedEvidenceIds(),
                    attempt.correct(),
                    attempt.score(),
                    attempt.fallacies().stream().map(FallacyKind::key).toList(),
                    attempt.timestamp() == null ? null : attempt.timestamp().toString()));
        }

        Map<String, List<String>> secrets = new LinkedHashMap<>();
        state.getRevealedSecrets().forEach((witness, ids) -> secrets.put(witness, List.copyOf(ids)));

        return new SnapshotDocument(
                FORMAT_VERSION,
                state.getCaseId(),
                state.getPlayerId(),
                state.getCurrentLocationId(),
                List.copyOf(state.getVisitedLocationIds()),
                List.copyOf(state.getDiscoveredEvidenceIds()),
                List.copyOf(state.getUnlockedHypothesisIds()),
                events,
                List.copyOf(state.getPendingNotificationIds()),
                attempts,
                state.getAttemptsRemaining(),
                state.getInvestigationPointsSpent(),
                state.getInvestigationPointBudget(),
                new LinkedHashMap<>(state.getWitnessTrust()),
                secrets);
    }

    private CauseDoc toCauseDoc(UnlockCause cause) {
        if (cause instanceof UnlockCause.EvidenceCollected evidence) {
            return new CauseDoc(CAUSE_EVIDENCE, evidence.evidenceId(), null, null, null);
        }
        if (cause instanceof UnlockCause.ThresholdMet threshold) {
            return new CauseDoc(CAUSE_THRESHOLD, null, threshold.metric().key(), threshold.observedValue(), null);
        }
        UnlockCause.ManualOverride manual = (UnlockCause.ManualOverride) cause;
        return new CauseDoc(CAUSE_MANUAL, null, null, null, manual.reason());
    }

    private PlayerState fromDocument(SnapshotDocument document) {
        PlayerState.Builder builder = PlayerState.builder(
                required(document.caseId(), "case_id"),
                required(document.playerId(), "player_id"));

        nonNull(document.visitedLocations()).forEach(builder::addVisitedLocation);
        if (document.currentLocation() != null) {
            builder.withCurrentLocation(document.currentLocation());
        }
        nonNull(document.discoveredEvidence()).forEach(builder::addDiscoveredEvidence);
        nonNull(document.unlockedHypotheses()).forEach(builder::addUnlockedHypothesis);

        for (UnlockEventDoc event : nonNull(document.unlockEvents())) {
            builder.addUnlockEvent(new UnlockEvent(
                    required(event.id(), "unlock_events.id"),
                    required(event.hypothesisId(), "unlock_events.hypothesis_id"),
                    fromCauseDoc(event.cause()),
                    parseInstant(required(event.timestamp(), "unlock_events.timestamp")),
                    event.acknowledged()));
        }
        nonNull(document.pendingNotifications()).forEach(builder::addPendingNotification);

        for (VerdictAttemptDoc attempt : nonNull(document.verdictAttempts())) {
            List<FallacyKind> fallacies = new ArrayList<>();
            for (String key : nonNull(attempt.fallacies())) {
                fallacies.add(FallacyKind.fromKey(key)
                        .orElseThrow(() -> new PersistenceException("Unknown fallacy '" + key + "' in snapshot")));
            }
            builder.addVerdictAttempt(new VerdictAttempt(
                    attempt.accusedId(),
                    attempt.reasoning(),
                    attempt.citedEvidence(),
                    attempt.correct(),
                    attempt.score(),
                    fallacies,
                    attempt.timestamp() == null ? null : parseInstant(attempt.timestamp())));
        }

        builder.withAttemptsRemaining(document.attemptsRemaining())
                .withInvestigationPointsSpent(document.investigationPointsSpent())
                .withInvestigationPointBudget(document.investigationPointBudget());
        if (document.witnessTrust() != null) {
            document.witnessTrust().forEach(builder::withWitnessTrust);
        }
        if (document.revealedSecrets() != null) {
            document.revealedSecrets().forEach((witness, ids) -> nonNull(ids).forEach(id -> builder.addRevealedSecret(witness, id)));
        }
        return builder.build();
    }

    private UnlockCause fromCauseDoc(CauseDoc cause) {
        if (cause == null) {
            throw new PersistenceException("Snapshot unlock event has no cause");
        }
        String type = required(cause.type(), "cause.type");
        switch (type) {
            case CAUSE_EVIDENCE:
                return new UnlockCause.EvidenceCollected(required(cause.evidenceId(), "cause.evidence_id"));
            case CAUSE_THRESHOLD:
                Metric metric = Metric.fromKey(cause.metric())
                        .orElseThrow(() -> new PersistenceException("Unknown metric '" + cause.metric() + "' in snapshot"));
                return new UnlockCause.ThresholdMet(metric, cause.observedValue() == null ? 0 : cause.observedValue());
            case CAUSE_MANUAL:
                return new UnlockCause.ManualOverride(cause.reason());
            default:
                throw new PersistenceException("Unknown unlock cause type '" + type + "' in snapshot");
        }
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new PersistenceException("Invalid timestamp '" + value + "' in snapshot", e);
        }
    }

    private static String required(String value, String field) {
        if (value == null) {
            throw new PersistenceException("Snapshot is missing required field '" + field + "'");
        }
        return value;
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values;
    }
}
