/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured context handed to a narrative generator. The engine never parses the text it
 * gets back.
 *
 * <p>The {@code for*} factories derive the context from engine results so that generators see
 * the same facts the rules saw. Absent values are left out of the map rather than mapped to
 * {@code null}.
 */
public record NarrativeRequest(Kind kind, String caseId, String playerId, Map<String, Object> context) {

    public enum Kind {
        INVESTIGATION,
        INTERROGATION,
        VERDICT_FEEDBACK
    }

    public NarrativeRequest {
        Objects.requireNonNull(kind, "kind must not be null");
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /**
     * Context for describing the result of a free-text investigation action.
     */
    public static NarrativeRequest forAction(PlayerState state, ActionOutcome outcome) {
        Map<String, Object> context = baseContext(state);
        MatchResult match = outcome.match();
        context.put("outcome", match.outcome().name());
        putIfPresent(context, "evidenceId", match.evidenceId());
        putIfPresent(context, "trigger", match.matchedTrigger());
        putIfPresent(context, "responseId", match.responseId());
        context.put("unlockedNow", outcome.unlocks().stream().map(UnlockEvent::hypothesisId).toList());
        return new NarrativeRequest(Kind.INVESTIGATION, state.getCaseId(), state.getPlayerId(), context);
    }

    /**
     * Context for a witness reply. {@code state} is the state after the question was applied.
     */
    public static NarrativeRequest forInterrogation(PlayerState state, String question, InterrogationResult result) {
        Map<String, Object> context = baseContext(state);
        context.put("witnessId", result.witnessId());
        putIfPresent(context, "question", question);
        context.put("trust", result.trust());
        context.put("trustDelta", result.trustDelta());
        context.put("revealedSecrets", result.revealedSecretIds());
        putIfPresent(context, "presentedEvidenceId", result.presentedEvidenceId());
        return new NarrativeRequest(Kind.INTERROGATION, state.getCaseId(), state.getPlayerId(), context);
    }

    /**
     * Context for mentor feedback on a scored accusation.
     */
    public static NarrativeRequest forVerdict(PlayerState state, VerdictResult result) {
        Map<String, Object> context = baseContext(state);
        context.put("accusedId", result.accusedId());
        context.put("correct", result.correct());
        context.put("score", result.score());
        context.put("quality", result.quality().name());
        VerdictResult.ScoreBreakdown breakdown = result.breakdown();
        context.put("breakdown", Map.of(
                "correctness", breakdown.correctness(),
                "keyEvidence", breakdown.keyEvidence(),
                "structure", breakdown.structure(),
                "citation", breakdown.citation(),
                "fallacyDeduction", breakdown.fallacyDeduction(),
                "capped", breakdown.capped()));
        context.put("fallacies", result.fallacyKinds().stream().map(FallacyKind::key).toList());
        context.put("citedKeyEvidence", result.citedKeyEvidence());
        context.put("missingEvidence", result.missingEvidence());
        VerdictResult.Feedback feedback = result.feedback();
        if (feedback != null) {
            context.put("tone", feedback.tone().name());
            putIfPresent(context, "feedback", feedback.message());
            putIfPresent(context, "hint", feedback.hint());
        }
        context.put("attemptsRemaining", result.attemptsRemaining());
        context.put("caseStatus", result.caseStatus().name());
        putIfPresent(context, "revealedCulprit", result.revealedCulprit());
        return new NarrativeRequest(Kind.VERDICT_FEEDBACK, state.getCaseId(), state.getPlayerId(), context);
    }

    private static Map<String, Object> baseContext(PlayerState state) {
        Map<String, Object> context = new LinkedHashMap<>();
        putIfPresent(context, "location", state.getCurrentLocationId());
        context.put("discoveredEvidence", List.copyOf(state.getDiscoveredEvidenceIds()));
        context.put("unlockedHypotheses", List.copyOf(state.getUnlockedHypothesisIds()));
        context.put("witnessTrust", Map.copyOf(state.getWitnessTrust()));
        return context;
    }

    private static void putIfPresent(Map<String, Object> context, String key, Object value) {
        if (value != null) {
            context.put(key, value);
        }
    }
}
