/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;

/**
 * Everything the verdict evaluator concludes about one accusation.
 *
 * <p>{@code revealedCulprit} is non-null only once the player has no attempts left.
 */
public record VerdictResult(
        String accusedId,
        boolean correct,
        int score,
        ReasoningQuality quality,
        ScoreBreakdown breakdown,
        List<DetectedFallacy> fallacies,
        List<String> citedKeyEvidence,
        List<String> missingEvidence,
        Feedback feedback,
        int attemptsRemaining,
        CaseStatus caseStatus,
        String revealedCulprit
) {
    public VerdictResult {
        fallacies = List.copyOf(fallacies);
        citedKeyEvidence = List.copyOf(citedKeyEvidence);
        missingEvidence = List.copyOf(missingEvidence);
    }

    public List<FallacyKind> fallacyKinds() {
        return fallacies.stream().map(DetectedFallacy::kind).toList();
    }

    public boolean isTerminal() {
        return revealedCulprit != null;
    }

    /**
     * Points awarded per rubric component before clamping. {@code fallacyDeduction} is
     * non-positive; {@code capped} records whether the unsupported-accusation cap applied.
     */
    public record ScoreBreakdown(
            int correctness,
            int keyEvidence,
            int structure,
            int citation,
            int fallacyDeduction,
            boolean capped
    ) {
        public int rawTotal() {
            return correctness + keyEvidence + structure + citation + fallacyDeduction;
        }
    }

    public record DetectedFallacy(FallacyKind kind, String example) {
    }

    /**
     * @param message  headline feedback text
     * @param reason   canned common-mistake reason, when the accusation matched one
     * @param whyWrong canned common-mistake explanation, when the accusation matched one
     * @param hint     tone-dependent hint for incorrect accusations
     */
    public record Feedback(FeedbackTone tone, String message, String reason, String whyWrong, String hint) {
    }
}
