/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.exceptions.AccusationRejectedException;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.ReasoningQuality;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.VerdictAttempt;
import com.casebook.engine.api.model.VerdictResult;
import com.casebook.engine.api.model.VerdictResult.DetectedFallacy;
import com.casebook.engine.api.model.VerdictResult.Feedback;
import com.casebook.engine.api.model.VerdictResult.ScoreBreakdown;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Evaluates an accusation and performs attempt bookkeeping.
 *
 * <p>Every accepted submission, correct or not, costs one attempt (never below zero) and is
 * appended to the attempt history. Once no attempts remain the result reveals the culprit.
 * Blank accusations are rejected before anything is recorded.
 */
public class VerdictEvaluator {

    private static final Logger logger = Logger.getLogger(VerdictEvaluator.class.getName());

    private final FallacyDetector fallacyDetector;
    private final ReasoningScorer scorer;
    private final FeedbackSelector feedbackSelector;
    private final Clock clock;

    public VerdictEvaluator(Clock clock) {
        this(new FallacyDetector(), new ReasoningScorer(), new FeedbackSelector(), clock);
    }

    public VerdictEvaluator(FallacyDetector fallacyDetector, ReasoningScorer scorer,
                            FeedbackSelector feedbackSelector, Clock clock) {
        this.fallacyDetector = fallacyDetector;
        this.scorer = scorer;
        this.feedbackSelector = feedbackSelector;
        this.clock = clock;
    }

    public Transition<VerdictResult> evaluateVerdict(String accusedId, String reasoningText, List<String> citedEvidenceIds,
                                                     CaseDefinition caseDefinition, PlayerState state) {
        if (accusedId == null || accusedId.isBlank()) {
            throw new AccusationRejectedException("Accusation must name a suspect");
        }
        if (reasoningText == null || reasoningText.isBlank()) {
            throw new AccusationRejectedException("Accusation must include reasoning");
        }
        String accused = accusedId.trim();
        List<String> cited = normalizeCitations(citedEvidenceIds);
        Solution solution = caseDefinition.getSolution();

        boolean correct = solution.isCulprit(accused);
        List<DetectedFallacy> fallacies = fallacyDetector.detect(accused, reasoningText, cited, caseDefinition);
        ScoreBreakdown breakdown = scorer.score(correct, reasoningText, cited, fallacies.size(), solution, state);
        int score = scorer.total(breakdown);

        List<String> citedKey = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String key : solution.keyEvidence()) {
            (cited.contains(key) ? citedKey : missing).add(key);
        }

        int attemptsRemaining = Math.max(0, state.getAttemptsRemaining() - 1);
        PlayerState next = state.toBuilder()
                .addVerdictAttempt(new VerdictAttempt(accused, reasoningText, cited, correct, score,
                        fallacies.stream().map(DetectedFallacy::kind).toList(), clock.instant()))
                .withAttemptsRemaining(attemptsRemaining)
                .build();

        Feedback feedback = feedbackSelector.select(correct, accused, fallacies, solution, attemptsRemaining);
        String revealedCulprit = attemptsRemaining == 0 ? solution.culprit() : null;

        VerdictResult result = new VerdictResult(accused, correct, score, ReasoningQuality.fromScore(score), breakdown,
                fallacies, citedKey, missing, feedback, attemptsRemaining, next.getCaseStatus(), revealedCulprit);
        logger.fine(() -> "Verdict for " + state.getPlayerId() + " accusing '" + accused + "': correct=" + correct
                + ", score=" + score + ", attemptsRemaining=" + attemptsRemaining);
        return new Transition<>(result, next);
    }

    /**
     * Trims, drops blanks and duplicates, keeps first-seen order.
     */
    private static List<String> normalizeCitations(List<String> citedEvidenceIds) {
        if (citedEvidenceIds == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : citedEvidenceIds) {
            if (id != null && !id.isBlank()) {
                unique.add(id.trim());
            }
        }
        return List.copyOf(unique);
    }
}
