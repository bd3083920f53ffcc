/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.FeedbackTone;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.VerdictResult.DetectedFallacy;
import com.casebook.engine.api.model.VerdictResult.Feedback;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chooses verdict feedback text. Tone depends only on attempts remaining.
 */
public class FeedbackSelector {

    public static final String GENERIC_INCORRECT = "Incorrect. The evidence does not support this accusation.";
    public static final String COMMON_MISTAKE = "Incorrect. This is a common mistake.";
    public static final String CORRECT = "Correct. You identified the culprit and your reasoning holds up.";
    public static final String CORRECT_FLAWED = "Correct suspect, but your reasoning was flawed: ";
    public static final String VAGUE_HINT = "Look again at what the evidence actually proves, not just what it suggests.";

    public Feedback select(boolean correct, String accusedId, List<DetectedFallacy> fallacies,
                           Solution solution, int attemptsRemaining) {
        FeedbackTone tone = FeedbackTone.forAttemptsRemaining(attemptsRemaining);
        if (correct) {
            String message = fallacies.isEmpty()
                    ? CORRECT
                    : CORRECT_FLAWED + fallacies.stream()
                            .map(DetectedFallacy::kind)
                            .map(FallacyKind::displayName)
                            .collect(Collectors.joining(", ")) + ".";
            return new Feedback(tone, message, null, null, null);
        }

        String hint = hint(tone, solution);
        Optional<Solution.CommonMistake> mistake = solution.commonMistakeFor(accusedId);
        if (mistake.isPresent()) {
            return new Feedback(tone, COMMON_MISTAKE, mistake.get().reason(), mistake.get().whyWrong(), hint);
        }
        return new Feedback(tone, GENERIC_INCORRECT, null, null, hint);
    }

    String hint(FeedbackTone tone, Solution solution) {
        return switch (tone) {
            case VAGUE -> VAGUE_HINT;
            case SPECIFIC -> solution.keyEvidence().isEmpty()
                    ? VAGUE_HINT
                    : "Re-examine: " + String.join(", ", solution.keyEvidence().subList(0, Math.min(2, solution.keyEvidence().size()))) + ".";
            case DIRECT -> solution.method() == null || solution.method().isBlank()
                    ? "Ask who had both the opportunity and the means."
                    : "Think about how it was done: " + solution.method();
        };
    }
}
