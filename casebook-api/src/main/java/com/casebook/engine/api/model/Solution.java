/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The case's answer key plus the tables the verdict evaluator consults.
 *
 * <p>Common mistakes, authority figures and presence pairings are keyed by lower-cased
 * suspect id; lookups ignore case.
 */
public record Solution(
        String culprit,
        String method,
        String motive,
        List<String> keyEvidence,
        List<String> deductionsRequired,
        Map<String, CommonMistake> commonMistakes,
        Map<FallacyKind, String> fallacyExamples,
        Set<String> authorityFigures,
        Map<String, PresencePairing> presencePairings,
        List<ChronologyClaim> chronologyClaims,
        List<String> counterArgumentKeywords
) {
    public static final List<String> DEFAULT_COUNTER_ARGUMENT_KEYWORDS = List.of(
            "however", "but", "although", "despite", "regardless", "even though",
            "nevertheless", "on the other hand", "doesn't prove", "does not prove");

    public Solution {
        Objects.requireNonNull(culprit, "culprit must not be null");
        keyEvidence = keyEvidence == null ? List.of() : List.copyOf(keyEvidence);
        deductionsRequired = deductionsRequired == null ? List.of() : List.copyOf(deductionsRequired);
        commonMistakes = commonMistakes == null ? Map.of() : lowerKeys(commonMistakes);
        fallacyExamples = fallacyExamples == null ? Map.of() : Map.copyOf(fallacyExamples);
        authorityFigures = authorityFigures == null ? Set.of()
                : authorityFigures.stream().map(Solution::normalize).collect(Collectors.toUnmodifiableSet());
        presencePairings = presencePairings == null ? Map.of() : lowerKeys(presencePairings);
        chronologyClaims = chronologyClaims == null ? List.of() : List.copyOf(chronologyClaims);
        counterArgumentKeywords = usableKeywords(counterArgumentKeywords);
    }

    public static Solution of(String culprit, List<String> keyEvidence) {
        return new Solution(culprit, "", "", keyEvidence, null, null, null, null, null, null, null);
    }

    public boolean isCulprit(String accusedId) {
        return accusedId != null && culprit.equalsIgnoreCase(accusedId.trim());
    }

    public Optional<CommonMistake> commonMistakeFor(String accusedId) {
        return Optional.ofNullable(commonMistakes.get(normalize(accusedId)));
    }

    public Optional<PresencePairing> presencePairingFor(String accusedId) {
        return Optional.ofNullable(presencePairings.get(normalize(accusedId)));
    }

    public boolean isAuthorityFigure(String suspectId) {
        return authorityFigures.contains(normalize(suspectId));
    }

    public Optional<String> exampleFor(FallacyKind kind) {
        return Optional.ofNullable(fallacyExamples.get(kind));
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }

    private static <V> Map<String, V> lowerKeys(Map<String, V> source) {
        return source.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> normalize(e.getKey()), Map.Entry::getValue, (a, b) -> a));
    }

    // a blank keyword would match every text
    private static List<String> usableKeywords(List<String> keywords) {
        if (keywords == null) {
            return DEFAULT_COUNTER_ARGUMENT_KEYWORDS;
        }
        List<String> usable = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .toList();
        return usable.isEmpty() ? DEFAULT_COUNTER_ARGUMENT_KEYWORDS : usable;
    }

    /**
     * Canned feedback for a plausible wrong accusation.
     */
    public record CommonMistake(String reason, String whyWrong) {
    }

    /**
     * Evidence that places a suspect at the scene, and the timeline or alibi evidence needed
     * to tell presence apart from guilt.
     */
    public record PresencePairing(List<String> presenceEvidence, List<String> distinguishingEvidence) {
        public PresencePairing {
            presenceEvidence = presenceEvidence == null ? List.of() : List.copyOf(presenceEvidence);
            distinguishingEvidence = distinguishingEvidence == null ? List.of() : List.copyOf(distinguishingEvidence);
        }
    }

    /**
     * Citing {@code evidenceId} asserts that {@code earlierEventId} happened before {@code laterEventId}.
     */
    public record ChronologyClaim(String evidenceId, String earlierEventId, String laterEventId) {
    }
}
