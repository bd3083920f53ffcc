/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.VerdictResult.DetectedFallacy;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Heuristic reasoning-defect classifiers.
 *
 * <p>Each heuristic is independent and runs on every verdict, correct or not. All case-specific
 * knowledge (presence pairings, authority figures, chronology claims) comes from the
 * {@link Solution}; nothing about a particular case is hardcoded.
 *
 * <h2>Heuristics</h2>
 * <ul>
 *   <li><b>Confirmation bias</b>: fewer than half of the key evidence ids are cited.
 *       Never fires when the case defines no key evidence.</li>
 *   <li><b>Correlation not causation</b>: every cited id is presence evidence for the accused
 *       and none of the distinguishing evidence is cited.</li>
 *   <li><b>Appeal to authority</b>: exactly one of culprit and accused is an authority figure,
 *       and the reasoning contains no counter-argument keyword.</li>
 *   <li><b>Post hoc</b>: a cited item implies an ordering of two timeline events that the
 *       timeline contradicts.</li>
 *   <li><b>Weak reasoning</b>: the reasoning hedges ("i guess", "probably", ...).</li>
 * </ul>
 */
public class FallacyDetector {

    private static final Logger logger = Logger.getLogger(FallacyDetector.class.getName());

    static final List<String> HEDGING_PHRASES = List.of(
            "i guess", "probably", "just a feeling", "gut feeling", "maybe", "i suppose", "no idea", "somehow");

    private static final Pattern HEDGING = phrasePattern(HEDGING_PHRASES);

    private static final Map<FallacyKind, String> DEFAULT_EXAMPLES = defaultExamples();

    public List<DetectedFallacy> detect(String accusedId, String reasoningText, List<String> citedEvidenceIds,
                                        CaseDefinition caseDefinition) {
        Solution solution = caseDefinition.getSolution();
        List<FallacyKind> kinds = new ArrayList<>();
        if (isConfirmationBias(citedEvidenceIds, solution)) {
            kinds.add(FallacyKind.CONFIRMATION_BIAS);
        }
        if (isCorrelationNotCausation(accusedId, citedEvidenceIds, solution)) {
            kinds.add(FallacyKind.CORRELATION_NOT_CAUSATION);
        }
        if (isAppealToAuthority(accusedId, reasoningText, solution)) {
            kinds.add(FallacyKind.APPEAL_TO_AUTHORITY);
        }
        if (isPostHoc(citedEvidenceIds, caseDefinition)) {
            kinds.add(FallacyKind.POST_HOC);
        }
        if (isWeakReasoning(reasoningText)) {
            kinds.add(FallacyKind.WEAK_REASONING);
        }
        return kinds.stream()
                .map(kind -> new DetectedFallacy(kind, solution.exampleFor(kind).orElse(DEFAULT_EXAMPLES.get(kind))))
                .toList();
    }

    boolean isConfirmationBias(List<String> cited, Solution solution) {
        List<String> key = solution.keyEvidence();
        if (key.isEmpty()) {
            return false;
        }
        long citedKey = key.stream().filter(cited::contains).count();
        return (double) citedKey / key.size() < 0.5;
    }

    boolean isCorrelationNotCausation(String accusedId, List<String> cited, Solution solution) {
        Optional<Solution.PresencePairing> pairing = solution.presencePairingFor(accusedId);
        if (pairing.isEmpty() || cited.isEmpty()) {
            return false;
        }
        boolean onlyPresence = pairing.get().presenceEvidence().containsAll(cited);
        boolean omitsDistinguishing = pairing.get().distinguishingEvidence().stream().noneMatch(cited::contains);
        return onlyPresence && omitsDistinguishing;
    }

    boolean isAppealToAuthority(String accusedId, String reasoningText, Solution solution) {
        boolean culpritIsAuthority = solution.isAuthorityFigure(solution.culprit());
        boolean accusedIsAuthority = solution.isAuthorityFigure(accusedId);
        if (culpritIsAuthority == accusedIsAuthority) {
            return false;
        }
        List<String> keywords = solution.counterArgumentKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        // whole words only: "but" must not match inside "butler"
        return !phrasePattern(keywords).matcher(reasoningText.toLowerCase(Locale.ROOT)).find();
    }

    boolean isPostHoc(List<String> cited, CaseDefinition caseDefinition) {
        for (Solution.ChronologyClaim claim : caseDefinition.getSolution().chronologyClaims()) {
            if (!cited.contains(claim.evidenceId())) {
                continue;
            }
            int earlier = caseDefinition.timelinePosition(claim.earlierEventId());
            int later = caseDefinition.timelinePosition(claim.laterEventId());
            if (earlier < 0 || later < 0) {
                logger.warning("Chronology claim for '" + claim.evidenceId() + "' names unknown timeline events; ignoring");
                continue;
            }
            if (earlier > later) {
                return true;
            }
        }
        return false;
    }

    boolean isWeakReasoning(String reasoningText) {
        return HEDGING.matcher(reasoningText.toLowerCase(Locale.ROOT)).find();
    }

    private static Pattern phrasePattern(List<String> phrases) {
        StringBuilder regex = new StringBuilder("\\b(?:");
        for (int i = 0; i < phrases.size(); i++) {
            regex.append(i > 0 ? "|" : "").append(Pattern.quote(phrases.get(i)));
        }
        return Pattern.compile(regex.append(")\\b").toString());
    }

    private static Map<FallacyKind, String> defaultExamples() {
        Map<FallacyKind, String> examples = new EnumMap<>(FallacyKind.class);
        examples.put(FallacyKind.CONFIRMATION_BIAS, "You focused on evidence that fit your theory and ignored the rest.");
        examples.put(FallacyKind.CORRELATION_NOT_CAUSATION, "Being near the scene is not the same as committing the crime.");
        examples.put(FallacyKind.APPEAL_TO_AUTHORITY, "Someone's position does not make them more or less likely to be guilty.");
        examples.put(FallacyKind.POST_HOC, "Your evidence implies an order of events the timeline contradicts.");
        examples.put(FallacyKind.WEAK_REASONING, "Hedged guesses are not a deduction.");
        return Map.copyOf(examples);
    }
}
