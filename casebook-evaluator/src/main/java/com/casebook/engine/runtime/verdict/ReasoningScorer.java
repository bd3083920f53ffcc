/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.VerdictResult.ScoreBreakdown;

import java.util.List;

/**
 * Deterministic 0-100 reasoning rubric.
 *
 * <pre>
 *   correct accusation           40
 *   key evidence cited           round(30 * cited / total)
 *   2-5 sentences                20   (1 sentence or 6+: 5)
 *   all citations discovered     10
 *   per detected fallacy        -10   (at most -40)
 * </pre>
 * When the case has key evidence and none of it is cited, the total is capped at 30.
 */
public class ReasoningScorer {

    public static final int CORRECT_ACCUSATION = 40;
    public static final int KEY_EVIDENCE = 30;
    public static final int STRUCTURE_COHERENT = 20;
    public static final int STRUCTURE_WEAK = 5;
    public static final int GROUNDED_CITATION = 10;
    public static final int FALLACY_PENALTY = 10;
    public static final int MAX_FALLACY_PENALTY = 40;
    public static final int UNSUPPORTED_CAP = 30;

    public ScoreBreakdown score(boolean correct, String reasoningText, List<String> cited, int fallacyCount,
                                Solution solution, PlayerState state) {
        int correctness = correct ? CORRECT_ACCUSATION : 0;

        List<String> key = solution.keyEvidence();
        long citedKey = key.stream().filter(cited::contains).count();
        int keyEvidence;
        if (key.isEmpty()) {
            keyEvidence = cited.isEmpty() ? 0 : KEY_EVIDENCE;
        } else {
            keyEvidence = (int) Math.round(KEY_EVIDENCE * (double) citedKey / key.size());
        }

        int sentences = countSentences(reasoningText);
        int structure;
        if (sentences >= 2 && sentences <= 5) {
            structure = STRUCTURE_COHERENT;
        } else {
            structure = sentences == 0 ? 0 : STRUCTURE_WEAK;
        }

        boolean grounded = !cited.isEmpty() && cited.stream().allMatch(state::isEvidenceDiscovered);
        int citation = grounded ? GROUNDED_CITATION : 0;

        int deduction = -Math.min(MAX_FALLACY_PENALTY, fallacyCount * FALLACY_PENALTY);
        boolean capped = !key.isEmpty() && citedKey == 0;
        return new ScoreBreakdown(correctness, keyEvidence, structure, citation, deduction, capped);
    }

    public int total(ScoreBreakdown breakdown) {
        int total = breakdown.rawTotal();
        if (breakdown.capped()) {
            total = Math.min(total, UNSUPPORTED_CAP);
        }
        return Math.max(0, Math.min(100, total));
    }

    /**
     * Counts terminal punctuation marks, plus one when the text does not end with one.
     */
    public static int countSentences(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                count++;
            }
        }
        char last = text.strip().charAt(text.strip().length() - 1);
        if (last != '.' && last != '!' && last != '?') {
            count++;
        }
        return Math.max(count, 1);
    }
}
