/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.witness;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trust effect of interrogation questions.
 *
 * <p>Aggressive phrasing costs 10 trust and takes precedence; otherwise empathetic phrasing
 * earns 5. Keywords match on word boundaries, so "believe" does not count as "lie".
 */
public class TrustEvaluator {

    public static final int MIN_TRUST = 0;
    public static final int MAX_TRUST = 100;
    public static final int AGGRESSIVE_PENALTY = -10;
    public static final int EMPATHETIC_BONUS = 5;

    static final List<String> AGGRESSIVE_KEYWORDS = List.of(
            "lie", "lying", "liar", "accuse", "guilty", "did it", "admit",
            "confess", "know you", "hiding", "suspect", "criminal");

    static final List<String> EMPATHETIC_KEYWORDS = List.of(
            "understand", "help", "remember", "tell me", "please", "sorry",
            "difficult", "must be hard", "appreciate", "thank", "trust", "believe");

    private static final Pattern AGGRESSIVE = keywordPattern(AGGRESSIVE_KEYWORDS);
    private static final Pattern EMPATHETIC = keywordPattern(EMPATHETIC_KEYWORDS);
    private static final Pattern PRESENTATION = Pattern.compile(
            "\\b(?:show|present|give|reveal)\\s+(?:the\\s+)?([a-z0-9_-]+)");

    public int trustDelta(String question) {
        String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
        if (AGGRESSIVE.matcher(text).find()) {
            return AGGRESSIVE_PENALTY;
        }
        if (EMPATHETIC.matcher(text).find()) {
            return EMPATHETIC_BONUS;
        }
        return 0;
    }

    public static int clamp(int trust) {
        return Math.max(MIN_TRUST, Math.min(MAX_TRUST, trust));
    }

    /**
     * Extracts the object of "show/present/give/reveal [the] X".
     *
     * @return the lower-cased token naming what was presented
     */
    public Optional<String> detectPresentation(String question) {
        if (question == null) {
            return Optional.empty();
        }
        Matcher m = PRESENTATION.matcher(question.toLowerCase(Locale.ROOT));
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static Pattern keywordPattern(List<String> keywords) {
        StringBuilder regex = new StringBuilder("\\b(?:");
        for (int i = 0; i < keywords.size(); i++) {
            if (i > 0) {
                regex.append('|');
            }
            regex.append(Pattern.quote(keywords.get(i)));
        }
        return Pattern.compile(regex.append(")\\b").toString());
    }
}
