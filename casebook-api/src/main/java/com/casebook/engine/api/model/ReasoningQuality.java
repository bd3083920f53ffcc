/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

public enum ReasoningQuality {
    EXCELLENT(90),
    GOOD(75),
    FAIR(60),
    POOR(40),
    FAILING(0);

    private final int minimumScore;

    ReasoningQuality(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    public int minimumScore() {
        return minimumScore;
    }

    public static ReasoningQuality fromScore(int score) {
        for (ReasoningQuality quality : values()) {
            if (score >= quality.minimumScore) {
                return quality;
            }
        }
        return FAILING;
    }
}
