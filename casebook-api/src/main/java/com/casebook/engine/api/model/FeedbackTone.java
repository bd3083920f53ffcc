/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

/**
 * How directly verdict feedback points at the answer. Chosen purely from attempts remaining.
 */
public enum FeedbackTone {
    VAGUE,
    SPECIFIC,
    DIRECT;

    public static FeedbackTone forAttemptsRemaining(int attemptsRemaining) {
        if (attemptsRemaining >= 7) {
            return VAGUE;
        }
        return attemptsRemaining >= 4 ? SPECIFIC : DIRECT;
    }
}
