/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Reasoning defects the verdict evaluator can detect.
 */
public enum FallacyKind {
    CONFIRMATION_BIAS("confirmation_bias", "Confirmation bias"),
    CORRELATION_NOT_CAUSATION("correlation_not_causation", "Correlation is not causation"),
    APPEAL_TO_AUTHORITY("appeal_to_authority", "Appeal to authority"),
    POST_HOC("post_hoc", "Post hoc ergo propter hoc"),
    WEAK_REASONING("weak_reasoning", "Weak reasoning");

    private final String key;
    private final String displayName;

    FallacyKind(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Accepts both {@code post_hoc} and {@code POST_HOC} style keys.
     */
    public static Optional<FallacyKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FallacyKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
