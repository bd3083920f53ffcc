/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Numeric player-state metrics a {@link Requirement.ThresholdMet} can compare against.
 *
 * <p>Each metric is read directly from {@link PlayerState} counters. The set is closed:
 * a metric key loaded from a case file that does not resolve here never satisfies a
 * threshold.
 */
public enum Metric {

    /** Number of distinct evidence ids discovered. */
    EVIDENCE_COUNT("evidenceCount", "evidence_count"),

    /** Investigation points spent so far. */
    INVESTIGATION_POINTS_SPENT("investigationPointsSpent", "investigation_points_spent", "ipSpent", "ip_spent"),

    /** Percentage (0-100) of the case's investigation point budget already spent. */
    INVESTIGATION_PROGRESS("investigationProgress", "investigation_progress");

    private final List<String> keys;

    Metric(String... keys) {
        this.keys = List.of(keys);
    }

    /**
     * Returns the key written in case files and snapshots.
     */
    public String key() {
        return keys.get(0);
    }

    /**
     * Resolves a metric key as found in a case file. Matching ignores case.
     *
     * @param key metric key, e.g. {@code "ipSpent"} or {@code "evidence_count"}
     * @return the metric, or empty when the key is unknown
     */
    public static Optional<Metric> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Metric metric : values()) {
            for (String candidate : metric.keys) {
                if (candidate.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return Optional.of(metric);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the current value of this metric from a state snapshot.
     */
    public int currentValue(PlayerState state) {
        return switch (this) {
            case EVIDENCE_COUNT -> state.getDiscoveredEvidenceIds().size();
            case INVESTIGATION_POINTS_SPENT -> state.getInvestigationPointsSpent();
            case INVESTIGATION_PROGRESS -> {
                int budget = state.getInvestigationPointBudget();
                if (budget <= 0) {
                    yield 100;
                }
                yield (int) Math.round(state.getInvestigationPointsSpent() * 100.0 / budget);
            }
        };
    }
}
