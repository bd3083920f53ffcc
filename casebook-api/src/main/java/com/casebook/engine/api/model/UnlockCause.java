/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.Objects;

/**
 * What caused a hypothesis to unlock. Mirrors the leaf kinds of {@link Requirement},
 * plus a marker for unlocks granted outside the requirement tree.
 */
public sealed interface UnlockCause
        permits UnlockCause.EvidenceCollected,
                UnlockCause.ThresholdMet,
                UnlockCause.ManualOverride {

    /**
     * Short human-readable description, e.g. for notification toasts.
     */
    String describe();

    record EvidenceCollected(String evidenceId) implements UnlockCause {
        public EvidenceCollected {
            Objects.requireNonNull(evidenceId, "evidenceId must not be null");
        }

        @Override
        public String describe() {
            return "Evidence collected: " + evidenceId;
        }
    }

    record ThresholdMet(Metric metric, int observedValue) implements UnlockCause {
        public ThresholdMet {
            Objects.requireNonNull(metric, "metric must not be null");
        }

        @Override
        public String describe() {
            return "Threshold met: " + metric.key() + " = " + observedValue;
        }
    }

    record ManualOverride(String reason) implements UnlockCause {
        public ManualOverride {
            reason = reason == null ? "" : reason;
        }

        @Override
        public String describe() {
            return reason.isEmpty() ? "Unlocked manually" : "Unlocked manually: " + reason;
        }
    }
}
