/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Boolean requirement tree gating a tier-2 {@link Hypothesis}.
 *
 * <p>Leaves test a single fact about the player state; composites combine children.
 * The hierarchy is sealed, and evaluation goes through {@link Visitor}, so adding a
 * requirement kind forces every evaluator to handle it at compile time.
 *
 * <p>Composite children are copied into immutable lists on construction, so a tree
 * built from these records is always finite and acyclic.
 */
public sealed interface Requirement
        permits Requirement.EvidenceCollected,
                Requirement.ThresholdMet,
                Requirement.AllOf,
                Requirement.AnyOf {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the requirement kinds.
     */
    interface Visitor<R> {
        R visitEvidenceCollected(EvidenceCollected requirement);

        R visitThresholdMet(ThresholdMet requirement);

        R visitAllOf(AllOf requirement);

        R visitAnyOf(AnyOf requirement);
    }

    /**
     * Holds when the evidence id has been discovered.
     */
    record EvidenceCollected(String evidenceId) implements Requirement {
        public EvidenceCollected {
            Objects.requireNonNull(evidenceId, "evidenceId must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEvidenceCollected(this);
        }
    }

    /**
     * Holds when the named metric's current value is at least {@code threshold}.
     *
     * <p>The metric key is kept as loaded so an unknown key can be reported and
     * evaluated fail-closed instead of being rejected at construction.
     */
    record ThresholdMet(String metricKey, int threshold) implements Requirement {
        public ThresholdMet {
            Objects.requireNonNull(metricKey, "metricKey must not be null");
        }

        public ThresholdMet(Metric metric, int threshold) {
            this(metric.key(), threshold);
        }

        public Optional<Metric> metric() {
            return Metric.fromKey(metricKey);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThresholdMet(this);
        }
    }

    /**
     * Holds when every child holds. An empty list holds vacuously.
     */
    record AllOf(List<Requirement> children) implements Requirement {
        public AllOf {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAllOf(this);
        }
    }

    /**
     * Holds when at least one child holds. An empty list never holds.
     */
    record AnyOf(List<Requirement> children) implements Requirement {
        public AnyOf {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnyOf(this);
        }
    }

    static Requirement evidence(String evidenceId) {
        return new EvidenceCollected(evidenceId);
    }

    static Requirement threshold(Metric metric, int threshold) {
        return new ThresholdMet(metric, threshold);
    }

    static Requirement allOf(Requirement... children) {
        return new AllOf(Arrays.asList(children));
    }

    static Requirement anyOf(Requirement... children) {
        return new AnyOf(Arrays.asList(children));
    }
}
