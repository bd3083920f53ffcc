/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.unlock;

import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.UnlockCause;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Evaluates {@link Requirement} trees against a player state snapshot.
 *
 * <p>Evaluation is pure and total. Anything the evaluator cannot resolve (an unknown metric,
 * a tree deeper than {@link #MAX_DEPTH}) evaluates to {@code false} and logs a warning, so a
 * malformed rule can never grant an unlock.
 *
 * <p>Trees are finite: {@link Requirement.AllOf} and {@link Requirement.AnyOf} copy their
 * children into immutable lists at construction, so no cycle can be built. The depth bound
 * guards against pathological but finite trees.
 */
public class RequirementEvaluator {

    private static final Logger logger = Logger.getLogger(RequirementEvaluator.class.getName());

    public static final int MAX_DEPTH = 32;

    public boolean evaluate(Requirement requirement, PlayerState state) {
        if (requirement == null) {
            return false;
        }
        return requirement.accept(new EvaluationVisitor(state));
    }

    /**
     * Tier-1 hypotheses are always unlocked; tier-2 hypotheses are unlocked iff their requirement holds.
     */
    public boolean isHypothesisUnlocked(Hypothesis hypothesis, PlayerState state) {
        if (hypothesis.isBase()) {
            return true;
        }
        if (hypothesis.requirement() == null) {
            logger.warning("Hypothesis '" + hypothesis.id() + "' is tier " + hypothesis.tier()
                    + " but has no requirement; treating as locked");
            return false;
        }
        return evaluate(hypothesis.requirement(), state);
    }

    /**
     * Picks the cause to record for an unlock: the first satisfied leaf in depth-first order,
     * unless {@code preferredEvidenceId} is itself a satisfied leaf. Only branches that hold
     * are walked, so a leaf under a failed {@code AllOf} is never credited.
     *
     * @param preferredEvidenceId evidence discovered by the triggering action, or {@code null}
     * @return the cause, or empty when no leaf holds (e.g. an empty {@code AllOf})
     */
    public Optional<UnlockCause> findCause(Requirement requirement, PlayerState state, String preferredEvidenceId) {
        if (requirement == null) {
            return Optional.empty();
        }
        List<UnlockCause> satisfied = new ArrayList<>();
        collectSatisfiedLeaves(requirement, state, satisfied, 1);
        if (preferredEvidenceId != null) {
            for (UnlockCause cause : satisfied) {
                if (cause instanceof UnlockCause.EvidenceCollected collected
                        && collected.evidenceId().equals(preferredEvidenceId)) {
                    return Optional.of(cause);
                }
            }
        }
        return satisfied.stream().findFirst();
    }

    private void collectSatisfiedLeaves(Requirement requirement, PlayerState state, List<UnlockCause> out, int depth) {
        if (depth > MAX_DEPTH || !evaluate(requirement, state)) {
            return;
        }
        requirement.accept(new Requirement.Visitor<Void>() {
            @Override
            public Void visitEvidenceCollected(Requirement.EvidenceCollected r) {
                if (state.isEvidenceDiscovered(r.evidenceId())) {
                    out.add(new UnlockCause.EvidenceCollected(r.evidenceId()));
                }
                return null;
            }

            @Override
            public Void visitThresholdMet(Requirement.ThresholdMet r) {
                r.metric().ifPresent(metric -> {
                    int value = metric.currentValue(state);
                    if (value >= r.threshold()) {
                        out.add(new UnlockCause.ThresholdMet(metric, value));
                    }
                });
                return null;
            }

            @Override
            public Void visitAllOf(Requirement.AllOf r) {
                r.children().forEach(c -> collectSatisfiedLeaves(c, state, out, depth + 1));
                return null;
            }

            @Override
            public Void visitAnyOf(Requirement.AnyOf r) {
                r.children().forEach(c -> collectSatisfiedLeaves(c, state, out, depth + 1));
                return null;
            }
        });
    }

    /**
     * Single-use visitor; tracks recursion depth.
     */
    private static final class EvaluationVisitor implements Requirement.Visitor<Boolean> {
        private final PlayerState state;
        private int depth;

        EvaluationVisitor(PlayerState state) {
            this.state = state;
        }

        private boolean descend(Requirement child) {
            if (depth >= MAX_DEPTH) {
                logger.warning("Requirement tree exceeds depth " + MAX_DEPTH + "; failing closed");
                return false;
            }
            depth++;
            try {
                return child.accept(this);
            } finally {
                depth--;
            }
        }

        @Override
        public Boolean visitEvidenceCollected(Requirement.EvidenceCollected requirement) {
            return state.isEvidenceDiscovered(requirement.evidenceId());
        }

        @Override
        public Boolean visitThresholdMet(Requirement.ThresholdMet requirement) {
            Optional<Metric> metric = requirement.metric();
            if (metric.isEmpty()) {
                logger.warning("Unknown metric '" + requirement.metricKey() + "' in requirement; treating as unmet");
                return false;
            }
            return metric.get().currentValue(state) >= requirement.threshold();
        }

        @Override
        public Boolean visitAllOf(Requirement.AllOf requirement) {
            for (Requirement child : requirement.children()) {
                if (!descend(child)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitAnyOf(Requirement.AnyOf requirement) {
            for (Requirement child : requirement.children()) {
                if (descend(child)) {
                    return true;
                }
            }
            return false;
        }
    }
}
