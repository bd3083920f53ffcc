/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.compiler.analysis;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Evidence;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.Witness;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authoring checks over a compiled case.
 *
 * <p>Nothing reported here stops a case from loading. Findings point at content that is
 * legal but probably not what the author intended:
 * <ul>
 *   <li>a witness with {@code wants} but no {@code fears}, or the reverse</li>
 *   <li>evidence with no triggers, which can never be discovered</li>
 *   <li>a tier-1 hypothesis carrying a requirement, which is ignored</li>
 *   <li>thresholds no player can reach with this case's budget or evidence</li>
 *   <li>chronology claims naming events missing from the timeline</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * CaseDefinition definition = compiler.compile(casePath);
 * LintReport report = new CaseLintAnalyzer().analyze(definition);
 * report.warnings().forEach(w -&gt; System.out.println(w.describe()));
 * </pre>
 */
public class CaseLintAnalyzer {

    public enum Rule {
        WANTS_FEARS_PAIRING,
        EVIDENCE_WITHOUT_TRIGGERS,
        BASE_HYPOTHESIS_WITH_REQUIREMENT,
        UNREACHABLE_THRESHOLD,
        UNKNOWN_TIMELINE_EVENT
    }

    public LintReport analyze(CaseDefinition definition) {
        List<LintWarning> warnings = new ArrayList<>();

        for (Witness witness : definition.getWitnesses()) {
            boolean hasWants = !witness.wants().isEmpty();
            boolean hasFears = !witness.fears().isEmpty();
            if (hasWants != hasFears) {
                warnings.add(new LintWarning(Rule.WANTS_FEARS_PAIRING, witness.id(),
                        hasWants ? "declares wants but no fears" : "declares fears but no wants"));
            }
        }

        for (Evidence evidence : definition.getAllEvidence()) {
            if (evidence.triggers().stream().allMatch(String::isBlank)) {
                warnings.add(new LintWarning(Rule.EVIDENCE_WITHOUT_TRIGGERS, evidence.id(),
                        "has no triggers and can never be discovered"));
            }
        }

        int evidenceTotal = definition.getAllEvidence().size();
        for (Hypothesis hypothesis : definition.getHypotheses()) {
            if (hypothesis.requirement() == null) {
                continue;
            }
            if (hypothesis.isBase()) {
                warnings.add(new LintWarning(Rule.BASE_HYPOTHESIS_WITH_REQUIREMENT, hypothesis.id(),
                        "is tier 1, so its requirement is ignored"));
            }
            for (Requirement.ThresholdMet threshold : thresholds(hypothesis.requirement())) {
                unreachable(threshold, definition.getInvestigationPointBudget(), evidenceTotal)
                        .ifPresent(msg -> warnings.add(new LintWarning(Rule.UNREACHABLE_THRESHOLD, hypothesis.id(), msg)));
            }
        }

        Solution solution = definition.getSolution();
        if (solution != null) {
            for (Solution.ChronologyClaim claim : solution.chronologyClaims()) {
                for (String eventId : List.of(claim.earlierEventId(), claim.laterEventId())) {
                    if (definition.timelinePosition(eventId) < 0) {
                        warnings.add(new LintWarning(Rule.UNKNOWN_TIMELINE_EVENT, claim.evidenceId(),
                                "chronology claim names unknown timeline event '" + eventId + "'"));
                    }
                }
            }
        }

        return new LintReport(definition.getCaseId(), warnings);
    }

    private Optional<String> unreachable(Requirement.ThresholdMet threshold, int budget, int evidenceTotal) {
        Optional<Metric> metric = threshold.metric();
        if (metric.isEmpty()) {
            return Optional.empty();
        }
        int limit = switch (metric.get()) {
            case EVIDENCE_COUNT -> evidenceTotal;
            case INVESTIGATION_POINTS_SPENT -> budget;
            case INVESTIGATION_PROGRESS -> 100;
        };
        if (threshold.threshold() > limit) {
            return Optional.of(String.format("needs %s >= %d but at most %d is reachable",
                    metric.get().key(), threshold.threshold(), limit));
        }
        return Optional.empty();
    }

    private List<Requirement.ThresholdMet> thresholds(Requirement requirement) {
        List<Requirement.ThresholdMet> found = new ArrayList<>();
        requirement.accept(new Requirement.Visitor<Void>() {
            @Override
            public Void visitEvidenceCollected(Requirement.EvidenceCollected r) {
                return null;
            }

            @Override
            public Void visitThresholdMet(Requirement.ThresholdMet r) {
                found.add(r);
                return null;
            }

            @Override
            public Void visitAllOf(Requirement.AllOf r) {
                r.children().forEach(c -> c.accept(this));
                return null;
            }

            @Override
            public Void visitAnyOf(Requirement.AnyOf r) {
                r.children().forEach(c -> c.accept(this));
                return null;
            }
        });
        return found;
    }

    public record LintReport(String caseId, List<LintWarning> warnings) implements Serializable {

        public LintReport {
            warnings = List.copyOf(warnings);
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }

        public int warningCount() {
            return warnings.size();
        }

        public List<LintWarning> byRule(Rule rule) {
            return warnings.stream().filter(w -> w.rule() == rule).toList();
        }
    }

    /**
     * @param subjectId id of the witness, evidence or hypothesis the finding is about
     */
    public record LintWarning(Rule rule, String subjectId, String message) implements Serializable {

        public String describe() {
            return String.format("[%s] '%s' %s", rule, subjectId, message);
        }
    }
}
