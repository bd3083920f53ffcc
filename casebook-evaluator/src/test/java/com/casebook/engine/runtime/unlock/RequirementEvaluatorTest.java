package com.casebook.engine.runtime.unlock;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.runtime.CaseFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.casebook.engine.api.model.Requirement.allOf;
import static com.casebook.engine.api.model.Requirement.anyOf;
import static com.casebook.engine.api.model.Requirement.evidence;
import static com.casebook.engine.api.model.Requirement.threshold;
import static org.assertj.core.api.Assertions.assertThat;

class RequirementEvaluatorTest {

    private RequirementEvaluator evaluator;
    private PlayerState empty;

    @BeforeEach
    void setUp() {
        evaluator = new RequirementEvaluator();
        empty = PlayerState.builder("case", "p").withInvestigationPointBudget(12).build();
    }

    private PlayerState discovered(String... ids) {
        return CaseFixtures.withEvidence(empty, ids);
    }

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Should hold evidence-collected only after discovery")
        void shouldEvaluateEvidenceCollected() {
            assertThat(evaluator.evaluate(evidence("e1"), empty)).isFalse();
            assertThat(evaluator.evaluate(evidence("e1"), discovered("e1"))).isTrue();
        }

        @Test
        @DisplayName("Should compare metrics with greater-or-equal")
        void shouldEvaluateThresholds() {
            PlayerState spent = empty.toBuilder().withInvestigationPointsSpent(6).build();

            assertThat(evaluator.evaluate(threshold(Metric.INVESTIGATION_POINTS_SPENT, 6), spent)).isTrue();
            assertThat(evaluator.evaluate(threshold(Metric.INVESTIGATION_POINTS_SPENT, 7), spent)).isFalse();
            assertThat(evaluator.evaluate(threshold(Metric.EVIDENCE_COUNT, 2), discovered("a", "b"))).isTrue();
            assertThat(evaluator.evaluate(threshold(Metric.INVESTIGATION_PROGRESS, 50), spent)).isTrue();
        }

        @Test
        @DisplayName("Should treat an unknown metric as unmet")
        void shouldFailClosedOnUnknownMetric() {
            Requirement luck = new Requirement.ThresholdMet("luck", 0);

            assertThat(evaluator.evaluate(luck, empty)).isFalse();
            assertThat(evaluator.evaluate(anyOf(luck, evidence("e1")), discovered("e1"))).isTrue();
        }

        @Test
        @DisplayName("Should treat a missing requirement as unmet")
        void shouldTreatNullAsUnmet() {
            assertThat(evaluator.evaluate(null, empty)).isFalse();
        }
    }

    @Nested
    @DisplayName("Composites")
    class Composites {

        @Test
        @DisplayName("Should hold an empty all-of vacuously and never an empty any-of")
        void shouldHandleEmptyComposites() {
            assertThat(evaluator.evaluate(new Requirement.AllOf(List.of()), empty)).isTrue();
            assertThat(evaluator.evaluate(new Requirement.AnyOf(List.of()), empty)).isFalse();
        }

        @Test
        @DisplayName("Should evaluate trees nested three levels deep")
        void shouldEvaluateDeepTrees() {
            Requirement h4 = anyOf(evidence("e1"),
                    allOf(evidence("e3"),
                            anyOf(evidence("e4"), threshold(Metric.EVIDENCE_COUNT, 4))));

            assertThat(evaluator.evaluate(h4, discovered("e3"))).isFalse();
            assertThat(evaluator.evaluate(h4, discovered("e4"))).isFalse();
            assertThat(evaluator.evaluate(h4, discovered("e3", "e4"))).isTrue();
            assertThat(evaluator.evaluate(h4, discovered("e3", "e2", "e5", "x"))).isTrue();
            assertThat(evaluator.evaluate(h4, discovered("e1"))).isTrue();
        }

        @Test
        @DisplayName("Should fail closed past the depth bound")
        void shouldFailClosedPastDepthBound() {
            Requirement withinBound = evidence("e1");
            for (int i = 0; i < RequirementEvaluator.MAX_DEPTH; i++) {
                withinBound = allOf(withinBound);
            }
            Requirement pastBound = allOf(withinBound);

            assertThat(evaluator.evaluate(withinBound, discovered("e1"))).isTrue();
            assertThat(evaluator.evaluate(pastBound, discovered("e1"))).isFalse();
        }
    }

    @Nested
    @DisplayName("Hypotheses")
    class Hypotheses {

        @Test
        @DisplayName("Should always unlock base hypotheses")
        void shouldUnlockBaseHypotheses() {
            assertThat(evaluator.isHypothesisUnlocked(Hypothesis.base("h1"), empty)).isTrue();
        }

        @Test
        @DisplayName("Should keep a deduced hypothesis without requirement locked")
        void shouldKeepRequirementlessDeducedLocked() {
            Hypothesis broken = new Hypothesis("hx", "Broken", "", Hypothesis.TIER_DEDUCED, null);

            assertThat(evaluator.isHypothesisUnlocked(broken, discovered("e1"))).isFalse();
        }

        @Test
        @DisplayName("Should evaluate the fixture's deduced hypotheses")
        void shouldEvaluateFixtureHypotheses() {
            CaseDefinition manor = CaseFixtures.manorLibrary();
            Hypothesis h3 = manor.findHypothesis("h3").orElseThrow();
            PlayerState e5Only = discovered("e5").toBuilder().withInvestigationPointsSpent(2).build();

            assertThat(evaluator.isHypothesisUnlocked(h3, e5Only)).isFalse();
            assertThat(evaluator.isHypothesisUnlocked(h3,
                    e5Only.toBuilder().withInvestigationPointsSpent(6).build())).isTrue();
        }
    }

    @Nested
    @DisplayName("Cause selection")
    class CauseSelection {

        @Test
        @DisplayName("Should prefer the just-discovered evidence as the cause")
        void shouldPreferTriggeringEvidence() {
            Requirement requirement = allOf(evidence("e3"), evidence("e4"));

            assertThat(evaluator.findCause(requirement, discovered("e3", "e4"), "e4"))
                    .contains(new UnlockCause.EvidenceCollected("e4"));
            assertThat(evaluator.findCause(requirement, discovered("e3", "e4"), null))
                    .contains(new UnlockCause.EvidenceCollected("e3"));
        }

        @Test
        @DisplayName("Should record the observed metric value for threshold causes")
        void shouldRecordObservedMetricValue() {
            PlayerState spent = empty.toBuilder().withInvestigationPointsSpent(8).build();

            assertThat(evaluator.findCause(threshold(Metric.INVESTIGATION_POINTS_SPENT, 6), spent, null))
                    .contains(new UnlockCause.ThresholdMet(Metric.INVESTIGATION_POINTS_SPENT, 8));
        }

        @Test
        @DisplayName("Should not credit evidence from an all-of branch that does not hold")
        void shouldSkipFailedBranches() {
            Requirement requirement = anyOf(allOf(evidence("e1"), evidence("e9")),
                    threshold(Metric.INVESTIGATION_POINTS_SPENT, 6));
            PlayerState state = discovered("e1").toBuilder().withInvestigationPointsSpent(6).build();

            assertThat(evaluator.findCause(requirement, state, "e1"))
                    .contains(new UnlockCause.ThresholdMet(Metric.INVESTIGATION_POINTS_SPENT, 6));
        }

        @Test
        @DisplayName("Should find no cause for a vacuous all-of")
        void shouldFindNoCauseForVacuousRequirement() {
            assertThat(evaluator.findCause(new Requirement.AllOf(List.of()), empty, null)).isEmpty();
        }
    }
}
