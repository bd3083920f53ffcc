package com.casebook.engine.compiler.analysis;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Evidence;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Location;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.TimelineEvent;
import com.casebook.engine.api.model.Witness;
import com.casebook.engine.compiler.analysis.CaseLintAnalyzer.LintReport;
import com.casebook.engine.compiler.analysis.CaseLintAnalyzer.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CaseLintAnalyzerTest {

    private final CaseLintAnalyzer analyzer = new CaseLintAnalyzer();

    private CaseDefinition.Builder baseCase() {
        return CaseDefinition.builder("lint")
                .withInvestigationPointBudget(10)
                .addLocation(new Location("hall", List.of(
                        Evidence.of("e1", "hall", "desk"),
                        Evidence.of("e2", "hall", "floor"))))
                .addTimelineEvent(new TimelineEvent("t1", "20:00", "Dinner", List.of()))
                .addTimelineEvent(new TimelineEvent("t2", "22:00", "Scream", List.of()))
                .withSolution(Solution.of("cook", List.of("e1")));
    }

    @Test
    @DisplayName("Should report nothing for a clean case")
    void shouldReportNothingForCleanCase() {
        LintReport report = analyzer.analyze(baseCase().build());

        assertThat(report.hasWarnings()).isFalse();
        assertThat(report.caseId()).isEqualTo("lint");
    }

    @Test
    @DisplayName("Should flag witnesses with wants but no fears and the reverse")
    void shouldFlagUnpairedWantsAndFears() {
        CaseDefinition definition = baseCase()
                .addWitness(new Witness("maid", "Maid", "", 50, List.of("a raise"), List.of(), List.of()))
                .addWitness(new Witness("cook", "Cook", "", 50, List.of(), List.of("dismissal"), List.of()))
                .addWitness(new Witness("valet", "Valet", "", 50, List.of("x"), List.of("y"), List.of()))
                .build();

        LintReport report = analyzer.analyze(definition);

        assertThat(report.byRule(Rule.WANTS_FEARS_PAIRING))
                .extracting(CaseLintAnalyzer.LintWarning::subjectId)
                .containsExactly("maid", "cook");
    }

    @Test
    @DisplayName("Should flag evidence that has no triggers")
    void shouldFlagEvidenceWithoutTriggers() {
        CaseDefinition definition = baseCase()
                .addLocation(new Location("cellar", List.of(Evidence.of("ghost", "cellar"))))
                .build();

        assertThat(analyzer.analyze(definition).byRule(Rule.EVIDENCE_WITHOUT_TRIGGERS))
                .singleElement()
                .satisfies(w -> assertThat(w.subjectId()).isEqualTo("ghost"));
    }

    @Test
    @DisplayName("Should flag tier 1 hypotheses with requirements and unreachable thresholds")
    void shouldFlagHypothesisProblems() {
        CaseDefinition definition = baseCase()
                .addHypothesis(new Hypothesis("h1", "h1", "", Hypothesis.TIER_BASE, Requirement.evidence("e1")))
                .addHypothesis(Hypothesis.deduced("h2", Requirement.anyOf(
                        Requirement.threshold(Metric.INVESTIGATION_POINTS_SPENT, 11),
                        Requirement.threshold(Metric.EVIDENCE_COUNT, 3),
                        Requirement.threshold(Metric.INVESTIGATION_PROGRESS, 100))))
                .build();

        LintReport report = analyzer.analyze(definition);

        assertThat(report.byRule(Rule.BASE_HYPOTHESIS_WITH_REQUIREMENT)).hasSize(1);
        assertThat(report.byRule(Rule.UNREACHABLE_THRESHOLD))
                .extracting(CaseLintAnalyzer.LintWarning::message)
                .containsExactly(
                        "needs investigationPointsSpent >= 11 but at most 10 is reachable",
                        "needs evidenceCount >= 3 but at most 2 is reachable");
    }

    @Test
    @DisplayName("Should flag chronology claims naming unknown timeline events")
    void shouldFlagUnknownTimelineEvents() {
        Solution solution = new Solution("cook", "", "", List.of("e1"), null, null, null, null, null,
                List.of(new Solution.ChronologyClaim("e2", "t1", "t9")), null);
        CaseDefinition definition = baseCase().withSolution(solution).build();

        assertThat(analyzer.analyze(definition).byRule(Rule.UNKNOWN_TIMELINE_EVENT))
                .singleElement()
                .satisfies(w -> assertThat(w.describe()).contains("t9"));
    }
}
