package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.VerdictResult.ScoreBreakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningScorerTest {

    private ReasoningScorer scorer;
    private Solution solution;
    private PlayerState state;

    @BeforeEach
    void setUp() {
        scorer = new ReasoningScorer();
        solution = Solution.of("gardener", List.of("e2", "e3"));
        state = PlayerState.builder("case", "p").addDiscoveredEvidence("e2").addDiscoveredEvidence("e3").build();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "One sentence without a stop | 1",
            "First. Second! Third? | 3",
            "Ends without. A period | 2",
            "'   ' | 0"
    })
    @DisplayName("Should count sentences by terminal punctuation")
    void shouldCountSentences(String text, int expected) {
        assertThat(ReasoningScorer.countSentences(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should weight partial key evidence proportionally")
    void shouldScorePartialKeyEvidence() {
        ScoreBreakdown breakdown = scorer.score(true, "He did it. The mud proves it.", List.of("e2"), 0, solution, state);

        assertThat(breakdown.keyEvidence()).isEqualTo(15);
        assertThat(breakdown.structure()).isEqualTo(ReasoningScorer.STRUCTURE_COHERENT);
        assertThat(breakdown.citation()).isEqualTo(ReasoningScorer.GROUNDED_CITATION);
        assertThat(scorer.total(breakdown)).isEqualTo(85);
    }

    @Test
    @DisplayName("Should withhold the citation bonus when any cited evidence is undiscovered")
    void shouldRequireDiscoveredCitations() {
        ScoreBreakdown breakdown = scorer.score(true, "He did it.", List.of("e2", "e9"), 0, solution, state);

        assertThat(breakdown.citation()).isZero();
        assertThat(breakdown.structure()).isEqualTo(ReasoningScorer.STRUCTURE_WEAK);
    }

    @Test
    @DisplayName("Should cap fallacy deductions and clamp the total at zero")
    void shouldCapDeductions() {
        ScoreBreakdown breakdown = scorer.score(false, "Guess.", List.of(), 6, solution, state);

        assertThat(breakdown.fallacyDeduction()).isEqualTo(-ReasoningScorer.MAX_FALLACY_PENALTY);
        assertThat(scorer.total(breakdown)).isZero();
    }

    @Test
    @DisplayName("Should penalise rambling reasoning as weakly structured")
    void shouldPenaliseLongReasoning() {
        ScoreBreakdown breakdown = scorer.score(true, "A. B. C. D. E. F.", List.of("e2", "e3"), 0, solution, state);

        assertThat(breakdown.structure()).isEqualTo(ReasoningScorer.STRUCTURE_WEAK);
        assertThat(scorer.total(breakdown)).isEqualTo(85);
    }
}
