package com.casebook.engine.runtime.verdict;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.VerdictResult.DetectedFallacy;
import com.casebook.engine.runtime.CaseFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FallacyDetectorTest {

    private FallacyDetector detector;
    private CaseDefinition manor;
    private Solution solution;

    @BeforeEach
    void setUp() {
        detector = new FallacyDetector();
        manor = CaseFixtures.manorLibrary();
        solution = manor.getSolution();
    }

    @Test
    @DisplayName("Should flag confirmation bias when less than half the key evidence is cited")
    void shouldDetectConfirmationBias() {
        assertThat(detector.isConfirmationBias(List.of(), solution)).isTrue();
        assertThat(detector.isConfirmationBias(List.of("e2"), solution)).isFalse();
        assertThat(detector.isConfirmationBias(List.of("e2", "e3"), solution)).isFalse();
        assertThat(detector.isConfirmationBias(List.of(), Solution.of("x", List.of()))).isFalse();
    }

    @Test
    @DisplayName("Should flag correlation when only presence evidence is cited")
    void shouldDetectCorrelationNotCausation() {
        assertThat(detector.isCorrelationNotCausation("butler", List.of("e4"), solution)).isTrue();
        assertThat(detector.isCorrelationNotCausation("butler", List.of("e4", "e3"), solution)).isFalse();
        assertThat(detector.isCorrelationNotCausation("butler", List.of("e4", "e1"), solution)).isFalse();
        assertThat(detector.isCorrelationNotCausation("gardener", List.of("e4"), solution)).isFalse();
        assertThat(detector.isCorrelationNotCausation("butler", List.of(), solution)).isFalse();
    }

    @Test
    @DisplayName("Should flag appeal to authority unless the reasoning argues against it")
    void shouldDetectAppealToAuthority() {
        assertThat(detector.isAppealToAuthority("butler", "The butler had the keys.", solution)).isTrue();
        assertThat(detector.isAppealToAuthority("butler",
                "The butler had the keys. However, nobody saw him leave.", solution)).isFalse();
        assertThat(detector.isAppealToAuthority("gardener", "The gardener had the keys.", solution)).isFalse();
    }

    @Test
    @DisplayName("Should ignore blank counter-argument keywords")
    void shouldIgnoreBlankCounterArgumentKeywords() {
        Solution blankKeywords = new Solution(solution.culprit(), solution.method(), solution.motive(),
                solution.keyEvidence(), solution.deductionsRequired(), solution.commonMistakes(),
                solution.fallacyExamples(), solution.authorityFigures(), solution.presencePairings(),
                solution.chronologyClaims(), List.of("  ", "nonetheless", ""));

        assertThat(blankKeywords.counterArgumentKeywords()).containsExactly("nonetheless");
        assertThat(detector.isAppealToAuthority("butler", "The butler had the keys.", blankKeywords)).isTrue();
        assertThat(new Solution(solution.culprit(), null, null, null, null, null, null, null, null, null,
                List.of(" ")).counterArgumentKeywords()).isEqualTo(Solution.DEFAULT_COUNTER_ARGUMENT_KEYWORDS);
    }

    @Test
    @DisplayName("Should flag post hoc when cited evidence implies an order the timeline contradicts")
    void shouldDetectPostHoc() {
        assertThat(detector.isPostHoc(List.of("e1"), manor)).isTrue();
        assertThat(detector.isPostHoc(List.of("e2"), manor)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"I guess it was him.", "He probably did it.", "Just a feeling.", "MAYBE the gardener."})
    @DisplayName("Should flag hedged reasoning as weak")
    void shouldDetectWeakReasoning(String reasoning) {
        assertThat(detector.isWeakReasoning(reasoning)).isTrue();
    }

    @Test
    @DisplayName("Should not flag hedging words embedded in other words")
    void shouldIgnoreEmbeddedHedges() {
        assertThat(detector.isWeakReasoning("The maybelline compact was on the desk.")).isFalse();
    }

    @Test
    @DisplayName("Should attach the case example or a default explanation")
    void shouldAttachExamples() {
        List<DetectedFallacy> fallacies = detector.detect("butler", "The butler had the keys. I guess.",
                List.of("e1"), manor);

        assertThat(fallacies).extracting(DetectedFallacy::kind).containsExactly(
                FallacyKind.CONFIRMATION_BIAS,
                FallacyKind.APPEAL_TO_AUTHORITY,
                FallacyKind.POST_HOC,
                FallacyKind.WEAK_REASONING);
        assertThat(fallacies.get(0).example()).isEqualTo("You only looked at what fit your first suspicion.");
        assertThat(fallacies).allSatisfy(f -> assertThat(f.example()).isNotBlank());
    }
}
