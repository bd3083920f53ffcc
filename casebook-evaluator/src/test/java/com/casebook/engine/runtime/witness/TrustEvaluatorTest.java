package com.casebook.engine.runtime.witness;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class TrustEvaluatorTest {

    private TrustEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new TrustEvaluator();
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "You are lying to me | -10",
            "Admit what you did | -10",
            "Please help me understand | 5",
            "I believe you | 5",
            "I believe you, now admit it | -10",
            "Where were you at ten? | 0"
    })
    @DisplayName("Should score question tone with aggressive phrasing taking precedence")
    void shouldScoreTone(String question, int expected) {
        assertThat(evaluator.trustDelta(question)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat a missing question as neutral")
    void shouldTreatNullAsNeutral() {
        assertThat(evaluator.trustDelta(null)).isZero();
    }

    @Test
    @DisplayName("Should clamp trust into 0-100")
    void shouldClamp() {
        assertThat(TrustEvaluator.clamp(-5)).isEqualTo(TrustEvaluator.MIN_TRUST);
        assertThat(TrustEvaluator.clamp(120)).isEqualTo(TrustEvaluator.MAX_TRUST);
        assertThat(TrustEvaluator.clamp(55)).isEqualTo(55);
    }

    @Test
    @DisplayName("Should extract what the player presents to the witness")
    void shouldDetectPresentation() {
        assertThat(evaluator.detectPresentation("I show the E2 to him")).contains("e2");
        assertThat(evaluator.detectPresentation("present torn_letter")).contains("torn_letter");
        assertThat(evaluator.detectPresentation("Where were you?")).isEmpty();
        assertThat(evaluator.detectPresentation(null)).isEmpty();
    }
}
