package com.casebook.engine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MetricTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "evidenceCount, EVIDENCE_COUNT",
            "evidence_count, EVIDENCE_COUNT",
            "ipSpent, INVESTIGATION_POINTS_SPENT",
            "INVESTIGATION_POINTS_SPENT, INVESTIGATION_POINTS_SPENT",
            "investigationProgress, INVESTIGATION_PROGRESS"
    })
    @DisplayName("Should resolve every accepted metric key")
    void shouldResolveKeys(String key, Metric expected) {
        assertThat(Metric.fromKey(key)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "suspicion", "evidence count"})
    @DisplayName("Should not resolve unknown keys")
    void shouldRejectUnknownKeys(String key) {
        assertThat(Metric.fromKey(key)).isEmpty();
    }

    @Test
    @DisplayName("Should read metric values from player state")
    void shouldReadValues() {
        PlayerState state = PlayerState.builder("c", "p")
                .addDiscoveredEvidence("e1")
                .addDiscoveredEvidence("e5")
                .withInvestigationPointBudget(12)
                .withInvestigationPointsSpent(6)
                .build();

        assertThat(Metric.EVIDENCE_COUNT.currentValue(state)).isEqualTo(2);
        assertThat(Metric.INVESTIGATION_POINTS_SPENT.currentValue(state)).isEqualTo(6);
        assertThat(Metric.INVESTIGATION_PROGRESS.currentValue(state)).isEqualTo(50);
    }

    @Test
    @DisplayName("Should treat a zero budget as complete progress")
    void shouldHandleZeroBudget() {
        PlayerState state = PlayerState.builder("c", "p").withInvestigationPointBudget(0).build();

        assertThat(Metric.INVESTIGATION_PROGRESS.currentValue(state)).isEqualTo(100);
    }

    @Test
    @DisplayName("Should resolve fallacy keys in either case")
    void shouldResolveFallacyKeys() {
        assertThat(FallacyKind.fromKey("POST_HOC")).contains(FallacyKind.POST_HOC);
        assertThat(FallacyKind.fromKey("post-hoc")).contains(FallacyKind.POST_HOC);
        assertThat(FallacyKind.fromKey("ad_hominem")).isEmpty();
    }
}
