package com.casebook.engine.runtime.unlock;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.api.model.UnlockEvent;
import com.casebook.engine.runtime.CaseFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class UnlockScannerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private UnlockScanner scanner;
    private CaseDefinition manor;
    private PlayerState fresh;

    @BeforeEach
    void setUp() {
        AtomicInteger sequence = new AtomicInteger();
        scanner = new UnlockScanner(new RequirementEvaluator(),
                () -> "evt-" + sequence.incrementAndGet(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        manor = CaseFixtures.manorLibrary();
        fresh = CaseFixtures.freshState(manor);
    }

    @Test
    @DisplayName("Should unlock h3 only once investigation points reach the threshold")
    void shouldUnlockWhenThresholdReached() {
        PlayerState e5Only = CaseFixtures.withEvidence(fresh, "e5").toBuilder().withInvestigationPointsSpent(2).build();

        Transition<List<UnlockEvent>> first = scanner.scan(manor, e5Only, "e5");
        assertThat(first.result()).isEmpty();
        assertThat(first.state().isHypothesisUnlocked("h3")).isFalse();

        PlayerState spent = first.state().toBuilder().withInvestigationPointsSpent(6).build();
        Transition<List<UnlockEvent>> second = scanner.scan(manor, spent, null);

        assertThat(second.result()).singleElement().satisfies(event -> {
            assertThat(event.hypothesisId()).isEqualTo("h3");
            assertThat(event.id()).isEqualTo("evt-1");
            assertThat(event.timestamp()).isEqualTo(NOW);
            assertThat(event.acknowledged()).isFalse();
            assertThat(event.cause()).isEqualTo(new UnlockCause.EvidenceCollected("e5"));
        });
        assertThat(second.state().isHypothesisUnlocked("h3")).isTrue();
        assertThat(second.state().getPendingNotificationIds()).containsExactly("evt-1");
    }

    @Test
    @DisplayName("Should emit nothing when scanning an already scanned state")
    void shouldBeIdempotent() {
        PlayerState ready = CaseFixtures.withEvidence(fresh, "e1");
        Transition<List<UnlockEvent>> first = scanner.scan(manor, ready, "e1");

        Transition<List<UnlockEvent>> second = scanner.scan(manor, first.state(), null);

        assertThat(first.result()).hasSize(1);
        assertThat(second.result()).isEmpty();
        assertThat(second.state()).isSameAs(first.state());
        assertThat(second.state().getUnlockEventLog()).hasSize(1);
    }

    @Test
    @DisplayName("Should apply every unlock of one scan to the same returned state")
    void shouldApplyBatchTogether() {
        PlayerState ready = CaseFixtures.withEvidence(fresh, "e1", "e5").toBuilder()
                .withInvestigationPointsSpent(6)
                .build();

        Transition<List<UnlockEvent>> transition = scanner.scan(manor, ready, null);

        assertThat(transition.result()).extracting(UnlockEvent::hypothesisId).containsExactly("h3", "h4");
        PlayerState after = transition.state();
        assertThat(after.getUnlockedHypothesisIds()).contains("h3", "h4");
        assertThat(after.getUnlockEventLog()).hasSize(2);
        assertThat(after.getPendingNotificationIds()).containsExactly("evt-1", "evt-2");
        assertThat(ready.isHypothesisUnlocked("h3")).isFalse();
    }

    @Test
    @DisplayName("Should add missing base hypotheses without emitting events")
    void shouldSeedBaseHypothesesSilently() {
        PlayerState bare = PlayerState.builder(manor.getCaseId(), "p").withCurrentLocation("library").build();

        Transition<List<UnlockEvent>> transition = scanner.scan(manor, bare, null);

        assertThat(transition.result()).isEmpty();
        assertThat(transition.state().getUnlockedHypothesisIds()).containsExactlyInAnyOrder("h1", "h2");
        assertThat(transition.state().getUnlockEventLog()).isEmpty();
    }

    @Test
    @DisplayName("Should list newly unlockable hypotheses in declaration order")
    void shouldFindNewlyUnlocked() {
        PlayerState ready = CaseFixtures.withEvidence(fresh, "e3", "e4");

        assertThat(scanner.findNewlyUnlocked(manor.getHypotheses(), ready)).containsExactly("h4");
    }
}
