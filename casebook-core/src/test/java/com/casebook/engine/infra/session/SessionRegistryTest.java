package com.casebook.engine.infra.session;

import com.casebook.engine.api.exceptions.SessionBusyException;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.infra.session.SessionRegistry.SessionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private static final SessionKey KEY = new SessionKey("manor_library", "player-1");

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(Duration.ofMillis(100), Duration.ofMinutes(5), 100);
    }

    @Test
    @DisplayName("Should open a session once and keep its state")
    void shouldOpenSessionOnce() {
        PlayerState initial = state(0);

        PlayerState opened = registry.open(KEY, () -> initial);
        PlayerState reopened = registry.open(KEY, () -> state(99));

        assertThat(opened).isSameAs(initial);
        assertThat(reopened).isSameAs(initial);
        assertThat(registry.activeSessions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should publish the state produced by a transition")
    void shouldPublishTransitionState() {
        registry.open(KEY, () -> state(0));

        Transition<String> result = registry.execute(KEY, s -> new Transition<>("spent", spend(s, 3)));

        assertThat(result.result()).isEqualTo("spent");
        assertThat(registry.current(KEY)).get()
                .extracting(PlayerState::getInvestigationPointsSpent)
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep the previous state when a transition throws")
    void shouldKeepStateOnFailure() {
        PlayerState initial = registry.open(KEY, () -> state(2));

        assertThatThrownBy(() -> registry.execute(KEY, s -> {
            throw new IllegalArgumentException("points must be positive");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.current(KEY)).contains(initial);
    }

    @Test
    @DisplayName("Should refuse transitions for sessions that are not open")
    void shouldRejectUnknownSession() {
        assertThatThrownBy(() -> registry.execute(KEY, s -> new Transition<>(null, s)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("manor_library/player-1");
    }

    @Test
    @DisplayName("Should throw SessionBusyException when the lock is held too long")
    void shouldReportBusySession() throws Exception {
        registry.open(KEY, () -> state(0));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> registry.execute(KEY, s -> {
                entered.countDown();
                await(release);
                return new Transition<>(null, s);
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> registry.execute(KEY, s -> new Transition<>(null, s)))
                    .isInstanceOf(SessionBusyException.class)
                    .hasMessageContaining("busy");

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should serialize concurrent transitions on one session")
    void shouldSerializeTransitions() throws Exception {
        SessionRegistry patient = new SessionRegistry(Duration.ofSeconds(10), Duration.ofMinutes(5), 100);
        patient.open(KEY, () -> state(0));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> patient.execute(KEY, s -> new Transition<>(null, spend(s, 1)))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(patient.current(KEY)).get()
                .extracting(PlayerState::getInvestigationPointsSpent)
                .isEqualTo(200);
    }

    @Test
    @DisplayName("Should replace the state of an open session")
    void shouldReplaceState() {
        registry.open(KEY, () -> state(0));

        registry.replace(KEY, state(7));

        assertThat(registry.current(KEY)).get()
                .extracting(PlayerState::getInvestigationPointsSpent)
                .isEqualTo(7);
    }

    @Test
    @DisplayName("Should forget closed sessions")
    void shouldCloseSession() {
        registry.open(KEY, () -> state(0));

        registry.close(KEY);

        assertThat(registry.current(KEY)).isEmpty();
        assertThat(registry.activeSessions()).isZero();
    }

    private static PlayerState state(int spent) {
        return PlayerState.builder(KEY.caseId(), KEY.playerId())
                .withInvestigationPointBudget(1000)
                .withInvestigationPointsSpent(spent)
                .build();
    }

    private static PlayerState spend(PlayerState state, int points) {
        return state.toBuilder()
                .withInvestigationPointsSpent(state.getInvestigationPointsSpent() + points)
                .build();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
