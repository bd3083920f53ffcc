package com.casebook.engine.runtime.notification;

import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.api.model.UnlockEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationQueueTest {

    private NotificationQueue queue;
    private PlayerState state;

    @BeforeEach
    void setUp() {
        queue = new NotificationQueue();
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        state = PlayerState.builder("case", "p")
                .recordUnlock(new UnlockEvent("evt-1", "h3", new UnlockCause.EvidenceCollected("e5"), now, false))
                .recordUnlock(new UnlockEvent("evt-2", "h4", new UnlockCause.EvidenceCollected("e1"), now, false))
                .build();
    }

    @Test
    @DisplayName("Should list pending events in unlock order")
    void shouldListPending() {
        assertThat(queue.pending(state)).extracting(UnlockEvent::id).containsExactly("evt-1", "evt-2");
        assertThat(queue.acknowledged(state)).isEmpty();
    }

    @Test
    @DisplayName("Should move an acknowledged event out of pending without removing it from the log")
    void shouldAcknowledge() {
        PlayerState after = queue.acknowledge("evt-1", state);

        assertThat(queue.pending(after)).extracting(UnlockEvent::id).containsExactly("evt-2");
        assertThat(queue.acknowledged(after)).extracting(UnlockEvent::id).containsExactly("evt-1");
        assertThat(after.getUnlockEventLog()).hasSize(2);
        assertThat(after.isHypothesisUnlocked("h3")).isTrue();
        assertThat(queue.pending(state)).hasSize(2);
    }

    @Test
    @DisplayName("Should ignore unknown and already acknowledged ids")
    void shouldIgnoreUnknownIds() {
        PlayerState once = queue.acknowledge("evt-1", state);

        assertThat(queue.acknowledge("evt-1", once)).isSameAs(once);
        assertThat(queue.acknowledge("evt-404", state)).isSameAs(state);
        assertThat(queue.acknowledge(null, state)).isSameAs(state);
    }

    @Test
    @DisplayName("Should acknowledge everything at once")
    void shouldAcknowledgeAll() {
        PlayerState after = queue.acknowledgeAll(state);

        assertThat(queue.pending(after)).isEmpty();
        assertThat(after.getUnlockEventLog()).allMatch(UnlockEvent::acknowledged);
        assertThat(queue.acknowledgeAll(after)).isSameAs(after);
    }
}
