/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.notification;

import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.UnlockEvent;

import java.util.List;

/**
 * Pending-notification view over the unlock event log.
 *
 * <p>Nothing is stored here: pending events are those in the log whose id is still in
 * {@link PlayerState#getPendingNotificationIds()}. Events move {@code pending -> acknowledged}
 * once and are never removed from the log.
 */
public class NotificationQueue {

    public List<UnlockEvent> pending(PlayerState state) {
        return state.getUnlockEventLog().stream()
                .filter(e -> state.getPendingNotificationIds().contains(e.id()))
                .toList();
    }

    public List<UnlockEvent> acknowledged(PlayerState state) {
        return state.getUnlockEventLog().stream()
                .filter(UnlockEvent::acknowledged)
                .toList();
    }

    /**
     * Acknowledges one event. Unknown and already acknowledged ids return the state unchanged.
     */
    public PlayerState acknowledge(String eventId, PlayerState state) {
        if (eventId == null || !state.getPendingNotificationIds().contains(eventId)) {
            return state;
        }
        return state.toBuilder().acknowledge(eventId).build();
    }

    public PlayerState acknowledgeAll(PlayerState state) {
        if (state.getPendingNotificationIds().isEmpty()) {
            return state;
        }
        PlayerState.Builder next = state.toBuilder();
        List.copyOf(state.getPendingNotificationIds()).forEach(next::acknowledge);
        return next.build();
    }
}
