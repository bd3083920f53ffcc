/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.session;

import com.casebook.engine.api.exceptions.SessionBusyException;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.infra.config.EngineConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Live player sessions, one per (case, player) pair.
 *
 * <p>Each session owns a {@link ReentrantLock}. {@link #execute} runs one engine transition
 * under that lock and publishes the resulting state before releasing it, so two requests for
 * the same session never interleave while different sessions proceed in parallel. Sessions
 * left idle longer than the configured timeout are evicted.
 */
public class SessionRegistry {

    private static final Logger logger = Logger.getLogger(SessionRegistry.class.getName());

    private final Cache<SessionKey, Session> sessions;
    private final Duration lockTimeout;

    public SessionRegistry(EngineConfig config) {
        this(config.getSessionLockTimeout(), config.getSessionIdleTimeout(), config.getSessionMaxSize());
    }

    public SessionRegistry(Duration lockTimeout, Duration idleTimeout, long maxSessions) {
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(idleTimeout)
                .maximumSize(maxSessions)
                .removalListener((SessionKey key, Session session, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        logger.info("Session " + key + " evicted (" + cause + ")");
                    }
                })
                .build();
    }

    /**
     * Returns the state of an open session, creating the session from {@code initialState} when
     * none exists yet.
     */
    public PlayerState open(SessionKey key, Supplier<PlayerState> initialState) {
        return sessions.get(key, k -> new Session(initialState.get())).state;
    }

    /**
     * Replaces the state of a session, opening it if needed. Used when a saved game is restored.
     */
    public PlayerState replace(SessionKey key, PlayerState state) {
        sessions.get(key, k -> new Session(state));
        return execute(key, current -> new Transition<>(null, state)).state();
    }

    public Optional<PlayerState> current(SessionKey key) {
        Session session = sessions.getIfPresent(key);
        return session == null ? Optional.empty() : Optional.of(session.state);
    }

    /**
     * Applies one transition to the session's state under the session lock.
     *
     * @throws IllegalStateException if the session is not open
     * @throws SessionBusyException  if the lock is not obtained within the configured wait
     */
    public <R> Transition<R> execute(SessionKey key, Function<PlayerState, Transition<R>> transition) {
        Session session = sessions.getIfPresent(key);
        if (session == null) {
            throw new IllegalStateException("No open session for " + key);
        }

        acquire(key, session.lock);
        try {
            Transition<R> result = transition.apply(session.state);
            session.state = result.state();
            return result;
        } finally {
            session.lock.unlock();
        }
    }

    public void close(SessionKey key) {
        sessions.invalidate(key);
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }

    private void acquire(SessionKey key, ReentrantLock lock) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SessionBusyException("Session " + key + " is busy; gave up after " + lockTimeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException("Interrupted while waiting for session " + key, e);
        }
    }

    public record SessionKey(String caseId, String playerId) {
        public SessionKey {
            Objects.requireNonNull(caseId, "caseId must not be null");
            Objects.requireNonNull(playerId, "playerId must not be null");
        }

        @Override
        public String toString() {
            return caseId + "/" + playerId;
        }
    }

    private static final class Session {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile PlayerState state;

        private Session(PlayerState state) {
            this.state = Objects.requireNonNull(state, "state must not be null");
        }
    }
}
