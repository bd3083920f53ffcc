/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.service;

import com.casebook.engine.api.ICaseRepository;
import com.casebook.engine.api.IInvestigationEngine;
import com.casebook.engine.api.INarrativeGenerator;
import com.casebook.engine.api.ISnapshotStore;
import com.casebook.engine.api.exceptions.AccusationRejectedException;
import com.casebook.engine.api.exceptions.PersistenceException;
import com.casebook.engine.api.model.ActionOutcome;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.InterrogationResult;
import com.casebook.engine.api.model.MatchResult;
import com.casebook.engine.api.model.NarrativeRequest;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.StateView;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.UnlockEvent;
import com.casebook.engine.api.model.VerdictResult;
import com.casebook.engine.compiler.CaseCompiler;
import com.casebook.engine.infra.config.EngineConfig;
import com.casebook.engine.infra.management.CaseRepository;
import com.casebook.engine.infra.metrics.Gauge;
import com.casebook.engine.infra.metrics.MetricNames;
import com.casebook.engine.infra.metrics.MetricsRegistry;
import com.casebook.engine.infra.narration.NarrationGateway;
import com.casebook.engine.infra.persistence.FileSnapshotStore;
import com.casebook.engine.infra.session.SessionRegistry;
import com.casebook.engine.infra.session.SessionRegistry.SessionKey;
import com.casebook.engine.infra.telemetry.TracingService;
import com.casebook.engine.runtime.InvestigationEngine;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Session-aware front door to the engine.
 *
 * <p>Resolves the case through the repository, runs each engine call under the session lock,
 * records metrics and autosaves the resulting state. The engine itself stays free of I/O; all of
 * that happens here.
 */
public class InvestigationService implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(InvestigationService.class.getName());

    public static final String AUTOSAVE_SLOT = "autosave";

    private final EngineConfig config;
    private final ICaseRepository cases;
    private final IInvestigationEngine engine;
    private final SessionRegistry sessions;
    private final ISnapshotStore store;
    private final NarrationGateway narration;
    private final MetricsRegistry metrics;
    private final Gauge activeSessions;

    public InvestigationService(EngineConfig config, ICaseRepository cases, IInvestigationEngine engine,
                                SessionRegistry sessions, ISnapshotStore store, NarrationGateway narration,
                                MetricsRegistry metrics) {
        this.config = config;
        this.cases = cases;
        this.engine = engine;
        this.sessions = sessions;
        this.store = store;
        this.narration = narration;
        this.metrics = metrics;
        this.activeSessions = metrics.gauge(MetricNames.ACTIVE_SESSIONS);
    }

    /**
     * Wires the default components from configuration.
     */
    public static InvestigationService create(EngineConfig config, INarrativeGenerator generator) {
        Tracer tracer = TracingService.getInstance().getTracer();
        MetricsRegistry metrics = MetricsRegistry.getInstance();
        return new InvestigationService(
                config,
                new CaseRepository(config, new CaseCompiler(), tracer, metrics),
                new InvestigationEngine(tracer),
                new SessionRegistry(config),
                new FileSnapshotStore(config),
                new NarrationGateway(generator, config, metrics),
                metrics);
    }

    public static InvestigationService create(INarrativeGenerator generator) {
        return create(EngineConfig.loadDefault(), generator);
    }

    public List<String> listCases() {
        return cases.listCases();
    }

    /**
     * Starts a fresh session. An already open session for the same player and case is replaced.
     */
    public PlayerState startSession(String caseId, String playerId) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        PlayerState initial = engine.startSession(caseDefinition, playerId);
        PlayerState state = sessions.replace(new SessionKey(caseId, playerId), initial);
        updateActiveSessions();
        logger.info("Session started: " + caseId + "/" + playerId);
        return state;
    }

    /**
     * Opens a session from a saved slot.
     *
     * @return the restored state, or empty when the slot holds nothing
     */
    public Optional<PlayerState> resumeSession(String caseId, String playerId, String slot) {
        cases.loadCase(caseId);
        Optional<PlayerState> saved = store.load(caseId, playerId, slot);
        saved.ifPresent(state -> {
            sessions.replace(new SessionKey(caseId, playerId), state);
            updateActiveSessions();
            logger.info("Session resumed from slot '" + slot + "': " + caseId + "/" + playerId);
        });
        return saved;
    }

    public void endSession(String caseId, String playerId) {
        sessions.close(new SessionKey(caseId, playerId));
        updateActiveSessions();
    }

    public ActionOutcome submitPlayerAction(String caseId, String playerId, String text) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        ActionOutcome outcome = run(caseId, playerId, state -> engine.submitPlayerAction(caseDefinition, state, text));
        if (outcome.match().outcome() == MatchResult.Outcome.DISCOVERED) {
            metrics.counter(MetricNames.DISCOVERIES, "case", caseId).increment();
        }
        countUnlocks(caseId, outcome.unlocks());
        return outcome;
    }

    public List<UnlockEvent> scanUnlocks(String caseId, String playerId) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        List<UnlockEvent> unlocks = run(caseId, playerId, state -> engine.scanUnlocks(caseDefinition, state));
        countUnlocks(caseId, unlocks);
        return unlocks;
    }

    public PlayerState acknowledgeNotification(String caseId, String playerId, String eventId) {
        return update(caseId, playerId, state -> engine.acknowledgeNotification(eventId, state));
    }

    /**
     * @throws AccusationRejectedException if the accusation is incomplete; nothing is recorded
     */
    public VerdictResult submitVerdict(String caseId, String playerId, String accusedId, String reasoningText,
                                       List<String> evidenceIds) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        try {
            VerdictResult result = run(caseId, playerId,
                    state -> engine.submitVerdict(accusedId, reasoningText, evidenceIds, caseDefinition, state));
            metrics.counter(MetricNames.VERDICTS, "correct", String.valueOf(result.correct())).increment();
            return result;
        } catch (AccusationRejectedException e) {
            metrics.counter(MetricNames.REJECTED_ACCUSATIONS).increment();
            throw e;
        }
    }

    public StateView querySnapshot(String caseId, String playerId) {
        return engine.querySnapshot(getState(caseId, playerId));
    }

    /**
     * @throws IllegalStateException if the session is not open
     */
    public PlayerState getState(String caseId, String playerId) {
        SessionKey key = new SessionKey(caseId, playerId);
        return sessions.current(key).orElseThrow(() -> new IllegalStateException("No open session for " + key));
    }

    public PlayerState changeLocation(String caseId, String playerId, String locationId) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        return update(caseId, playerId, state -> engine.changeLocation(caseDefinition, state, locationId));
    }

    public List<UnlockEvent> spendInvestigationPoints(String caseId, String playerId, int points) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        List<UnlockEvent> unlocks = run(caseId, playerId,
                state -> engine.spendInvestigationPoints(caseDefinition, state, points));
        countUnlocks(caseId, unlocks);
        return unlocks;
    }

    public Optional<UnlockEvent> unlockManually(String caseId, String playerId, String hypothesisId, String reason) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        Optional<UnlockEvent> unlock = run(caseId, playerId,
                state -> engine.unlockManually(caseDefinition, state, hypothesisId, reason));
        unlock.ifPresent(event -> countUnlocks(caseId, List.of(event)));
        return unlock;
    }

    public InterrogationResult interrogateWitness(String caseId, String playerId, String witnessId, String question) {
        CaseDefinition caseDefinition = cases.loadCase(caseId);
        return run(caseId, playerId, state -> engine.interrogateWitness(caseDefinition, state, witnessId, question));
    }

    /**
     * Produces display prose. Never changes session state.
     */
    public String narrate(NarrativeRequest request) {
        return narration.narrate(request);
    }

    public String narrateAction(String caseId, String playerId, ActionOutcome outcome) {
        return narrate(NarrativeRequest.forAction(getState(caseId, playerId), outcome));
    }

    public String narrateInterrogation(String caseId, String playerId, String question, InterrogationResult result) {
        return narrate(NarrativeRequest.forInterrogation(getState(caseId, playerId), question, result));
    }

    public String narrateVerdict(String caseId, String playerId, VerdictResult result) {
        return narrate(NarrativeRequest.forVerdict(getState(caseId, playerId), result));
    }

    /**
     * @throws PersistenceException if the snapshot cannot be written
     */
    public void saveGame(String caseId, String playerId, String slot) {
        store.save(getState(caseId, playerId), slot);
    }

    public boolean deleteSave(String caseId, String playerId, String slot) {
        return store.delete(caseId, playerId, slot);
    }

    public List<String> listSaves(String caseId, String playerId) {
        return store.listSlots(caseId, playerId);
    }

    @Override
    public void close() {
        narration.close();
    }

    private <R> R run(String caseId, String playerId, Function<PlayerState, Transition<R>> operation) {
        SessionKey key = new SessionKey(caseId, playerId);
        return sessions.execute(key, state -> {
            Transition<R> transition = operation.apply(state);
            if (transition.state() != state) {
                autosave(transition.state());
            }
            return transition;
        }).result();
    }

    private PlayerState update(String caseId, String playerId, UnaryOperator<PlayerState> operation) {
        SessionKey key = new SessionKey(caseId, playerId);
        return sessions.execute(key, state -> {
            PlayerState next = operation.apply(state);
            if (next != state) {
                autosave(next);
            }
            return new Transition<Void>(null, next);
        }).state();
    }

    private void autosave(PlayerState state) {
        if (!config.isAutosaveEnabled()) {
            return;
        }
        try {
            store.save(state, AUTOSAVE_SLOT);
        } catch (PersistenceException e) {
            metrics.counter(MetricNames.AUTOSAVE_FAILURES).increment();
            logger.warning("Autosave failed for " + state.getCaseId() + "/" + state.getPlayerId() + ": " + e.getMessage());
        }
    }

    private void countUnlocks(String caseId, List<UnlockEvent> unlocks) {
        if (!unlocks.isEmpty()) {
            metrics.counter(MetricNames.UNLOCKS, "case", caseId).increment(unlocks.size());
        }
    }

    private void updateActiveSessions() {
        activeSessions.set(sessions.activeSessions());
    }
}
