/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime;

import com.casebook.engine.api.IInvestigationEngine;
import com.casebook.engine.api.model.ActionOutcome;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Evidence;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.InterrogationResult;
import com.casebook.engine.api.model.MatchResult;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.StateView;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.api.model.UnlockEvent;
import com.casebook.engine.api.model.VerdictResult;
import com.casebook.engine.api.model.Witness;
import com.casebook.engine.runtime.matching.TriggerMatcher;
import com.casebook.engine.runtime.notification.NotificationQueue;
import com.casebook.engine.runtime.unlock.RequirementEvaluator;
import com.casebook.engine.runtime.unlock.UnlockScanner;
import com.casebook.engine.runtime.verdict.VerdictEvaluator;
import com.casebook.engine.runtime.witness.SecretTriggerEvaluator;
import com.casebook.engine.runtime.witness.TrustEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Default {@link IInvestigationEngine}: a stateless facade over the matching, unlock,
 * notification, verdict and witness rules.
 *
 * <p>Instances are thread-safe and may be shared by every session. Each operation runs inside
 * its own span. Event ids and timestamps come from the injected supplier and clock, so tests
 * can make whole sessions reproducible.
 */
public class InvestigationEngine implements IInvestigationEngine {

    private static final Logger logger = Logger.getLogger(InvestigationEngine.class.getName());

    private final Tracer tracer;
    private final Supplier<String> eventIds;
    private final Clock clock;
    private final TriggerMatcher triggerMatcher;
    private final RequirementEvaluator requirementEvaluator;
    private final UnlockScanner unlockScanner;
    private final NotificationQueue notificationQueue;
    private final VerdictEvaluator verdictEvaluator;
    private final TrustEvaluator trustEvaluator;
    private final SecretTriggerEvaluator secretTriggerEvaluator;

    public InvestigationEngine() {
        this(OpenTelemetry.noop().getTracer("casebook-evaluator"));
    }

    public InvestigationEngine(Tracer tracer) {
        this(tracer, Clock.systemUTC(), () -> "evt-" + UUID.randomUUID());
    }

    public InvestigationEngine(Tracer tracer, Clock clock, Supplier<String> eventIds) {
        this.tracer = tracer;
        this.clock = clock;
        this.eventIds = eventIds;
        this.triggerMatcher = new TriggerMatcher();
        this.requirementEvaluator = new RequirementEvaluator();
        this.unlockScanner = new UnlockScanner(requirementEvaluator, eventIds, clock);
        this.notificationQueue = new NotificationQueue();
        this.verdictEvaluator = new VerdictEvaluator(clock);
        this.trustEvaluator = new TrustEvaluator();
        this.secretTriggerEvaluator = new SecretTriggerEvaluator();
    }

    @Override
    public PlayerState startSession(CaseDefinition caseDefinition, String playerId) {
        PlayerState.Builder builder = PlayerState.builder(caseDefinition.getCaseId(), playerId)
                .withCurrentLocation(caseDefinition.getStartingLocationId())
                .withAttemptsRemaining(caseDefinition.getMaxVerdictAttempts())
                .withInvestigationPointBudget(caseDefinition.getInvestigationPointBudget());
        caseDefinition.getHypotheses().stream()
                .filter(Hypothesis::isBase)
                .forEach(h -> builder.addUnlockedHypothesis(h.id()));
        logger.info("Started case '" + caseDefinition.getCaseId() + "' for player " + playerId);
        return builder.build();
    }

    @Override
    public Transition<ActionOutcome> submitPlayerAction(CaseDefinition caseDefinition, PlayerState state, String text) {
        Span span = startSpan("submit-player-action", state);
        try (Scope scope = span.makeCurrent()) {
            MatchResult match = triggerMatcher.matchAction(caseDefinition, state, text);
            span.setAttribute("outcome", match.outcome().name());
            if (!match.isDiscovery()) {
                return new Transition<>(new ActionOutcome(match, List.of()), state);
            }
            // Discovery must be recorded before the unlock scan reads the state
            PlayerState discovered = state.toBuilder().addDiscoveredEvidence(match.evidenceId()).build();
            span.setAttribute("evidenceId", match.evidenceId());
            logger.fine(() -> state.getPlayerId() + " discovered '" + match.evidenceId() + "' in " + match.locationId());

            Transition<List<UnlockEvent>> unlocks = unlockScanner.scan(caseDefinition, discovered, match.evidenceId());
            span.setAttribute("unlockCount", unlocks.result().size());
            return new Transition<>(new ActionOutcome(match, unlocks.result()), unlocks.state());
        } finally {
            span.end();
        }
    }

    @Override
    public Transition<List<UnlockEvent>> scanUnlocks(CaseDefinition caseDefinition, PlayerState state) {
        Span span = startSpan("scan-unlocks", state);
        try (Scope scope = span.makeCurrent()) {
            Transition<List<UnlockEvent>> transition = unlockScanner.scan(caseDefinition, state, null);
            span.setAttribute("unlockCount", transition.result().size());
            return transition;
        } finally {
            span.end();
        }
    }

    @Override
    public PlayerState acknowledgeNotification(String eventId, PlayerState state) {
        return notificationQueue.acknowledge(eventId, state);
    }

    @Override
    public Transition<VerdictResult> submitVerdict(String accusedId, String reasoningText, List<String> evidenceIds,
                                                   CaseDefinition caseDefinition, PlayerState state) {
        Span span = startSpan("submit-verdict", state);
        try (Scope scope = span.makeCurrent()) {
            Transition<VerdictResult> transition =
                    verdictEvaluator.evaluateVerdict(accusedId, reasoningText, evidenceIds, caseDefinition, state);
            VerdictResult result = transition.result();
            span.setAttribute("correct", result.correct());
            span.setAttribute("score", result.score());
            span.setAttribute("attemptsRemaining", result.attemptsRemaining());
            if (result.isTerminal()) {
                logger.info("Case '" + caseDefinition.getCaseId() + "' out of attempts for " + state.getPlayerId()
                        + "; culprit revealed");
            }
            return transition;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public StateView querySnapshot(PlayerState state) {
        return new StateView(state.getCaseId(), state.getPlayerId(), state.getCurrentLocationId(),
                state.getDiscoveredEvidenceIds(), state.getUnlockedHypothesisIds(),
                notificationQueue.pending(state), state.getAttemptsRemaining(),
                state.getInvestigationPointsSpent(), state.getCaseStatus());
    }

    @Override
    public PlayerState changeLocation(CaseDefinition caseDefinition, PlayerState state, String locationId) {
        if (caseDefinition.findLocation(locationId).isEmpty()) {
            logger.warning("Unknown location '" + locationId + "' in case " + caseDefinition.getCaseId());
            return state;
        }
        return state.toBuilder().withCurrentLocation(locationId).build();
    }

    @Override
    public Transition<List<UnlockEvent>> spendInvestigationPoints(CaseDefinition caseDefinition, PlayerState state, int points) {
        if (points <= 0) {
            throw new IllegalArgumentException("Investigation points to spend must be positive, got: " + points);
        }
        Span span = startSpan("spend-investigation-points", state);
        try (Scope scope = span.makeCurrent()) {
            int current = state.getInvestigationPointsSpent();
            int spent = Math.max(current, Math.min(state.getInvestigationPointBudget(), current + points));
            span.setAttribute("investigationPointsSpent", spent);
            PlayerState next = state.toBuilder().withInvestigationPointsSpent(spent).build();
            return unlockScanner.scan(caseDefinition, next, null);
        } finally {
            span.end();
        }
    }

    @Override
    public Transition<Optional<UnlockEvent>> unlockManually(CaseDefinition caseDefinition, PlayerState state,
                                                            String hypothesisId, String reason) {
        if (caseDefinition.findHypothesis(hypothesisId).isEmpty()) {
            logger.warning("Unknown hypothesis '" + hypothesisId + "' in case " + caseDefinition.getCaseId());
            return new Transition<>(Optional.empty(), state);
        }
        if (state.isHypothesisUnlocked(hypothesisId)) {
            return new Transition<>(Optional.empty(), state);
        }
        UnlockEvent event = new UnlockEvent(eventIds.get(), hypothesisId,
                new UnlockCause.ManualOverride(reason), clock.instant(), false);
        return new Transition<>(Optional.of(event), state.toBuilder().recordUnlock(event).build());
    }

    @Override
    public Transition<InterrogationResult> interrogateWitness(CaseDefinition caseDefinition, PlayerState state,
                                                              String witnessId, String question) {
        Optional<Witness> found = caseDefinition.findWitness(witnessId);
        if (found.isEmpty()) {
            logger.warning("Unknown witness '" + witnessId + "' in case " + caseDefinition.getCaseId());
            return new Transition<>(InterrogationResult.unknownWitness(witnessId), state);
        }
        Span span = startSpan("interrogate-witness", state);
        try (Scope scope = span.makeCurrent()) {
            Witness witness = found.get();
            int delta = trustEvaluator.trustDelta(question);
            int trust = TrustEvaluator.clamp(state.trustFor(witness.id(), witness.baseTrust()) + delta);
            PlayerState.Builder next = state.toBuilder().withWitnessTrust(witness.id(), trust);

            String presented = trustEvaluator.detectPresentation(question)
                    .flatMap(token -> state.getDiscoveredEvidenceIds().stream()
                            .filter(id -> id.equalsIgnoreCase(token))
                            .findFirst())
                    .orElse(null);

            List<String> revealed = new ArrayList<>();
            for (Witness.Secret secret : witness.secrets()) {
                if (!state.revealedSecretsFor(witness.id()).contains(secret.id())
                        && secretTriggerEvaluator.isSatisfied(secret.trigger(), trust, state)) {
                    next.addRevealedSecret(witness.id(), secret.id());
                    revealed.add(secret.id());
                }
            }
            span.setAttribute("witnessId", witness.id());
            span.setAttribute("trust", trust);
            span.setAttribute("revealedSecrets", revealed.size());
            return new Transition<>(new InterrogationResult(witness.id(), delta, trust, revealed, presented), next.build());
        } finally {
            span.end();
        }
    }

    /**
     * Evidence the player may cite or present, in discovery order.
     */
    public List<Evidence> discoveredEvidence(CaseDefinition caseDefinition, PlayerState state) {
        return state.getDiscoveredEvidenceIds().stream()
                .map(caseDefinition::findEvidence)
                .flatMap(Optional::stream)
                .toList();
    }

    public NotificationQueue notifications() {
        return notificationQueue;
    }

    private Span startSpan(String name, PlayerState state) {
        Span span = tracer.spanBuilder(name).startSpan();
        span.setAttribute("caseId", state.getCaseId());
        span.setAttribute("playerId", state.getPlayerId());
        return span;
    }
}
