/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.model.ActionOutcome;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.InterrogationResult;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.StateView;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.UnlockEvent;
import com.casebook.engine.api.model.VerdictResult;

import java.util.List;
import java.util.Optional;

/**
 * Rule-evaluation surface of the investigation engine.
 *
 * <p>Every operation is a pure function of its arguments: it reads the shared, immutable
 * {@link CaseDefinition} and the caller's {@link PlayerState} snapshot and returns the next
 * snapshot. Implementations hold no per-session state and perform no I/O, so one instance can
 * serve any number of sessions concurrently. Serializing calls for the same session is the
 * caller's responsibility.
 */
public interface IInvestigationEngine {

    /**
     * Creates the initial state for a player starting a case.
     */
    PlayerState startSession(CaseDefinition caseDefinition, String playerId);

    /**
     * Matches free text against the current location and, on a fresh discovery, scans for
     * hypotheses the discovery unlocked.
     */
    Transition<ActionOutcome> submitPlayerAction(CaseDefinition caseDefinition, PlayerState state, String text);

    /**
     * Unlocks every tier-2 hypothesis whose requirement now holds, as one batch.
     * A second call with no intervening state change returns no events.
     */
    Transition<List<UnlockEvent>> scanUnlocks(CaseDefinition caseDefinition, PlayerState state);

    /**
     * Marks a pending notification acknowledged. Unknown or already acknowledged ids are ignored.
     */
    PlayerState acknowledgeNotification(String eventId, PlayerState state);

    /**
     * Evaluates an accusation and records the attempt.
     *
     * @throws com.casebook.engine.api.exceptions.AccusationRejectedException if the accused id or
     *         the reasoning is blank; no attempt is recorded in that case
     */
    Transition<VerdictResult> submitVerdict(String accusedId, String reasoningText, List<String> evidenceIds,
                                            CaseDefinition caseDefinition, PlayerState state);

    StateView querySnapshot(PlayerState state);

    /**
     * Moves the player. Unknown locations leave the state unchanged.
     */
    PlayerState changeLocation(CaseDefinition caseDefinition, PlayerState state, String locationId);

    /**
     * Spends investigation points, capped at the case budget, then scans for unlocks.
     *
     * @throws IllegalArgumentException if {@code points} is not positive
     */
    Transition<List<UnlockEvent>> spendInvestigationPoints(CaseDefinition caseDefinition, PlayerState state, int points);

    /**
     * Unlocks a hypothesis regardless of its requirement. Returns empty when the hypothesis is
     * unknown or already unlocked.
     */
    Transition<Optional<UnlockEvent>> unlockManually(CaseDefinition caseDefinition, PlayerState state,
                                                     String hypothesisId, String reason);

    /**
     * Applies the trust effect of a question and reveals any secrets whose trigger now holds.
     */
    Transition<InterrogationResult> interrogateWitness(CaseDefinition caseDefinition, PlayerState state,
                                                       String witnessId, String question);
}
