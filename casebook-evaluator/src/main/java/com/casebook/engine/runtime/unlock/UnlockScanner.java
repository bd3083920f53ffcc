/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.unlock;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.Transition;
import com.casebook.engine.api.model.UnlockCause;
import com.casebook.engine.api.model.UnlockEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Finds hypotheses whose requirement now holds and applies their unlocks as one batch.
 *
 * <p>The already-unlocked set is the only duplicate guard: a hypothesis in
 * {@link PlayerState#getUnlockedHypothesisIds()} is never reported again, so scanning twice
 * with no state change in between yields nothing the second time.
 */
public class UnlockScanner {

    private static final Logger logger = Logger.getLogger(UnlockScanner.class.getName());

    private final RequirementEvaluator evaluator;
    private final Supplier<String> eventIds;
    private final Clock clock;

    public UnlockScanner(RequirementEvaluator evaluator, Supplier<String> eventIds, Clock clock) {
        this.evaluator = evaluator;
        this.eventIds = eventIds;
        this.clock = clock;
    }

    /**
     * @return ids of hypotheses that are unlocked by the rules but not yet recorded as unlocked,
     *         in case declaration order
     */
    public List<String> findNewlyUnlocked(List<Hypothesis> hypotheses, PlayerState state) {
        List<String> ids = new ArrayList<>();
        for (Hypothesis hypothesis : hypotheses) {
            if (!state.isHypothesisUnlocked(hypothesis.id()) && evaluator.isHypothesisUnlocked(hypothesis, state)) {
                ids.add(hypothesis.id());
            }
        }
        return ids;
    }

    /**
     * Applies every pending unlock. Each tier-2 unlock logs an event, marks the hypothesis unlocked
     * and queues the notification, all in the single returned state. Tier-1 hypotheses missing
     * from the state are added silently.
     *
     * @param triggeringEvidenceId evidence just discovered, preferred as the recorded cause; may be null
     */
    public Transition<List<UnlockEvent>> scan(CaseDefinition caseDefinition, PlayerState state, String triggeringEvidenceId) {
        List<String> newlyUnlocked = findNewlyUnlocked(caseDefinition.getHypotheses(), state);
        if (newlyUnlocked.isEmpty()) {
            return new Transition<>(List.of(), state);
        }

        PlayerState.Builder next = state.toBuilder();
        List<UnlockEvent> events = new ArrayList<>();
        Instant now = clock.instant();
        for (String hypothesisId : newlyUnlocked) {
            Hypothesis hypothesis = caseDefinition.findHypothesis(hypothesisId).orElseThrow();
            if (hypothesis.isBase()) {
                next.addUnlockedHypothesis(hypothesisId);
                continue;
            }
            UnlockCause cause = evaluator.findCause(hypothesis.requirement(), state, triggeringEvidenceId)
                    .orElseGet(() -> new UnlockCause.ManualOverride("requirement holds vacuously"));
            UnlockEvent event = new UnlockEvent(eventIds.get(), hypothesisId, cause, now, false);
            next.recordUnlock(event);
            events.add(event);
            logger.fine(() -> "Unlocked hypothesis '" + hypothesisId + "' for " + state.getPlayerId()
                    + " (" + cause.describe() + ")");
        }
        return new Transition<>(List.copyOf(events), next.build());
    }
}
