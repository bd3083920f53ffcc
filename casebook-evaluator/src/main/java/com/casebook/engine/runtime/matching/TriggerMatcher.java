/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.matching;

import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Evidence;
import com.casebook.engine.api.model.Location;
import com.casebook.engine.api.model.MatchResult;
import com.casebook.engine.api.model.NotPresentEntry;
import com.casebook.engine.api.model.PlayerState;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Matches free-text player actions against the evidence triggers of the current location.
 *
 * <p>Matching is a case-insensitive substring test. Resolution order:
 * <ol>
 *   <li>the first undiscovered evidence with a matching trigger is DISCOVERED</li>
 *   <li>otherwise the first discovered evidence with a matching trigger is ALREADY_EXAMINED</li>
 *   <li>otherwise the first matching not-present entry yields its canned response</li>
 *   <li>otherwise NO_DISCOVERY</li>
 * </ol>
 * The matcher never changes state; recording a discovery is the caller's job.
 */
public class TriggerMatcher {

    private static final Logger logger = Logger.getLogger(TriggerMatcher.class.getName());

    public MatchResult matchAction(CaseDefinition caseDefinition, PlayerState state, String inputText) {
        String locationId = state.getCurrentLocationId();
        Optional<Location> location = caseDefinition.findLocation(locationId);
        if (location.isEmpty()) {
            logger.warning("Player " + state.getPlayerId() + " is at unknown location '" + locationId
                    + "' in case " + caseDefinition.getCaseId());
            return MatchResult.noDiscovery(locationId);
        }
        String input = normalize(inputText);
        if (input.isEmpty()) {
            return MatchResult.noDiscovery(locationId);
        }

        MatchResult alreadyExamined = null;
        for (Evidence evidence : location.get().evidence()) {
            if (evidence.triggers().isEmpty()) {
                logger.warning("Evidence '" + evidence.id() + "' has no triggers and can never match");
                continue;
            }
            String trigger = firstMatchingTrigger(evidence.triggers(), input);
            if (trigger == null) {
                continue;
            }
            if (!state.isEvidenceDiscovered(evidence.id())) {
                return MatchResult.discovered(locationId, evidence.id(), trigger);
            }
            if (alreadyExamined == null) {
                alreadyExamined = MatchResult.alreadyExamined(locationId, evidence.id(), trigger);
            }
        }
        if (alreadyExamined != null) {
            return alreadyExamined;
        }

        for (NotPresentEntry entry : location.get().notPresent()) {
            String trigger = firstMatchingTrigger(entry.triggers(), input);
            if (trigger != null) {
                return MatchResult.notPresent(locationId, entry.responseId(), trigger);
            }
        }
        return MatchResult.noDiscovery(locationId);
    }

    private static String firstMatchingTrigger(Iterable<String> triggers, String normalizedInput) {
        for (String trigger : triggers) {
            String normalized = normalize(trigger);
            if (!normalized.isEmpty() && normalizedInput.contains(normalized)) {
                return trigger;
            }
        }
        return null;
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
