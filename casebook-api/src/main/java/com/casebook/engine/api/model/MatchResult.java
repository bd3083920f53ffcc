/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

/**
 * Outcome of matching one player action against the current location.
 *
 * @param outcome        what happened
 * @param locationId     location the action was matched in
 * @param evidenceId     matched evidence, for {@code DISCOVERED} and {@code ALREADY_EXAMINED}
 * @param matchedTrigger the trigger phrase that matched, if any
 * @param responseId     canned response id, for {@code NOT_PRESENT}
 */
public record MatchResult(
        Outcome outcome,
        String locationId,
        String evidenceId,
        String matchedTrigger,
        String responseId
) {
    public enum Outcome {
        DISCOVERED,
        ALREADY_EXAMINED,
        NOT_PRESENT,
        NO_DISCOVERY
    }

    public static MatchResult discovered(String locationId, String evidenceId, String trigger) {
        return new MatchResult(Outcome.DISCOVERED, locationId, evidenceId, trigger, null);
    }

    public static MatchResult alreadyExamined(String locationId, String evidenceId, String trigger) {
        return new MatchResult(Outcome.ALREADY_EXAMINED, locationId, evidenceId, trigger, null);
    }

    public static MatchResult notPresent(String locationId, String responseId, String trigger) {
        return new MatchResult(Outcome.NOT_PRESENT, locationId, null, trigger, responseId);
    }

    public static MatchResult noDiscovery(String locationId) {
        return new MatchResult(Outcome.NO_DISCOVERY, locationId, null, null, null);
    }

    public boolean isDiscovery() {
        return outcome == Outcome.DISCOVERED;
    }
}
