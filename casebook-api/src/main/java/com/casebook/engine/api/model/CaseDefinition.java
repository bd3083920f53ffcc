/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated description of one playable case.
 *
 * <p>Instances are produced by the case compiler and shared read-only across every session
 * playing the case. Lookup indexes for locations, evidence, hypotheses, witnesses and timeline
 * positions are built once at construction.
 */
public final class CaseDefinition {

    public static final int DEFAULT_INVESTIGATION_POINTS = 12;
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final String caseId;
    private final String title;
    private final int investigationPointBudget;
    private final int maxVerdictAttempts;
    private final String startingLocationId;
    private final List<Location> locations;
    private final List<Hypothesis> hypotheses;
    private final List<Witness> witnesses;
    private final List<TimelineEvent> timeline;
    private final Solution solution;

    private final Map<String, Location> locationsById;
    private final Map<String, Evidence> evidenceById;
    private final Map<String, Hypothesis> hypothesesById;
    private final Map<String, Witness> witnessesById;
    private final Map<String, Integer> timelinePositions;

    private CaseDefinition(Builder builder) {
        this.caseId = Objects.requireNonNull(builder.caseId, "caseId must not be null");
        this.title = builder.title == null ? builder.caseId : builder.title;
        this.investigationPointBudget = builder.investigationPointBudget;
        this.maxVerdictAttempts = builder.maxVerdictAttempts;
        this.locations = List.copyOf(builder.locations);
        this.hypotheses = List.copyOf(builder.hypotheses);
        this.witnesses = List.copyOf(builder.witnesses);
        this.timeline = List.copyOf(builder.timeline);
        this.solution = builder.solution;
        this.startingLocationId = builder.startingLocationId != null || locations.isEmpty()
                ? builder.startingLocationId
                : locations.get(0).id();

        Map<String, Location> locationIndex = new LinkedHashMap<>();
        Map<String, Evidence> evidenceIndex = new LinkedHashMap<>();
        for (Location location : locations) {
            locationIndex.put(location.id(), location);
            for (Evidence evidence : location.evidence()) {
                evidenceIndex.putIfAbsent(evidence.id(), evidence);
            }
        }
        Map<String, Hypothesis> hypothesisIndex = new LinkedHashMap<>();
        hypotheses.forEach(h -> hypothesisIndex.putIfAbsent(h.id(), h));
        Map<String, Witness> witnessIndex = new LinkedHashMap<>();
        witnesses.forEach(w -> witnessIndex.putIfAbsent(w.id(), w));
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < timeline.size(); i++) {
            positions.putIfAbsent(timeline.get(i).id(), i);
        }

        this.locationsById = Collections.unmodifiableMap(locationIndex);
        this.evidenceById = Collections.unmodifiableMap(evidenceIndex);
        this.hypothesesById = Collections.unmodifiableMap(hypothesisIndex);
        this.witnessesById = Collections.unmodifiableMap(witnessIndex);
        this.timelinePositions = Collections.unmodifiableMap(positions);
    }

    public String getCaseId() {
        return caseId;
    }

    public String getTitle() {
        return title;
    }

    public int getInvestigationPointBudget() {
        return investigationPointBudget;
    }

    public int getMaxVerdictAttempts() {
        return maxVerdictAttempts;
    }

    public String getStartingLocationId() {
        return startingLocationId;
    }

    public List<Location> getLocations() {
        return locations;
    }

    public List<Hypothesis> getHypotheses() {
        return hypotheses;
    }

    public List<Witness> getWitnesses() {
        return witnesses;
    }

    public List<TimelineEvent> getTimeline() {
        return timeline;
    }

    public Solution getSolution() {
        return solution;
    }

    /**
     * Every evidence entry across all locations, in declaration order.
     */
    public List<Evidence> getAllEvidence() {
        return new ArrayList<>(evidenceById.values());
    }

    public Optional<Location> findLocation(String locationId) {
        return Optional.ofNullable(locationId).map(locationsById::get);
    }

    public Optional<Evidence> findEvidence(String evidenceId) {
        return Optional.ofNullable(evidenceId).map(evidenceById::get);
    }

    public Optional<Hypothesis> findHypothesis(String hypothesisId) {
        return Optional.ofNullable(hypothesisId).map(hypothesesById::get);
    }

    public Optional<Witness> findWitness(String witnessId) {
        return Optional.ofNullable(witnessId).map(witnessesById::get);
    }

    /**
     * @return position of the event in the case timeline, or -1 when the id is unknown
     */
    public int timelinePosition(String eventId) {
        Integer position = eventId == null ? null : timelinePositions.get(eventId);
        return position == null ? -1 : position;
    }

    public static Builder builder(String caseId) {
        return new Builder(caseId);
    }

    @Override
    public String toString() {
        return "CaseDefinition{" + caseId + ", locations=" + locations.size()
                + ", evidence=" + evidenceById.size() + ", hypotheses=" + hypotheses.size() + "}";
    }

    public static final class Builder {
        private final String caseId;
        private String title;
        private int investigationPointBudget = DEFAULT_INVESTIGATION_POINTS;
        private int maxVerdictAttempts = DEFAULT_MAX_ATTEMPTS;
        private String startingLocationId;
        private final List<Location> locations = new ArrayList<>();
        private final List<Hypothesis> hypotheses = new ArrayList<>();
        private final List<Witness> witnesses = new ArrayList<>();
        private final List<TimelineEvent> timeline = new ArrayList<>();
        private Solution solution;

        private Builder(String caseId) {
            this.caseId = caseId;
        }

        public Builder withTitle(String title) {
            this.title = title;
            return this;
        }

        public Builder withInvestigationPointBudget(int budget) {
            this.investigationPointBudget = budget;
            return this;
        }

        public Builder withMaxVerdictAttempts(int attempts) {
            this.maxVerdictAttempts = attempts;
            return this;
        }

        public Builder withStartingLocation(String locationId) {
            this.startingLocationId = locationId;
            return this;
        }

        public Builder addLocation(Location location) {
            this.locations.add(location);
            return this;
        }

        public Builder addHypothesis(Hypothesis hypothesis) {
            this.hypotheses.add(hypothesis);
            return this;
        }

        public Builder addWitness(Witness witness) {
            this.witnesses.add(witness);
            return this;
        }

        public Builder addTimelineEvent(TimelineEvent event) {
            this.timeline.add(event);
            return this;
        }

        public Builder withSolution(Solution solution) {
            this.solution = solution;
            return this;
        }

        public CaseDefinition build() {
            return new CaseDefinition(this);
        }
    }
}
