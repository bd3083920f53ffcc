/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.compiler.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Case file as written by authors, in YAML or JSON.
 * Loading-only DTOs; the compiler turns them into the immutable API model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseDocument(
        @JsonProperty("id") @JsonAlias("case_id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("investigation_points") Integer investigationPoints,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("starting_location") String startingLocation,
        @JsonProperty("locations") List<LocationDoc> locations,
        @JsonProperty("witnesses") List<WitnessDoc> witnesses,
        @JsonProperty("hypotheses") List<HypothesisDoc> hypotheses,
        @JsonProperty("timeline") List<TimelineDoc> timeline,
        @JsonProperty("solution") SolutionDoc solution
) {
    public List<LocationDoc> locations() {
        return locations != null ? locations : List.of();
    }

    public List<WitnessDoc> witnesses() {
        return witnesses != null ? witnesses : List.of();
    }

    public List<HypothesisDoc> hypotheses() {
        return hypotheses != null ? hypotheses : List.of();
    }

    public List<TimelineDoc> timeline() {
        return timeline != null ? timeline : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocationDoc(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("evidence") @JsonAlias("hidden_evidence") List<EvidenceDoc> evidence,
            @JsonProperty("not_present") List<NotPresentDoc> notPresent,
            @JsonProperty("witnesses_present") List<String> witnessesPresent
    ) {
        public List<EvidenceDoc> evidence() {
            return evidence != null ? evidence : List.of();
        }

        public List<NotPresentDoc> notPresent() {
            return notPresent != null ? notPresent : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EvidenceDoc(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("type") String type,
            @JsonProperty("triggers") List<String> triggers,
            @JsonProperty("significance") String significance,
            @JsonProperty("strength") Integer strength,
            @JsonProperty("implicates") List<String> implicates,
            @JsonProperty("exonerates") List<String> exonerates
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotPresentDoc(
            @JsonProperty("triggers") List<String> triggers,
            @JsonProperty("response") @JsonAlias("response_id") String response
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WitnessDoc(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("personality") String personality,
            @JsonProperty("base_trust") Integer baseTrust,
            @JsonProperty("wants") List<String> wants,
            @JsonProperty("fears") List<String> fears,
            @JsonProperty("secrets") List<SecretDoc> secrets
    ) {
        public List<SecretDoc> secrets() {
            return secrets != null ? secrets : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SecretDoc(
            @JsonProperty("id") String id,
            @JsonProperty("description") @JsonAlias("text") String description,
            @JsonProperty("trigger") String trigger
    ) {}

    /**
     * The requirement is kept as a raw tree and parsed by {@code RequirementParser}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HypothesisDoc(
            @JsonProperty("id") String id,
            @JsonProperty("label") @JsonAlias("name") String label,
            @JsonProperty("description") String description,
            @JsonProperty("tier") Integer tier,
            @JsonProperty("requirement") @JsonAlias("unlock_requirements") JsonNode requirement
    ) {
        public Integer tier() {
            return tier != null ? tier : 1;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimelineDoc(
            @JsonProperty("id") String id,
            @JsonProperty("time") String time,
            @JsonProperty("event") @JsonAlias("description") String event,
            @JsonProperty("witnesses") List<String> witnesses
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SolutionDoc(
            @JsonProperty("culprit") String culprit,
            @JsonProperty("method") String method,
            @JsonProperty("motive") String motive,
            @JsonProperty("key_evidence") List<String> keyEvidence,
            @JsonProperty("deductions_required") List<String> deductionsRequired,
            @JsonProperty("common_mistakes") List<CommonMistakeDoc> commonMistakes,
            @JsonProperty("fallacy_examples") Map<String, String> fallacyExamples,
            @JsonProperty("authority_figures") List<String> authorityFigures,
            @JsonProperty("presence_pairings") List<PresencePairingDoc> presencePairings,
            @JsonProperty("chronology_claims") List<ChronologyClaimDoc> chronologyClaims,
            @JsonProperty("counter_argument_keywords") List<String> counterArgumentKeywords
    ) {
        public List<String> keyEvidence() {
            return keyEvidence != null ? keyEvidence : List.of();
        }

        public List<CommonMistakeDoc> commonMistakes() {
            return commonMistakes != null ? commonMistakes : List.of();
        }

        public Map<String, String> fallacyExamples() {
            return fallacyExamples != null ? fallacyExamples : Map.of();
        }

        public List<PresencePairingDoc> presencePairings() {
            return presencePairings != null ? presencePairings : List.of();
        }

        public List<ChronologyClaimDoc> chronologyClaims() {
            return chronologyClaims != null ? chronologyClaims : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommonMistakeDoc(
            @JsonProperty("accused") @JsonAlias("suspect") String accused,
            @JsonProperty("reason") String reason,
            @JsonProperty("why_wrong") String whyWrong
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PresencePairingDoc(
            @JsonProperty("suspect") String suspect,
            @JsonProperty("presence_evidence") List<String> presenceEvidence,
            @JsonProperty("distinguishing_evidence") List<String> distinguishingEvidence
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChronologyClaimDoc(
            @JsonProperty("evidence") String evidence,
            @JsonProperty("earlier") String earlier,
            @JsonProperty("later") String later
    ) {}
}
