/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.compiler;

import com.casebook.engine.api.CaseCompilationListener;
import com.casebook.engine.api.ICaseCompiler;
import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.api.model.Evidence;
import com.casebook.engine.api.model.FallacyKind;
import com.casebook.engine.api.model.Hypothesis;
import com.casebook.engine.api.model.Location;
import com.casebook.engine.api.model.NotPresentEntry;
import com.casebook.engine.api.model.Requirement;
import com.casebook.engine.api.model.SecretTrigger;
import com.casebook.engine.api.model.Solution;
import com.casebook.engine.api.model.TimelineEvent;
import com.casebook.engine.api.model.Witness;
import com.casebook.engine.compiler.analysis.CaseLintAnalyzer;
import com.casebook.engine.compiler.model.CaseDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles YAML or JSON case files into validated {@link CaseDefinition}s.
 *
 * <p>Runs four stages: PARSING, VALIDATION, MODEL_BUILDING and LINT. Any structural
 * problem aborts compilation with a {@link CaseValidationException} naming the offending
 * element; lint findings are only logged.
 */
public class CaseCompiler implements ICaseCompiler {

    private static final Logger logger = Logger.getLogger(CaseCompiler.class.getName());
    private static final int TOTAL_STAGES = 4;

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final RequirementParser requirementParser = new RequirementParser();
    private final SecretTriggerParser secretTriggerParser = new SecretTriggerParser();
    private final CaseLintAnalyzer lintAnalyzer = new CaseLintAnalyzer();

    private Tracer tracer;
    private CaseCompilationListener listener;

    public CaseCompiler() {
        this(OpenTelemetry.noop().getTracer("casebook-compiler"));
    }

    public CaseCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CaseCompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public CaseDefinition compile(Path casePath) throws IOException {
        CaseFormat format = CaseFormat.fromFileName(casePath.getFileName().toString());
        if (format == null) {
            throw new CaseValidationException("Unsupported case file extension: " + casePath.getFileName());
        }
        Span span = tracer.spanBuilder("compile-case-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("caseFilePath", casePath.toString());
            return compile(Files.readString(casePath), format);
        } catch (IOException | CaseValidationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CaseDefinition compile(String content, CaseFormat format) throws IOException {
        Span span = tracer.spanBuilder("compile-case").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("format", format.name());
            long startTime = System.nanoTime();

            CaseDocument document = runStage("PARSING", 1, () -> parse(content, format));
            ValidatedCase validated = runStage("VALIDATION", 2, () -> validate(document));
            CaseDefinition definition = runStage("MODEL_BUILDING", 3, () -> build(document, validated));
            CaseLintAnalyzer.LintReport report = runStage("LINT", 4, () -> lintAnalyzer.analyze(definition));

            report.warnings().forEach(w -> logger.warning("Case '" + definition.getCaseId() + "' lint: " + w.describe()));

            span.setAttribute("caseId", definition.getCaseId());
            span.setAttribute("evidenceCount", definition.getAllEvidence().size());
            span.setAttribute("hypothesisCount", definition.getHypotheses().size());
            span.setAttribute("lintWarnings", report.warningCount());
            logger.info(String.format("Compiled case '%s' in %d ms (%d locations, %d evidence, %d hypotheses)",
                    definition.getCaseId(), (System.nanoTime() - startTime) / 1_000_000,
                    definition.getLocations().size(), definition.getAllEvidence().size(),
                    definition.getHypotheses().size()));
            return definition;
        } catch (IOException | CaseValidationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @FunctionalInterface
    private interface StageAction<T> {
        T run() throws IOException;
    }

    private <T> T runStage(String stageName, int stageNumber, StageAction<T> action) throws IOException {
        Span span = tracer.spanBuilder("stage-" + stageName.toLowerCase(Locale.ROOT).replace('_', '-')).startSpan();
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T result = action.run();
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CaseCompilationListener.StageResult(stageName, System.nanoTime() - start, stageMetrics(result)));
            }
            return result;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, Object> stageMetrics(Object result) {
        Map<String, Object> metrics = new HashMap<>();
        if (result instanceof CaseDocument document) {
            metrics.put("locationCount", document.locations().size());
            metrics.put("hypothesisCount", document.hypotheses().size());
        } else if (result instanceof ValidatedCase validated) {
            metrics.put("evidenceCount", validated.evidenceIds().size());
            metrics.put("requirementCount", validated.requirements().size());
        } else if (result instanceof CaseDefinition definition) {
            metrics.put("caseId", definition.getCaseId());
        } else if (result instanceof CaseLintAnalyzer.LintReport report) {
            metrics.put("warningCount", report.warningCount());
        }
        return metrics;
    }

    private CaseDocument parse(String content, CaseFormat format) throws IOException {
        ObjectMapper mapper = format == CaseFormat.YAML ? yamlMapper : jsonMapper;
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed " + format + " case document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CaseValidationException("Case document must be an object");
        }
        // Documents may wrap everything in a top-level "case" key
        JsonNode caseNode = root.has("case") && root.get("case").isObject() ? root.get("case") : root;
        try {
            return mapper.treeToValue(caseNode, CaseDocument.class);
        } catch (JsonProcessingException e) {
            throw new CaseValidationException("Case document has invalid structure: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parsed requirement trees and secret triggers, keyed by owner id, produced during validation.
     */
    private record ValidatedCase(
            Set<String> evidenceIds,
            Map<String, Requirement> requirements,
            Map<String, SecretTrigger> secretTriggers,
            List<String> timelineIds
    ) {}

    private ValidatedCase validate(CaseDocument doc) {
        if (doc.id() == null || doc.id().isBlank()) {
            throw new CaseValidationException("Case id is missing");
        }
        String caseId = doc.id();
        if (doc.locations().isEmpty()) {
            throw new CaseValidationException("Case '" + caseId + "' defines no locations");
        }
        if (doc.investigationPoints() != null && doc.investigationPoints() < 0) {
            throw new CaseValidationException("Case '" + caseId + "' has negative investigation_points");
        }
        if (doc.maxAttempts() != null && doc.maxAttempts() < 1) {
            throw new CaseValidationException("Case '" + caseId + "' max_attempts must be at least 1");
        }

        Set<String> locationIds = new HashSet<>();
        Set<String> evidenceIds = new LinkedHashSet<>();
        for (int i = 0; i < doc.locations().size(); i++) {
            CaseDocument.LocationDoc location = doc.locations().get(i);
            if (isBlank(location.id())) {
                throw new CaseValidationException("Location at index " + i + " has no id");
            }
            if (!locationIds.add(location.id())) {
                throw new CaseValidationException("Duplicate location id: " + location.id());
            }
            for (int j = 0; j < location.evidence().size(); j++) {
                CaseDocument.EvidenceDoc evidence = location.evidence().get(j);
                if (isBlank(evidence.id())) {
                    throw new CaseValidationException("Evidence " + j + " in location '" + location.id() + "' has no id");
                }
                if (!evidenceIds.add(evidence.id())) {
                    throw new CaseValidationException("Duplicate evidence id: " + evidence.id());
                }
            }
            for (CaseDocument.NotPresentDoc notPresent : location.notPresent()) {
                if (isBlank(notPresent.response())) {
                    throw new CaseValidationException("Location '" + location.id() + "' has a not_present entry without a response");
                }
            }
        }
        if (doc.startingLocation() != null && !locationIds.contains(doc.startingLocation())) {
            throw new CaseValidationException("Case '" + caseId + "' has unknown starting location: " + doc.startingLocation());
        }

        Map<String, SecretTrigger> secretTriggers = new LinkedHashMap<>();
        Set<String> witnessIds = new HashSet<>();
        for (int i = 0; i < doc.witnesses().size(); i++) {
            CaseDocument.WitnessDoc witness = doc.witnesses().get(i);
            if (isBlank(witness.id())) {
                throw new CaseValidationException("Witness at index " + i + " has no id");
            }
            if (!witnessIds.add(witness.id())) {
                throw new CaseValidationException("Duplicate witness id: " + witness.id());
            }
            if (witness.baseTrust() != null && (witness.baseTrust() < 0 || witness.baseTrust() > 100)) {
                throw new CaseValidationException("Witness '" + witness.id() + "' base_trust must be between 0 and 100, got: " + witness.baseTrust());
            }
            for (CaseDocument.SecretDoc secret : witness.secrets()) {
                if (isBlank(secret.id())) {
                    throw new CaseValidationException("Witness '" + witness.id() + "' has a secret without an id");
                }
                try {
                    secretTriggers.put(witness.id() + "/" + secret.id(), secretTriggerParser.parse(secret.trigger()));
                } catch (CaseValidationException e) {
                    throw new CaseValidationException("Witness '" + witness.id() + "' secret '" + secret.id() + "': " + e.getMessage(), e);
                }
            }
        }

        Map<String, Requirement> requirements = new LinkedHashMap<>();
        Set<String> hypothesisIds = new HashSet<>();
        for (int i = 0; i < doc.hypotheses().size(); i++) {
            CaseDocument.HypothesisDoc hypothesis = doc.hypotheses().get(i);
            if (isBlank(hypothesis.id())) {
                throw new CaseValidationException("Hypothesis at index " + i + " has no id");
            }
            if (!hypothesisIds.add(hypothesis.id())) {
                throw new CaseValidationException("Duplicate hypothesis id: " + hypothesis.id());
            }
            int tier = hypothesis.tier();
            if (tier != Hypothesis.TIER_BASE && tier != Hypothesis.TIER_DEDUCED) {
                throw new CaseValidationException("Hypothesis '" + hypothesis.id() + "' has invalid tier: " + tier);
            }
            JsonNode rawRequirement = hypothesis.requirement();
            boolean hasRequirement = rawRequirement != null && !rawRequirement.isNull() && !rawRequirement.isMissingNode();
            if (tier == Hypothesis.TIER_DEDUCED && !hasRequirement) {
                throw new CaseValidationException("Tier 2 hypothesis '" + hypothesis.id() + "' has no requirement");
            }
            if (hasRequirement) {
                Requirement requirement = requirementParser.parse(rawRequirement, hypothesis.id());
                for (String referenced : referencedEvidence(requirement)) {
                    if (!evidenceIds.contains(referenced)) {
                        throw new CaseValidationException("Hypothesis '" + hypothesis.id() + "' references unknown evidence: " + referenced);
                    }
                }
                requirements.put(hypothesis.id(), requirement);
            }
        }

        List<String> timelineIds = new ArrayList<>();
        for (int i = 0; i < doc.timeline().size(); i++) {
            String id = timelineId(doc.timeline().get(i), i);
            if (timelineIds.contains(id)) {
                throw new CaseValidationException("Duplicate timeline event id: " + id);
            }
            timelineIds.add(id);
        }

        validateSolution(caseId, doc.solution(), evidenceIds);
        return new ValidatedCase(evidenceIds, requirements, secretTriggers, timelineIds);
    }

    private void validateSolution(String caseId, CaseDocument.SolutionDoc solution, Set<String> evidenceIds) {
        if (solution == null) {
            throw new CaseValidationException("Case '" + caseId + "' has no solution");
        }
        if (isBlank(solution.culprit())) {
            throw new CaseValidationException("Case '" + caseId + "' solution has no culprit");
        }
        for (String keyEvidence : solution.keyEvidence()) {
            if (!evidenceIds.contains(keyEvidence)) {
                throw new CaseValidationException("Solution key evidence references unknown evidence: " + keyEvidence);
            }
        }
        for (String kind : solution.fallacyExamples().keySet()) {
            if (FallacyKind.fromKey(kind).isEmpty()) {
                throw new CaseValidationException("Solution fallacy_examples has unknown fallacy kind: " + kind);
            }
        }
        for (CaseDocument.CommonMistakeDoc mistake : solution.commonMistakes()) {
            if (isBlank(mistake.accused())) {
                throw new CaseValidationException("Solution common mistake entry has no accused id");
            }
        }
        for (CaseDocument.PresencePairingDoc pairing : solution.presencePairings()) {
            if (isBlank(pairing.suspect())) {
                throw new CaseValidationException("Solution presence pairing has no suspect");
            }
            for (String id : concat(pairing.presenceEvidence(), pairing.distinguishingEvidence())) {
                if (!evidenceIds.contains(id)) {
                    throw new CaseValidationException("Presence pairing for '" + pairing.suspect() + "' references unknown evidence: " + id);
                }
            }
        }
        for (CaseDocument.ChronologyClaimDoc claim : solution.chronologyClaims()) {
            if (isBlank(claim.evidence()) || isBlank(claim.earlier()) || isBlank(claim.later())) {
                throw new CaseValidationException("Chronology claim needs evidence, earlier and later");
            }
            if (!evidenceIds.contains(claim.evidence())) {
                throw new CaseValidationException("Chronology claim references unknown evidence: " + claim.evidence());
            }
        }
    }

    private CaseDefinition build(CaseDocument doc, ValidatedCase validated) {
        CaseDefinition.Builder builder = CaseDefinition.builder(doc.id())
                .withTitle(doc.title())
                .withStartingLocation(doc.startingLocation());
        if (doc.investigationPoints() != null) {
            builder.withInvestigationPointBudget(doc.investigationPoints());
        }
        if (doc.maxAttempts() != null) {
            builder.withMaxVerdictAttempts(doc.maxAttempts());
        }

        for (CaseDocument.LocationDoc loc : doc.locations()) {
            List<Evidence> evidence = new ArrayList<>();
            for (CaseDocument.EvidenceDoc e : loc.evidence()) {
                evidence.add(new Evidence(e.id(), e.name() != null ? e.name() : e.id(), e.description(), e.type(),
                        loc.id(), nonNull(e.triggers()), e.significance(), e.strength(), e.implicates(), e.exonerates()));
            }
            List<NotPresentEntry> notPresent = loc.notPresent().stream()
                    .map(np -> new NotPresentEntry(nonNull(np.triggers()), np.response()))
                    .toList();
            builder.addLocation(new Location(loc.id(), loc.name() != null ? loc.name() : loc.id(),
                    loc.description(), evidence, notPresent, loc.witnessesPresent()));
        }

        for (CaseDocument.WitnessDoc w : doc.witnesses()) {
            List<Witness.Secret> secrets = w.secrets().stream()
                    .map(s -> new Witness.Secret(s.id(), s.description(), validated.secretTriggers().get(w.id() + "/" + s.id())))
                    .toList();
            builder.addWitness(new Witness(w.id(), w.name() != null ? w.name() : w.id(), w.personality(),
                    w.baseTrust() != null ? w.baseTrust() : Witness.DEFAULT_BASE_TRUST, w.wants(), w.fears(), secrets));
        }

        for (CaseDocument.HypothesisDoc h : doc.hypotheses()) {
            builder.addHypothesis(new Hypothesis(h.id(), h.label() != null ? h.label() : h.id(), h.description(),
                    h.tier(), validated.requirements().get(h.id())));
        }

        for (int i = 0; i < doc.timeline().size(); i++) {
            CaseDocument.TimelineDoc t = doc.timeline().get(i);
            builder.addTimelineEvent(new TimelineEvent(validated.timelineIds().get(i), t.time(), t.event(), t.witnesses()));
        }

        builder.withSolution(buildSolution(doc.solution()));
        return builder.build();
    }

    private Solution buildSolution(CaseDocument.SolutionDoc doc) {
        Map<String, Solution.CommonMistake> mistakes = new LinkedHashMap<>();
        doc.commonMistakes().forEach(m -> mistakes.putIfAbsent(m.accused(), new Solution.CommonMistake(m.reason(), m.whyWrong())));

        Map<FallacyKind, String> examples = new EnumMap<>(FallacyKind.class);
        doc.fallacyExamples().forEach((key, text) ->
                FallacyKind.fromKey(key).ifPresent(kind -> examples.put(kind, text == null ? "" : text)));

        Map<String, Solution.PresencePairing> pairings = new LinkedHashMap<>();
        doc.presencePairings().forEach(p -> pairings.putIfAbsent(p.suspect(),
                new Solution.PresencePairing(p.presenceEvidence(), p.distinguishingEvidence())));

        List<Solution.ChronologyClaim> claims = doc.chronologyClaims().stream()
                .map(c -> new Solution.ChronologyClaim(c.evidence(), c.earlier(), c.later()))
                .toList();

        Set<String> authorities = doc.authorityFigures() == null ? Set.of() : new LinkedHashSet<>(doc.authorityFigures());
        return new Solution(doc.culprit().trim(), doc.method(), doc.motive(), doc.keyEvidence(), doc.deductionsRequired(),
                mistakes, examples, authorities, pairings, claims, doc.counterArgumentKeywords());
    }

    private static String timelineId(CaseDocument.TimelineDoc event, int index) {
        return isBlank(event.id()) ? "event_" + (index + 1) : event.id();
    }

    /**
     * Collects every evidence id a requirement tree refers to.
     */
    static Set<String> referencedEvidence(Requirement requirement) {
        Set<String> ids = new LinkedHashSet<>();
        requirement.accept(new Requirement.Visitor<Void>() {
            @Override
            public Void visitEvidenceCollected(Requirement.EvidenceCollected r) {
                ids.add(r.evidenceId());
                return null;
            }

            @Override
            public Void visitThresholdMet(Requirement.ThresholdMet r) {
                return null;
            }

            @Override
            public Void visitAllOf(Requirement.AllOf r) {
                r.children().forEach(c -> c.accept(this));
                return null;
            }

            @Override
            public Void visitAnyOf(Requirement.AnyOf r) {
                r.children().forEach(c -> c.accept(this));
                return null;
            }
        });
        return ids;
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>();
        if (a != null) all.addAll(a);
        if (b != null) all.addAll(b);
        return all;
    }

    private static List<String> nonNull(List<String> values) {
        return values == null ? null : values.stream().filter(Objects::nonNull).toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
