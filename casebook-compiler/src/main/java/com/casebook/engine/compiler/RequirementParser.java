/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.compiler;

import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.model.Metric;
import com.casebook.engine.api.model.Requirement;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the {@code type}-tagged requirement objects of a case file into {@link Requirement} trees.
 *
 * <pre>
 * requirement:
 *   type: all_of
 *   requirements:
 *     - { type: evidence_collected, evidence_id: e5 }
 *     - { type: threshold_met, metric: ipSpent, threshold: 6 }
 * </pre>
 */
public class RequirementParser {

    public static final int MAX_DEPTH = 32;

    public Requirement parse(JsonNode node, String hypothesisId) {
        return parse(node, hypothesisId, 1);
    }

    private Requirement parse(JsonNode node, String hypothesisId, int depth) {
        if (depth > MAX_DEPTH) {
            throw new CaseValidationException("Hypothesis '" + hypothesisId
                    + "' requirement is nested deeper than " + MAX_DEPTH + " levels");
        }
        if (node == null || !node.isObject()) {
            throw new CaseValidationException("Hypothesis '" + hypothesisId + "' has a requirement that is not an object");
        }
        String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "evidence_collected": {
                String evidenceId = text(node, "evidence_id", "evidenceId");
                if (evidenceId == null) {
                    throw new CaseValidationException("Hypothesis '" + hypothesisId
                            + "' evidence_collected requirement has no evidence_id");
                }
                return new Requirement.EvidenceCollected(evidenceId);
            }
            case "threshold_met": {
                String metricKey = text(node, "metric");
                if (metricKey == null || Metric.fromKey(metricKey).isEmpty()) {
                    throw new CaseValidationException("Hypothesis '" + hypothesisId
                            + "' references unknown metric: " + metricKey);
                }
                JsonNode threshold = node.get("threshold");
                if (threshold == null || !threshold.canConvertToInt()) {
                    throw new CaseValidationException("Hypothesis '" + hypothesisId
                            + "' threshold_met requirement has no integer threshold");
                }
                if (threshold.asInt() < 0) {
                    throw new CaseValidationException("Hypothesis '" + hypothesisId
                            + "' has negative threshold: " + threshold.asInt());
                }
                return new Requirement.ThresholdMet(metricKey.trim(), threshold.asInt());
            }
            case "all_of":
                return new Requirement.AllOf(children(node, hypothesisId, depth));
            case "any_of":
                return new Requirement.AnyOf(children(node, hypothesisId, depth));
            default:
                throw new CaseValidationException("Hypothesis '" + hypothesisId
                        + "' has unknown requirement type: '" + type + "'");
        }
    }

    private List<Requirement> children(JsonNode node, String hypothesisId, int depth) {
        JsonNode children = node.has("requirements") ? node.get("requirements") : node.get("children");
        if (children == null || !children.isArray()) {
            throw new CaseValidationException("Hypothesis '" + hypothesisId
                    + "' composite requirement needs a 'requirements' list");
        }
        List<Requirement> parsed = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            parsed.add(parse(child, hypothesisId, depth + 1));
        }
        return parsed;
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
