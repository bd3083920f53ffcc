/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.runtime.witness;

import com.casebook.engine.api.model.PlayerState;
import com.casebook.engine.api.model.SecretTrigger;

import java.util.List;
import java.util.logging.Logger;

/**
 * Evaluates parsed secret triggers: true when any AND-group has all its conditions true.
 * Incomplete conditions evaluate to false.
 */
public class SecretTriggerEvaluator {

    private static final Logger logger = Logger.getLogger(SecretTriggerEvaluator.class.getName());

    public boolean isSatisfied(SecretTrigger trigger, int trust, PlayerState state) {
        if (trigger == null) {
            return false;
        }
        for (List<SecretTrigger.Condition> group : trigger.groups()) {
            if (!group.isEmpty() && group.stream().allMatch(c -> holds(c, trust, state))) {
                return true;
            }
        }
        return false;
    }

    private boolean holds(SecretTrigger.Condition condition, int trust, PlayerState state) {
        if (condition.type() == null) {
            return false;
        }
        return switch (condition.type()) {
            case EVIDENCE -> condition.evidenceId() != null && state.isEvidenceDiscovered(condition.evidenceId());
            case TRUST -> compare(condition, trust);
            case EVIDENCE_COUNT -> compare(condition, state.getDiscoveredEvidenceIds().size());
        };
    }

    private boolean compare(SecretTrigger.Condition condition, int actual) {
        if (condition.comparison() == null) {
            logger.warning("Secret trigger condition " + condition + " has no comparison; treating as false");
            return false;
        }
        return condition.comparison().test(actual, condition.value());
    }
}
