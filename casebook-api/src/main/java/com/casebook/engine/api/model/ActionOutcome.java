/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

import java.util.List;

/**
 * A matched player action and the unlocks it caused.
 */
public record ActionOutcome(MatchResult match, List<UnlockEvent> unlocks) {
    public ActionOutcome {
        unlocks = List.copyOf(unlocks);
    }
}
