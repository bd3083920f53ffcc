/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import java.util.Map;

/**
 * Callback for case compilation stage events.
 *
 * <p>The pipeline runs four stages in order: PARSING, VALIDATION, MODEL_BUILDING and LINT.
 */
public interface CaseCompilationListener {

    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * @param metrics stage-specific counters, e.g. {@code "evidenceCount"} or {@code "warningCount"}
     */
    record StageResult(String stageName, long durationNanos, Map<String, Object> metrics) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
