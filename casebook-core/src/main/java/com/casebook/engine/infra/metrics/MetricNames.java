/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.metrics;

/**
 * Metric names recorded by the casebook service layer.
 */
public final class MetricNames {

    public static final String DISCOVERIES = "casebook_discoveries_total";
    public static final String UNLOCKS = "casebook_unlocks_total";
    /** Tagged {@code correct=true|false}. */
    public static final String VERDICTS = "casebook_verdicts_total";
    public static final String REJECTED_ACCUSATIONS = "casebook_rejected_accusations_total";
    public static final String NARRATION_FALLBACKS = "casebook_narration_fallbacks_total";
    public static final String AUTOSAVE_FAILURES = "casebook_autosave_failures_total";
    public static final String ACTIVE_SESSIONS = "casebook_active_sessions";
    public static final String CASE_LOAD = "casebook_case_load";

    private MetricNames() {
        throw new AssertionError("No instances");
    }
}
