/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.model;

public enum CaseStatus {
    IN_PROGRESS,
    SOLVED,
    FAILED_SOLVED_BY_MENTOR
}
