/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.model.CaseDefinition;

import java.util.List;

/**
 * Source of compiled cases, keyed by case id.
 */
public interface ICaseRepository {

    /**
     * @throws com.casebook.engine.api.exceptions.CaseNotFoundException if no such case exists
     * @throws com.casebook.engine.api.exceptions.CaseValidationException if the case is malformed
     */
    CaseDefinition loadCase(String caseId);

    List<String> listCases();

    /**
     * Drops any cached copy so the next load recompiles from source.
     */
    void reload(String caseId);
}
