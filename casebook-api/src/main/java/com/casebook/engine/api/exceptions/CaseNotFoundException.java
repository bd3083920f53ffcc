/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api.exceptions;

public class CaseNotFoundException extends RuntimeException {

    private final String caseId;

    public CaseNotFoundException(String caseId) {
        super("Case not found: " + caseId);
        this.caseId = caseId;
    }

    public String getCaseId() {
        return caseId;
    }
}
