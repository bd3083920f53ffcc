/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.model.CaseDefinition;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for turning a case file into a validated {@link CaseDefinition}.
 */
public interface ICaseCompiler {

    /**
     * Compiles a case from a YAML or JSON file, chosen by extension.
     *
     * @param casePath path to the case file
     * @return the validated case
     * @throws IOException if the file cannot be read or parsed
     * @throws com.casebook.engine.api.exceptions.CaseValidationException if the case is malformed
     */
    CaseDefinition compile(Path casePath) throws IOException;

    /**
     * Compiles a case from an in-memory document.
     */
    CaseDefinition compile(String content, CaseFormat format) throws IOException;

    default void setTracer(Tracer tracer) {
    }

    /**
     * @param listener stage listener, or null to disable
     */
    default void setCompilationListener(CaseCompilationListener listener) {
    }

    enum CaseFormat {
        YAML,
        JSON;

        /**
         * @return the format implied by the file extension, or {@code null} when unsupported
         */
        public static CaseFormat fromFileName(String fileName) {
            String lower = fileName.toLowerCase(java.util.Locale.ROOT);
            if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
                return YAML;
            }
            return lower.endsWith(".json") ? JSON : null;
        }
    }
}
