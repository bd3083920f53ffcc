/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.api;

import com.casebook.engine.api.exceptions.NarrativeGenerationException;
import com.casebook.engine.api.model.NarrativeRequest;

/**
 * External producer of display prose, typically backed by a language model.
 */
@FunctionalInterface
public interface INarrativeGenerator {

    String generate(NarrativeRequest request) throws NarrativeGenerationException;
}
