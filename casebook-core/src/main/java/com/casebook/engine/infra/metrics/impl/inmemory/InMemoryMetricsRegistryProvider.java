/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.metrics.impl.inmemory;

import com.casebook.engine.infra.metrics.MetricsRegistry;
import com.casebook.engine.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory provider for tests. Register it in
 * {@code src/test/resources/META-INF/services/com.casebook.engine.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
