/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.metrics.impl.inmemory;

import com.casebook.engine.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong();

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }
}
