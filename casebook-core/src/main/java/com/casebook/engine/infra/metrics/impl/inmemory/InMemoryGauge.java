/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.metrics.impl.inmemory;

import com.casebook.engine.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {
    private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

    @Override
    public void set(double value) {
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }
}
