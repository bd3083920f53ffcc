/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.metrics.impl.prometheus;

import com.casebook.engine.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram. Durations are observed in seconds;
 * percentiles are left to PromQL {@code histogram_quantile()}.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Duration must be non-negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    /**
     * The last bucket is {@code +Inf} and cumulative, so it holds the observation count.
     */
    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        return (long) buckets[buckets.length - 1];
    }
}
