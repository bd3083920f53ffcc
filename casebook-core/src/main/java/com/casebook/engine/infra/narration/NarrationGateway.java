/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.narration;

import com.casebook.engine.api.INarrativeGenerator;
import com.casebook.engine.api.exceptions.NarrativeGenerationException;
import com.casebook.engine.api.model.NarrativeRequest;
import com.casebook.engine.infra.config.EngineConfig;
import com.casebook.engine.infra.metrics.Counter;
import com.casebook.engine.infra.metrics.MetricNames;
import com.casebook.engine.infra.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls the external narrative generator with a bounded wait.
 *
 * <p>Narration is display-only: whatever happens here, the caller gets text back and no engine
 * state is read or written. When the generator is slow or fails, a fixed fallback line for the
 * request kind is returned instead. A generator that overruns the timeout is interrupted so
 * its worker thread is released.
 */
public class NarrationGateway implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(NarrationGateway.class.getName());

    /** Context key a caller may set to supply its own fallback line. */
    public static final String FALLBACK_KEY = "fallback";

    private final INarrativeGenerator generator;
    private final Duration timeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Counter fallbacks;

    public NarrationGateway(INarrativeGenerator generator, EngineConfig config, MetricsRegistry metrics) {
        this(generator, config.getNarrationTimeout(), newExecutor(), true, metrics);
    }

    public NarrationGateway(INarrativeGenerator generator, Duration timeout, ExecutorService executor,
                            MetricsRegistry metrics) {
        this(generator, timeout, executor, false, metrics);
    }

    private NarrationGateway(INarrativeGenerator generator, Duration timeout, ExecutorService executor,
                             boolean ownsExecutor, MetricsRegistry metrics) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownsExecutor = ownsExecutor;
        this.fallbacks = metrics.counter(MetricNames.NARRATION_FALLBACKS);
    }

    /**
     * Returns generated text, or the fallback line when generation times out or fails.
     */
    public String narrate(NarrativeRequest request) {
        Future<String> future = executor.submit(() -> generator.generate(request));

        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                logger.warning("Narrative generator returned no text for " + request.kind() + "; using fallback");
                return fallback(request);
            }
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning("Narrative generation for " + request.kind() + " timed out after "
                    + timeout.toMillis() + " ms; using fallback");
            return fallback(request);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NarrativeGenerationException) {
                logger.warning("Narrative generation for " + request.kind() + " failed: " + cause.getMessage());
            } else {
                logger.log(Level.SEVERE, "Narrative generator raised an unexpected error for " + request.kind(), cause);
            }
            return fallback(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback(request);
        }
    }

    String fallback(NarrativeRequest request) {
        fallbacks.increment();
        Object custom = request.context().get(FALLBACK_KEY);
        if (custom instanceof String && !((String) custom).isBlank()) {
            return (String) custom;
        }
        return defaultFallback(request.kind());
    }

    public static String defaultFallback(NarrativeRequest.Kind kind) {
        switch (kind) {
            case INTERROGATION:
                return "The witness considers the question for a long moment before answering.";
            case VERDICT_FEEDBACK:
                return "Your mentor reviews the case file and weighs your reasoning.";
            case INVESTIGATION:
            default:
                return "You take in the scene carefully, noting every detail.";
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ExecutorService newExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "casebook-narration");
            thread.setDaemon(true);
            return thread;
        });
    }
}
