/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.management;

import com.casebook.engine.api.ICaseCompiler;
import com.casebook.engine.api.ICaseRepository;
import com.casebook.engine.api.exceptions.CaseNotFoundException;
import com.casebook.engine.api.exceptions.CaseValidationException;
import com.casebook.engine.api.exceptions.PersistenceException;
import com.casebook.engine.api.model.CaseDefinition;
import com.casebook.engine.infra.config.EngineConfig;
import com.casebook.engine.infra.metrics.MetricNames;
import com.casebook.engine.infra.metrics.MetricsRegistry;
import com.casebook.engine.infra.metrics.Timer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Loads compiled cases from a directory of {@code <caseId>.yaml|.yml|.json} files.
 *
 * <p>Compiled cases are immutable and shared by every session, so they are cached by id.
 * {@link #reload(String)} drops a cached case; the next load recompiles it from disk.
 * A file must declare the id it is named after.
 */
public class CaseRepository implements ICaseRepository {
    private static final Logger logger = Logger.getLogger(CaseRepository.class.getName());

    static final Pattern CASE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");

    private final Path caseDirectory;
    private final ICaseCompiler compiler;
    private final Tracer tracer;
    private final Timer loadTimer;
    private final Cache<String, CaseDefinition> cache;

    public CaseRepository(EngineConfig config, ICaseCompiler compiler, Tracer tracer, MetricsRegistry metrics) {
        this(config.getCaseDirectory(), compiler, tracer, metrics, config.getCaseCacheMaxSize());
    }

    public CaseRepository(Path caseDirectory, ICaseCompiler compiler, Tracer tracer, MetricsRegistry metrics,
                          long maxCachedCases) {
        this.caseDirectory = caseDirectory;
        this.compiler = compiler;
        this.tracer = tracer;
        this.loadTimer = metrics.timer(MetricNames.CASE_LOAD);
        this.compiler.setTracer(tracer);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCachedCases)
                .build();
    }

    /**
     * @throws CaseNotFoundException   when the id is malformed or no case file exists
     * @throws CaseValidationException when the case file does not compile or declares another id
     */
    @Override
    public CaseDefinition loadCase(String caseId) {
        if (caseId == null || !CASE_ID.matcher(caseId).matches()) {
            logger.warning("Rejected malformed case id: " + caseId);
            throw new CaseNotFoundException(String.valueOf(caseId));
        }
        return cache.get(caseId, this::compileCase);
    }

    @Override
    public List<String> listCases() {
        if (!Files.isDirectory(caseDirectory)) {
            logger.warning("Case directory does not exist: " + caseDirectory);
            return List.of();
        }
        TreeSet<String> ids = new TreeSet<>();
        try (Stream<Path> files = Files.list(caseDirectory)) {
            files.map(path -> path.getFileName().toString())
                    .forEach(name -> EXTENSIONS.stream()
                            .filter(name::endsWith)
                            .map(ext -> name.substring(0, name.length() - ext.length()))
                            .filter(id -> CASE_ID.matcher(id).matches())
                            .forEach(ids::add));
        } catch (IOException e) {
            throw new PersistenceException("Could not list case directory " + caseDirectory, e);
        }
        return List.copyOf(ids);
    }

    @Override
    public void reload(String caseId) {
        cache.invalidate(caseId);
        logger.info("Invalidated cached case '" + caseId + "'");
    }

    public void reloadAll() {
        cache.invalidateAll();
        logger.info("Invalidated all cached cases");
    }

    long cachedCaseCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private CaseDefinition compileCase(String caseId) {
        Path file = resolve(caseId).orElseThrow(() -> {
            logger.warning("No case file for '" + caseId + "' in " + caseDirectory);
            return new CaseNotFoundException(caseId);
        });
        Span span = tracer.spanBuilder("load-case").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("caseId", caseId);
            span.setAttribute("caseFile", file.toString());
            CaseDefinition definition = compiler.compile(file);
            if (!caseId.equals(definition.getCaseId())) {
                throw new CaseValidationException("Case file " + file.getFileName() + " declares id '"
                        + definition.getCaseId() + "'; expected '" + caseId + "'");
            }
            logger.info("Loaded case '" + caseId + "' from " + file);
            return definition;
        } catch (IOException e) {
            span.recordException(e);
            throw new CaseValidationException("Case '" + caseId + "' could not be loaded: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            loadTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    private Optional<Path> resolve(String caseId) {
        return EXTENSIONS.stream()
                .map(ext -> caseDirectory.resolve(caseId + ext))
                .filter(Files::isRegularFile)
                .findFirst();
    }
}
