/*
 * Copyright (c) 2025 Casebook Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.casebook.engine.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Runtime configuration for the casebook infrastructure.
 *
 * <p>Values resolve in three layers, later layers winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>a properties file ({@code casebook.properties} on the classpath, or a file path)</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <p>Each property key maps to one environment variable: drop the {@code casebook.} prefix,
 * upper-case, replace dots with underscores and prefix {@code CASEBOOK_}. For example
 * {@code casebook.session.lock.timeout.millis} becomes {@code CASEBOOK_SESSION_LOCK_TIMEOUT_MILLIS}.
 *
 * <pre>
 * casebook.case.directory=cases
 * casebook.case.cache.max.size=100
 * casebook.session.max.size=10000
 * casebook.session.idle.timeout.minutes=30
 * casebook.session.lock.timeout.millis=2000
 * casebook.snapshot.directory=saves
 * casebook.autosave.enabled=true
 * casebook.narration.timeout.millis=5000
 * </pre>
 *
 * Unparseable values are logged and ignored.
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "casebook.properties";

    static final String CASE_DIRECTORY = "casebook.case.directory";
    static final String CASE_CACHE_MAX_SIZE = "casebook.case.cache.max.size";
    static final String SESSION_MAX_SIZE = "casebook.session.max.size";
    static final String SESSION_IDLE_TIMEOUT_MINUTES = "casebook.session.idle.timeout.minutes";
    static final String SESSION_LOCK_TIMEOUT_MILLIS = "casebook.session.lock.timeout.millis";
    static final String SNAPSHOT_DIRECTORY = "casebook.snapshot.directory";
    static final String AUTOSAVE_ENABLED = "casebook.autosave.enabled";
    static final String NARRATION_TIMEOUT_MILLIS = "casebook.narration.timeout.millis";

    private final Path caseDirectory;
    private final long caseCacheMaxSize;
    private final long sessionMaxSize;
    private final Duration sessionIdleTimeout;
    private final Duration sessionLockTimeout;
    private final Path snapshotDirectory;
    private final boolean autosaveEnabled;
    private final Duration narrationTimeout;

    private EngineConfig(Builder builder) {
        this.caseDirectory = builder.caseDirectory;
        this.caseCacheMaxSize = builder.caseCacheMaxSize;
        this.sessionMaxSize = builder.sessionMaxSize;
        this.sessionIdleTimeout = builder.sessionIdleTimeout;
        this.sessionLockTimeout = builder.sessionLockTimeout;
        this.snapshotDirectory = builder.snapshotDirectory;
        this.autosaveEnabled = builder.autosaveEnabled;
        this.narrationTimeout = builder.narrationTimeout;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults, overridden by {@code casebook.properties} and then by the process environment.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads the properties file from the classpath, or from the file system when it is not on
     * the classpath. A missing file leaves the defaults in place. Environment variables win.
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath properties " + propertiesPath + ": " + e.getMessage());
        }
        if (props.isEmpty()) {
            try (InputStream is = new FileInputStream(propertiesPath)) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.fine("No properties file at " + propertiesPath + "; using defaults");
            }
        }
        return load(props, System::getenv);
    }

    /**
     * @param environment variable lookup, {@code System::getenv} outside tests
     */
    public static EngineConfig load(Properties props, Function<String, String> environment) {
        Builder builder = builder();
        builder.apply(props::getProperty);
        builder.apply(key -> environment.apply(envName(key)));
        return builder.build();
    }

    static String envName(String propertyKey) {
        return "CASEBOOK_" + propertyKey.substring("casebook.".length())
                .toUpperCase(Locale.ROOT)
                .replace('.', '_');
    }

    private void validate() {
        if (caseCacheMaxSize <= 0) {
            throw new IllegalArgumentException("case cache max size must be positive: " + caseCacheMaxSize);
        }
        if (sessionMaxSize <= 0) {
            throw new IllegalArgumentException("session max size must be positive: " + sessionMaxSize);
        }
        if (sessionIdleTimeout.isNegative() || sessionIdleTimeout.isZero()) {
            throw new IllegalArgumentException("session idle timeout must be positive: " + sessionIdleTimeout);
        }
        if (sessionLockTimeout.isNegative()) {
            throw new IllegalArgumentException("session lock timeout must not be negative: " + sessionLockTimeout);
        }
        if (narrationTimeout.isNegative() || narrationTimeout.isZero()) {
            throw new IllegalArgumentException("narration timeout must be positive: " + narrationTimeout);
        }
    }

    public Path getCaseDirectory() { return caseDirectory; }
    public long getCaseCacheMaxSize() { return caseCacheMaxSize; }
    public long getSessionMaxSize() { return sessionMaxSize; }
    public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
    public Duration getSessionLockTimeout() { return sessionLockTimeout; }
    public Path getSnapshotDirectory() { return snapshotDirectory; }
    public boolean isAutosaveEnabled() { return autosaveEnabled; }
    public Duration getNarrationTimeout() { return narrationTimeout; }

    @Override
    public String toString() {
        return "EngineConfig{caseDirectory=" + caseDirectory
                + ", caseCacheMaxSize=" + caseCacheMaxSize
                + ", sessionMaxSize=" + sessionMaxSize
                + ", sessionIdleTimeout=" + sessionIdleTimeout
                + ", sessionLockTimeout=" + sessionLockTimeout
                + ", snapshotDirectory=" + snapshotDirectory
                + ", autosaveEnabled=" + autosaveEnabled
                + ", narrationTimeout=" + narrationTimeout + '}';
    }

    public static final class Builder {
        private Path caseDirectory = Path.of("cases");
        private long caseCacheMaxSize = 100;
        private long sessionMaxSize = 10_000;
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
        private Duration sessionLockTimeout = Duration.ofSeconds(2);
        private Path snapshotDirectory = Path.of("saves");
        private boolean autosaveEnabled = true;
        private Duration narrationTimeout = Duration.ofSeconds(5);

        private Builder() {
        }

        public Builder withCaseDirectory(Path directory) {
            this.caseDirectory = directory;
            return this;
        }

        public Builder withCaseCacheMaxSize(long size) {
            this.caseCacheMaxSize = size;
            return this;
        }

        public Builder withSessionMaxSize(long size) {
            this.sessionMaxSize = size;
            return this;
        }

        public Builder withSessionIdleTimeout(Duration timeout) {
            this.sessionIdleTimeout = timeout;
            return this;
        }

        public Builder withSessionLockTimeout(Duration timeout) {
            this.sessionLockTimeout = timeout;
            return this;
        }

        public Builder withSnapshotDirectory(Path directory) {
            this.snapshotDirectory = directory;
            return this;
        }

        public Builder withAutosaveEnabled(boolean enabled) {
            this.autosaveEnabled = enabled;
            return this;
        }

        public Builder withNarrationTimeout(Duration timeout) {
            this.narrationTimeout = timeout;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private void apply(Function<String, String> source) {
            string(source, CASE_DIRECTORY).ifPresent(v -> caseDirectory = Path.of(v));
            parsed(source, CASE_CACHE_MAX_SIZE, Long::parseLong, v -> caseCacheMaxSize = v);
            parsed(source, SESSION_MAX_SIZE, Long::parseLong, v -> sessionMaxSize = v);
            parsed(source, SESSION_IDLE_TIMEOUT_MINUTES, Long::parseLong, v -> sessionIdleTimeout = Duration.ofMinutes(v));
            parsed(source, SESSION_LOCK_TIMEOUT_MILLIS, Long::parseLong, v -> sessionLockTimeout = Duration.ofMillis(v));
            string(source, SNAPSHOT_DIRECTORY).ifPresent(v -> snapshotDirectory = Path.of(v));
            string(source, AUTOSAVE_ENABLED).ifPresent(v -> autosaveEnabled = parseBoolean(v));
            parsed(source, NARRATION_TIMEOUT_MILLIS, Long::parseLong, v -> narrationTimeout = Duration.ofMillis(v));
        }

        private static Optional<String> string(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value == null || value.trim().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        private static <T> void parsed(Function<String, String> source, String key,
                                       Function<String, T> parser, Consumer<T> target) {
            string(source, key).ifPresent(value -> {
                try {
                    target.accept(parser.apply(value));
                } catch (NumberFormatException e) {
                    logger.warning("Invalid value for " + key + ": " + value + "; keeping previous setting");
                }
            });
        }

        private static boolean parseBoolean(String value) {
            String normalized = value.toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
    }
}
