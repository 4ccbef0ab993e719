package com.logsentinel.service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the Log Sentinel process.
 *
 * <p>
 * Values are resolved from environment variables with defaults suited to a
 * local run. Use {@link #fromEnvironment()} in production and the
 * {@link Builder} in tests; {@link Builder#build()} validates every value.
 * </p>
 *
 * <h3>Environment</h3>
 * <table>
 * <caption>Variables</caption>
 * <tr><td>{@code AGENT_CONFIG_PATH}</td><td>agent definitions file; empty
 * for classpath {@code agents.yml}</td></tr>
 * <tr><td>{@code MODEL_STORE_DIR}</td><td>model registry root
 * ({@code ./model-store})</td></tr>
 * <tr><td>{@code LOG_SOURCE_PATH}</td><td>JSON-lines log file or directory
 * ({@code ./logs})</td></tr>
 * <tr><td>{@code ANOMALY_OUTPUT_PATH}</td><td>anomaly output file
 * ({@code ./anomalies.jsonl})</td></tr>
 * <tr><td>{@code STATUS_OUTPUT_PATH}</td><td>status record file
 * ({@code ./status.jsonl})</td></tr>
 * <tr><td>{@code TICK_INTERVAL_SECONDS}</td><td>driver tick (10)</td></tr>
 * <tr><td>{@code WORKER_THREADS}</td><td>cycle worker pool size (4)</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final String agentConfigPath;
    private final Path modelStoreDir;
    private final Path logSourcePath;
    private final Path anomalyOutputPath;
    private final Path statusOutputPath;
    private final Duration tickInterval;
    private final int workerThreads;

    private ServiceConfig(Builder b) {
        this.agentConfigPath = b.agentConfigPath;
        this.modelStoreDir = b.modelStoreDir;
        this.logSourcePath = b.logSourcePath;
        this.anomalyOutputPath = b.anomalyOutputPath;
        this.statusOutputPath = b.statusOutputPath;
        this.tickInterval = b.tickInterval;
        this.workerThreads = b.workerThreads;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * @return configuration from the process environment
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolve from an explicit variable map.
     */
    static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .agentConfigPath(env(env, "AGENT_CONFIG_PATH", ""))
                    .modelStoreDir(Path.of(env(env, "MODEL_STORE_DIR", "model-store")))
                    .logSourcePath(Path.of(env(env, "LOG_SOURCE_PATH", "logs")))
                    .anomalyOutputPath(Path.of(env(env, "ANOMALY_OUTPUT_PATH", "anomalies.jsonl")))
                    .statusOutputPath(Path.of(env(env, "STATUS_OUTPUT_PATH", "status.jsonl")))
                    .tickInterval(Duration.ofSeconds(Long.parseLong(env(env, "TICK_INTERVAL_SECONDS", "10"))))
                    .workerThreads(Integer.parseInt(env(env, "WORKER_THREADS", "4")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** Blank when agents come from the classpath. */
    public String getAgentConfigPath() {
        return agentConfigPath;
    }

    public Path getModelStoreDir() {
        return modelStoreDir;
    }

    public Path getLogSourcePath() {
        return logSourcePath;
    }

    public Path getAnomalyOutputPath() {
        return anomalyOutputPath;
    }

    public Path getStatusOutputPath() {
        return statusOutputPath;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}. {@link #build()} requires
     * every path, a positive tick interval and at least one worker thread.
     */
    public static class Builder {
        private String agentConfigPath = "";
        private Path modelStoreDir = Path.of("model-store");
        private Path logSourcePath = Path.of("logs");
        private Path anomalyOutputPath = Path.of("anomalies.jsonl");
        private Path statusOutputPath = Path.of("status.jsonl");
        private Duration tickInterval = Duration.ofSeconds(10);
        private int workerThreads = 4;

        public Builder agentConfigPath(String v) {
            this.agentConfigPath = v;
            return this;
        }

        public Builder modelStoreDir(Path v) {
            this.modelStoreDir = v;
            return this;
        }

        public Builder logSourcePath(Path v) {
            this.logSourcePath = v;
            return this;
        }

        public Builder anomalyOutputPath(Path v) {
            this.anomalyOutputPath = v;
            return this;
        }

        public Builder statusOutputPath(Path v) {
            this.statusOutputPath = v;
            return this;
        }

        public Builder tickInterval(Duration v) {
            this.tickInterval = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(modelStoreDir, "modelStoreDir required");
            Objects.requireNonNull(logSourcePath, "logSourcePath required");
            Objects.requireNonNull(anomalyOutputPath, "anomalyOutputPath required");
            Objects.requireNonNull(statusOutputPath, "statusOutputPath required");
            Objects.requireNonNull(tickInterval, "tickInterval required");
            if (agentConfigPath == null) {
                agentConfigPath = "";
            }
            if (tickInterval.isZero() || tickInterval.isNegative()) {
                throw new IllegalArgumentException("tickInterval must be positive, got: " + tickInterval);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "agentConfigPath='" + agentConfigPath + '\'' +
                ", modelStoreDir=" + modelStoreDir +
                ", logSourcePath=" + logSourcePath +
                ", anomalyOutputPath=" + anomalyOutputPath +
                ", statusOutputPath=" + statusOutputPath +
                ", tickInterval=" + tickInterval +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
