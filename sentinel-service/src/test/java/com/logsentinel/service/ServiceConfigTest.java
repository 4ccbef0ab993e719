package com.logsentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("An empty environment should yield the local defaults")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of());

        assertThat(config.getAgentConfigPath()).isEmpty();
        assertThat(config.getModelStoreDir()).isEqualTo(Path.of("model-store"));
        assertThat(config.getLogSourcePath()).isEqualTo(Path.of("logs"));
        assertThat(config.getAnomalyOutputPath()).isEqualTo(Path.of("anomalies.jsonl"));
        assertThat(config.getStatusOutputPath()).isEqualTo(Path.of("status.jsonl"));
        assertThat(config.getTickInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getWorkerThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("Environment variables should override defaults; blank ones should not")
    void shouldReadVariables() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                "AGENT_CONFIG_PATH", "/etc/sentinel/agents.yml",
                "MODEL_STORE_DIR", "/var/lib/sentinel/models",
                "TICK_INTERVAL_SECONDS", "30",
                "WORKER_THREADS", "8",
                "LOG_SOURCE_PATH", "  "));

        assertThat(config.getAgentConfigPath()).isEqualTo("/etc/sentinel/agents.yml");
        assertThat(config.getModelStoreDir()).isEqualTo(Path.of("/var/lib/sentinel/models"));
        assertThat(config.getTickInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getWorkerThreads()).isEqualTo(8);
        assertThat(config.getLogSourcePath()).isEqualTo(Path.of("logs"));
    }

    @Test
    @DisplayName("A non-numeric variable should fail with the parse error")
    void shouldRejectNonNumeric() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("WORKER_THREADS", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Out-of-range values should be rejected")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("TICK_INTERVAL_SECONDS", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tickInterval must be positive");
        assertThatThrownBy(() -> new ServiceConfig.Builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads must be >= 1");
    }
}
