package com.logsentinel.service;

import com.logsentinel.core.agent.AgentRegistry;
import com.logsentinel.core.agent.AgentStatus;
import com.logsentinel.core.agent.MlAgent;
import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.config.AgentConfigLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the wiring in {@link LogSentinelService}.
 */
class LogSentinelServiceTest {

    private static final String AGENTS = String.join("\n",
            "agents:",
            "  - agentId: wifi",
            "    name: WiFi Agent",
            "    agentType: rule_based",
            "    processFilters: [hostapd]",
            "  - agentId: dns-ml",
            "    name: DNS Model Agent",
            "    agentType: ml_based",
            "    processFilters: [dnsmasq]",
            "    modelSlot: dns",
            "");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("The bundled agent definitions should load")
    void shouldLoadBundledAgents() {
        List<AgentConfig> bundled = AgentConfigLoader.fromClasspath(AgentConfigLoader.DEFAULT_RESOURCE);

        assertThat(bundled).isNotEmpty();
        assertThat(bundled).filteredOn(c -> c.getLevelAlerts().isEnabled())
                .extracting(AgentConfig::getId).containsExactly("syslog-levels");
    }

    @Test
    @DisplayName("A started service should turn log files into anomaly and status lines")
    void shouldDetectFromLogFiles() throws Exception {
        Path logs = Files.createDirectories(tempDir.resolve("logs"));
        Instant recent = Instant.now().minusSeconds(30).truncatedTo(ChronoUnit.SECONDS);
        Files.write(logs.resolve("hostapd.jsonl"), List.of(
                "{\"timestamp\":\"" + recent + "\",\"deviceId\":\"ap-1\",\"program\":\"hostapd\","
                        + "\"authFailures\":12}"));
        ServiceConfig config = new ServiceConfig.Builder()
                .modelStoreDir(tempDir.resolve("models"))
                .logSourcePath(logs)
                .anomalyOutputPath(tempDir.resolve("anomalies.jsonl"))
                .statusOutputPath(tempDir.resolve("status.jsonl"))
                .tickInterval(Duration.ofMillis(50))
                .workerThreads(2)
                .build();
        List<AgentConfig> agents = AgentConfigLoader.parse(AGENTS);

        try (AgentRegistry registry = LogSentinelService.start(config, agents)) {
            assertThat(registry.listAgents()).hasSize(2);
            assertThat(registry.getAgent("dns-ml")).hasValueSatisfying(a -> {
                assertThat(a.getStatus()).isEqualTo(AgentStatus.INACTIVE);
                assertThat(a.getState().getReason()).isEqualTo(MlAgent.NO_MODEL_REASON);
            });

            assertThat(awaitLines(config.getAnomalyOutputPath(), Duration.ofSeconds(5)))
                    .anySatisfy(line -> assertThat(line).contains("\"auth_failure\"").contains("\"ap-1\""));
        }
        assertThat(Files.readString(config.getStatusOutputPath()))
                .contains("agent:wifi:status")
                .contains("agent:dns-ml:status");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<String> awaitLines(Path file, Duration timeout) throws Exception {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (Files.exists(file)) {
                List<String> lines = Files.readAllLines(file);
                if (!lines.isEmpty()) {
                    return lines;
                }
            }
            Thread.sleep(20);
        }
        return List.of();
    }
}
