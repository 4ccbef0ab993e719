package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentStrategy;
import com.logsentinel.core.lifecycle.ModelLifecycleManager;
import com.logsentinel.core.lifecycle.RegistryConflictException;
import com.logsentinel.core.lifecycle.TestBundles;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.AnomalySink;
import com.logsentinel.core.port.InMemoryStatusPublisher;
import com.logsentinel.core.port.LogSource;
import com.logsentinel.core.port.StatusPublisher;
import com.logsentinel.core.scoring.ArtifactLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static com.logsentinel.core.agent.AgentTestSupport.T0;
import static com.logsentinel.core.agent.AgentTestSupport.attack;
import static com.logsentinel.core.agent.AgentTestSupport.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AgentRegistry}.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AgentRegistryTest {

    @TempDir
    Path tempDir;

    @Mock
    private LogSource logSource;

    @Mock
    private AnomalySink sink;

    private AgentTestSupport.MutableClock clock;
    private InMemoryStatusPublisher status;
    private ModelLifecycleManager manager;
    private AgentRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        clock = new AgentTestSupport.MutableClock(T0);
        status = new InMemoryStatusPublisher();
        manager = new ModelLifecycleManager(tempDir.resolve("store"), status, clock, new ArtifactLoader());
        registry = new AgentRegistry(context(), new AgentTestSupport.DirectExecutorService());
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    @Test
    @DisplayName("createAgent should build, register and start the agent")
    void shouldCreateAndStart() {
        Agent agent = registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        assertThat(agent).isInstanceOf(RuleAgent.class);
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(registry.getAgent("wifi")).containsSame(agent);
    }

    @Test
    @DisplayName("A duplicate agent id should be rejected")
    void shouldRejectDuplicateId() {
        registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        assertThatThrownBy(() -> registry.createAgent(config("wifi", AgentStrategy.HYBRID).build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Agent already registered");
        assertThat(registry.listAgents()).hasSize(1);
    }

    @Test
    @DisplayName("registerAgent should not start the agent")
    void shouldRegisterWithoutStarting() {
        RuleAgent agent = new RuleAgent(config("wifi", AgentStrategy.RULE).build(), context());

        registry.registerAgent(agent);

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.INITIALIZED);
        assertThat(registry.tick()).isZero();
    }

    @Test
    @DisplayName("listAgents should be ordered by id")
    void shouldListById() {
        registry.createAgent(config("zeta", AgentStrategy.RULE).build());
        registry.createAgent(config("alpha", AgentStrategy.RULE).build());
        registry.createAgent(config("mid", AgentStrategy.HYBRID).build());

        assertThat(registry.listAgents()).extracting(Agent::getId).containsExactly("alpha", "mid", "zeta");
    }

    @Test
    @DisplayName("unregisterAgent should stop the agent and publish an unregistered status")
    void shouldUnregister() {
        Agent agent = registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        assertThat(registry.unregisterAgent("wifi")).isTrue();
        assertThat(registry.unregisterAgent("wifi")).isFalse();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.INACTIVE);
        assertThat(registry.getAgent("wifi")).isEmpty();
        StatusRecord last = status.latest(StatusPublisher.agentKey("wifi")).orElseThrow();
        assertThat(last.getStatus()).isEqualTo("unregistered");
        assertThat(last.getAttributes()).containsEntry("agentType", "rule_based");
    }

    @Test
    @DisplayName("restartAgent should bring a stopped agent back")
    void shouldRestart() {
        Agent agent = registry.createAgent(config("wifi", AgentStrategy.RULE).build());
        agent.stop();

        assertThat(registry.restartAgent("wifi")).isSameAs(agent);
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThatThrownBy(() -> registry.restartAgent("ghost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown agent");
    }

    @Test
    @DisplayName("replaceConfig should swap in a new agent under the same id")
    void shouldReplaceConfig() {
        Agent old = registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        Agent fresh = registry.replaceConfig(config("wifi", AgentStrategy.RULE).analysisIntervalSeconds(30).build());

        assertThat(fresh).isNotSameAs(old);
        assertThat(old.getStatus()).isEqualTo(AgentStatus.INACTIVE);
        assertThat(fresh.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(fresh.getConfig().getAnalysisIntervalSeconds()).isEqualTo(30);
        assertThat(registry.getAgent("wifi")).containsSame(fresh);
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    @Test
    @DisplayName("tick should dispatch agents only when their interval has elapsed")
    void shouldDispatchDueAgents() throws Exception {
        registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        assertThat(registry.tick()).isEqualTo(1);
        assertThat(registry.tick()).isZero();

        clock.advance(Duration.ofSeconds(59));
        assertThat(registry.tick()).isZero();

        clock.advance(Duration.ofSeconds(1));
        assertThat(registry.tick()).isEqualTo(1);
        verify(sink, times(2)).persistAnomaly(any());
    }

    @Test
    @DisplayName("tick should skip stopped agents and retry agents in error")
    void shouldSkipStoppedAndRetryErrors() throws Exception {
        Agent stopped = registry.createAgent(config("idle", AgentStrategy.RULE).build());
        stopped.stop();
        when(logSource.fetchLogs(any(), any(), any())).thenThrow(new IOException("log store unreachable"));
        Agent failing = registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        assertThat(registry.tick()).isEqualTo(1);
        assertThat(failing.getStatus()).isEqualTo(AgentStatus.ERROR);

        clock.advance(Duration.ofMinutes(1));
        assertThat(registry.tick()).isEqualTo(1);
        assertThat(stopped.getState().getLastRunAt()).isNull();
    }

    @Test
    @DisplayName("isDue should compare lastRunAt plus the interval with now")
    void shouldComputeDueness() {
        Agent agent = registry.createAgent(config("wifi", AgentStrategy.RULE).build());
        assertThat(AgentRegistry.isDue(agent, T0)).isTrue();

        registry.tick();

        assertThat(AgentRegistry.isDue(agent, T0.plusSeconds(59))).isFalse();
        assertThat(AgentRegistry.isDue(agent, T0.plusSeconds(60))).isTrue();
    }

    @Test
    @DisplayName("A closed registry should stop its agents and dispatch nothing")
    void shouldStopOnClose() {
        Agent agent = registry.createAgent(config("wifi", AgentStrategy.RULE).build());

        registry.close();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.INACTIVE);
        assertThat(registry.tick()).isZero();
        assertThatThrownBy(() -> registry.createAgent(config("late", AgentStrategy.RULE).build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }

    @Test
    @DisplayName("The driver loop should run cycles on the worker pool")
    void shouldScheduleCycles() throws Exception {
        try (AgentRegistry pooled = new AgentRegistry(context(), 2)) {
            pooled.createAgent(config("wifi", AgentStrategy.RULE).build());

            pooled.startScheduling(Duration.ofMillis(20));

            verify(sink, timeout(2000).atLeastOnce()).persistAnomaly(any());
            assertThatThrownBy(() -> pooled.startScheduling(Duration.ofMillis(20)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Scheduling already started");
        }
    }

    // ------------------------------------------------------------------
    // Model references
    // ------------------------------------------------------------------

    @Test
    @DisplayName("A version pinned by an agent should not be deletable until the agent goes away")
    void shouldProtectReferencedVersions() throws Exception {
        Path bundle = TestBundles.validBundle(tempDir.resolve("src"), "v1", T0.minus(Duration.ofDays(1)));
        manager.importVersion(bundle, "v1", null, true);
        Path stored = manager.directoryOf(manager.getVersion("v1"));
        registry.createAgent(config("wifi-ml", AgentStrategy.ML).modelPath(stored.toString()).build());

        assertThat(registry.isModelReferenced("v1")).isTrue();
        assertThatThrownBy(() -> manager.delete("v1"))
                .isInstanceOf(RegistryConflictException.class)
                .hasMessageContaining("referenced");

        registry.unregisterAgent("wifi-ml");

        assertThat(registry.isModelReferenced("v1")).isFalse();
        assertThat(manager.delete("v1")).isTrue();
        assertThat(Files.exists(stored)).isFalse();
    }

    @Test
    @DisplayName("A stopped agent should not keep its pinned version from being deleted")
    void shouldIgnoreStoppedAgentsForReferences() throws Exception {
        Path bundle = TestBundles.validBundle(tempDir.resolve("src"), "v1", T0.minus(Duration.ofDays(1)));
        manager.importVersion(bundle, "v1", null, true);
        Path stored = manager.directoryOf(manager.getVersion("v1"));
        Agent agent = registry.createAgent(config("wifi-ml", AgentStrategy.ML).modelPath(stored.toString()).build());

        agent.stop();

        assertThat(registry.getAgent("wifi-ml")).isPresent();
        assertThat(registry.isModelReferenced("v1")).isFalse();
        assertThat(manager.delete("v1")).isTrue();
    }

    @Test
    @DisplayName("A version deployed to an agent's slot should count as referenced")
    void shouldReferenceDeployedVersion() throws Exception {
        Path bundle = TestBundles.validBundle(tempDir.resolve("src"), "v1", T0.minus(Duration.ofDays(1)));
        manager.importVersion(bundle, "v1", null, true);
        manager.deploy("v1");

        registry.createAgent(config("wifi-ml", AgentStrategy.ML).build());

        assertThat(registry.isModelReferenced("v1")).isTrue();
        assertThat(registry.isModelReferenced("v2")).isFalse();
    }

    // ------------------------------------------------------------------
    // Context
    // ------------------------------------------------------------------

    @Test
    @DisplayName("An agent context should require a log source and an anomaly sink")
    void shouldValidateContext() {
        assertThatThrownBy(() -> AgentContext.builder().statusPublisher(null).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid agent context")
                .hasMessageContaining("logSource is required")
                .hasMessageContaining("anomalySink is required")
                .hasMessageContaining("statusPublisher is required");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AgentContext context() {
        return AgentContext.builder()
                .logSource(logSource)
                .anomalySink(sink)
                .statusPublisher(status)
                .modelManager(manager)
                .clock(clock)
                .build();
    }
}
