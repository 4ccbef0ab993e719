package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentStrategy;
import com.logsentinel.core.config.LevelAlertSpec;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.AnomalySink;
import com.logsentinel.core.port.InMemoryStatusPublisher;
import com.logsentinel.core.port.LogSource;
import com.logsentinel.core.port.StatusPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.logsentinel.core.agent.AgentTestSupport.T0;
import static com.logsentinel.core.agent.AgentTestSupport.attack;
import static com.logsentinel.core.agent.AgentTestSupport.config;
import static com.logsentinel.core.agent.AgentTestSupport.levelEntry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RuleAgent} and the {@link CycleRunner} it runs on.
 */
@ExtendWith(MockitoExtension.class)
class RuleAgentTest {

    @Mock
    private LogSource logSource;

    @Mock
    private AnomalySink sink;

    private AgentTestSupport.MutableClock clock;
    private InMemoryStatusPublisher status;

    @BeforeEach
    void setUp() {
        clock = new AgentTestSupport.MutableClock(T0);
        status = new InMemoryStatusPublisher();
    }

    @Test
    @DisplayName("A cycle should fetch the lookback window, classify and persist anomalies")
    void shouldRunCycle() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE).sourceFilters(Set.of("hostapd")));
        agent.start();

        assertThat(agent.runAnalysisCycle()).isTrue();

        verify(logSource).fetchLogs(eq(Set.of("hostapd")), eq(T0.minus(Duration.ofMinutes(5))), eq(T0));
        ArgumentCaptor<Anomaly> captor = ArgumentCaptor.forClass(Anomaly.class);
        verify(sink).persistAnomaly(captor.capture());
        assertThat(captor.getValue().getAnomalyType()).isEqualTo("auth_failure");
        assertThat(captor.getValue().getSeverity()).isEqualTo(5);
        assertThat(captor.getValue().getSourceAgentId()).isEqualTo("wifi");
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(agent.getState().getLastRunAt()).isEqualTo(T0);
        assertThat(agent.getState().getLastError()).isNull();
    }

    @Test
    @DisplayName("Status records should trace active, analyzing and active again")
    void shouldPublishStatusTransitions() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE));
        agent.start();

        agent.runAnalysisCycle();

        List<StatusRecord> records = status.history(StatusPublisher.agentKey("wifi"));
        assertThat(records).extracting(StatusRecord::getStatus).containsExactly("active", "analyzing", "active");
        StatusRecord last = records.get(records.size() - 1);
        assertThat(last.getAttributes())
                .containsEntry("agentType", "rule_based")
                .containsEntry("lastRunAt", T0.toString())
                .containsEntry("anomalies", 1);
    }

    @Test
    @DisplayName("A failing log source should leave the agent in error and the next cycle should recover")
    void shouldRecordErrorAndRecover() throws Exception {
        when(logSource.fetchLogs(any(), any(), any()))
                .thenThrow(new IOException("log store unreachable"))
                .thenReturn(attack(T0));
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE));
        agent.start();

        agent.runAnalysisCycle();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ERROR);
        assertThat(agent.getState().getLastError()).isEqualTo("log store unreachable");
        assertThat(agent.getState().getLastRunAt()).isEqualTo(T0);
        verifyNoInteractions(sink);

        clock.advance(Duration.ofMinutes(1));
        agent.runAnalysisCycle();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(agent.getState().getLastError()).isNull();
        verify(sink).persistAnomaly(any());
    }

    @Test
    @DisplayName("A failing anomaly sink should fail the cycle, not the caller")
    void shouldRecordSinkFailure() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        doThrow(new IOException("disk full")).when(sink).persistAnomaly(any());
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE));
        agent.start();

        assertThat(agent.runAnalysisCycle()).isTrue();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ERROR);
        assertThat(agent.getState().getLastError()).isEqualTo("disk full");
    }

    @Test
    @DisplayName("An alert cooldown should suppress repeats of the same entity and type")
    void shouldSuppressDuringCooldown() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE).alertCooldownSeconds(300));
        agent.start();

        agent.runAnalysisCycle();
        clock.advance(Duration.ofSeconds(120));
        agent.runAnalysisCycle();
        verify(sink, times(1)).persistAnomaly(any());

        clock.advance(Duration.ofSeconds(181));
        agent.runAnalysisCycle();
        verify(sink, times(2)).persistAnomaly(any());
    }

    @Test
    @DisplayName("A failed write should not start the cooldown")
    void shouldRetryAlertAfterFailedWrite() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        doThrow(new IOException("disk full")).doNothing().when(sink).persistAnomaly(any());
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE).alertCooldownSeconds(300));
        agent.start();

        agent.runAnalysisCycle();
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ERROR);

        clock.advance(Duration.ofSeconds(60));
        agent.runAnalysisCycle();

        verify(sink, times(2)).persistAnomaly(any());
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
    }

    @Test
    @DisplayName("No cooldown should persist every repeat")
    void shouldPersistRepeatsWithoutCooldown() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE));
        agent.start();

        agent.runAnalysisCycle();
        agent.runAnalysisCycle();

        verify(sink, times(2)).persistAnomaly(any());
    }

    // ------------------------------------------------------------------
    // Level alerts
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Level alerts should report each target-level entry with escalated severity")
    void shouldRaiseLevelAlerts() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(List.of(
                levelEntry("dnsmasq", "error", "upstream timeout", T0.minusSeconds(30)),
                levelEntry("dnsmasq", "info", "cache size 150", T0.minusSeconds(20)),
                levelEntry("dnsmasq", "ERROR", "upstream timeout", T0.minusSeconds(10))));
        RuleAgent agent = agent(config("dns", AgentStrategy.RULE)
                .levelAlerts(new LevelAlertSpec(true, 0.8, Map.of("dnsmasq_error", 2))));
        agent.start();

        agent.runAnalysisCycle();

        ArgumentCaptor<Anomaly> captor = ArgumentCaptor.forClass(Anomaly.class);
        verify(sink, times(2)).persistAnomaly(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(a -> {
            assertThat(a.getAnomalyType()).isEqualTo("error_log_detected");
            assertThat(a.getEntityId()).isEqualTo("dnsmasq");
            assertThat(a.getSeverity()).isEqualTo(5);
            assertThat(a.getConfidence()).isEqualTo(0.8);
        });
        assertThat(captor.getAllValues()).extracting(Anomaly::getTimestamp)
                .containsExactly(T0.minusSeconds(30), T0.minusSeconds(10));
    }

    @Test
    @DisplayName("Level alerts for one program and level should share a cooldown")
    void shouldApplyCooldownToLevelAlerts() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(List.of(
                levelEntry("dnsmasq", "error", "upstream timeout", T0.minusSeconds(30)),
                levelEntry("dnsmasq", "error", "upstream timeout", T0.minusSeconds(10))));
        RuleAgent agent = agent(config("dns", AgentStrategy.RULE)
                .alertCooldownSeconds(300)
                .levelAlerts(new LevelAlertSpec(true, 1.0, Map.of())));
        agent.start();

        agent.runAnalysisCycle();

        verify(sink, times(1)).persistAnomaly(any());
    }

    @Test
    @DisplayName("Without level alerts enabled error entries should not be reported one by one")
    void shouldNotRaiseLevelAlertsByDefault() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(List.of(
                levelEntry("dnsmasq", "error", "upstream timeout", T0)));
        RuleAgent agent = agent(config("dns", AgentStrategy.RULE));
        agent.start();

        agent.runAnalysisCycle();

        verify(sink, never()).persistAnomaly(any());
    }

    @Test
    @DisplayName("A cycle requested while one is in flight should be skipped")
    void shouldNotOverlapCycles() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        LogSource blocking = (filters, start, end) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        RuleAgent agent = new RuleAgent(config("wifi", AgentStrategy.RULE).build(), context(blocking));
        agent.start();
        AtomicBoolean firstRan = new AtomicBoolean();
        Thread worker = new Thread(() -> firstRan.set(agent.runAnalysisCycle()));
        worker.start();

        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(agent.isRunning()).isTrue();
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ANALYZING);
        assertThat(agent.runAnalysisCycle()).isFalse();
        assertThat(agent.awaitIdle(Duration.ofMillis(50))).isFalse();

        release.countDown();
        worker.join(5000);

        assertThat(firstRan.get()).isTrue();
        assertThat(agent.awaitIdle(Duration.ofSeconds(1))).isTrue();
        assertThat(agent.isRunning()).isFalse();
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
    }

    @Test
    @DisplayName("A stopped agent should skip cycles until started again")
    void shouldSkipCyclesWhenStopped() throws Exception {
        RuleAgent agent = agent(config("wifi", AgentStrategy.RULE));
        agent.start();
        agent.stop();

        assertThat(agent.runAnalysisCycle()).isFalse();
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.INACTIVE);
        assertThat(agent.getState().getReason()).isEqualTo("stopped");
        verifyNoInteractions(logSource);

        when(logSource.fetchLogs(any(), any(), any())).thenReturn(List.of());
        agent.start();
        assertThat(agent.runAnalysisCycle()).isTrue();
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        verify(sink, never()).persistAnomaly(any());
    }

    @Test
    @DisplayName("A failing status publisher should not fail the cycle")
    void shouldTolerateStatusPublisherFailure() throws Exception {
        when(logSource.fetchLogs(any(), any(), any())).thenReturn(attack(T0));
        AgentContext context = AgentContext.builder()
                .logSource(logSource)
                .anomalySink(sink)
                .statusPublisher((key, record) -> {
                    throw new IllegalStateException("status store down");
                })
                .clock(clock)
                .build();
        RuleAgent agent = new RuleAgent(config("wifi", AgentStrategy.RULE).build(), context);
        agent.start();

        agent.runAnalysisCycle();

        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        verify(sink).persistAnomaly(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RuleAgent agent(com.logsentinel.core.config.AgentConfig.Builder builder) {
        return new RuleAgent(builder.build(), context(logSource));
    }

    private AgentContext context(LogSource source) {
        return AgentContext.builder()
                .logSource(source)
                .anomalySink(sink)
                .statusPublisher(status)
                .clock(clock)
                .build();
    }
}
