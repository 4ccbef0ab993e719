package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.features.FeatureExtractor;
import com.logsentinel.core.lifecycle.ModelUnavailableException;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.StatusPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Shared analysis-cycle machinery every agent strategy delegates to.
 *
 * <h3>Cycle</h3>
 *
 * <pre>
 *   fetch logs for [now - lookback, now] and the source filters
 *     -&gt; FeatureExtractor
 *     -&gt; strategy {@link Detection}
 *     -&gt; alert cooldown
 *     -&gt; AnomalySink
 * </pre>
 * <p>
 * The cooldown for an entity and anomaly type starts when an anomaly is
 * stored; a failed write leaves it open. Expired entries are evicted at the
 * start of each persist pass.
 * </p>
 *
 * <h3>State and overlap</h3>
 * <p>
 * An {@link AtomicBoolean} admits one cycle at a time; a call arriving while
 * a cycle is in flight returns immediately. Every status change is published
 * under {@code agent:<id>:status}. A {@link ModelUnavailableException} leaves
 * the agent {@code inactive}; any other failure leaves it {@code error} with
 * {@code lastError} set, and the next cycle runs normally.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CycleRunner.class);

    /** Status reason of an agent halted by {@link #stop(String)}. */
    static final String STOPPED_REASON = "stopped";

    /**
     * Strategy-specific classification step of a cycle.
     */
    @FunctionalInterface
    public interface Detection {

        /**
         * Called before any log is fetched.
         *
         * @throws ModelUnavailableException if the strategy cannot score
         */
        default void checkReady() {
        }

        /**
         * @param logs    entries fetched for the cycle, before message filters
         * @param vectors per-entity features of the filtered entries
         * @return anomalies to persist, subject to the alert cooldown
         */
        List<Anomaly> detect(List<LogEntry> logs, Collection<FeatureVector> vectors);
    }

    private final AgentConfig config;
    private final AgentContext context;
    private final FeatureExtractor extractor;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();
    private final Map<String, Instant> lastAlerts = new ConcurrentHashMap<>();

    private volatile AgentRuntimeState state = AgentRuntimeState.initial();
    private volatile boolean stopRequested;
    private volatile int lastAnomalyCount;

    public CycleRunner(AgentConfig config, AgentContext context) {
        this(config, context, FeatureExtractor.forConfig(config));
    }

    public CycleRunner(AgentConfig config, AgentContext context, FeatureExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /** Clear the stop flag and go {@code active}. */
    public void activate(String modelVersion) {
        stopRequested = false;
        transition(AgentStatus.ACTIVE, null, modelVersion);
    }

    /**
     * Go {@code inactive} with a reason. The stop flag is left unchanged, so
     * an agent waiting for a model can be reactivated.
     */
    public void deactivate(String reason, String modelVersion) {
        transition(AgentStatus.INACTIVE, reason, modelVersion);
    }

    /** Clear the stop flag but stay {@code inactive} until reactivated. */
    public void park(String reason, String modelVersion) {
        stopRequested = false;
        transition(AgentStatus.INACTIVE, reason, modelVersion);
    }

    /** Set the stop flag and go {@code inactive}. */
    public void stop(String modelVersion) {
        stopRequested = true;
        transition(AgentStatus.INACTIVE, STOPPED_REASON, modelVersion);
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    /**
     * Run one cycle with the given strategy.
     *
     * @param detection    classification step
     * @param modelVersion current model version for status records
     * @return {@code false} if the cycle was skipped
     */
    public boolean run(Detection detection, Supplier<String> modelVersion) {
        if (stopRequested) {
            LOG.debug("Agent [{}] is stopped; cycle skipped", config.getId());
            return false;
        }
        if (!inFlight.compareAndSet(false, true)) {
            LOG.debug("Agent [{}] cycle still in flight; tick skipped", config.getId());
            return false;
        }
        Instant now = context.getClock().instant();
        try {
            detection.checkReady();
            transition(AgentStatus.ANALYZING, null, modelVersion.get());

            Instant windowStart = now.minus(Duration.ofMinutes(config.getLookbackMinutes()));
            List<LogEntry> logs = context.getLogSource().fetchLogs(config.getSourceFilters(), windowStart, now);
            Map<String, FeatureVector> vectors = extractor.extract(logs, windowStart, now);
            List<Anomaly> anomalies = detection.detect(logs, vectors.values());

            pruneCooldowns(now);
            int persisted = 0;
            for (Anomaly anomaly : anomalies) {
                if (suppressed(anomaly, now)) {
                    continue;
                }
                context.getAnomalySink().persistAnomaly(anomaly);
                recordAlert(anomaly, now);
                persisted++;
            }
            lastAnomalyCount = persisted;
            LOG.info("Agent [{}] analysed {} log(s) from {} entit(ies): {} anomal(ies) persisted",
                    config.getId(), logs.size(), vectors.size(), persisted);
            finish(new AgentRuntimeState(endStatus(AgentStatus.ACTIVE), now, null, endReason(null)),
                    modelVersion.get());
        } catch (ModelUnavailableException e) {
            LOG.warn("Agent [{}] has no usable model: {}", config.getId(), e.getMessage());
            finish(new AgentRuntimeState(AgentStatus.INACTIVE, now, state.getLastError(), e.getMessage()),
                    modelVersion.get());
        } catch (IOException | RuntimeException e) {
            LOG.error("Agent [{}] analysis cycle failed", config.getId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            finish(new AgentRuntimeState(endStatus(AgentStatus.ERROR), now, message, endReason(null)),
                    modelVersion.get());
        } finally {
            inFlight.set(false);
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
        return true;
    }

    public boolean isRunning() {
        return inFlight.get();
    }

    /**
     * Block until no cycle is in flight or the timeout elapses.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                idleMonitor.wait(Math.max(1L, remaining / 1_000_000L));
            }
        }
        return true;
    }

    public AgentRuntimeState getState() {
        return state;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** A stop requested mid-cycle wins over the cycle's own outcome. */
    private AgentStatus endStatus(AgentStatus outcome) {
        return stopRequested ? AgentStatus.INACTIVE : outcome;
    }

    private String endReason(String reason) {
        return stopRequested ? STOPPED_REASON : reason;
    }

    private boolean suppressed(Anomaly anomaly, Instant now) {
        long cooldown = config.getAlertCooldownSeconds();
        if (cooldown <= 0) {
            return false;
        }
        Instant last = lastAlerts.get(alertKey(anomaly));
        if (last != null && now.isBefore(last.plusSeconds(cooldown))) {
            LOG.debug("Agent [{}] suppressed {} for {} (cooldown {}s)", config.getId(),
                    anomaly.getAnomalyType(), anomaly.getEntityId(), cooldown);
            return true;
        }
        return false;
    }

    /** The cooldown starts only once the anomaly is stored. */
    private void recordAlert(Anomaly anomaly, Instant now) {
        if (config.getAlertCooldownSeconds() > 0) {
            lastAlerts.put(alertKey(anomaly), now);
        }
    }

    private void pruneCooldowns(Instant now) {
        long cooldown = config.getAlertCooldownSeconds();
        lastAlerts.values().removeIf(last -> !now.isBefore(last.plusSeconds(cooldown)));
    }

    private static String alertKey(Anomaly anomaly) {
        return anomaly.getEntityId() + '|' + anomaly.getAnomalyType();
    }

    /** Number of entity and type pairs currently under cooldown. */
    int trackedAlertCount() {
        return lastAlerts.size();
    }

    private void transition(AgentStatus status, String reason, String modelVersion) {
        finish(state.withStatus(status, reason), modelVersion);
    }

    private void finish(AgentRuntimeState next, String modelVersion) {
        AgentStatus previous = state.getStatus();
        state = next;
        if (previous != next.getStatus()) {
            LOG.debug("Agent [{}] {} -> {}", config.getId(), previous.getValue(), next.getStatus().getValue());
        }
        publish(next, modelVersion);
    }

    private void publish(AgentRuntimeState snapshot, String modelVersion) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("name", config.getDisplayName());
        attrs.put("agentType", config.getStrategy().getConfigName());
        attrs.put("capabilities", config.getCapabilities());
        attrs.put("description", config.getDescription());
        attrs.put("lastRunAt", snapshot.getLastRunAt() != null ? snapshot.getLastRunAt().toString() : null);
        attrs.put("lastError", snapshot.getLastError());
        attrs.put("reason", snapshot.getReason());
        attrs.put("anomalies", lastAnomalyCount);
        attrs.put("modelVersion", modelVersion);
        try {
            context.getStatusPublisher().publish(StatusPublisher.agentKey(config.getId()),
                    new StatusRecord(config.getId(), snapshot.getStatus().getValue(),
                            context.getClock().instant(), attrs));
        } catch (RuntimeException e) {
            LOG.warn("Agent [{}] failed to publish status {}: {}", config.getId(),
                    snapshot.getStatus().getValue(), e.getMessage());
        }
    }
}
