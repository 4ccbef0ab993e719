package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * A configured, schedulable detection unit.
 *
 * <p>
 * Implementations are strategies ({@link RuleAgent}, {@link MlAgent},
 * {@link HybridAgent}) sharing scheduling behaviour through a
 * {@link CycleRunner}. All methods are safe to call from any thread; at most
 * one analysis cycle per agent runs at a time.
 * </p>
 *
 * @since 1.0.0
 */
public interface Agent {

    AgentConfig getConfig();

    default String getId() {
        return getConfig().getId();
    }

    /**
     * Make the agent schedulable and publish its state. Never throws for a
     * missing model; an ML agent without one goes {@code inactive}.
     */
    void start();

    /**
     * Cooperative stop: no new cycle starts, an in-flight cycle finishes.
     */
    void stop();

    /**
     * Run one fetch, extract, classify, persist cycle. Failures are recorded
     * in the agent state, never thrown.
     *
     * @return {@code true} if a cycle ran, {@code false} if it was skipped
     *         (stopped, no model, or a cycle already in flight)
     */
    boolean runAnalysisCycle();

    AgentRuntimeState getState();

    default AgentStatus getStatus() {
        return getState().getStatus();
    }

    /**
     * @return {@code true} while a cycle is in flight
     */
    boolean isRunning();

    /**
     * Wait for an in-flight cycle to finish.
     *
     * @return {@code true} if idle before the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;

    /**
     * @return id of the model version the agent currently scores with
     */
    default Optional<String> getModelVersion() {
        return Optional.empty();
    }
}
