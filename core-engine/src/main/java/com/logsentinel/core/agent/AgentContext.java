package com.logsentinel.core.agent;

import com.logsentinel.core.lifecycle.ModelLifecycleManager;
import com.logsentinel.core.port.AnomalySink;
import com.logsentinel.core.port.LogSource;
import com.logsentinel.core.port.StatusPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collaborators shared by every agent of a registry. Built once by whoever
 * owns the registry and passed down explicitly.
 *
 * @since 1.0.0
 */
public final class AgentContext {

    private final LogSource logSource;
    private final AnomalySink anomalySink;
    private final StatusPublisher statusPublisher;
    private final ModelLifecycleManager modelManager;
    private final Clock clock;

    private AgentContext(Builder b) {
        this.logSource = b.logSource;
        this.anomalySink = b.anomalySink;
        this.statusPublisher = b.statusPublisher;
        this.modelManager = b.modelManager;
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public LogSource getLogSource() {
        return logSource;
    }

    public AnomalySink getAnomalySink() {
        return anomalySink;
    }

    public StatusPublisher getStatusPublisher() {
        return statusPublisher;
    }

    /**
     * @return the model manager, or {@code null} when the process runs rule
     *         agents only
     */
    public ModelLifecycleManager getModelManager() {
        return modelManager;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Fluent builder; {@link #build()} checks the required collaborators.
     */
    public static final class Builder {
        private LogSource logSource;
        private AnomalySink anomalySink;
        private StatusPublisher statusPublisher = StatusPublisher.NO_OP;
        private ModelLifecycleManager modelManager;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder logSource(LogSource logSource) {
            this.logSource = logSource;
            return this;
        }

        public Builder anomalySink(AnomalySink anomalySink) {
            this.anomalySink = anomalySink;
            return this;
        }

        public Builder statusPublisher(StatusPublisher statusPublisher) {
            this.statusPublisher = statusPublisher;
            return this;
        }

        public Builder modelManager(ModelLifecycleManager modelManager) {
            this.modelManager = modelManager;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AgentContext build() {
            List<String> errors = new ArrayList<>();
            if (logSource == null)
                errors.add("logSource is required");
            if (anomalySink == null)
                errors.add("anomalySink is required");
            if (statusPublisher == null)
                errors.add("statusPublisher is required");
            if (clock == null)
                errors.add("clock is required");
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid agent context: " + String.join("; ", errors));
            }
            return new AgentContext(this);
        }
    }

    @Override
    public String toString() {
        return "AgentContext{logSource=" + logSource.getClass().getSimpleName()
                + ", anomalySink=" + anomalySink.getClass().getSimpleName()
                + ", modelManager=" + (modelManager != null ? Objects.toString(modelManager.getStoreRoot()) : "none")
                + '}';
    }
}
