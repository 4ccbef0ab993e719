package com.logsentinel.core.agent;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an agent's runtime state.
 *
 * @since 1.0.0
 */
public final class AgentRuntimeState {

    private final AgentStatus status;
    private final Instant lastRunAt;
    private final String lastError;
    private final String reason;

    public AgentRuntimeState(AgentStatus status, Instant lastRunAt, String lastError, String reason) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.lastRunAt = lastRunAt;
        this.lastError = lastError;
        this.reason = reason;
    }

    public static AgentRuntimeState initial() {
        return new AgentRuntimeState(AgentStatus.INITIALIZED, null, null, null);
    }

    /** Same run history, new status and reason. */
    public AgentRuntimeState withStatus(AgentStatus newStatus, String newReason) {
        return new AgentRuntimeState(newStatus, lastRunAt, lastError, newReason);
    }

    public AgentStatus getStatus() {
        return status;
    }

    /** Start of the last completed or failed cycle; {@code null} if never run. */
    public Instant getLastRunAt() {
        return lastRunAt;
    }

    /** Message of the last cycle failure; cleared by a successful cycle. */
    public String getLastError() {
        return lastError;
    }

    /** Why the agent is inactive, when it is. */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AgentRuntimeState that))
            return false;
        return status == that.status
                && Objects.equals(lastRunAt, that.lastRunAt)
                && Objects.equals(lastError, that.lastError)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, lastRunAt, lastError, reason);
    }

    @Override
    public String toString() {
        return "AgentRuntimeState{status=" + status.getValue()
                + ", lastRunAt=" + lastRunAt
                + ", lastError='" + lastError + '\''
                + ", reason='" + reason + '\'' + '}';
    }
}
