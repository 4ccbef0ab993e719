package com.logsentinel.core.port;

import com.logsentinel.core.model.StatusRecord;

/**
 * Write-only view of the external key-value status store.
 *
 * <p>
 * Agents publish under {@code agent:<agentId>:status}, the model lifecycle
 * manager under {@code model:<versionId>:status}. Implementations may throw
 * unchecked exceptions; callers log them and carry on.
 * </p>
 */
@FunctionalInterface
public interface StatusPublisher {

    /** Publisher that discards every record. */
    StatusPublisher NO_OP = (key, record) -> {
    };

    /**
     * @param key    store key
     * @param record the status snapshot
     */
    void publish(String key, StatusRecord record);

    static String agentKey(String agentId) {
        return "agent:" + agentId + ":status";
    }

    static String modelKey(String versionId) {
        return "model:" + versionId + ":status";
    }
}
