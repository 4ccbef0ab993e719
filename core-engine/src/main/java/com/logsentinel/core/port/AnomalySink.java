package com.logsentinel.core.port;

import com.logsentinel.core.model.Anomaly;

import java.io.IOException;

/**
 * Persistence collaborator that takes ownership of detected anomalies.
 *
 * <p>
 * Failures propagate to the calling analysis cycle, which records them as a
 * cycle error. The core does not retry.
 * </p>
 */
@FunctionalInterface
public interface AnomalySink {

    /**
     * @param anomaly the anomaly to persist; never {@code null}
     * @throws IOException if the anomaly could not be stored
     */
    void persistAnomaly(Anomaly anomaly) throws IOException;
}
