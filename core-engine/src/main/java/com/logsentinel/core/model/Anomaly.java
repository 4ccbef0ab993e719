package com.logsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Anomaly record emitted when a detection path fires for an entity.
 *
 * <p>
 * Created by the classifier and handed to the anomaly sink; the core does
 * not keep a reference afterwards. Serialized to JSON by the service
 * module's sink.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. It requires {@code timestamp}, {@code entityId},
 * {@code anomalyType} and {@code sourceAgentId}, and rejects a severity
 * outside {@code [1, 5]} or a confidence outside {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public class Anomaly {

    /** Lowest severity rank. */
    public static final int MIN_SEVERITY = 1;

    /** Highest severity rank. */
    public static final int MAX_SEVERITY = 5;

    /** Detection method value for rule-path anomalies. */
    public static final String METHOD_RULE = "rule";

    /** Detection method value for model-path anomalies. */
    public static final String METHOD_MODEL = "model";

    private Instant timestamp;
    private String entityId;
    private String anomalyType;
    private int severity;
    private double confidence;
    private String description;
    private Map<String, Double> features;
    private String sourceAgentId;
    private String detectionMethod;
    private String modelVersion;

    /** No-arg constructor required by Jackson. */
    public Anomaly() {
    }

    private Anomaly(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId must not be null");
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.sourceAgentId = Objects.requireNonNull(builder.sourceAgentId, "sourceAgentId must not be null");
        if (builder.severity < MIN_SEVERITY || builder.severity > MAX_SEVERITY) {
            throw new IllegalArgumentException(
                    "severity must be in [" + MIN_SEVERITY + ", " + MAX_SEVERITY + "], got: " + builder.severity);
        }
        if (!(builder.confidence >= 0.0 && builder.confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.severity = builder.severity;
        this.confidence = builder.confidence;
        this.description = builder.description;
        this.features = builder.features != null
                ? new LinkedHashMap<>(builder.features)
                : new LinkedHashMap<>();
        this.detectionMethod = builder.detectionMethod;
        this.modelVersion = builder.modelVersion;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private String entityId;
        private String anomalyType;
        private int severity = MIN_SEVERITY;
        private double confidence;
        private String description;
        private Map<String, Double> features;
        private String sourceAgentId;
        private String detectionMethod = METHOD_RULE;
        private String modelVersion;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder anomalyType(String anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder severity(int severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder features(Map<String, Double> features) {
            this.features = features;
            return this;
        }

        public Builder sourceAgentId(String sourceAgentId) {
            this.sourceAgentId = sourceAgentId;
            return this;
        }

        public Builder detectionMethod(String detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if severity or confidence is out of
         *                                  range
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(String anomalyType) {
        this.anomalyType = anomalyType;
    }

    public int getSeverity() {
        return severity;
    }

    public void setSeverity(int severity) {
        this.severity = severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * @return unmodifiable snapshot of the features behind this anomaly
     */
    public Map<String, Double> getFeatures() {
        return features != null ? Collections.unmodifiableMap(features) : Collections.emptyMap();
    }

    public void setFeatures(Map<String, Double> features) {
        this.features = features != null ? new LinkedHashMap<>(features) : null;
    }

    public String getSourceAgentId() {
        return sourceAgentId;
    }

    public void setSourceAgentId(String sourceAgentId) {
        this.sourceAgentId = sourceAgentId;
    }

    public String getDetectionMethod() {
        return detectionMethod;
    }

    public void setDetectionMethod(String detectionMethod) {
        this.detectionMethod = detectionMethod;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return severity == that.severity
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(entityId, that.entityId)
                && Objects.equals(anomalyType, that.anomalyType)
                && Objects.equals(description, that.description)
                && Objects.equals(features, that.features)
                && Objects.equals(sourceAgentId, that.sourceAgentId)
                && Objects.equals(detectionMethod, that.detectionMethod)
                && Objects.equals(modelVersion, that.modelVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, entityId, anomalyType, severity, confidence, sourceAgentId,
                detectionMethod);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "entityId='" + entityId + '\'' +
                ", type='" + anomalyType + '\'' +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", method='" + detectionMethod + '\'' +
                ", agent='" + sourceAgentId + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
