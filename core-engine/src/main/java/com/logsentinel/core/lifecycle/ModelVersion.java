package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry entry for one imported model bundle.
 *
 * <p>
 * Immutable: every status change produces a new instance through
 * {@link #transition(ModelStatus, Instant, String)}, which also appends to
 * the transition history. Readers can therefore hold on to a version
 * returned by {@code listVersions()} without seeing it change.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelVersion {

    private final String versionId;
    private final String slot;
    private final String artifactPath;
    private final Instant createdAt;
    private final ModelStatus status;
    private final ValidationReport validation;
    private final Map<String, Double> metricsSnapshot;
    private final List<StatusTransition> history;

    @JsonCreator
    public ModelVersion(@JsonProperty("versionId") String versionId,
            @JsonProperty("slot") String slot,
            @JsonProperty("artifactPath") String artifactPath,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("status") ModelStatus status,
            @JsonProperty("validation") ValidationReport validation,
            @JsonProperty("metricsSnapshot") Map<String, Double> metricsSnapshot,
            @JsonProperty("history") List<StatusTransition> history) {
        this.versionId = Objects.requireNonNull(versionId, "versionId must not be null");
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
        this.artifactPath = Objects.requireNonNull(artifactPath, "artifactPath must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.validation = validation;
        this.metricsSnapshot = metricsSnapshot != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metricsSnapshot))
                : Collections.emptyMap();
        this.history = history != null ? List.copyOf(history) : List.of();
    }

    /**
     * @return copy in status {@code to}, with the transition appended to the
     *         history
     */
    public ModelVersion transition(ModelStatus to, Instant at, String note) {
        List<StatusTransition> next = new ArrayList<>(history);
        next.add(new StatusTransition(status, to, at, note));
        return new ModelVersion(versionId, slot, artifactPath, createdAt, to, validation, metricsSnapshot, next);
    }

    /**
     * @return copy carrying a new validation report
     */
    public ModelVersion withValidation(ValidationReport report) {
        return new ModelVersion(versionId, slot, artifactPath, createdAt, status, report, metricsSnapshot, history);
    }

    public String getVersionId() {
        return versionId;
    }

    /** Logical deployment target; at most one version per slot is deployed. */
    public String getSlot() {
        return slot;
    }

    /** Bundle directory inside the managed store. */
    public String getArtifactPath() {
        return artifactPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ModelStatus getStatus() {
        return status;
    }

    /** Latest validation report; {@code null} if the version was never validated. */
    public ValidationReport getValidation() {
        return validation;
    }

    public Map<String, Double> getMetricsSnapshot() {
        return metricsSnapshot;
    }

    public List<StatusTransition> getHistory() {
        return history;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelVersion that))
            return false;
        return versionId.equals(that.versionId)
                && slot.equals(that.slot)
                && artifactPath.equals(that.artifactPath)
                && createdAt.equals(that.createdAt)
                && status == that.status
                && Objects.equals(validation, that.validation)
                && metricsSnapshot.equals(that.metricsSnapshot)
                && history.equals(that.history);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versionId, slot, status, createdAt);
    }

    @Override
    public String toString() {
        return "ModelVersion{" +
                "versionId='" + versionId + '\'' +
                ", slot='" + slot + '\'' +
                ", status=" + status.getValue() +
                ", createdAt=" + createdAt +
                '}';
    }
}
