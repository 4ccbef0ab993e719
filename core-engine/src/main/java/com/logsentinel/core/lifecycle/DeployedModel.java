package com.logsentinel.core.lifecycle;

import com.logsentinel.core.scoring.ScoringArtifact;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the artifact currently deployed to a slot. Agents
 * read one reference per cycle, so a concurrent deploy never shows them a
 * half-swapped model.
 *
 * @since 1.0.0
 */
public final class DeployedModel {

    private final String versionId;
    private final String slot;
    private final ScoringArtifact artifact;
    private final Instant deployedAt;

    public DeployedModel(String versionId, String slot, ScoringArtifact artifact, Instant deployedAt) {
        this.versionId = Objects.requireNonNull(versionId, "versionId must not be null");
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
        this.artifact = Objects.requireNonNull(artifact, "artifact must not be null");
        this.deployedAt = Objects.requireNonNull(deployedAt, "deployedAt must not be null");
    }

    public String getVersionId() {
        return versionId;
    }

    public String getSlot() {
        return slot;
    }

    public ScoringArtifact getArtifact() {
        return artifact;
    }

    public Instant getDeployedAt() {
        return deployedAt;
    }

    @Override
    public String toString() {
        return "DeployedModel{versionId='" + versionId + "', slot='" + slot + "', format="
                + artifact.getFormat() + ", deployedAt=" + deployedAt + '}';
    }
}
