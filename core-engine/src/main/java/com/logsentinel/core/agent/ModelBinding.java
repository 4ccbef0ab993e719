package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.lifecycle.DeployedModel;
import com.logsentinel.core.lifecycle.ModelLifecycleManager;
import com.logsentinel.core.scoring.ModelLoadException;
import com.logsentinel.core.scoring.ScoringArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves and holds the scoring artifact of a model-backed agent.
 *
 * <p>
 * A pinned {@code modelPath} is loaded once per {@link #refresh()}; otherwise
 * the artifact deployed to the agent's slot is used and replaced on every
 * deployment to that slot. The current binding is an immutable
 * {@link Bound} read once per cycle.
 * </p>
 */
final class ModelBinding {

    private static final Logger LOG = LoggerFactory.getLogger(ModelBinding.class);

    /** An artifact with the version id recorded on model hits. */
    static final class Bound {
        private final String versionId;
        private final ScoringArtifact artifact;

        Bound(String versionId, ScoringArtifact artifact) {
            this.versionId = versionId;
            this.artifact = Objects.requireNonNull(artifact, "artifact must not be null");
        }

        String getVersionId() {
            return versionId;
        }

        ScoringArtifact getArtifact() {
            return artifact;
        }
    }

    private final AgentConfig config;
    private final ModelLifecycleManager manager;
    private volatile Bound current;

    ModelBinding(AgentConfig config, ModelLifecycleManager manager) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.manager = Objects.requireNonNull(manager,
                "agent '" + config.getId() + "' needs a model lifecycle manager");
    }

    ModelLifecycleManager getManager() {
        return manager;
    }

    /**
     * Re-resolve the artifact.
     *
     * @return {@code true} if a usable artifact is bound
     */
    boolean refresh() {
        current = resolve().orElse(null);
        return current != null;
    }

    /**
     * Take a newly deployed artifact if it belongs to this agent's slot.
     *
     * @return {@code true} if the binding changed
     */
    boolean accept(DeployedModel deployed) {
        if (isPinned() || !deployed.getSlot().equals(config.getModelSlot())) {
            return false;
        }
        current = new Bound(deployed.getVersionId(), deployed.getArtifact());
        return true;
    }

    /** May be {@code null}. */
    Bound current() {
        return current;
    }

    String currentVersion() {
        Bound b = current;
        return b != null ? b.getVersionId() : null;
    }

    boolean isPinned() {
        return config.getModelPath() != null;
    }

    private Optional<Bound> resolve() {
        if (!isPinned()) {
            return manager.getDeployed(config.getModelSlot())
                    .map(d -> new Bound(d.getVersionId(), d.getArtifact()));
        }
        try {
            Path path = Path.of(config.getModelPath());
            return Optional.of(new Bound(pinnedVersionId(path), manager.loadArtifact(path)));
        } catch (ModelLoadException | InvalidPathException e) {
            LOG.warn("Agent [{}] cannot load pinned model {}: {}", config.getId(), config.getModelPath(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    /** Bundle directory name, or the directory holding a pinned artifact file. */
    private static String pinnedVersionId(Path path) {
        Path dir = Files.isDirectory(path) ? path : path.toAbsolutePath().getParent();
        Path name = dir != null ? dir.getFileName() : null;
        return name != null ? name.toString() : path.toString();
    }
}
