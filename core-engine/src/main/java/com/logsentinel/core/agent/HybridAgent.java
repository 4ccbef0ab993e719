package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.detection.AnomalyClassifier;
import com.logsentinel.core.detection.LevelAlertDetector;
import com.logsentinel.core.lifecycle.DeployedModel;
import com.logsentinel.core.lifecycle.ModelDeploymentListener;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Agent combining the model path and the rule path.
 *
 * <h3>Paths per cycle</h3>
 * <ul>
 * <li>Model bound: the model path is primary. With {@code fallbackOnly=false}
 * the rule path also runs on every cycle; with {@code fallbackOnly=true} it
 * runs only when the model path fails.</li>
 * <li>No model: rules only. The agent stays {@code active}.</li>
 * </ul>
 * <p>
 * A model-path failure falls back to rules for that cycle without failing
 * it. Level alerts belong to the rule path. Results list rule hits before
 * model hits, the same order as {@link AnomalyClassifier#classify}.
 * </p>
 *
 * @since 1.0.0
 */
public class HybridAgent implements Agent, ModelDeploymentListener {

    private static final Logger LOG = LoggerFactory.getLogger(HybridAgent.class);

    private final AgentConfig config;
    private final AnomalyClassifier classifier;
    private final LevelAlertDetector levelAlerts;
    private final CycleRunner runner;
    private final ModelBinding binding;
    private final Clock clock;

    public HybridAgent(AgentConfig config, AgentContext context) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = AnomalyClassifier.forConfig(config);
        this.levelAlerts = LevelAlertDetector.forConfig(config);
        this.runner = new CycleRunner(config, context);
        this.clock = context.getClock();
        this.binding = new ModelBinding(config, context.getModelManager());
        binding.refresh();
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public void start() {
        binding.getManager().addDeploymentListener(this);
        if (!binding.refresh()) {
            LOG.info("Agent [{}] has no model yet; running rules only", config.getId());
        }
        runner.activate(binding.currentVersion());
    }

    @Override
    public void stop() {
        binding.getManager().removeDeploymentListener(this);
        runner.stop(binding.currentVersion());
    }

    @Override
    public boolean runAnalysisCycle() {
        ModelBinding.Bound model = binding.current();
        return runner.run((logs, vectors) -> detect(logs, vectors, model),
                () -> model != null ? model.getVersionId() : null);
    }

    List<Anomaly> detect(List<LogEntry> logs, Collection<FeatureVector> vectors, ModelBinding.Bound model) {
        List<Anomaly> modelHits = null;
        if (model != null) {
            try {
                List<Anomaly> hits = new ArrayList<>();
                for (FeatureVector vector : vectors) {
                    hits.addAll(classifier.classifyModel(vector, model.getArtifact(), model.getVersionId()));
                }
                modelHits = hits;
            } catch (RuntimeException e) {
                LOG.warn("Agent [{}] model path failed, falling back to rules: {}", config.getId(), e.getMessage());
            }
        }
        List<Anomaly> out = new ArrayList<>();
        if (modelHits == null || !config.isFallbackOnly()) {
            for (FeatureVector vector : vectors) {
                out.addAll(classifier.classifyRules(vector));
            }
            out.addAll(levelAlerts.detect(logs, clock.instant()));
        }
        if (modelHits != null) {
            out.addAll(modelHits);
        }
        return out;
    }

    @Override
    public void onModelDeployed(DeployedModel model) {
        if (binding.accept(model)) {
            LOG.info("Agent [{}] switched to model {}", config.getId(), model.getVersionId());
        }
    }

    @Override
    public AgentRuntimeState getState() {
        return runner.getState();
    }

    @Override
    public boolean isRunning() {
        return runner.isRunning();
    }

    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return runner.awaitIdle(timeout);
    }

    @Override
    public Optional<String> getModelVersion() {
        return Optional.ofNullable(binding.currentVersion());
    }

    @Override
    public String toString() {
        return "HybridAgent{" + config.getId() + ", " + runner.getState().getStatus().getValue()
                + ", model=" + binding.currentVersion() + ", fallbackOnly=" + config.isFallbackOnly() + '}';
    }
}
