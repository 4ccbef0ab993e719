package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.detection.AnomalyClassifier;
import com.logsentinel.core.lifecycle.DeployedModel;
import com.logsentinel.core.lifecycle.ModelDeploymentListener;
import com.logsentinel.core.lifecycle.ModelUnavailableException;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Agent scoring with a deployed (or pinned) model.
 *
 * <p>
 * Without a loadable model the agent does not fail: it sits
 * {@code inactive} with reason {@value #NO_MODEL_REASON}. A deployment to the
 * agent's slot reactivates a started agent.
 * </p>
 *
 * @since 1.0.0
 */
public class MlAgent implements Agent, ModelDeploymentListener {

    private static final Logger LOG = LoggerFactory.getLogger(MlAgent.class);

    public static final String NO_MODEL_REASON = "no valid model loaded";

    private final AgentConfig config;
    private final AnomalyClassifier classifier;
    private final CycleRunner runner;
    private final ModelBinding binding;

    public MlAgent(AgentConfig config, AgentContext context) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = AnomalyClassifier.forConfig(config);
        this.runner = new CycleRunner(config, context);
        this.binding = new ModelBinding(config, context.getModelManager());
        if (!binding.refresh()) {
            runner.deactivate(NO_MODEL_REASON, null);
        }
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public void start() {
        binding.getManager().addDeploymentListener(this);
        if (binding.refresh()) {
            runner.activate(binding.currentVersion());
            LOG.info("Agent [{}] started with model {}", config.getId(), binding.currentVersion());
        } else {
            runner.park(NO_MODEL_REASON, null);
            LOG.warn("Agent [{}] started without a model; waiting for a deployment to slot '{}'",
                    config.getId(), config.getModelSlot());
        }
    }

    @Override
    public void stop() {
        binding.getManager().removeDeploymentListener(this);
        runner.stop(binding.currentVersion());
    }

    @Override
    public boolean runAnalysisCycle() {
        ModelBinding.Bound model = binding.current();
        return runner.run(new CycleRunner.Detection() {
            @Override
            public void checkReady() {
                if (model == null) {
                    throw new ModelUnavailableException(NO_MODEL_REASON);
                }
            }

            @Override
            public List<Anomaly> detect(List<LogEntry> logs, Collection<FeatureVector> vectors) {
                List<Anomaly> out = new ArrayList<>();
                for (FeatureVector vector : vectors) {
                    out.addAll(classifier.classifyModel(vector, model.getArtifact(), model.getVersionId()));
                }
                return out;
            }
        }, () -> model != null ? model.getVersionId() : null);
    }

    @Override
    public void onModelDeployed(DeployedModel model) {
        if (!binding.accept(model)) {
            return;
        }
        if (runner.getState().getStatus() == AgentStatus.INACTIVE && !runner.isStopRequested()) {
            runner.activate(model.getVersionId());
            LOG.info("Agent [{}] reactivated by deployment of {}", config.getId(), model.getVersionId());
        } else {
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
        return "MlAgent{" + config.getId() + ", " + runner.getState().getStatus().getValue()
                + ", model=" + binding.currentVersion() + '}';
    }
}
