package com.logsentinel.core.agent;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.detection.AnomalyClassifier;
import com.logsentinel.core.detection.LevelAlertDetector;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.LogEntry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Agent running only the rule path of the classifier, plus per-entry level
 * alerts when the agent enables them. Has no model dependency.
 *
 * @since 1.0.0
 */
public class RuleAgent implements Agent {

    private final AgentConfig config;
    private final AnomalyClassifier classifier;
    private final LevelAlertDetector levelAlerts;
    private final CycleRunner runner;
    private final Clock clock;

    public RuleAgent(AgentConfig config, AgentContext context) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = AnomalyClassifier.forConfig(config);
        this.levelAlerts = LevelAlertDetector.forConfig(config);
        this.runner = new CycleRunner(config, context);
        this.clock = context.getClock();
    }

    @Override
    public AgentConfig getConfig() {
        return config;
    }

    @Override
    public void start() {
        runner.activate(null);
    }

    @Override
    public void stop() {
        runner.stop(null);
    }

    @Override
    public boolean runAnalysisCycle() {
        return runner.run(this::detect, () -> null);
    }

    private List<Anomaly> detect(List<LogEntry> logs, Collection<FeatureVector> vectors) {
        List<Anomaly> out = new ArrayList<>();
        for (FeatureVector vector : vectors) {
            out.addAll(classifier.classifyRules(vector));
        }
        out.addAll(levelAlerts.detect(logs, clock.instant()));
        return out;
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
    public String toString() {
        return "RuleAgent{" + config.getId() + ", " + runner.getState().getStatus().getValue() + '}';
    }
}
