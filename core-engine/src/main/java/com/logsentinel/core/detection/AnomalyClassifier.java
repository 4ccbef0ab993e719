package com.logsentinel.core.detection;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.config.RuleSpec;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.scoring.AnomalyScoreModel;
import com.logsentinel.core.scoring.ProbabilityModel;
import com.logsentinel.core.scoring.ScoringArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a feature vector into typed, severity-ranked anomalies.
 *
 * <p>
 * Two paths run independently and their results are concatenated, rule
 * hits first. A rule hit and a model hit for the same entity are both
 * reported.
 * </p>
 *
 * <h3>Rule path</h3>
 * <p>
 * Every rule whose feature value is strictly above its threshold fires with
 * severity {@code floor(value / divisor)} clamped to {@code [1, 5]} and the
 * rule's fixed confidence.
 * </p>
 *
 * <h3>Model path</h3>
 * <p>
 * Probability artifacts flag inputs whose probability exceeds the configured
 * threshold. Anomaly-score artifacts flag negative decision values, with
 * confidence {@code 1 - exp(d)}. Artifacts supporting neither are skipped with
 * a warning. Model hits are labelled by the rule whose threshold the profile
 * exceeds by the largest ratio.
 * </p>
 *
 * <p>
 * Pure apart from logging: timestamps come from the vector's window end, so
 * identical inputs give identical output.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyClassifier.class);

    private final String agentId;
    private final RuleTable rules;
    private final Map<String, Integer> severityMap;
    private final double probabilityThreshold;
    private final Set<String> warnedFormats = ConcurrentHashMap.newKeySet();

    /**
     * @param agentId              recorded as the anomaly source
     * @param rules                rule table for the rule path and labelling
     * @param severityMap          anomaly type to fixed severity
     * @param probabilityThreshold cut-off for probability artifacts
     */
    public AnomalyClassifier(String agentId, RuleTable rules, Map<String, Integer> severityMap,
            double probabilityThreshold) {
        this.agentId = Objects.requireNonNull(agentId, "agentId must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.severityMap = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(severityMap, "severityMap must not be null")));
        if (!(probabilityThreshold >= 0.0 && probabilityThreshold <= 1.0)) {
            throw new IllegalArgumentException("probabilityThreshold must be in [0, 1], got: " + probabilityThreshold);
        }
        this.probabilityThreshold = probabilityThreshold;
    }

    /**
     * @param config agent configuration supplying id, rule overrides, severity
     *               map and probability threshold
     * @return classifier for the agent
     */
    public static AnomalyClassifier forConfig(AgentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new AnomalyClassifier(config.getId(), RuleTable.defaults().withOverrides(config.getRules()),
                config.getSeverityMap(), config.getProbabilityThreshold());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run both paths.
     *
     * @param vector   features of one entity
     * @param artifact scoring artifact, or {@code null} for rules only
     * @return rule hits followed by model hits
     */
    public List<Anomaly> classify(FeatureVector vector, ScoringArtifact artifact) {
        return classify(vector, artifact, null);
    }

    /**
     * Run both paths, tagging model hits with {@code modelVersion}.
     */
    public List<Anomaly> classify(FeatureVector vector, ScoringArtifact artifact, String modelVersion) {
        List<Anomaly> out = new ArrayList<>(classifyRules(vector));
        if (artifact != null) {
            out.addAll(classifyModel(vector, artifact, modelVersion));
        }
        return out;
    }

    /**
     * Rule path only.
     *
     * @param vector features of one entity
     * @return one anomaly per rule that fired, in rule-table order
     */
    public List<Anomaly> classifyRules(FeatureVector vector) {
        Objects.requireNonNull(vector, "vector must not be null");
        List<Anomaly> out = new ArrayList<>();
        for (RuleSpec rule : rules.getRules()) {
            Optional<Double> value = vector.get(rule.getFeatureName());
            if (value.isEmpty() || !(value.get() > rule.getThreshold())) {
                continue;
            }
            double v = value.get();
            LOG.debug("Agent [{}] rule {} fired for {}: {}={} > {}", agentId, rule.getAnomalyType(),
                    vector.getEntityId(), rule.getFeatureName(), v, rule.getThreshold());
            out.add(Anomaly.builder()
                    .timestamp(vector.getWindowEnd())
                    .entityId(vector.getEntityId())
                    .anomalyType(rule.getAnomalyType())
                    .severity(resolveSeverity(rule.getAnomalyType(), ruleSeverity(v, rule)))
                    .confidence(rule.getConfidence())
                    .description(String.format(Locale.ROOT, "%s: %s=%.2f (threshold: %.2f)",
                            rule.getDescription(), rule.getFeatureName(), v, rule.getThreshold()))
                    .features(vector.getFeatures())
                    .sourceAgentId(agentId)
                    .detectionMethod(Anomaly.METHOD_RULE)
                    .build());
        }
        return out;
    }

    /**
     * Model path only. Exceptions thrown by the artifact propagate.
     *
     * @param vector       features of one entity
     * @param artifact     scoring artifact; must not be {@code null}
     * @param modelVersion version id recorded on hits, may be {@code null}
     * @return at most one anomaly
     */
    public List<Anomaly> classifyModel(FeatureVector vector, ScoringArtifact artifact, String modelVersion) {
        Objects.requireNonNull(vector, "vector must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");

        double confidence;
        String detail;
        double[] input = artifact.toInput(vector);
        if (artifact instanceof ProbabilityModel probability) {
            double p = probability.predictProbability(input);
            if (!(p > probabilityThreshold)) {
                return List.of();
            }
            confidence = clamp(p);
            detail = String.format(Locale.ROOT, "probability %.3f > %.3f", p, probabilityThreshold);
        } else if (artifact instanceof AnomalyScoreModel scoreModel) {
            double d = scoreModel.decisionFunction(input);
            if (!(d < 0)) {
                return List.of();
            }
            confidence = clamp(1.0 - Math.exp(d));
            detail = String.format(Locale.ROOT, "decision score %.3f", d);
        } else {
            if (warnedFormats.add(artifact.getFormat())) {
                LOG.warn("Agent [{}]: artifact format '{}' exposes no predict capability; model path skipped",
                        agentId, artifact.getFormat());
            }
            return List.of();
        }

        Optional<RuleSpec> closest = closestRule(vector);
        String type;
        int severity;
        String label;
        if (closest.isPresent()) {
            RuleSpec rule = closest.get();
            type = rule.getAnomalyType();
            severity = ruleSeverity(vector.getOrZero(rule.getFeatureName()), rule);
            label = rule.getDescription();
        } else {
            type = DetectionDefaults.MODEL_ANOMALY;
            severity = clampSeverity((int) Math.ceil(confidence * 5));
            label = "Model-detected anomaly";
        }

        LOG.debug("Agent [{}] model flagged {} as {} ({})", agentId, vector.getEntityId(), type, detail);
        return List.of(Anomaly.builder()
                .timestamp(vector.getWindowEnd())
                .entityId(vector.getEntityId())
                .anomalyType(type)
                .severity(resolveSeverity(type, severity))
                .confidence(confidence)
                .description(label + " (" + artifact.getFormat() + " " + detail + ")")
                .features(vector.getFeatures())
                .sourceAgentId(agentId)
                .detectionMethod(Anomaly.METHOD_MODEL)
                .modelVersion(modelVersion)
                .build());
    }

    public RuleTable getRules() {
        return rules;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Rule with the largest positive value-to-threshold ratio; first wins ties. */
    Optional<RuleSpec> closestRule(FeatureVector vector) {
        RuleSpec best = null;
        double bestRatio = 0.0;
        for (RuleSpec rule : rules.getRules()) {
            Optional<Double> value = vector.get(rule.getFeatureName());
            if (value.isEmpty() || !(value.get() > 0) || !(rule.getThreshold() > 0)) {
                continue;
            }
            double ratio = value.get() / rule.getThreshold();
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = rule;
            }
        }
        return Optional.ofNullable(best);
    }

    private int resolveSeverity(String anomalyType, int computed) {
        Integer mapped = severityMap.get(anomalyType);
        return mapped != null ? clampSeverity(mapped) : computed;
    }

    static int ruleSeverity(double value, RuleSpec rule) {
        return clampSeverity((int) Math.floor(value / rule.getDivisor()));
    }

    static int clampSeverity(int severity) {
        return Math.max(Anomaly.MIN_SEVERITY, Math.min(Anomaly.MAX_SEVERITY, severity));
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
