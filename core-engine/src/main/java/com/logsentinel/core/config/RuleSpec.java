package com.logsentinel.core.config;

import java.util.Objects;

/**
 * One entry of the rule table: a feature threshold and how a hit on it is
 * typed and ranked.
 *
 * <p>
 * A rule fires when the feature value is strictly greater than
 * {@code threshold}. Severity is {@code floor(value / divisor)} clamped to
 * {@code [1, 5]}; confidence is the fixed per-rule constant.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSpec {

    private final String featureName;
    private final double threshold;
    private final double divisor;
    private final String anomalyType;
    private final double confidence;
    private final String description;

    /**
     * @throws ConfigException if any field is missing or out of range
     */
    public RuleSpec(String featureName, double threshold, double divisor, String anomalyType,
            double confidence, String description) {
        if (featureName == null || featureName.isBlank()) {
            throw new ConfigException("Rule featureName is required");
        }
        if (anomalyType == null || anomalyType.isBlank()) {
            throw new ConfigException("Rule '" + featureName + "' requires 'anomalyType'");
        }
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new ConfigException("Rule '" + featureName + "' requires 'threshold' >= 0");
        }
        if (!(divisor > 0)) {
            throw new ConfigException("Rule '" + featureName + "' requires 'divisor' > 0");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ConfigException("Rule '" + featureName + "' requires 'confidence' in [0, 1]");
        }
        this.featureName = featureName;
        this.threshold = threshold;
        this.divisor = divisor;
        this.anomalyType = anomalyType;
        this.confidence = confidence;
        this.description = description != null ? description : anomalyType.replace('_', ' ');
    }

    public String getFeatureName() {
        return featureName;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getDivisor() {
        return divisor;
    }

    public String getAnomalyType() {
        return anomalyType;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return copy of this rule with a different threshold
     */
    public RuleSpec withThreshold(double newThreshold) {
        return new RuleSpec(featureName, newThreshold, divisor, anomalyType, confidence, description);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleSpec that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && Double.compare(divisor, that.divisor) == 0
                && Double.compare(confidence, that.confidence) == 0
                && featureName.equals(that.featureName)
                && anomalyType.equals(that.anomalyType)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(featureName, threshold, divisor, anomalyType, confidence);
    }

    @Override
    public String toString() {
        return "RuleSpec{" +
                "feature='" + featureName + '\'' +
                ", threshold=" + threshold +
                ", divisor=" + divisor +
                ", type='" + anomalyType + '\'' +
                ", confidence=" + confidence +
                '}';
    }
}
