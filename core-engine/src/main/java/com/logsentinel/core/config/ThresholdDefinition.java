package com.logsentinel.core.config;

/**
 * Per-feature threshold override as written under
 * {@code analysisRules.thresholds} in an agent file.
 *
 * <p>
 * Every field is optional when the feature has a default rule; missing
 * fields inherit the default. Features without a default rule must supply
 * {@code threshold}, {@code anomalyType} and {@code confidence}.
 * </p>
 *
 * <pre>
 * thresholds:
 *   authFailures:
 *     threshold: 8
 *     divisor: 3
 * </pre>
 *
 * @since 1.0.0
 */
public class ThresholdDefinition {

    private Double threshold;
    private Double divisor;
    private String anomalyType;
    private Double confidence;
    private String description;

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Double getDivisor() {
        return divisor;
    }

    public void setDivisor(Double divisor) {
        this.divisor = divisor;
    }

    public String getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(String anomalyType) {
        this.anomalyType = anomalyType;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return "ThresholdDefinition{threshold=" + threshold + ", divisor=" + divisor
                + ", anomalyType='" + anomalyType + "', confidence=" + confidence + '}';
    }
}
