package com.logsentinel.core.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code analysisRules} block of an agent file. All fields are
 * optional; {@code null} means "use the default".
 *
 * @since 1.0.0
 */
public class AnalysisRules {

    private Integer lookbackMinutes;
    private Integer analysisIntervalSeconds;
    private Map<String, Integer> severityMapping = new LinkedHashMap<>();
    private Map<String, ThresholdDefinition> thresholds = new LinkedHashMap<>();
    private List<String> targetLevels;
    private FeatureExtractionRules featureExtraction;
    private Integer alertCooldownSeconds;
    private Double probabilityThreshold;
    private Boolean fallbackOnly;
    private LevelAlertDefinition levelAlerts;

    public Integer getLookbackMinutes() {
        return lookbackMinutes;
    }

    public void setLookbackMinutes(Integer lookbackMinutes) {
        this.lookbackMinutes = lookbackMinutes;
    }

    public Integer getAnalysisIntervalSeconds() {
        return analysisIntervalSeconds;
    }

    public void setAnalysisIntervalSeconds(Integer analysisIntervalSeconds) {
        this.analysisIntervalSeconds = analysisIntervalSeconds;
    }

    public Map<String, Integer> getSeverityMapping() {
        return severityMapping;
    }

    public void setSeverityMapping(Map<String, Integer> severityMapping) {
        this.severityMapping = severityMapping != null ? new LinkedHashMap<>(severityMapping)
                : new LinkedHashMap<>();
    }

    public Map<String, ThresholdDefinition> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, ThresholdDefinition> thresholds) {
        this.thresholds = thresholds != null ? new LinkedHashMap<>(thresholds) : new LinkedHashMap<>();
    }

    public List<String> getTargetLevels() {
        return targetLevels;
    }

    public void setTargetLevels(List<String> targetLevels) {
        this.targetLevels = targetLevels;
    }

    public FeatureExtractionRules getFeatureExtraction() {
        return featureExtraction;
    }

    public void setFeatureExtraction(FeatureExtractionRules featureExtraction) {
        this.featureExtraction = featureExtraction;
    }

    public Integer getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    public void setAlertCooldownSeconds(Integer alertCooldownSeconds) {
        this.alertCooldownSeconds = alertCooldownSeconds;
    }

    public Double getProbabilityThreshold() {
        return probabilityThreshold;
    }

    public void setProbabilityThreshold(Double probabilityThreshold) {
        this.probabilityThreshold = probabilityThreshold;
    }

    public Boolean getFallbackOnly() {
        return fallbackOnly;
    }

    public void setFallbackOnly(Boolean fallbackOnly) {
        this.fallbackOnly = fallbackOnly;
    }

    public LevelAlertDefinition getLevelAlerts() {
        return levelAlerts;
    }

    public void setLevelAlerts(LevelAlertDefinition levelAlerts) {
        this.levelAlerts = levelAlerts;
    }
}
