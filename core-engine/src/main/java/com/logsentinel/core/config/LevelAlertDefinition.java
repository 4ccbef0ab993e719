package com.logsentinel.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code analysisRules.levelAlerts} block of an agent file.
 *
 * <pre>
 * levelAlerts:
 *   enabled: true
 *   confidence: 0.9
 *   escalationRules:
 *     dnsmasq_error: 3
 * </pre>
 *
 * @since 1.0.0
 */
public class LevelAlertDefinition {

    private Boolean enabled;
    private Double confidence;
    private Map<String, Integer> escalationRules = new LinkedHashMap<>();

    /**
     * @return immutable form; disabled unless {@code enabled} is set
     * @throws ConfigException if a value is out of range
     */
    public LevelAlertSpec toSpec() {
        return new LevelAlertSpec(Boolean.TRUE.equals(enabled),
                confidence != null ? confidence : LevelAlertSpec.DEFAULT_CONFIDENCE,
                escalationRules);
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public Map<String, Integer> getEscalationRules() {
        return escalationRules;
    }

    public void setEscalationRules(Map<String, Integer> escalationRules) {
        this.escalationRules = escalationRules != null ? new LinkedHashMap<>(escalationRules)
                : new LinkedHashMap<>();
    }
}
