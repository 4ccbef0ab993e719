package com.logsentinel.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-entry level alerting: every log entry at one of the agent's target
 * levels is reported on its own as {@code <level>_log_detected}.
 *
 * <p>
 * Off by default. Severity comes from the agent's severity mapping keyed by
 * level. An escalation rule keyed {@code <program>_<level>} raises severity
 * by one, capped at 5, once that many matching entries are seen in a cycle.
 * </p>
 *
 * @since 1.0.0
 */
public final class LevelAlertSpec {

    public static final double DEFAULT_CONFIDENCE = 1.0;

    private static final LevelAlertSpec DISABLED = new LevelAlertSpec(false, DEFAULT_CONFIDENCE, Map.of());

    private final boolean enabled;
    private final double confidence;
    private final Map<String, Integer> escalationRules;

    /**
     * @param enabled         whether the agent reports individual entries
     * @param confidence      fixed confidence of every level alert
     * @param escalationRules {@code <program>_<level>} to the entry count that
     *                        triggers escalation
     * @throws ConfigException if confidence or an escalation count is out of
     *                         range
     */
    public LevelAlertSpec(boolean enabled, double confidence, Map<String, Integer> escalationRules) {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ConfigException("levelAlerts 'confidence' must be in [0, 1]");
        }
        Map<String, Integer> escalation = new LinkedHashMap<>();
        if (escalationRules != null) {
            escalationRules.forEach((key, count) -> {
                if (key == null || key.isBlank()) {
                    throw new ConfigException("levelAlerts escalation keys must not be blank");
                }
                if (count == null || count < 1) {
                    throw new ConfigException("levelAlerts escalation count for '" + key + "' must be >= 1");
                }
                escalation.put(key.toLowerCase(Locale.ROOT), count);
            });
        }
        this.enabled = enabled;
        this.confidence = confidence;
        this.escalationRules = Collections.unmodifiableMap(escalation);
    }

    public static LevelAlertSpec disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getConfidence() {
        return confidence;
    }

    /** Lower-case {@code <program>_<level>} to minimum entries per cycle. */
    public Map<String, Integer> getEscalationRules() {
        return escalationRules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LevelAlertSpec that))
            return false;
        return enabled == that.enabled
                && Double.compare(confidence, that.confidence) == 0
                && escalationRules.equals(that.escalationRules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, confidence, escalationRules);
    }

    @Override
    public String toString() {
        return "LevelAlertSpec{enabled=" + enabled + ", confidence=" + confidence
                + ", escalationRules=" + escalationRules + '}';
    }
}
