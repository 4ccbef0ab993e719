package com.logsentinel.core.config;

import java.util.Locale;

/**
 * Detection strategy an agent is bound to, selected once at construction.
 *
 * @since 1.0.0
 */
public enum AgentStrategy {

    /** Rule thresholds only; no model dependency. */
    RULE("rule_based"),

    /** Deployed or pinned scoring artifact only. */
    ML("ml_based"),

    /** Model path with the rule path as secondary or fallback. */
    HYBRID("hybrid");

    private final String configName;

    AgentStrategy(String configName) {
        this.configName = configName;
    }

    /**
     * @return the {@code agentType} value used in configuration files
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Parse an {@code agentType} value. Accepts {@code rule_based},
     * {@code ml_based}, {@code hybrid} and the short forms {@code rule} and
     * {@code ml}, case-insensitively.
     *
     * @param value configuration value
     * @return the matching strategy
     * @throws ConfigException if the value is blank or unknown
     */
    public static AgentStrategy fromConfigName(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("agentType is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "rule_based", "rule" -> RULE;
            case "ml_based", "ml" -> ML;
            case "hybrid" -> HYBRID;
            default -> throw new ConfigException("Unknown agentType: '" + value
                    + "'. Supported: rule_based, ml_based, hybrid");
        };
    }
}
