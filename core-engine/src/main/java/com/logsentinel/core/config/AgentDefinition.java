package com.logsentinel.core.config;

import com.logsentinel.core.detection.DetectionDefaults;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One agent as written in a YAML or JSON agent file.
 *
 * <pre>
 * agentId: wifi-security
 * name: WiFi Security Agent
 * description: Watches hostapd for authentication attacks
 * agentType: rule_based
 * processFilters: [hostapd, wpa_supplicant]
 * analysisRules:
 *   lookbackMinutes: 5
 *   analysisIntervalSeconds: 60
 *   severityMapping:
 *     deauth_flood: 5
 *   thresholds:
 *     authFailures:
 *       threshold: 8
 *   levelAlerts:
 *     enabled: true
 * </pre>
 *
 * <p>
 * Call {@link #toConfig()} to validate and convert into an immutable
 * {@link AgentConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class AgentDefinition {

    private String agentId;
    private String name;
    private String description;
    private String agentType;
    private List<String> processFilters = new ArrayList<>();
    private List<String> capabilities = new ArrayList<>();
    private String modelPath;
    private String modelSlot;
    private AnalysisRules analysisRules;

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * Validate required fields, merge threshold overrides with the default
     * rule table and build the immutable configuration.
     *
     * @return validated configuration
     * @throws ConfigException if any field is missing or invalid
     */
    public AgentConfig toConfig() {
        List<String> errors = new ArrayList<>();
        String label = agentId != null ? agentId : "<unnamed>";

        if (description == null || description.isBlank()) {
            errors.add("'description' is required");
        }
        AgentStrategy strategy = null;
        try {
            strategy = AgentStrategy.fromConfigName(agentType);
        } catch (ConfigException e) {
            errors.add(e.getMessage());
        }

        AnalysisRules rules = analysisRules != null ? analysisRules : new AnalysisRules();
        List<RuleSpec> overrides = new ArrayList<>();
        for (Map.Entry<String, ThresholdDefinition> entry : rules.getThresholds().entrySet()) {
            try {
                toRule(entry.getKey(), entry.getValue()).ifPresent(overrides::add);
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        }

        LevelAlertSpec levelAlerts = LevelAlertSpec.disabled();
        if (rules.getLevelAlerts() != null) {
            try {
                levelAlerts = rules.getLevelAlerts().toSpec();
            } catch (ConfigException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Invalid configuration for agent '" + label + "': " + String.join("; ", errors));
        }

        AgentConfig.Builder builder = AgentConfig.builder()
                .id(agentId)
                .displayName(name)
                .description(description)
                .strategy(strategy)
                .sourceFilters(new LinkedHashSet<>(processFilters))
                .capabilities(capabilities)
                .modelPath(modelPath)
                .severityMap(rules.getSeverityMapping())
                .levelAlerts(levelAlerts);
        overrides.forEach(builder::rule);
        if (modelSlot != null) {
            builder.modelSlot(modelSlot);
        }
        if (rules.getLookbackMinutes() != null) {
            builder.lookbackMinutes(rules.getLookbackMinutes());
        }
        if (rules.getAnalysisIntervalSeconds() != null) {
            builder.analysisIntervalSeconds(rules.getAnalysisIntervalSeconds());
        }
        if (rules.getTargetLevels() != null) {
            builder.targetLevels(rules.getTargetLevels());
        }
        if (rules.getFeatureExtraction() != null) {
            builder.includePatterns(rules.getFeatureExtraction().getIncludePatterns());
            builder.excludePatterns(rules.getFeatureExtraction().getExcludePatterns());
        }
        if (rules.getAlertCooldownSeconds() != null) {
            builder.alertCooldownSeconds(rules.getAlertCooldownSeconds());
        }
        if (rules.getProbabilityThreshold() != null) {
            builder.probabilityThreshold(rules.getProbabilityThreshold());
        }
        if (rules.getFallbackOnly() != null) {
            builder.fallbackOnly(rules.getFallbackOnly());
        }
        return builder.build();
    }

    private static Optional<RuleSpec> toRule(String feature, ThresholdDefinition def) {
        if (def == null) {
            return Optional.empty();
        }
        RuleSpec base = DetectionDefaults.rule(feature).orElse(null);
        Double threshold = def.getThreshold() != null ? def.getThreshold()
                : base != null ? Double.valueOf(base.getThreshold()) : null;
        if (threshold == null) {
            throw new ConfigException("Threshold for '" + feature + "' requires 'threshold'");
        }
        double divisor = def.getDivisor() != null ? def.getDivisor()
                : base != null ? base.getDivisor() : Math.max(threshold / 2.0, 1.0);
        String type = def.getAnomalyType() != null ? def.getAnomalyType()
                : base != null ? base.getAnomalyType() : null;
        Double confidence = def.getConfidence() != null ? def.getConfidence()
                : base != null ? Double.valueOf(base.getConfidence()) : null;
        if (confidence == null) {
            throw new ConfigException("Threshold for '" + feature + "' requires 'confidence'");
        }
        String description = def.getDescription() != null ? def.getDescription()
                : base != null ? base.getDescription() : null;
        return Optional.of(new RuleSpec(feature, threshold, divisor, type, confidence, description));
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAgentType() {
        return agentType;
    }

    public void setAgentType(String agentType) {
        this.agentType = agentType;
    }

    public List<String> getProcessFilters() {
        return processFilters;
    }

    public void setProcessFilters(List<String> processFilters) {
        this.processFilters = processFilters != null ? new ArrayList<>(processFilters) : new ArrayList<>();
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>();
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public String getModelSlot() {
        return modelSlot;
    }

    public void setModelSlot(String modelSlot) {
        this.modelSlot = modelSlot;
    }

    public AnalysisRules getAnalysisRules() {
        return analysisRules;
    }

    public void setAnalysisRules(AnalysisRules analysisRules) {
        this.analysisRules = analysisRules;
    }

    @Override
    public String toString() {
        return "AgentDefinition{agentId='" + agentId + "', agentType='" + agentType + "'}";
    }
}
