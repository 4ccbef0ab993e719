package com.logsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable descriptor of one agent.
 *
 * <p>
 * Loaded once when the agent is created. Updating an agent means building a
 * new {@code AgentConfig} and handing it to
 * {@code AgentRegistry#replaceConfig}, which restarts the agent.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link Builder#build()} collects every problem and throws a single
 * {@link ConfigException}, so a misconfigured agent fails before it exists.
 * </p>
 *
 * @since 1.0.0
 */
public final class AgentConfig {

    public static final int DEFAULT_ANALYSIS_INTERVAL_SECONDS = 60;
    public static final int DEFAULT_LOOKBACK_MINUTES = 5;
    public static final double DEFAULT_PROBABILITY_THRESHOLD = 0.95;
    public static final String DEFAULT_MODEL_SLOT = "default";
    public static final List<String> DEFAULT_TARGET_LEVELS = List.of("error", "critical");

    private final String id;
    private final String displayName;
    private final String description;
    private final AgentStrategy strategy;
    private final Set<String> sourceFilters;
    private final List<String> capabilities;
    private final int analysisIntervalSeconds;
    private final int lookbackMinutes;
    private final Map<String, Integer> severityMap;
    private final Map<String, RuleSpec> rules;
    private final Set<String> targetLevels;
    private final List<Pattern> includePatterns;
    private final List<Pattern> excludePatterns;
    private final long alertCooldownSeconds;
    private final String modelPath;
    private final String modelSlot;
    private final double probabilityThreshold;
    private final boolean fallbackOnly;
    private final LevelAlertSpec levelAlerts;

    private AgentConfig(Builder b, List<Pattern> includes, List<Pattern> excludes) {
        this.id = b.id;
        this.displayName = b.displayName;
        this.description = b.description != null ? b.description : "";
        this.strategy = b.strategy;
        this.sourceFilters = Collections.unmodifiableSet(new LinkedHashSet<>(b.sourceFilters));
        this.capabilities = List.copyOf(b.capabilities);
        this.analysisIntervalSeconds = b.analysisIntervalSeconds;
        this.lookbackMinutes = b.lookbackMinutes;
        this.severityMap = Collections.unmodifiableMap(new LinkedHashMap<>(b.severityMap));
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(b.rules));
        Set<String> levels = new LinkedHashSet<>();
        for (String level : b.targetLevels) {
            levels.add(level.toLowerCase(Locale.ROOT));
        }
        this.targetLevels = Collections.unmodifiableSet(levels);
        this.includePatterns = List.copyOf(includes);
        this.excludePatterns = List.copyOf(excludes);
        this.alertCooldownSeconds = b.alertCooldownSeconds;
        this.modelPath = b.modelPath;
        this.modelSlot = b.modelSlot;
        this.probabilityThreshold = b.probabilityThreshold;
        this.fallbackOnly = b.fallbackOnly;
        this.levelAlerts = b.levelAlerts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .id(id)
                .displayName(displayName)
                .description(description)
                .strategy(strategy)
                .sourceFilters(sourceFilters)
                .capabilities(capabilities)
                .analysisIntervalSeconds(analysisIntervalSeconds)
                .lookbackMinutes(lookbackMinutes)
                .severityMap(severityMap)
                .rules(rules)
                .targetLevels(targetLevels)
                .alertCooldownSeconds(alertCooldownSeconds)
                .modelPath(modelPath)
                .modelSlot(modelSlot)
                .probabilityThreshold(probabilityThreshold)
                .fallbackOnly(fallbackOnly)
                .levelAlerts(levelAlerts);
        b.includePatterns(patternStrings(includePatterns));
        b.excludePatterns(patternStrings(excludePatterns));
        return b;
    }

    private static List<String> patternStrings(List<Pattern> patterns) {
        List<String> out = new ArrayList<>(patterns.size());
        for (Pattern p : patterns) {
            out.add(p.pattern());
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public AgentStrategy getStrategy() {
        return strategy;
    }

    /** Program names this agent reads; empty means every source. */
    public Set<String> getSourceFilters() {
        return sourceFilters;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public int getAnalysisIntervalSeconds() {
        return analysisIntervalSeconds;
    }

    public int getLookbackMinutes() {
        return lookbackMinutes;
    }

    /** Anomaly type to fixed severity; replaces the computed severity. */
    public Map<String, Integer> getSeverityMap() {
        return severityMap;
    }

    /** Per-feature rule overrides layered over the default rule table. */
    public Map<String, RuleSpec> getRules() {
        return rules;
    }

    /** Lower-case log levels counted as errors by the generic feature set. */
    public Set<String> getTargetLevels() {
        return targetLevels;
    }

    public List<Pattern> getIncludePatterns() {
        return includePatterns;
    }

    public List<Pattern> getExcludePatterns() {
        return excludePatterns;
    }

    /** Zero disables suppression of repeated alerts. */
    public long getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    /** Pinned model bundle or artifact path; {@code null} when unpinned. */
    public String getModelPath() {
        return modelPath;
    }

    public String getModelSlot() {
        return modelSlot;
    }

    public double getProbabilityThreshold() {
        return probabilityThreshold;
    }

    /**
     * Hybrid agents only: when {@code true} the rule path runs only if the
     * model path is unavailable or fails.
     */
    public boolean isFallbackOnly() {
        return fallbackOnly;
    }

    /** Per-entry alerts for target-level logs; disabled unless configured. */
    public LevelAlertSpec getLevelAlerts() {
        return levelAlerts;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AgentConfig that))
            return false;
        return analysisIntervalSeconds == that.analysisIntervalSeconds
                && lookbackMinutes == that.lookbackMinutes
                && alertCooldownSeconds == that.alertCooldownSeconds
                && Double.compare(probabilityThreshold, that.probabilityThreshold) == 0
                && fallbackOnly == that.fallbackOnly
                && levelAlerts.equals(that.levelAlerts)
                && id.equals(that.id)
                && displayName.equals(that.displayName)
                && description.equals(that.description)
                && strategy == that.strategy
                && sourceFilters.equals(that.sourceFilters)
                && capabilities.equals(that.capabilities)
                && severityMap.equals(that.severityMap)
                && rules.equals(that.rules)
                && targetLevels.equals(that.targetLevels)
                && patternStrings(includePatterns).equals(patternStrings(that.includePatterns))
                && patternStrings(excludePatterns).equals(patternStrings(that.excludePatterns))
                && Objects.equals(modelPath, that.modelPath)
                && modelSlot.equals(that.modelSlot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, strategy, sourceFilters, analysisIntervalSeconds, lookbackMinutes, modelPath,
                modelSlot);
    }

    @Override
    public String toString() {
        return "AgentConfig{" +
                "id='" + id + '\'' +
                ", strategy=" + strategy +
                ", sourceFilters=" + sourceFilters +
                ", interval=" + analysisIntervalSeconds + "s" +
                ", lookback=" + lookbackMinutes + "m" +
                ", modelPath='" + modelPath + '\'' +
                ", modelSlot='" + modelSlot + '\'' +
                ", fallbackOnly=" + fallbackOnly +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AgentConfig}.
     */
    public static final class Builder {
        private String id;
        private String displayName;
        private String description;
        private AgentStrategy strategy;
        private Set<String> sourceFilters = new LinkedHashSet<>();
        private List<String> capabilities = new ArrayList<>();
        private int analysisIntervalSeconds = DEFAULT_ANALYSIS_INTERVAL_SECONDS;
        private int lookbackMinutes = DEFAULT_LOOKBACK_MINUTES;
        private Map<String, Integer> severityMap = new LinkedHashMap<>();
        private Map<String, RuleSpec> rules = new LinkedHashMap<>();
        private List<String> targetLevels = new ArrayList<>(DEFAULT_TARGET_LEVELS);
        private List<String> includePatterns = new ArrayList<>();
        private List<String> excludePatterns = new ArrayList<>();
        private long alertCooldownSeconds;
        private String modelPath;
        private String modelSlot = DEFAULT_MODEL_SLOT;
        private double probabilityThreshold = DEFAULT_PROBABILITY_THRESHOLD;
        private boolean fallbackOnly;
        private LevelAlertSpec levelAlerts = LevelAlertSpec.disabled();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder strategy(AgentStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder sourceFilters(Set<String> sourceFilters) {
            this.sourceFilters = sourceFilters != null ? new LinkedHashSet<>(sourceFilters) : new LinkedHashSet<>();
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities = capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>();
            return this;
        }

        public Builder analysisIntervalSeconds(int analysisIntervalSeconds) {
            this.analysisIntervalSeconds = analysisIntervalSeconds;
            return this;
        }

        public Builder lookbackMinutes(int lookbackMinutes) {
            this.lookbackMinutes = lookbackMinutes;
            return this;
        }

        public Builder severityMap(Map<String, Integer> severityMap) {
            this.severityMap = severityMap != null ? new LinkedHashMap<>(severityMap) : new LinkedHashMap<>();
            return this;
        }

        public Builder rules(Map<String, RuleSpec> rules) {
            this.rules = rules != null ? new LinkedHashMap<>(rules) : new LinkedHashMap<>();
            return this;
        }

        public Builder rule(RuleSpec rule) {
            Objects.requireNonNull(rule, "rule must not be null");
            this.rules.put(rule.getFeatureName(), rule);
            return this;
        }

        public Builder targetLevels(Iterable<String> targetLevels) {
            this.targetLevels = new ArrayList<>();
            if (targetLevels != null) {
                targetLevels.forEach(this.targetLevels::add);
            }
            return this;
        }

        public Builder includePatterns(List<String> includePatterns) {
            this.includePatterns = includePatterns != null ? new ArrayList<>(includePatterns) : new ArrayList<>();
            return this;
        }

        public Builder excludePatterns(List<String> excludePatterns) {
            this.excludePatterns = excludePatterns != null ? new ArrayList<>(excludePatterns) : new ArrayList<>();
            return this;
        }

        public Builder alertCooldownSeconds(long alertCooldownSeconds) {
            this.alertCooldownSeconds = alertCooldownSeconds;
            return this;
        }

        public Builder modelPath(String modelPath) {
            this.modelPath = modelPath != null && !modelPath.isBlank() ? modelPath : null;
            return this;
        }

        public Builder modelSlot(String modelSlot) {
            this.modelSlot = modelSlot;
            return this;
        }

        public Builder probabilityThreshold(double probabilityThreshold) {
            this.probabilityThreshold = probabilityThreshold;
            return this;
        }

        public Builder fallbackOnly(boolean fallbackOnly) {
            this.fallbackOnly = fallbackOnly;
            return this;
        }

        public Builder levelAlerts(LevelAlertSpec levelAlerts) {
            this.levelAlerts = levelAlerts != null ? levelAlerts : LevelAlertSpec.disabled();
            return this;
        }

        /**
         * Validate and build.
         *
         * @return immutable configuration
         * @throws ConfigException listing every invalid field
         */
        public AgentConfig build() {
            List<String> errors = new ArrayList<>();
            String label = id != null ? id : "<unnamed>";

            if (id == null || id.isBlank()) {
                errors.add("'agentId' is required");
            }
            if (displayName == null || displayName.isBlank()) {
                errors.add("'name' is required");
            }
            if (strategy == null) {
                errors.add("'agentType' is required");
            }
            if (analysisIntervalSeconds <= 0) {
                errors.add("'analysisIntervalSeconds' must be > 0");
            }
            if (lookbackMinutes <= 0) {
                errors.add("'lookbackMinutes' must be > 0");
            }
            if (alertCooldownSeconds < 0) {
                errors.add("'alertCooldownSeconds' must be >= 0");
            }
            if (!(probabilityThreshold >= 0.0 && probabilityThreshold <= 1.0)) {
                errors.add("'probabilityThreshold' must be in [0, 1]");
            }
            if (modelSlot == null || modelSlot.isBlank()) {
                errors.add("'modelSlot' must not be blank");
            }
            severityMap.forEach((type, severity) -> {
                if (severity == null || severity < 1 || severity > 5) {
                    errors.add("severityMapping for '" + type + "' must be in [1, 5]");
                }
            });
            rules.forEach((feature, rule) -> {
                if (rule == null) {
                    errors.add("rule for '" + feature + "' is null");
                } else if (!feature.equals(rule.getFeatureName())) {
                    errors.add("rule key '" + feature + "' does not match featureName '"
                            + rule.getFeatureName() + "'");
                }
            });
            for (String level : targetLevels) {
                if (level == null || level.isBlank()) {
                    errors.add("targetLevels must not contain blank entries");
                }
            }
            List<Pattern> includes = compile(includePatterns, "includePatterns", errors);
            List<Pattern> excludes = compile(excludePatterns, "excludePatterns", errors);

            if (!errors.isEmpty()) {
                throw new ConfigException(
                        "Invalid configuration for agent '" + label + "': " + String.join("; ", errors));
            }
            return new AgentConfig(this, includes, excludes);
        }

        private static List<Pattern> compile(List<String> patterns, String field, List<String> errors) {
            List<Pattern> compiled = new ArrayList<>(patterns.size());
            for (String p : patterns) {
                if (p == null) {
                    errors.add(field + " must not contain null entries");
                    continue;
                }
                try {
                    compiled.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException e) {
                    errors.add(field + " entry '" + p + "' is not a valid regex: " + e.getDescription());
                }
            }
            return compiled;
        }
    }
}
