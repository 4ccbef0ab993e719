package com.logsentinel.core.detection;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.config.LevelAlertSpec;
import com.logsentinel.core.features.FeatureExtractor;
import com.logsentinel.core.model.Anomaly;
import com.logsentinel.core.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Reports every log entry at a target level as its own anomaly of type
 * {@code <level>_log_detected}.
 *
 * <p>
 * Severity is the agent's severity mapping for the level, then the built-in
 * level severity, then {@value DetectionDefaults#DEFAULT_LEVEL_SEVERITY}.
 * An escalation rule for {@code <program>_<level>} adds one once the cycle
 * holds at least that many matching entries.
 * </p>
 *
 * @since 1.0.0
 */
public final class LevelAlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LevelAlertDetector.class);

    static final int MAX_MESSAGE_LENGTH = 200;

    private final String agentId;
    private final LevelAlertSpec spec;
    private final Set<String> targetLevels;
    private final Map<String, Integer> severityMap;
    private final Predicate<LogEntry> filter;

    /**
     * @param agentId      recorded as the anomaly source
     * @param spec         level alert settings
     * @param targetLevels lower-case levels that raise an alert
     * @param severityMap  level to severity
     * @param filter       message filter applied before level matching
     */
    public LevelAlertDetector(String agentId, LevelAlertSpec spec, Set<String> targetLevels,
            Map<String, Integer> severityMap, Predicate<LogEntry> filter) {
        this.agentId = Objects.requireNonNull(agentId, "agentId must not be null");
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.targetLevels = Set.copyOf(Objects.requireNonNull(targetLevels, "targetLevels must not be null"));
        this.severityMap = Map.copyOf(Objects.requireNonNull(severityMap, "severityMap must not be null"));
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public static LevelAlertDetector forConfig(AgentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new LevelAlertDetector(config.getId(), config.getLevelAlerts(), config.getTargetLevels(),
                config.getSeverityMap(), FeatureExtractor.forConfig(config)::accepts);
    }

    public boolean isEnabled() {
        return spec.isEnabled();
    }

    /**
     * @param logs      entries fetched for the cycle
     * @param windowEnd timestamp for entries that carry none
     * @return one anomaly per matching entry, in input order; empty when
     *         disabled
     */
    public List<Anomaly> detect(List<LogEntry> logs, Instant windowEnd) {
        Objects.requireNonNull(logs, "logs must not be null");
        if (!spec.isEnabled()) {
            return List.of();
        }
        List<LogEntry> matching = new ArrayList<>();
        Map<String, Integer> perKey = new HashMap<>();
        for (LogEntry entry : logs) {
            if (entry == null || !filter.test(entry)) {
                continue;
            }
            Optional<String> level = normalizedLevel(entry);
            if (level.isPresent() && targetLevels.contains(level.get())) {
                matching.add(entry);
                perKey.merge(escalationKey(entry, level.get()), 1, Integer::sum);
            }
        }

        List<Anomaly> out = new ArrayList<>(matching.size());
        for (LogEntry entry : matching) {
            String level = normalizedLevel(entry).orElseThrow();
            String key = escalationKey(entry, level);
            int count = perKey.get(key);
            Integer escalateAt = spec.getEscalationRules().get(key);
            boolean escalated = escalateAt != null && count >= escalateAt;
            int severity = baseSeverity(level);
            if (escalated) {
                severity = AnomalyClassifier.clampSeverity(severity + 1);
                LOG.debug("Agent [{}] escalated {} to severity {} ({} entries)", agentId, key, severity, count);
            }

            Map<String, Double> features = new LinkedHashMap<>();
            features.put("entryCount", (double) count);
            features.put("escalated", escalated ? 1.0 : 0.0);
            out.add(Anomaly.builder()
                    .timestamp(entry.getTimestamp() != null ? entry.getTimestamp() : windowEnd)
                    .entityId(entry.getEntityId())
                    .anomalyType(level + DetectionDefaults.LEVEL_ALERT_SUFFIX)
                    .severity(severity)
                    .confidence(spec.getConfidence())
                    .description(describe(entry, level))
                    .features(features)
                    .sourceAgentId(agentId)
                    .detectionMethod(Anomaly.METHOD_RULE)
                    .build());
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private int baseSeverity(String level) {
        Integer mapped = severityMap.get(level);
        if (mapped == null) {
            mapped = DetectionDefaults.LEVEL_SEVERITY.getOrDefault(level, DetectionDefaults.DEFAULT_LEVEL_SEVERITY);
        }
        return AnomalyClassifier.clampSeverity(mapped);
    }

    private static Optional<String> normalizedLevel(LogEntry entry) {
        return entry.getLevel()
                .map(level -> level.trim().toLowerCase(Locale.ROOT))
                .filter(level -> !level.isEmpty());
    }

    private static String escalationKey(LogEntry entry, String level) {
        return entry.getProgram().orElse(LogEntry.UNKNOWN_ENTITY).toLowerCase(Locale.ROOT) + '_' + level;
    }

    static String describe(LogEntry entry, String level) {
        String message = entry.getMessage();
        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        return level.toUpperCase(Locale.ROOT) + " log detected from "
                + entry.getProgram().orElse(LogEntry.UNKNOWN_ENTITY) + ": " + message;
    }
}
