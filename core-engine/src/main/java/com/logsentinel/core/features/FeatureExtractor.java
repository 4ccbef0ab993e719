package com.logsentinel.core.features;

import com.logsentinel.core.config.AgentConfig;
import com.logsentinel.core.model.FeatureVector;
import com.logsentinel.core.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Turns a raw log batch into one {@link FeatureVector} per entity.
 *
 * <p>
 * Deterministic and side-effect free: the same batch always yields the same
 * vectors, keyed and ordered by entity id. Every registered
 * {@link FeatureSet} whose marker fields occur in an entity's entries adds
 * its features; an entity matching no shape gets the generic set.
 * </p>
 *
 * <h3>Message filters</h3>
 * <p>
 * When include patterns are configured, entries whose message matches none
 * of them are dropped; entries matching any exclude pattern are always
 * dropped.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureExtractor.class);

    private final List<FeatureSet> shapeSets;
    private final FeatureSet fallback;
    private final List<Pattern> includePatterns;
    private final List<Pattern> excludePatterns;

    /**
     * @param shapeSets       shape-specific sets, tried in order
     * @param fallback        set used when no shape applies
     * @param includePatterns message allow-list; empty keeps every entry
     * @param excludePatterns message deny-list
     */
    public FeatureExtractor(List<FeatureSet> shapeSets, FeatureSet fallback,
            List<Pattern> includePatterns, List<Pattern> excludePatterns) {
        this.shapeSets = List.copyOf(Objects.requireNonNull(shapeSets, "shapeSets must not be null"));
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.includePatterns = List.copyOf(Objects.requireNonNull(includePatterns, "includePatterns must not be null"));
        this.excludePatterns = List.copyOf(Objects.requireNonNull(excludePatterns, "excludePatterns must not be null"));
    }

    /**
     * @return extractor with the built-in shapes, default target levels and
     *         no message filters
     */
    public static FeatureExtractor withDefaults() {
        return new FeatureExtractor(defaultShapes(),
                new GenericFeatureSet(new HashSet<>(AgentConfig.DEFAULT_TARGET_LEVELS)),
                List.of(), List.of());
    }

    /**
     * @param config agent configuration supplying target levels and message
     *               filters
     * @return extractor configured for one agent
     */
    public static FeatureExtractor forConfig(AgentConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new FeatureExtractor(defaultShapes(),
                new GenericFeatureSet(config.getTargetLevels()),
                config.getIncludePatterns(), config.getExcludePatterns());
    }

    private static List<FeatureSet> defaultShapes() {
        return List.of(new WifiFeatureSet(), new DnsFeatureSet(), new FirewallFeatureSet());
    }

    // ---------------------------------------------------------------
    // Extraction
    // ---------------------------------------------------------------

    /**
     * Extract features with window bounds taken from the entry timestamps.
     *
     * @param batch log entries; may be empty
     * @return entity id to feature vector, ordered by entity id; empty for an
     *         empty batch
     */
    public Map<String, FeatureVector> extract(List<LogEntry> batch) {
        return extract(batch, null, null);
    }

    /**
     * Extract features for an explicit observation window.
     *
     * @param batch       log entries; may be empty
     * @param windowStart window start, or {@code null} to derive from entries
     * @param windowEnd   window end, or {@code null} to derive from entries
     * @return entity id to feature vector, ordered by entity id
     */
    public Map<String, FeatureVector> extract(List<LogEntry> batch, Instant windowStart, Instant windowEnd) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (batch.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, List<LogEntry>> byEntity = new TreeMap<>();
        int dropped = 0;
        for (LogEntry entry : batch) {
            if (entry == null || !accepts(entry)) {
                dropped++;
                continue;
            }
            byEntity.computeIfAbsent(entry.getEntityId(), k -> new ArrayList<>()).add(entry);
        }
        if (dropped > 0) {
            LOG.debug("Dropped {} of {} entries by message filters", dropped, batch.size());
        }

        Map<String, FeatureVector> vectors = new LinkedHashMap<>();
        for (Map.Entry<String, List<LogEntry>> group : byEntity.entrySet()) {
            vectors.put(group.getKey(), vectorFor(group.getKey(), group.getValue(), windowStart, windowEnd));
        }
        LOG.debug("Extracted feature vectors for {} entities from {} entries", vectors.size(), batch.size());
        return Collections.unmodifiableMap(vectors);
    }

    private FeatureVector vectorFor(String entityId, List<LogEntry> entries, Instant windowStart, Instant windowEnd) {
        Map<String, Double> features = new LinkedHashMap<>();
        Set<String> shapes = new LinkedHashSet<>();
        for (FeatureSet set : shapeSets) {
            if (set.appliesTo(entries)) {
                set.contribute(entries, features);
                shapes.add(set.getShape());
            }
        }
        if (shapes.isEmpty()) {
            fallback.contribute(entries, features);
            shapes.add(fallback.getShape());
        }

        Instant start = windowStart;
        Instant end = windowEnd;
        if (start == null || end == null) {
            Instant min = null;
            Instant max = null;
            for (LogEntry entry : entries) {
                Instant ts = entry.getTimestamp();
                if (ts == null) {
                    continue;
                }
                min = min == null || ts.isBefore(min) ? ts : min;
                max = max == null || ts.isAfter(max) ? ts : max;
            }
            start = start != null ? start : (min != null ? min : Instant.EPOCH);
            end = end != null ? end : (max != null ? max : start);
        }
        return new FeatureVector(entityId, start, end, features, shapes);
    }

    /**
     * @param entry log entry; must not be {@code null}
     * @return whether the entry passes the include and exclude patterns
     */
    public boolean accepts(LogEntry entry) {
        String message = entry.getMessage();
        if (!includePatterns.isEmpty()) {
            boolean included = false;
            for (Pattern p : includePatterns) {
                if (p.matcher(message).find()) {
                    included = true;
                    break;
                }
            }
            if (!included) {
                return false;
            }
        }
        for (Pattern p : excludePatterns) {
            if (p.matcher(message).find()) {
                return false;
            }
        }
        return true;
    }
}
