package com.logsentinel.core.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Legacy dictionary model: a table of per-feature thresholds with no
 * predict capability. It loads so that old bundles can be imported and
 * inspected, but validation rejects it for deployment.
 *
 * @since 1.0.0
 */
public final class ThresholdTableArtifact implements ScoringArtifact {

    public static final String FORMAT = "threshold_table";

    private final Map<String, Double> thresholds;

    public ThresholdTableArtifact(Map<String, Double> thresholds) {
        this.thresholds = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(thresholds, "thresholds must not be null")));
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public List<String> getFeatureNames() {
        return List.copyOf(thresholds.keySet());
    }

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    @Override
    public String toString() {
        return "ThresholdTableArtifact{thresholds=" + thresholds + '}';
    }
}
