package com.logsentinel.core.features;

import com.logsentinel.core.model.LogEntry;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fallback features for entities whose entries match no known shape.
 *
 * @since 1.0.0
 */
public final class GenericFeatureSet implements FeatureSet {

    public static final String SHAPE = "generic";

    private final Set<String> targetLevels;

    /**
     * @param targetLevels lower-case log levels counted as errors
     */
    public GenericFeatureSet(Set<String> targetLevels) {
        this.targetLevels = Set.copyOf(Objects.requireNonNull(targetLevels, "targetLevels must not be null"));
    }

    @Override
    public String getShape() {
        return SHAPE;
    }

    /** No markers: used only as the fallback. */
    @Override
    public List<String> getMarkerFields() {
        return List.of();
    }

    @Override
    public void contribute(List<LogEntry> entries, Map<String, Double> features) {
        int errors = 0;
        Set<String> processes = new HashSet<>();
        for (LogEntry entry : entries) {
            boolean isError = entry.getLevel()
                    .map(level -> targetLevels.contains(level.trim().toLowerCase(Locale.ROOT)))
                    .orElse(false);
            if (isError) {
                errors++;
            }
            entry.getProgram().ifPresent(processes::add);
        }
        int count = entries.size();
        features.put("entryCount", (double) count);
        features.put("errorCount", (double) errors);
        features.put("errorRate", count == 0 ? 0.0 : (double) errors / count);
        features.put("distinctProcessCount", (double) processes.size());
    }
}
