package com.logsentinel.core.detection;

import com.logsentinel.core.config.RuleSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable set of rules, at most one per feature.
 *
 * @since 1.0.0
 */
public final class RuleTable {

    private static final RuleTable DEFAULTS = new RuleTable(DetectionDefaults.RULES);

    private final Map<String, RuleSpec> byFeature;

    public RuleTable(List<RuleSpec> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        Map<String, RuleSpec> map = new LinkedHashMap<>();
        for (RuleSpec rule : rules) {
            Objects.requireNonNull(rule, "rule must not be null");
            if (map.putIfAbsent(rule.getFeatureName(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for feature '" + rule.getFeatureName() + "'");
            }
        }
        this.byFeature = Collections.unmodifiableMap(map);
    }

    /**
     * @return the default rule table
     */
    public static RuleTable defaults() {
        return DEFAULTS;
    }

    /**
     * Layer per-agent overrides over this table. An override replaces the
     * rule for the same feature in place; overrides for new features are
     * appended.
     *
     * @param overrides feature name to rule
     * @return a new table
     */
    public RuleTable withOverrides(Map<String, RuleSpec> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        if (overrides.isEmpty()) {
            return this;
        }
        Map<String, RuleSpec> merged = new LinkedHashMap<>(byFeature);
        merged.putAll(overrides);
        return new RuleTable(new ArrayList<>(merged.values()));
    }

    public List<RuleSpec> getRules() {
        return List.copyOf(byFeature.values());
    }

    public Optional<RuleSpec> forFeature(String featureName) {
        return Optional.ofNullable(byFeature.get(featureName));
    }

    public int size() {
        return byFeature.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleTable that))
            return false;
        return byFeature.equals(that.byFeature);
    }

    @Override
    public int hashCode() {
        return byFeature.hashCode();
    }

    @Override
    public String toString() {
        return "RuleTable" + byFeature.values();
    }
}
