package com.logsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Numeric features computed for one entity over one time window.
 *
 * <p>
 * Feature order is preserved: the extractor emits features in a stable order
 * so that two extractions of the same batch produce equal vectors, and
 * model input can be assembled deterministically.
 * </p>
 *
 * <p>
 * Vectors are transient. They are recomputed every analysis cycle and never
 * persisted on their own; anomalies carry a snapshot of the features that
 * explain them.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    private final String entityId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final Map<String, Double> features;
    private final Set<String> shapes;

    /**
     * @param entityId    entity (device or source) the features describe
     * @param windowStart start of the observation window
     * @param windowEnd   end of the observation window
     * @param features    ordered feature values (copied)
     * @param shapes      names of the log shapes that contributed (copied)
     * @throws NullPointerException if any argument is {@code null}
     */
    public FeatureVector(String entityId, Instant windowStart, Instant windowEnd,
            Map<String, Double> features, Set<String> shapes) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        this.features = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(features, "features must not be null")));
        this.shapes = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(shapes, "shapes must not be null")));
    }

    /**
     * Shortcut for tests and ad hoc scoring: a vector with a zero-length
     * window at {@code at}.
     */
    public static FeatureVector of(String entityId, Instant at, Map<String, Double> features) {
        return new FeatureVector(entityId, at, at, features, Set.of());
    }

    public String getEntityId() {
        return entityId;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    /**
     * @return unmodifiable, ordered feature map
     */
    public Map<String, Double> getFeatures() {
        return features;
    }

    public Set<String> getShapes() {
        return shapes;
    }

    public Optional<Double> get(String featureName) {
        return Optional.ofNullable(features.get(featureName));
    }

    /**
     * @return the feature value, or {@code 0.0} when the feature is absent
     */
    public double getOrZero(String featureName) {
        Double value = features.get(featureName);
        return value != null ? value : 0.0;
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return entityId.equals(that.entityId)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd)
                && features.equals(that.features)
                && shapes.equals(that.shapes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, windowStart, windowEnd, features, shapes);
    }

    @Override
    public String toString() {
        return "FeatureVector{" +
                "entityId='" + entityId + '\'' +
                ", window=[" + windowStart + ", " + windowEnd + ']' +
                ", shapes=" + shapes +
                ", features=" + features +
                '}';
    }
}
