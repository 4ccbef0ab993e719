package com.logsentinel.core.features;

import com.logsentinel.core.model.LogEntry;

import java.util.List;
import java.util.Map;

/**
 * Computes the features of one log shape for one entity.
 *
 * <p>
 * A shape is recognised by the presence of its marker fields, never by a
 * type tag, so new shapes are added by registering another implementation
 * with the {@link FeatureExtractor}.
 * </p>
 *
 * @since 1.0.0
 */
public interface FeatureSet {

    /**
     * @return short shape name recorded on the feature vector
     */
    String getShape();

    /**
     * @return fields whose presence on any entry selects this shape
     */
    List<String> getMarkerFields();

    /**
     * @param entries entries of one entity
     * @return {@code true} if any entry carries a marker field
     */
    default boolean appliesTo(List<LogEntry> entries) {
        for (LogEntry entry : entries) {
            for (String marker : getMarkerFields()) {
                if (entry.hasField(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Compute this shape's features and add them to {@code features}.
     *
     * @param entries  entries of one entity, never empty
     * @param features ordered output map
     */
    void contribute(List<LogEntry> entries, Map<String, Double> features);
}
