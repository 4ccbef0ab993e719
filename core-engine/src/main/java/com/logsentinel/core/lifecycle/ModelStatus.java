package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a model version.
 *
 * <pre>
 * imported -&gt; available -&gt; deployed &lt;-&gt; rolled_back
 * </pre>
 *
 * <p>
 * {@code deleted} is reachable from every status except {@code deployed}.
 * Deleted versions leave the registry, so the value only appears in status
 * records.
 * </p>
 *
 * @since 1.0.0
 */
public enum ModelStatus {

    IMPORTED,
    AVAILABLE,
    DEPLOYED,
    ROLLED_BACK,
    DELETED;

    /**
     * @return lower-case name used in the registry file and status records
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ModelStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @return {@code true} for statuses a validated version can be deployed
     *         or rolled back to from
     */
    public boolean isAvailable() {
        return this == AVAILABLE || this == ROLLED_BACK;
    }
}
