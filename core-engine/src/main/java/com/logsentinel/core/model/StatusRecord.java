package com.logsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Status snapshot written to the external status store after every agent or
 * model-version lifecycle transition.
 *
 * <p>
 * The core only writes these; it never reads them back.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatusRecord {

    private final String subject;
    private final String status;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    /**
     * @param subject    agent id or model version id
     * @param status     lifecycle status name (lower case)
     * @param timestamp  time of the transition
     * @param attributes additional fields; copied, {@code null} values kept
     */
    public StatusRecord(String subject, String status, Instant timestamp, Map<String, Object> attributes) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    public String getSubject() {
        return subject;
    }

    public String getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Flatten into a single map, the shape most key-value stores expect.
     *
     * @return new mutable map with {@code subject}, {@code status},
     *         {@code timestamp} and every attribute
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("subject", subject);
        map.put("status", status);
        map.put("timestamp", timestamp.toString());
        map.putAll(attributes);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatusRecord that))
            return false;
        return subject.equals(that.subject) && status.equals(that.status)
                && timestamp.equals(that.timestamp) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, status, timestamp, attributes);
    }

    @Override
    public String toString() {
        return "StatusRecord{subject='" + subject + "', status='" + status + "', timestamp=" + timestamp
                + ", attributes=" + attributes + '}';
    }
}
