package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single device log record as returned by the log source.
 *
 * <p>
 * Log records are heterogeneous: WiFi authentication events, DNS queries,
 * firewall decisions and plain syslog lines all arrive through the same
 * source. The record is therefore kept as a free-form field map, and the
 * feature extractor decides how to read it by looking at which fields are
 * present.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Instances are created by
 * the log source and only read afterwards, within a single analysis cycle.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEntry {

    /** Field holding the emitting process name. */
    public static final String FIELD_PROGRAM = "program";

    /** Field holding the log level. */
    public static final String FIELD_LEVEL = "level";

    /** Field holding the free-text message. */
    public static final String FIELD_MESSAGE = "message";

    /** Fields consulted, in order, to determine the entity a record belongs to. */
    public static final List<String> ENTITY_FIELDS = List.of("deviceId", "entityId", "source", FIELD_PROGRAM);

    /** Entity id used when none of {@link #ENTITY_FIELDS} is present. */
    public static final String UNKNOWN_ENTITY = "unknown";

    /** Every key-value pair of the original record except the timestamp. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Time the record was written on the device. */
    private Instant timestamp;

    /** No-arg constructor required by Jackson. */
    public LogEntry() {
    }

    /**
     * Convenience constructor used by adapters and tests.
     *
     * @param timestamp record time, may be {@code null}
     * @param fields    initial fields; must not be {@code null}
     */
    public LogEntry(Instant timestamp, Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.timestamp = timestamp;
        fields.forEach(this::setField);
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set a field value. Called by Jackson for every JSON property other than
     * {@code timestamp}.
     *
     * @param key   the field name; must not be {@code null}
     * @param value the field value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    public boolean hasField(String fieldName) {
        return fields.get(fieldName) != null;
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing JSON numbers and
     * string-encoded numbers.
     *
     * @param fieldName the field name
     * @return the value as a {@code double}, or empty if absent or not numeric
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * @return the message text, or an empty string when absent
     */
    public String getMessage() {
        return getStringField(FIELD_MESSAGE).orElse("");
    }

    /**
     * @return the program (process) name, if present
     */
    public Optional<String> getProgram() {
        return getStringField(FIELD_PROGRAM);
    }

    /**
     * @return the log level, if present
     */
    public Optional<String> getLevel() {
        return getStringField(FIELD_LEVEL);
    }

    /**
     * Resolve the entity this record belongs to.
     *
     * @return the first non-blank value of {@link #ENTITY_FIELDS}, or
     *         {@value #UNKNOWN_ENTITY}
     */
    public String getEntityId() {
        for (String field : ENTITY_FIELDS) {
            Optional<String> value = getStringField(field);
            if (value.isPresent() && !value.get().isBlank()) {
                return value.get();
            }
        }
        return UNKNOWN_ENTITY;
    }

    // ---------------------------------------------------------------
    // Timestamp
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogEntry that))
            return false;
        return Objects.equals(timestamp, that.timestamp) && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, fields);
    }

    @Override
    public String toString() {
        return "LogEntry{timestamp=" + timestamp + ", fields=" + fields + '}';
    }
}
