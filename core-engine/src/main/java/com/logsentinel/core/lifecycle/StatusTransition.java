package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded status change of a model version.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StatusTransition {

    private final ModelStatus from;
    private final ModelStatus to;
    private final Instant at;
    private final String note;

    /**
     * @param from previous status, {@code null} for the initial import
     * @param to   new status
     * @param at   time of the change
     * @param note free-text reason, may be {@code null}
     */
    @JsonCreator
    public StatusTransition(@JsonProperty("from") ModelStatus from,
            @JsonProperty("to") ModelStatus to,
            @JsonProperty("at") Instant at,
            @JsonProperty("note") String note) {
        this.from = from;
        this.to = Objects.requireNonNull(to, "to must not be null");
        this.at = Objects.requireNonNull(at, "at must not be null");
        this.note = note;
    }

    public ModelStatus getFrom() {
        return from;
    }

    public ModelStatus getTo() {
        return to;
    }

    public Instant getAt() {
        return at;
    }

    public String getNote() {
        return note;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatusTransition that))
            return false;
        return from == that.from && to == that.to && at.equals(that.at) && Objects.equals(note, that.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, at, note);
    }

    @Override
    public String toString() {
        return from + "->" + to + "@" + at + (note != null ? " (" + note + ")" : "");
    }
}
