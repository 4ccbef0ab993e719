package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating one bundle. Immutable.
 *
 * <p>
 * Errors block import and deployment; warnings are informational.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationReport {

    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;
    private final Instant checkedAt;

    @JsonCreator
    public ValidationReport(@JsonProperty("valid") boolean valid,
            @JsonProperty("errors") List<String> errors,
            @JsonProperty("warnings") List<String> warnings,
            @JsonProperty("checkedAt") Instant checkedAt) {
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.valid = valid && this.errors.isEmpty();
        this.checkedAt = Objects.requireNonNull(checkedAt, "checkedAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationReport that))
            return false;
        return valid == that.valid && errors.equals(that.errors) && warnings.equals(that.warnings)
                && checkedAt.equals(that.checkedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, errors, warnings, checkedAt);
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + valid + ", errors=" + errors + ", warnings=" + warnings + '}';
    }

    /**
     * Accumulates findings; the report is valid iff no error was added.
     */
    public static final class Builder {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder() {
        }

        public Builder error(String message) {
            errors.add(message);
            return this;
        }

        public Builder warning(String message) {
            warnings.add(message);
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationReport build(Instant checkedAt) {
            return new ValidationReport(errors.isEmpty(), errors, warnings, checkedAt);
        }
    }
}
