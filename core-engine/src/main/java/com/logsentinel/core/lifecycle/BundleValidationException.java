package com.logsentinel.core.lifecycle;

import java.util.Objects;

/**
 * Raised when a bundle fails validation during import or deployment.
 *
 * @since 1.0.0
 */
public class BundleValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationReport report;

    public BundleValidationException(String message, ValidationReport report) {
        super(message + ": " + String.join("; ", Objects.requireNonNull(report, "report must not be null").getErrors()));
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }
}
