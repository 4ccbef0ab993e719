package com.logsentinel.core.lifecycle;

/**
 * Raised when an operation names a version id the registry does not hold.
 *
 * @since 1.0.0
 */
public class ModelNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String versionId;

    public ModelNotFoundException(String versionId) {
        super("Model version not found: " + versionId);
        this.versionId = versionId;
    }

    public String getVersionId() {
        return versionId;
    }
}
