package com.logsentinel.core.lifecycle;

/**
 * Raised when a registry operation is rejected: duplicate version id,
 * deletion of a deployed or referenced version, or an illegal status
 * transition. The registry is left unchanged.
 *
 * @since 1.0.0
 */
public class RegistryConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RegistryConflictException(String message) {
        super(message);
    }
}
