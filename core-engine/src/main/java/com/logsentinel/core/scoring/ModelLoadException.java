package com.logsentinel.core.scoring;

/**
 * Raised when a scoring artifact cannot be read or parsed.
 *
 * @since 1.0.0
 */
public class ModelLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
