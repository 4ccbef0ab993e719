package com.logsentinel.core.lifecycle;

/**
 * Raised when a model-backed cycle has no loadable model. An expected
 * condition: agents report it as {@code inactive}, not {@code error}.
 *
 * @since 1.0.0
 */
public class ModelUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
