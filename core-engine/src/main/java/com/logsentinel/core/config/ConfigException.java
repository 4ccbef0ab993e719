package com.logsentinel.core.config;

/**
 * Raised when an agent configuration is missing a required field or carries
 * an illegal value.
 *
 * <p>
 * Fatal at agent construction: an agent whose configuration fails validation
 * is never created and never reaches {@code active}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
