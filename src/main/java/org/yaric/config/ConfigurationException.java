package org.yaric.config;

/**
 * The batch description is invalid or inconsistent. Raised before any work is scheduled.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
