package com.msst.core.config;

/**
 * Thrown when harness or endpoint configuration is unusable.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
