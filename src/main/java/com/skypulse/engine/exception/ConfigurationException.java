package com.skypulse.engine.exception;

/**
 * Invalid weight, threshold or window configuration.
 *
 * Raised while the Spring context starts, before any deal or price
 * observation is processed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
