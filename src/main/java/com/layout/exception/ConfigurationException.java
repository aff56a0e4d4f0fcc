package com.layout.exception;

/**
 * Exception thrown when policy configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends LayoutPolicyException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
