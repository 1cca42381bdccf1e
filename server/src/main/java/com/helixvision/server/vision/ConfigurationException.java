package com.helixvision.server.vision;

/**
 * Raised when viewport, sampling or file-level configuration is out of range.
 * Thrown at construction time, never while scanning.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
