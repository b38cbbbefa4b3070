package com.jolly.config;

/**
 * Exception thrown when configuration cannot be read or is invalid.
 */
public class JollyConfigException extends Exception {
    public JollyConfigException(String message) {
        super(message);
    }

    public JollyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
