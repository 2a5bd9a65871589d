package com.suitebridge.core.config;

/**
 * Thrown while building a runner when its arguments are malformed or request an
 * unsupported feature.
 */
public class ArgumentException extends IllegalArgumentException {

    public ArgumentException(String message) {
        super(message);
    }

    public ArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
