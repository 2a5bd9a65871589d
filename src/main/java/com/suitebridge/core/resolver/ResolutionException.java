package com.suitebridge.core.resolver;

/**
 * Thrown when an explicitly specified run request names something that cannot run.
 */
public class ResolutionException extends IllegalArgumentException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
