package com.suitebridge.core.summary;

/**
 * Thrown when a run is completed a second time.
 */
public class DoubleCompletionException extends IllegalStateException {

    public DoubleCompletionException(String message) {
        super(message);
    }

    public DoubleCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
