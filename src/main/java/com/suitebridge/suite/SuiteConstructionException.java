package com.suitebridge.suite;

/**
 * Raised to the host when a suite instance could not be created. The cause is the
 * original failure from the suite's constructor or from reflective instantiation.
 */
public class SuiteConstructionException extends RuntimeException {

    public SuiteConstructionException(String message) {
        super(message);
    }

    public SuiteConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
