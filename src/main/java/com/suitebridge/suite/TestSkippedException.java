package com.suitebridge.suite;

/**
 * Thrown to skip a test.
 */
public class TestSkippedException extends RuntimeException {

    public TestSkippedException(String message) {
        super(message);
    }

    public TestSkippedException(String message, Throwable cause) {
        super(message, cause);
    }
}
