package com.suitebridge.suite;

/**
 * Thrown by a test whose body is not written yet.
 */
public class TestPendingException extends RuntimeException {

    public TestPendingException(String message) {
        super(message);
    }

    public TestPendingException(String message, Throwable cause) {
        super(message, cause);
    }
}
