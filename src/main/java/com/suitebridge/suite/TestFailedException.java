package com.suitebridge.suite;

/**
 * Thrown by {@link FunSuite#fail(String)}. Reported as a failure, not an error.
 */
public class TestFailedException extends AssertionError {

    public TestFailedException(String message) {
        super(message, null);
    }

    public TestFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
