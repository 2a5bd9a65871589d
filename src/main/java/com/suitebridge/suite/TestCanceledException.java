package com.suitebridge.suite;

/**
 * Thrown to cancel a test that cannot run, for example when a precondition does not hold.
 */
public class TestCanceledException extends RuntimeException {

    public TestCanceledException(String message) {
        super(message);
    }

    public TestCanceledException(String message, Throwable cause) {
        super(message, cause);
    }
}
