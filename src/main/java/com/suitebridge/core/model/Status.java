package com.suitebridge.core.model;

/**
 * Outcome reported to the host for a test or an aborted suite.
 */
public enum Status {
    SUCCESS,
    ERROR,
    FAILURE,
    SKIPPED,
    IGNORED,
    PENDING,
    CANCELED
}
