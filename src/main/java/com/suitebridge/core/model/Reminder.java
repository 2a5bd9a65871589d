package com.suitebridge.core.model;

import java.io.Serializable;

/**
 * A failed or canceled test remembered for the end-of-run report.
 */
public record Reminder(
        String suiteName,
        String testName,
        String description,
        boolean canceled
) implements Serializable {
}
