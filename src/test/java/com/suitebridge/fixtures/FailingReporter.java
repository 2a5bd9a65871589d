package com.suitebridge.fixtures;

import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;

/**
 * Custom reporter for {@code -C} that throws an {@link AssertionError} on every succeeded test.
 */
public class FailingReporter implements Reporter {

    @Override
    public void apply(RunEvent event) {
        if (event instanceof RunEvent.TestSucceeded) {
            throw new AssertionError("reporter rejected " + event);
        }
    }
}
