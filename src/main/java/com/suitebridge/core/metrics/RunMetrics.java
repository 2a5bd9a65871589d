package com.suitebridge.core.metrics;

import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteCompleted;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestPending;
import com.suitebridge.core.events.RunEvent.TestSkipped;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for suite runs. Registered as a reporter so it sees every event.
 */
public class RunMetrics implements Reporter {

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void apply(RunEvent event) {
        if (event instanceof TestSucceeded) {
            recordTest("succeeded");
        } else if (event instanceof TestFailed) {
            recordTest("failed");
        } else if (event instanceof TestCanceled) {
            recordTest("canceled");
        } else if (event instanceof TestIgnored) {
            recordTest("ignored");
        } else if (event instanceof TestPending) {
            recordTest("pending");
        } else if (event instanceof TestSkipped) {
            recordTest("skipped");
        } else if (event instanceof SuiteCompleted) {
            recordSuite("completed");
        } else if (event instanceof SuiteAborted) {
            recordSuite("aborted");
        }
    }

    public void recordTest(String status) {
        Counter.builder("suitebridge.tests")
                .description("Tests finished, by outcome")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSuite(String outcome) {
        Counter.builder("suitebridge.suites")
                .description("Suites finished, nested suites included")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how long one task took, construction included.
     *
     * @param suite qualified name of the task's suite
     * @param ms    elapsed milliseconds
     */
    public void recordTaskDuration(String suite, long ms) {
        Timer.builder("suitebridge.task.duration")
                .tag("suite", suite)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDroppedRequest() {
        Counter.builder("suitebridge.requests.dropped")
                .description("Run requests that produced no task")
                .register(registry)
                .increment();
    }
}
