package com.suitebridge.core.metrics;

import com.suitebridge.core.events.RunEvent.RunCompleted;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteCompleted;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import com.suitebridge.core.events.SuiteInfo;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunMetricsTest {

    private static final SuiteInfo SUITE = new SuiteInfo("MathSuite", "com.example.MathSuite", "com.example.MathSuite");

    private SimpleMeterRegistry registry;
    private RunMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RunMetrics(registry);
    }

    @Test
    @DisplayName("test events increment the counter tagged with their status")
    void countsTestsByStatus() {
        metrics.apply(new TestSucceeded(SUITE, "a", 1));
        metrics.apply(new TestSucceeded(SUITE, "b", 1));
        metrics.apply(new TestFailed(SUITE, "c", new AssertionError("x"), 1));
        metrics.apply(new TestCanceled(SUITE, "d", null, 1));
        metrics.apply(new TestIgnored(SUITE, "e"));

        assertEquals(2.0, registry.find("suitebridge.tests").tag("status", "succeeded").counter().count());
        assertEquals(1.0, registry.find("suitebridge.tests").tag("status", "failed").counter().count());
        assertEquals(1.0, registry.find("suitebridge.tests").tag("status", "canceled").counter().count());
        assertEquals(1.0, registry.find("suitebridge.tests").tag("status", "ignored").counter().count());
        assertNull(registry.find("suitebridge.tests").tag("status", "pending").counter());
    }

    @Test
    @DisplayName("suite events increment the counter tagged with their outcome")
    void countsSuitesByOutcome() {
        metrics.apply(new SuiteCompleted(SUITE, 10));
        metrics.apply(new SuiteAborted(SUITE, "boom", new IllegalStateException("boom"), 10));
        metrics.apply(new SuiteAborted(SUITE, "boom", null, 10));

        assertEquals(1.0, registry.find("suitebridge.suites").tag("outcome", "completed").counter().count());
        assertEquals(2.0, registry.find("suitebridge.suites").tag("outcome", "aborted").counter().count());
    }

    @Test
    @DisplayName("run-level events record nothing")
    void ignoresRunEvents() {
        metrics.apply(new RunCompleted(100));
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    @DisplayName("recordTaskDuration records a timer per suite")
    void recordTaskDuration() {
        metrics.recordTaskDuration("com.example.MathSuite", 200);
        metrics.recordTaskDuration("com.example.MathSuite", 100);
        metrics.recordTaskDuration("com.example.OtherSuite", 50);

        var timer = registry.find("suitebridge.task.duration").tag("suite", "com.example.MathSuite").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
        assertEquals(1, registry.find("suitebridge.task.duration").tag("suite", "com.example.OtherSuite").timer().count());
    }

    @Test
    @DisplayName("recordDroppedRequest increments the dropped counter")
    void recordDroppedRequest() {
        metrics.recordDroppedRequest();
        metrics.recordDroppedRequest();
        assertEquals(2.0, registry.find("suitebridge.requests.dropped").counter().count());
    }
}
