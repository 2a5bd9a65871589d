package com.suitebridge.core.summary;

import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteCompleted;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestPending;
import com.suitebridge.core.events.RunEvent.TestSkipped;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import com.suitebridge.core.events.SuiteInfo;
import com.suitebridge.core.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SummaryAggregatorTest {

    private static final SuiteInfo SUITE = new SuiteInfo("MathSuite", "com.example.MathSuite", "com.example.MathSuite");

    private SummaryAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new SummaryAggregator();
    }

    private static AssertionError assertionWithoutTrace(String message) {
        var error = new AssertionError(message);
        error.setStackTrace(new StackTraceElement[0]);
        return error;
    }

    private static RuntimeException exceptionWithoutTrace(String message) {
        var error = new RuntimeException(message);
        error.setStackTrace(new StackTraceElement[0]);
        return error;
    }

    // -- Counting -------------------------------------------------------------

    @Test
    @DisplayName("counts every outcome, splitting failures from errors")
    void countsOutcomes() {
        aggregator.apply(new TestSucceeded(SUITE, "a", 1));
        aggregator.apply(new TestFailed(SUITE, "b", assertionWithoutTrace("no"), 1));
        aggregator.apply(new TestFailed(SUITE, "c", exceptionWithoutTrace("boom"), 1));
        aggregator.apply(new TestCanceled(SUITE, "d", exceptionWithoutTrace("later"), 1));
        aggregator.apply(new TestIgnored(SUITE, "e"));
        aggregator.apply(new TestPending(SUITE, "f", 1));
        aggregator.apply(new TestSkipped(SUITE, "g", "offline", 1));
        aggregator.apply(new SuiteCompleted(SUITE, 5));
        aggregator.apply(new SuiteAborted(SUITE, "boom", null, 5));

        RunSummary summary = aggregator.snapshot();
        assertEquals(1, summary.succeeded());
        assertEquals(1, summary.failed());
        assertEquals(1, summary.errored());
        assertEquals(2, summary.failedTotal());
        assertEquals(1, summary.canceled());
        assertEquals(1, summary.ignored());
        assertEquals(1, summary.pending());
        assertEquals(1, summary.skipped());
        assertEquals(3, summary.totalRun());
        assertEquals(1, summary.suitesCompleted());
        assertEquals(1, summary.suitesAborted());
        assertFalse(summary.allPassed());
        assertEquals(List.of("b", "c", "d"), summary.reminders().stream().map(r -> r.testName()).toList());
        assertTrue(summary.reminders().get(2).canceled());
    }

    @Test
    @DisplayName("counts concurrent events without losing any")
    void concurrentCounting() throws InterruptedException {
        int threads = 8;
        int perThread = 250;
        CountDownLatch latch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    aggregator.apply(new TestSucceeded(SUITE, "t" + i, 0));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, aggregator.snapshot().succeeded());
    }

    // -- Rendering ------------------------------------------------------------

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("a clean run ends with 'All tests passed.'")
        void allPassed() {
            aggregator.apply(new TestSucceeded(SUITE, "a", 1));
            aggregator.apply(new SuiteCompleted(SUITE, 1));

            var report = aggregator.complete(PresentationConfig.defaults(), 1500);

            assertEquals(String.join("\n",
                    "Run completed in 1 second, 500 milliseconds.",
                    "Total number of tests run: 1",
                    "Suites: completed 1, aborted 0",
                    "Tests: succeeded 1, failed 0, canceled 0, ignored 0, pending 0",
                    "All tests passed."), report);
            assertTrue(aggregator.isCompleted());
        }

        @Test
        @DisplayName("failures and aborts are announced in plural banners")
        void banners() {
            aggregator.apply(new TestFailed(SUITE, "a", assertionWithoutTrace("x"), 1));
            aggregator.apply(new TestFailed(SUITE, "b", assertionWithoutTrace("y"), 1));
            aggregator.apply(new SuiteAborted(SUITE, "boom", null, 1));
            aggregator.apply(new SuiteAborted(SUITE, "boom", null, 1));

            var lines = List.of(aggregator.complete(PresentationConfig.defaults(), 10).split("\n"));

            assertEquals(6, lines.size());
            assertEquals("*** 2 SUITES ABORTED ***", lines.get(4));
            assertEquals("*** 2 TESTS FAILED ***", lines.get(5));
        }

        @Test
        @DisplayName("reminders list failures first, then cancellations unless K is set")
        void reminders() {
            aggregator.apply(new TestCanceled(SUITE, "later", exceptionWithoutTrace("not today"), 1));
            aggregator.apply(new TestFailed(SUITE, "adds", assertionWithoutTrace("expected 2"), 1));
            var summary = aggregator.snapshot();

            var withCanceled = SummaryAggregator.render(summary, PresentationConfig.parse("-o", "I"), 10);
            assertEquals(List.of(
                    "MathSuite:", "", "- adds *** FAILED ***", "  expected 2",
                    "MathSuite:", "", "- later !!! CANCELED !!!", "  not today"),
                    withCanceled.subList(5, withCanceled.size()));

            var withoutCanceled = SummaryAggregator.render(summary, PresentationConfig.parse("-o", "IK"), 10);
            assertEquals(9, withoutCanceled.size());

            var noReminders = SummaryAggregator.render(summary, PresentationConfig.defaults(), 10);
            assertEquals(5, noReminders.size());
        }

        @Test
        @DisplayName("completing twice fails")
        void doubleCompletion() {
            aggregator.complete(PresentationConfig.defaults(), 1);
            assertThrows(DoubleCompletionException.class,
                    () -> aggregator.complete(PresentationConfig.defaults(), 1));
        }
    }
}
