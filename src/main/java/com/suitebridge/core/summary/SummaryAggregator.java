package com.suitebridge.core.summary;

import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.events.EventTranslator;
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
import com.suitebridge.core.model.Reminder;
import com.suitebridge.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts run events from every task and renders the end-of-run report.
 * <p>
 * {@link #apply} is safe to call from any number of worker threads. Reminders keep the
 * order in which their events arrived. {@link #complete} renders exactly once.
 */
public class SummaryAggregator implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(SummaryAggregator.class);

    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger errored = new AtomicInteger();
    private final AtomicInteger canceled = new AtomicInteger();
    private final AtomicInteger ignored = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger suitesCompleted = new AtomicInteger();
    private final AtomicInteger suitesAborted = new AtomicInteger();
    private final ConcurrentLinkedQueue<Reminder> reminders = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);

    @Override
    public void apply(RunEvent event) {
        if (event instanceof TestSucceeded) {
            succeeded.incrementAndGet();
        } else if (event instanceof TestFailed e) {
            if (EventTranslator.isAssertionFailure(e.throwable())) {
                failed.incrementAndGet();
            } else {
                errored.incrementAndGet();
            }
            reminders.add(new Reminder(e.suite().suiteName(), e.testName(),
                    FailureDescription.of(e.throwable()), false));
        } else if (event instanceof TestCanceled e) {
            canceled.incrementAndGet();
            reminders.add(new Reminder(e.suite().suiteName(), e.testName(),
                    FailureDescription.of(e.throwable()), true));
        } else if (event instanceof TestIgnored) {
            ignored.incrementAndGet();
        } else if (event instanceof TestPending) {
            pending.incrementAndGet();
        } else if (event instanceof TestSkipped) {
            skipped.incrementAndGet();
        } else if (event instanceof SuiteCompleted) {
            suitesCompleted.incrementAndGet();
        } else if (event instanceof SuiteAborted) {
            suitesAborted.incrementAndGet();
        }
    }

    public RunSummary snapshot() {
        return new RunSummary(
                succeeded.get(),
                failed.get(),
                errored.get(),
                canceled.get(),
                ignored.get(),
                pending.get(),
                skipped.get(),
                suitesCompleted.get(),
                suitesAborted.get(),
                new ArrayList<>(reminders)
        );
    }

    public boolean isCompleted() {
        return completed.get();
    }

    /**
     * Renders the report for the run.
     *
     * @param presentation  settings of the log reporter; decides whether reminders are shown
     * @param elapsedMillis wall-clock duration of the run
     * @throws DoubleCompletionException when called more than once
     */
    public String complete(PresentationConfig presentation, long elapsedMillis) {
        if (!completed.compareAndSet(false, true)) {
            throw new DoubleCompletionException("Run summary has already been completed");
        }
        RunSummary summary = snapshot();
        String report = String.join("\n", render(summary, presentation, elapsedMillis));
        log.info("Run completed: {} succeeded, {} failed, {} canceled, {} suite(s) aborted",
                summary.succeeded(), summary.failedTotal(), summary.canceled(), summary.suitesAborted());
        return report;
    }

    static List<String> render(RunSummary summary, PresentationConfig presentation, long elapsedMillis) {
        List<String> lines = new ArrayList<>();
        lines.add("Run completed in " + DurationText.format(elapsedMillis) + ".");
        lines.add("Total number of tests run: " + summary.totalRun());
        lines.add("Suites: completed " + summary.suitesCompleted() + ", aborted " + summary.suitesAborted());
        lines.add("Tests: succeeded " + summary.succeeded() + ", failed " + summary.failedTotal()
                + ", canceled " + summary.canceled() + ", ignored " + summary.ignored()
                + ", pending " + summary.pending());

        if (summary.allPassed()) {
            lines.add("All tests passed.");
            return lines;
        }

        if (summary.suitesAborted() > 0) {
            lines.add(summary.suitesAborted() == 1
                    ? "*** 1 SUITE ABORTED ***"
                    : "*** " + summary.suitesAborted() + " SUITES ABORTED ***");
        }
        if (summary.failedTotal() > 0) {
            lines.add(summary.failedTotal() == 1
                    ? "*** 1 TEST FAILED ***"
                    : "*** " + summary.failedTotal() + " TESTS FAILED ***");
        }

        if (presentation.presentReminder()) {
            for (Reminder reminder : summary.reminders()) {
                if (!reminder.canceled()) {
                    addReminder(lines, reminder, "*** FAILED ***");
                }
            }
            if (!presentation.presentReminderWithoutCanceledTests()) {
                for (Reminder reminder : summary.reminders()) {
                    if (reminder.canceled()) {
                        addReminder(lines, reminder, "!!! CANCELED !!!");
                    }
                }
            }
        }
        return lines;
    }

    private static void addReminder(List<String> lines, Reminder reminder, String marker) {
        lines.add(reminder.suiteName() + ":");
        lines.add("");
        lines.add("- " + reminder.testName() + " " + marker);
        lines.add("  " + reminder.description());
    }
}
