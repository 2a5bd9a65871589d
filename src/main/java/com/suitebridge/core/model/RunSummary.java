package com.suitebridge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Snapshot of the counters collected for one run.
 * <p>
 * {@code failed} counts assertion failures only; {@link #failedTotal()} adds errors.
 */
public record RunSummary(
        int succeeded,
        int failed,
        int errored,
        int canceled,
        int ignored,
        int pending,
        int skipped,
        int suitesCompleted,
        int suitesAborted,
        List<Reminder> reminders
) implements Serializable {

    public RunSummary {
        reminders = reminders == null ? List.of() : List.copyOf(reminders);
    }

    public int failedTotal() {
        return failed + errored;
    }

    /** Canceled, ignored, pending and skipped tests are not counted as run. */
    public int totalRun() {
        return succeeded + failedTotal();
    }

    public boolean allPassed() {
        return failedTotal() == 0 && suitesAborted == 0;
    }
}
