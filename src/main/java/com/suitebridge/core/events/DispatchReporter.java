package com.suitebridge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans every event out to a list of reporters.
 * <p>
 * A reporter that throws is logged and skipped; delivery to the remaining
 * reporters continues. Thread-safe for concurrent apply and add.
 */
public class DispatchReporter implements Reporter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchReporter.class);

    private final CopyOnWriteArrayList<Reporter> reporters;

    public DispatchReporter(List<? extends Reporter> reporters) {
        this.reporters = new CopyOnWriteArrayList<>(reporters);
    }

    public DispatchReporter(Reporter... reporters) {
        this(List.of(reporters));
    }

    public void add(Reporter reporter) {
        reporters.add(reporter);
    }

    public List<Reporter> reporters() {
        return List.copyOf(reporters);
    }

    @Override
    public void apply(RunEvent event) {
        for (Reporter reporter : reporters) {
            deliverSafely(reporter, event);
        }
    }

    /**
     * Closes every reporter that is {@link AutoCloseable}. Failures are logged, not rethrown.
     */
    @Override
    public void close() {
        for (Reporter reporter : reporters) {
            if (reporter instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Reporter {} failed to close: {}",
                            reporter.getClass().getName(), e.getMessage(), e);
                }
            }
        }
    }

    private void deliverSafely(Reporter reporter, RunEvent event) {
        try {
            reporter.apply(event);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Reporter {} threw exception processing {}: {}",
                    reporter.getClass().getName(), event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
