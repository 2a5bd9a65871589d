package com.suitebridge.core.events;

import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestEvent;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestPending;
import com.suitebridge.core.events.RunEvent.TestSkipped;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import com.suitebridge.core.model.NestedSuiteSelector;
import com.suitebridge.core.model.NestedTestSelector;
import com.suitebridge.core.model.RunRequest;
import com.suitebridge.core.model.Selector;
import com.suitebridge.core.model.Status;
import com.suitebridge.core.model.StatusEvent;
import com.suitebridge.core.model.SuiteSelector;
import com.suitebridge.core.model.TestSelector;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Maps internal run events of one task onto host status events.
 * <p>
 * The fully qualified name and fingerprint of every status event come from the task's
 * request, never from the event, so nested-suite results are attributed to the
 * top-level suite the host asked for. Events with no host counterpart (starting,
 * completed, messages) translate to nothing.
 */
public class EventTranslator {

    private final RunRequest request;
    private final String topLevelSuiteId;

    public EventTranslator(RunRequest request, String topLevelSuiteId) {
        this.request = request;
        this.topLevelSuiteId = topLevelSuiteId;
    }

    public Optional<StatusEvent> translate(RunEvent event) {
        if (event instanceof TestSucceeded e) {
            return Optional.of(status(Status.SUCCESS, e, e.durationMs(), null));
        }
        if (event instanceof TestFailed e) {
            Status status = isAssertionFailure(e.throwable()) ? Status.FAILURE : Status.ERROR;
            return Optional.of(status(status, e, e.durationMs(), e.throwable()));
        }
        if (event instanceof TestCanceled e) {
            return Optional.of(status(Status.CANCELED, e, e.durationMs(), null));
        }
        if (event instanceof TestPending e) {
            return Optional.of(status(Status.PENDING, e, e.durationMs(), null));
        }
        if (event instanceof TestSkipped e) {
            return Optional.of(status(Status.SKIPPED, e, e.durationMs(), null));
        }
        if (event instanceof TestIgnored e) {
            return Optional.of(status(Status.IGNORED, e, -1L, null));
        }
        if (event instanceof SuiteAborted e) {
            Selector selector = isTopLevel(e.suite())
                    ? new SuiteSelector()
                    : new NestedSuiteSelector(e.suite().suiteId());
            return Optional.of(new StatusEvent(Status.ERROR, request.qualifiedName(), request.fingerprint(),
                    e.durationMs(), Optional.ofNullable(e.throwable()), selector));
        }
        return Optional.empty();
    }

    /**
     * Returns a reporter that forwards each translated event to {@code sink} as soon as it arrives.
     */
    public Reporter forwardingTo(Consumer<StatusEvent> sink) {
        return event -> translate(event).ifPresent(sink);
    }

    /**
     * Assertion failures are {@link AssertionError}s, which includes
     * {@link com.suitebridge.suite.TestFailedException}. Anything else is an error.
     */
    public static boolean isAssertionFailure(Throwable throwable) {
        return throwable instanceof AssertionError;
    }

    private StatusEvent status(Status status, TestEvent event, long duration, Throwable throwable) {
        Selector selector = isTopLevel(event.suite())
                ? new TestSelector(event.testName())
                : new NestedTestSelector(event.suite().suiteId(), event.testName());
        return new StatusEvent(status, request.qualifiedName(), request.fingerprint(),
                duration, Optional.ofNullable(throwable), selector);
    }

    private boolean isTopLevel(SuiteInfo suite) {
        return suite == null || topLevelSuiteId.equals(suite.suiteId());
    }
}
