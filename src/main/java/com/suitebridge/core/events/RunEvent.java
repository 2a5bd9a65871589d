package com.suitebridge.core.events;

/**
 * Lifecycle notifications produced while suites run.
 * <p>
 * Every event flows through a {@link Reporter}; the host only ever sees the
 * {@link com.suitebridge.core.model.StatusEvent}s that {@link EventTranslator} derives from them.
 */
public sealed interface RunEvent {

    long timestamp();

    /** Events raised for a single test. */
    sealed interface TestEvent extends RunEvent {
        SuiteInfo suite();

        String testName();
    }

    /** Events raised for a suite as a whole. */
    sealed interface SuiteEvent extends RunEvent {
        SuiteInfo suite();
    }

    /** Free-form messages raised by a running suite; {@code suite} may be null. */
    sealed interface MessageEvent extends RunEvent {
        SuiteInfo suite();

        String message();
    }

    record RunStarting(int expectedSuiteCount, long timestamp) implements RunEvent {
        public RunStarting(int expectedSuiteCount) {
            this(expectedSuiteCount, System.currentTimeMillis());
        }
    }

    record RunCompleted(long durationMs, long timestamp) implements RunEvent {
        public RunCompleted(long durationMs) {
            this(durationMs, System.currentTimeMillis());
        }
    }

    record SuiteStarting(SuiteInfo suite, long timestamp) implements SuiteEvent {
        public SuiteStarting(SuiteInfo suite) {
            this(suite, System.currentTimeMillis());
        }
    }

    record SuiteCompleted(SuiteInfo suite, long durationMs, long timestamp) implements SuiteEvent {
        public SuiteCompleted(SuiteInfo suite, long durationMs) {
            this(suite, durationMs, System.currentTimeMillis());
        }
    }

    record SuiteAborted(SuiteInfo suite, String message, Throwable throwable, long durationMs, long timestamp)
            implements SuiteEvent {
        public SuiteAborted(SuiteInfo suite, String message, Throwable throwable, long durationMs) {
            this(suite, message, throwable, durationMs, System.currentTimeMillis());
        }
    }

    record TestStarting(SuiteInfo suite, String testName, long timestamp) implements TestEvent {
        public TestStarting(SuiteInfo suite, String testName) {
            this(suite, testName, System.currentTimeMillis());
        }
    }

    record TestSucceeded(SuiteInfo suite, String testName, long durationMs, long timestamp) implements TestEvent {
        public TestSucceeded(SuiteInfo suite, String testName, long durationMs) {
            this(suite, testName, durationMs, System.currentTimeMillis());
        }
    }

    record TestFailed(SuiteInfo suite, String testName, Throwable throwable, long durationMs, long timestamp)
            implements TestEvent {
        public TestFailed(SuiteInfo suite, String testName, Throwable throwable, long durationMs) {
            this(suite, testName, throwable, durationMs, System.currentTimeMillis());
        }
    }

    record TestCanceled(SuiteInfo suite, String testName, Throwable throwable, long durationMs, long timestamp)
            implements TestEvent {
        public TestCanceled(SuiteInfo suite, String testName, Throwable throwable, long durationMs) {
            this(suite, testName, throwable, durationMs, System.currentTimeMillis());
        }
    }

    record TestIgnored(SuiteInfo suite, String testName, long timestamp) implements TestEvent {
        public TestIgnored(SuiteInfo suite, String testName) {
            this(suite, testName, System.currentTimeMillis());
        }
    }

    record TestPending(SuiteInfo suite, String testName, long durationMs, long timestamp) implements TestEvent {
        public TestPending(SuiteInfo suite, String testName, long durationMs) {
            this(suite, testName, durationMs, System.currentTimeMillis());
        }
    }

    record TestSkipped(SuiteInfo suite, String testName, String reason, long durationMs, long timestamp)
            implements TestEvent {
        public TestSkipped(SuiteInfo suite, String testName, String reason, long durationMs) {
            this(suite, testName, reason, durationMs, System.currentTimeMillis());
        }
    }

    record AlertProvided(SuiteInfo suite, String message, long timestamp) implements MessageEvent {
        public AlertProvided(SuiteInfo suite, String message) {
            this(suite, message, System.currentTimeMillis());
        }
    }

    record NoteProvided(SuiteInfo suite, String message, long timestamp) implements MessageEvent {
        public NoteProvided(SuiteInfo suite, String message) {
            this(suite, message, System.currentTimeMillis());
        }
    }

    record InfoProvided(SuiteInfo suite, String message, long timestamp) implements MessageEvent {
        public InfoProvided(SuiteInfo suite, String message) {
            this(suite, message, System.currentTimeMillis());
        }
    }
}
