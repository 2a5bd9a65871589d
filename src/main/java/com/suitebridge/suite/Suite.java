package com.suitebridge.suite;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A runnable collection of named tests and nested suites.
 * <p>
 * Implementations report their progress through {@link Args#reporter()}. The engine
 * wraps every {@link #run} call with suite-starting and suite-completed (or
 * suite-aborted) events, so implementations only report test-level events and the
 * lifecycle of their own nested suites.
 */
public interface Suite {

    /** Unique id; nested suites must use ids distinct from their siblings. */
    default String suiteId() {
        return getClass().getName();
    }

    default String suiteName() {
        return getClass().getSimpleName();
    }

    /** Top-level test names in declared order. */
    List<String> testNames();

    /** Tags of each top-level test, keyed by test name. */
    default Map<String, Set<String>> testTags() {
        return Map.of();
    }

    /** Nested suites in declared order. */
    default List<Suite> nestedSuites() {
        return List.of();
    }

    /**
     * Runs the selected nested suites and tests. Throwing aborts the suite.
     */
    void run(Args args) throws Exception;
}
