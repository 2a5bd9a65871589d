package com.suitebridge.suite;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which tests and nested suites of a suite should run.
 *
 * @param allTests        run every top-level test
 * @param testNames       top-level tests to run when {@code allTests} is false
 * @param allNestedSuites run every nested suite in full
 * @param nestedSuites    per nested-suite selections when {@code allNestedSuites} is false
 */
public record Selection(
        boolean allTests,
        Set<String> testNames,
        boolean allNestedSuites,
        Map<String, Selection> nestedSuites
) {

    private static final Selection ENTIRE_SUITE = new Selection(true, Set.of(), true, Map.of());

    public Selection {
        testNames = testNames == null ? Set.of() : Set.copyOf(testNames);
        nestedSuites = nestedSuites == null ? Map.of() : Map.copyOf(nestedSuites);
    }

    public static Selection entireSuite() {
        return ENTIRE_SUITE;
    }

    public static Selection of(Set<String> testNames, Map<String, Selection> nestedSuites) {
        return new Selection(false, testNames, false, nestedSuites);
    }

    public boolean includesTest(String testName) {
        return allTests || testNames.contains(testName);
    }

    /**
     * Selection for the nested suite with {@code suiteId}, or empty when it should not run at all.
     */
    public Optional<Selection> nestedSuite(String suiteId) {
        if (allNestedSuites) {
            return Optional.of(ENTIRE_SUITE);
        }
        return Optional.ofNullable(nestedSuites.get(suiteId));
    }
}
