package com.suitebridge.core.resolver;

import com.suitebridge.suite.Selection;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The concrete units a run request resolved to, in execution order.
 *
 * @param entireSuite true when the whole suite runs, in which case {@code units} is empty
 * @param units       selected (suite id, test name) pairs; a null test name stands for a whole nested suite
 */
public record ResolvedUnits(boolean entireSuite, List<Unit> units) {

    public record Unit(String suiteId, String testName) {

        public boolean wholeSuite() {
            return testName == null;
        }
    }

    public ResolvedUnits {
        units = List.copyOf(units);
    }

    public static ResolvedUnits entire() {
        return new ResolvedUnits(true, List.of());
    }

    public boolean isEmpty() {
        return !entireSuite && units.isEmpty();
    }

    /**
     * Converts the units into the {@link Selection} handed to the top-level suite.
     */
    public Selection toSelection(String topLevelSuiteId) {
        if (entireSuite) {
            return Selection.entireSuite();
        }
        Set<String> topLevelTests = new LinkedHashSet<>();
        Map<String, Set<String>> nestedTests = new LinkedHashMap<>();
        Set<String> wholeNestedSuites = new LinkedHashSet<>();
        for (Unit unit : units) {
            if (unit.suiteId().equals(topLevelSuiteId)) {
                topLevelTests.add(unit.testName());
            } else if (unit.wholeSuite()) {
                wholeNestedSuites.add(unit.suiteId());
            } else {
                nestedTests.computeIfAbsent(unit.suiteId(), id -> new LinkedHashSet<>()).add(unit.testName());
            }
        }
        Map<String, Selection> nested = new LinkedHashMap<>();
        nestedTests.forEach((id, names) -> nested.put(id, Selection.of(names, Map.of())));
        wholeNestedSuites.forEach(id -> nested.put(id, Selection.entireSuite()));
        return Selection.of(topLevelTests, nested);
    }
}
