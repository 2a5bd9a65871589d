package com.suitebridge.suite;

import com.suitebridge.core.events.Reporter;

import java.util.Map;

/**
 * Everything a suite needs to run: where to report, which tests to include, the
 * user's config map and the selection resolved for this suite.
 */
public record Args(
        Reporter reporter,
        TestFilter filter,
        Map<String, String> configMap,
        Selection selection
) {

    public Args {
        configMap = configMap == null ? Map.of() : Map.copyOf(configMap);
        filter = filter == null ? TestFilter.acceptAll() : filter;
        selection = selection == null ? Selection.entireSuite() : selection;
    }

    public Args withSelection(Selection newSelection) {
        return new Args(reporter, filter, configMap, newSelection);
    }
}
