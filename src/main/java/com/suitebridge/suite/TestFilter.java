package com.suitebridge.suite;

import java.util.Collections;
import java.util.Set;

/**
 * Tag-based test filter built from {@code -n} (include) and {@code -l} (exclude).
 * <p>
 * A test is accepted when the include set is empty or the test carries at least one
 * included tag, and the test carries no excluded tag.
 */
public record TestFilter(Set<String> tagsToInclude, Set<String> tagsToExclude) {

    public TestFilter {
        tagsToInclude = tagsToInclude == null ? Set.of() : Set.copyOf(tagsToInclude);
        tagsToExclude = tagsToExclude == null ? Set.of() : Set.copyOf(tagsToExclude);
    }

    public static TestFilter acceptAll() {
        return new TestFilter(Set.of(), Set.of());
    }

    public boolean accepts(Set<String> testTags) {
        if (!tagsToInclude.isEmpty() && Collections.disjoint(tagsToInclude, testTags)) {
            return false;
        }
        return Collections.disjoint(tagsToExclude, testTags);
    }
}
