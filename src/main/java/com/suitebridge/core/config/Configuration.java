package com.suitebridge.core.config;

import com.suitebridge.core.model.Selector;
import com.suitebridge.core.model.TestSelector;
import com.suitebridge.core.model.TestWildcardSelector;
import com.suitebridge.suite.TestFilter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable run options produced by {@link ConfigurationBuilder}.
 *
 * @param logReporter            presentation of lines written to host loggers
 * @param stderrReporter         presentation of the stderr reporter, empty when {@code -e} was not given
 * @param customReporterClasses  reporter classes from {@code -C}
 * @param tagsToInclude          {@code -n}
 * @param tagsToExclude          {@code -l}
 * @param wildcardPackages       {@code -w}: package and sub-packages
 * @param membersOnlyPackages    {@code -m}: package only
 * @param testWildcards          {@code -z}
 * @param testNames              {@code -t}
 * @param threadCount            worker count from {@code -P<n>}
 * @param sortingTimeout         how long completion waits for in-flight tasks
 * @param slowpoke               {@code -W} settings, empty when slow-test alerts are off
 * @param configMap              {@code -D} entries
 */
public record Configuration(
        PresentationConfig logReporter,
        Optional<PresentationConfig> stderrReporter,
        List<String> customReporterClasses,
        Set<String> tagsToInclude,
        Set<String> tagsToExclude,
        List<String> wildcardPackages,
        List<String> membersOnlyPackages,
        List<String> testWildcards,
        List<String> testNames,
        int threadCount,
        Duration sortingTimeout,
        Optional<SlowpokeSettings> slowpoke,
        Map<String, String> configMap
) {

    public static final Duration DEFAULT_SORTING_TIMEOUT = Duration.ofSeconds(2);

    public Configuration {
        customReporterClasses = List.copyOf(customReporterClasses);
        tagsToInclude = Set.copyOf(tagsToInclude);
        tagsToExclude = Set.copyOf(tagsToExclude);
        wildcardPackages = List.copyOf(wildcardPackages);
        membersOnlyPackages = List.copyOf(membersOnlyPackages);
        testWildcards = List.copyOf(testWildcards);
        testNames = List.copyOf(testNames);
        configMap = Map.copyOf(configMap);
    }

    public static Configuration defaults() {
        return new ConfigurationBuilder().build(new String[0]);
    }

    public TestFilter testFilter() {
        return new TestFilter(tagsToInclude, tagsToExclude);
    }

    /** Selectors contributed by {@code -z} and {@code -t}, in that order. */
    public List<Selector> testFilterSelectors() {
        List<Selector> selectors = new ArrayList<>();
        testWildcards.forEach(w -> selectors.add(new TestWildcardSelector(w)));
        testNames.forEach(n -> selectors.add(new TestSelector(n)));
        return selectors;
    }

    /**
     * Whether a suite with this qualified name passes the {@code -w}/{@code -m} package filters.
     * With neither option every suite passes; with both, a suite passing either one passes.
     */
    public boolean acceptsPackage(String qualifiedName) {
        if (wildcardPackages.isEmpty() && membersOnlyPackages.isEmpty()) {
            return true;
        }
        int lastDot = qualifiedName.lastIndexOf('.');
        String pkg = lastDot < 0 ? "" : qualifiedName.substring(0, lastDot);
        for (String wildcard : wildcardPackages) {
            if (pkg.equals(wildcard) || pkg.startsWith(wildcard + ".")) {
                return true;
            }
        }
        return membersOnlyPackages.contains(pkg);
    }
}
