package com.suitebridge.core.remote;

import com.suitebridge.core.config.Configuration;
import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.config.PresentationFlag;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Reporter settings a forked runner inherits from the runner that spawned it.
 */
public record RemoteConfiguration(
        Set<PresentationFlag> logReporterFlags,
        boolean stderrReporterEnabled,
        Set<PresentationFlag> stderrReporterFlags,
        long sortingTimeoutMillis
) {

    public RemoteConfiguration {
        logReporterFlags = logReporterFlags == null ? Set.of() : Set.copyOf(logReporterFlags);
        stderrReporterFlags = stderrReporterFlags == null ? Set.of() : Set.copyOf(stderrReporterFlags);
    }

    public static RemoteConfiguration from(Configuration configuration) {
        return new RemoteConfiguration(
                configuration.logReporter().flags(),
                configuration.stderrReporter().isPresent(),
                configuration.stderrReporter().map(PresentationConfig::flags).orElse(Set.of()),
                configuration.sortingTimeout().toMillis()
        );
    }

    /**
     * Copy of {@code configuration} with these reporter settings in place of its own.
     */
    public Configuration applyTo(Configuration configuration) {
        return new Configuration(
                new PresentationConfig(logReporterFlags),
                stderrReporterEnabled ? Optional.of(new PresentationConfig(stderrReporterFlags)) : Optional.empty(),
                configuration.customReporterClasses(),
                configuration.tagsToInclude(),
                configuration.tagsToExclude(),
                configuration.wildcardPackages(),
                configuration.membersOnlyPackages(),
                configuration.testWildcards(),
                configuration.testNames(),
                configuration.threadCount(),
                Duration.ofMillis(sortingTimeoutMillis),
                configuration.slowpoke(),
                configuration.configMap()
        );
    }
}
