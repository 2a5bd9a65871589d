package com.suitebridge.dispatch.host;

import com.suitebridge.core.config.Configuration;
import com.suitebridge.core.config.ConfigurationBuilder;
import com.suitebridge.core.model.AnnotatedFingerprint;
import com.suitebridge.core.model.Fingerprint;
import com.suitebridge.core.model.SubclassFingerprint;
import com.suitebridge.suite.ReflectiveSuiteFactory;
import com.suitebridge.suite.Suite;
import com.suitebridge.suite.WrapWith;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Entry point a build tool loads to run suites.
 */
public class Framework {

    public static final String NAME = "Suitebridge";

    /** Public concrete subclasses of {@link Suite} with a no-arg constructor. */
    public static final SubclassFingerprint SUITE_FINGERPRINT =
            new SubclassFingerprint(Suite.class.getName(), false, true);

    /** Classes annotated with {@link WrapWith}. */
    public static final AnnotatedFingerprint WRAP_WITH_FINGERPRINT =
            new AnnotatedFingerprint(WrapWith.class.getName(), false);

    private final MeterRegistry meterRegistry;
    private final ConfigurationBuilder configurationBuilder = new ConfigurationBuilder();

    public Framework() {
        this(new SimpleMeterRegistry());
    }

    public Framework(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public String name() {
        return NAME;
    }

    public Fingerprint[] fingerprints() {
        return new Fingerprint[]{SUITE_FINGERPRINT, WRAP_WITH_FINGERPRINT};
    }

    /**
     * Creates a runner.
     *
     * @param args       runner options
     * @param remoteArgs settings from a parent runner when this one is forked, otherwise empty
     * @param loader     class loader the suites are loaded through
     * @throws com.suitebridge.core.config.ArgumentException when the options are invalid
     */
    public Runner runner(String[] args, String[] remoteArgs, ClassLoader loader) {
        Configuration configuration = configurationBuilder.build(args, remoteArgs);
        return new Runner(args, loader, configuration, new ReflectiveSuiteFactory(loader), meterRegistry);
    }
}
