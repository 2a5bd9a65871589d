package com.suitebridge.suite;

import java.util.Optional;

/**
 * Loads suite classes and creates suite instances.
 */
public interface SuiteFactory {

    /**
     * Loads a class by name, or returns empty when it cannot be loaded.
     */
    Optional<Class<?>> load(String qualifiedName);

    /** Public concrete {@link Suite} with a public no-arg constructor. */
    boolean isSubclassSuite(Class<?> suiteClass);

    /** Class annotated with {@link WrapWith}. */
    boolean isWrappedSuite(Class<?> suiteClass);

    /**
     * Creates a suite for {@code suiteClass}. Whatever the suite's constructor throws is
     * rethrown unwrapped.
     */
    Suite create(Class<?> suiteClass) throws Exception;
}
