package com.suitebridge.core.model;

/**
 * Recognizes suites by their supertype.
 */
public record SubclassFingerprint(
        String superclassName,
        boolean isModule,
        boolean requireNoArgConstructor
) implements Fingerprint {
}
