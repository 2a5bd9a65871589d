package com.suitebridge.core.model;

/**
 * Recognizes suites by a class-level annotation.
 */
public record AnnotatedFingerprint(
        String annotationName,
        boolean isModule
) implements Fingerprint {
}
