package com.suitebridge.core.model;

import java.io.Serializable;

/**
 * Capability marker declared by a run request: how the host recognized the class as a suite.
 */
public sealed interface Fingerprint extends Serializable permits SubclassFingerprint, AnnotatedFingerprint {

    boolean isModule();
}
