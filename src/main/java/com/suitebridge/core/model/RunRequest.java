package com.suitebridge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A host request to run (part of) one suite class.
 *
 * @param qualifiedName       fully qualified name of the suite class
 * @param fingerprint         how the host recognized the class
 * @param explicitlySpecified whether the user named this suite directly
 * @param selectors           OR-ed selections within the suite; empty means the entire suite
 */
public record RunRequest(
        String qualifiedName,
        Fingerprint fingerprint,
        boolean explicitlySpecified,
        List<Selector> selectors
) implements Serializable {

    public RunRequest {
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }

    public static RunRequest entireSuite(String qualifiedName, Fingerprint fingerprint, boolean explicitlySpecified) {
        return new RunRequest(qualifiedName, fingerprint, explicitlySpecified, List.of(new SuiteSelector()));
    }
}
