package com.suitebridge.core.model;

/**
 * Selects every top-level test whose name contains {@code testWildcard}.
 */
public record TestWildcardSelector(String testWildcard) implements Selector {
}
