package com.suitebridge.core.model;

/**
 * Selects every test of the nested suite with the given id.
 */
public record NestedSuiteSelector(String suiteId) implements Selector {
}
