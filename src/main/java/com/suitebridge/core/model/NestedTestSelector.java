package com.suitebridge.core.model;

/**
 * Selects one test inside the nested suite with the given id.
 */
public record NestedTestSelector(String suiteId, String testName) implements Selector {
}
