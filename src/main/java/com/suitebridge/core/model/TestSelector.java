package com.suitebridge.core.model;

/**
 * Selects one top-level test by exact name.
 */
public record TestSelector(String testName) implements Selector {
}
