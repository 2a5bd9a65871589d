package com.suitebridge.core.model;

/**
 * Selects the entire suite.
 */
public record SuiteSelector() implements Selector {
}
