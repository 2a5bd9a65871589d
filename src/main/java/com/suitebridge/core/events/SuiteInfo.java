package com.suitebridge.core.events;

/**
 * Identity of the suite an event belongs to.
 *
 * @param suiteName      display name, usually the simple class name
 * @param suiteId        unique id; top-level suites use their class name
 * @param suiteClassName class that implements the suite
 */
public record SuiteInfo(String suiteName, String suiteId, String suiteClassName) {
}
