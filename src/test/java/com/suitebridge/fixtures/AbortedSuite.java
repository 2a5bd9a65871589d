package com.suitebridge.fixtures;

import com.suitebridge.suite.FunSuite;

/**
 * Has no tests of its own; its only nested suite aborts in {@code beforeAll}.
 */
public class AbortedSuite extends FunSuite {

    public AbortedSuite() {
        super(new SuiteWithFailedSkippedTests.AbortingSuite("aborting nested"));
    }
}
