package com.suitebridge.fixtures;

import com.suitebridge.suite.FunSuite;

/**
 * Every outcome at top level and in two nested suites, plus a nested suite that aborts.
 */
public class SuiteWithFailedSkippedTests extends FunSuite {

    public SuiteWithFailedSkippedTests() {
        super(new MixedOutcomeSuite("nested 1"), new MixedOutcomeSuite("nested 2"), new AbortingSuite("nested 3"));
        test("success", () -> {});
        test("failed", () -> fail("top-level failure"));
        ignore("ignored", () -> {});
        test("pending", FunSuite::pending);
        test("canceled", () -> cancel("top-level cancel"));
        test("error", () -> {
            throw new IllegalStateException("top-level error");
        });
    }

    static class MixedOutcomeSuite extends FunSuite {

        private final String id;

        MixedOutcomeSuite(String id) {
            this.id = id;
            test(id + " success", () -> {});
            test(id + " failed", () -> fail(id + " failure"));
            ignore(id + " ignored", () -> {});
            test(id + " pending", FunSuite::pending);
            test(id + " canceled", () -> cancel(id + " cancel"));
        }

        @Override
        public String suiteId() {
            return id;
        }

        @Override
        public String suiteName() {
            return id;
        }
    }

    static class AbortingSuite extends FunSuite {

        private final String id;

        AbortingSuite(String id) {
            this.id = id;
            test(id + " never runs", () -> {});
        }

        @Override
        protected void beforeAll() {
            throw new IllegalStateException(id + " cannot start");
        }

        @Override
        public String suiteId() {
            return id;
        }

        @Override
        public String suiteName() {
            return id;
        }
    }
}
