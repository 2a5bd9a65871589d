package com.suitebridge.fixtures;

import com.suitebridge.suite.DoNotDiscover;
import com.suitebridge.suite.FunSuite;

@DoNotDiscover
public class DoNotDiscoverSuite extends FunSuite {

    public DoNotDiscoverSuite() {
        test("test 1", () -> {});
        test("test 2", () -> {});
        test("test 3", () -> {});
    }
}
