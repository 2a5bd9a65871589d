package com.suitebridge.suite;

@FunctionalInterface
public interface TestBody {

    void run() throws Exception;
}
