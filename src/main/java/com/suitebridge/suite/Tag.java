package com.suitebridge.suite;

/**
 * Label attached to a single test, matched by {@code -n} and {@code -l}.
 */
public record Tag(String name) {

    public static Tag of(String name) {
        return new Tag(name);
    }
}
