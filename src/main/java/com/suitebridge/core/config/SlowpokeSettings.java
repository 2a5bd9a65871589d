package com.suitebridge.core.config;

/**
 * Settings from {@code -W <delay> <interval>}, both in seconds.
 */
public record SlowpokeSettings(long delaySeconds, long intervalSeconds) {
}
