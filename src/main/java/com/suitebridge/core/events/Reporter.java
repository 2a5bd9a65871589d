package com.suitebridge.core.events;

/**
 * Receives run events.
 * <p>
 * Implementations may be called from several worker threads at once. Reporters that
 * also implement {@link AutoCloseable} are closed when the run completes.
 */
@FunctionalInterface
public interface Reporter {

    void apply(RunEvent event);
}
