package com.suitebridge.core.scheduler;

import java.time.Duration;

/**
 * Counts tasks currently executing so completion can wait for them to drain.
 */
public class InFlightTracker {

    private int active;

    public synchronized void enter() {
        active++;
    }

    public synchronized void exit() {
        active--;
        if (active <= 0) {
            active = 0;
            notifyAll();
        }
    }

    public synchronized int active() {
        return active;
    }

    /**
     * Waits until no task is in flight or the timeout elapses.
     *
     * @return true if idle, false if the timeout elapsed first
     */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (active > 0) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }
}
