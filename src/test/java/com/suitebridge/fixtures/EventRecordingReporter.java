package com.suitebridge.fixtures;

import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Custom reporter for {@code -C}: records every event it sees.
 */
public class EventRecordingReporter implements Reporter, AutoCloseable {

    private final List<RunEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    @Override
    public void apply(RunEvent event) {
        events.add(event);
    }

    public <T extends RunEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
