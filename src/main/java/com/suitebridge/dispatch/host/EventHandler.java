package com.suitebridge.dispatch.host;

import com.suitebridge.core.model.StatusEvent;

/**
 * Host-side sink for status events. May be called from several workers at once.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(StatusEvent event);
}
