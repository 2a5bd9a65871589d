package com.suitebridge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Suitebridge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, String taskId, String suiteId) {
        MDC.put("runId", runId);
        MDC.put("taskId", taskId);
        MDC.put("suiteId", suiteId);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("taskId");
        MDC.remove("suiteId");
    }
}
