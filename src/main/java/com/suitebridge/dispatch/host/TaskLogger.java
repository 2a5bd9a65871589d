package com.suitebridge.dispatch.host;

/**
 * Host-provided log sink handed to each task execution.
 */
public interface TaskLogger {

    boolean ansiCodesSupported();

    void error(String message);

    void warn(String message);

    void info(String message);

    void debug(String message);

    void trace(Throwable throwable);
}
