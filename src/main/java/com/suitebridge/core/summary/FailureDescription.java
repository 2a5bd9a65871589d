package com.suitebridge.core.summary;

import java.util.List;

/**
 * One-line description of a test failure: the throwable's message, or
 * {@code "<class> was thrown."} when it has none, followed by the source location of the
 * first stack frame outside the engine and the JDK.
 */
public final class FailureDescription {

    private static final List<String> FRAMEWORK_PACKAGES = List.of(
            "com.suitebridge.core.",
            "com.suitebridge.suite.",
            "com.suitebridge.dispatch.",
            "java.",
            "javax.",
            "jdk.",
            "sun."
    );

    private FailureDescription() {}

    public static String of(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        String message = throwable.getMessage();
        String text = message == null || message.isEmpty()
                ? throwable.getClass().getName() + " was thrown."
                : message;
        String location = location(throwable);
        return location.isEmpty() ? text : text + " (" + location + ")";
    }

    /**
     * {@code File.java:line} of the first user frame, or an empty string if there is none.
     */
    public static String location(Throwable throwable) {
        for (StackTraceElement frame : throwable.getStackTrace()) {
            if (isFrameworkFrame(frame.getClassName())) {
                continue;
            }
            if (frame.getFileName() == null || frame.getLineNumber() < 0) {
                return "";
            }
            return frame.getFileName() + ":" + frame.getLineNumber();
        }
        return "";
    }

    private static boolean isFrameworkFrame(String className) {
        return FRAMEWORK_PACKAGES.stream().anyMatch(className::startsWith);
    }
}
