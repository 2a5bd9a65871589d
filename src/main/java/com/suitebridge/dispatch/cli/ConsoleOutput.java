package com.suitebridge.dispatch.cli;

import com.suitebridge.core.model.NestedSuiteSelector;
import com.suitebridge.core.model.NestedTestSelector;
import com.suitebridge.core.model.Selector;
import com.suitebridge.core.model.StatusEvent;
import com.suitebridge.core.model.TestSelector;
import com.suitebridge.dispatch.host.TaskLogger;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Suitebridge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SUITEBRIDGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SUITEBRIDGE]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static synchronized void statusEvent(StatusEvent event) {
        String status = switch (event.status()) {
            case SUCCESS -> "@|fg(green) PASS|@";
            case FAILURE -> "@|fg(red) FAIL|@";
            case ERROR -> "@|fg(red),bold ERROR|@";
            case CANCELED -> "@|fg(yellow) CANCELED|@";
            case IGNORED -> "@|fg(yellow) IGNORED|@";
            case PENDING -> "@|fg(yellow) PENDING|@";
            case SKIPPED -> "@|fg(yellow) SKIPPED|@";
        };
        String duration = event.duration() >= 0 ? " (" + event.duration() + "ms)" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + event.fullyQualifiedName() + " " + describe(event.selector()) + duration));
    }

    public static void summary(String report, boolean passed) {
        System.out.println("──────────────────────────────────");
        String color = passed ? "fg(green)" : "fg(red)";
        for (String line : report.split("\n")) {
            if (line.startsWith("***") || line.startsWith("All tests passed")) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold," + color + " " + line + "|@"));
            } else {
                System.out.println(line);
            }
        }
    }

    /**
     * Logger that writes engine log lines to standard out.
     */
    public static TaskLogger taskLogger() {
        return new TaskLogger() {
            @Override
            public boolean ansiCodesSupported() {
                return CommandLine.Help.Ansi.AUTO.enabled();
            }

            @Override
            public void error(String message) {
                System.out.println(message);
            }

            @Override
            public void warn(String message) {
                System.out.println(message);
            }

            @Override
            public void info(String message) {
                System.out.println(message);
            }

            @Override
            public void debug(String message) {
            }

            @Override
            public void trace(Throwable throwable) {
                throwable.printStackTrace(System.out);
            }
        };
    }

    private static String describe(Selector selector) {
        if (selector instanceof TestSelector s) {
            return "\"" + s.testName() + "\"";
        }
        if (selector instanceof NestedTestSelector s) {
            return "[" + s.suiteId() + "] \"" + s.testName() + "\"";
        }
        if (selector instanceof NestedSuiteSelector s) {
            return "[" + s.suiteId() + "]";
        }
        return "(suite)";
    }
}
