package com.suitebridge.core.report;

import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.config.PresentationFlag;
import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.events.RunEvent.AlertProvided;
import com.suitebridge.core.events.RunEvent.InfoProvided;
import com.suitebridge.core.events.RunEvent.MessageEvent;
import com.suitebridge.core.events.RunEvent.NoteProvided;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteCompleted;
import com.suitebridge.core.events.RunEvent.SuiteStarting;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestPending;
import com.suitebridge.core.events.RunEvent.TestSkipped;
import com.suitebridge.core.events.RunEvent.TestStarting;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import com.suitebridge.core.summary.DurationText;
import com.suitebridge.core.summary.FailureDescription;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders run events as the text lines shown by the log-sink and stderr reporters.
 * <p>
 * Filter flags ({@code N C X E H L O}) drop whole events. Colors use picocli's ANSI
 * markup and are only applied when requested and supported by the target.
 */
public class EventLineFormatter {

    /** Number of stack frames printed with {@code S}. */
    static final int SHORT_STACK_DEPTH = 10;

    public enum Level { INFO, ERROR }

    public record Line(Level level, String text) {
    }

    private final PresentationConfig presentation;
    private final CommandLine.Help.Ansi ansi;

    public EventLineFormatter(PresentationConfig presentation, boolean ansiSupported) {
        this.presentation = presentation;
        this.ansi = presentation.presentInColor() && ansiSupported
                ? CommandLine.Help.Ansi.ON
                : CommandLine.Help.Ansi.OFF;
    }

    public List<Line> format(RunEvent event) {
        List<Line> lines = new ArrayList<>();
        if (event instanceof SuiteStarting e) {
            if (!presentation.has(PresentationFlag.FILTER_SUITE_STARTING)) {
                lines.add(info("green", e.suite().suiteName() + ":"));
            }
        } else if (event instanceof SuiteCompleted e) {
            if (!presentation.has(PresentationFlag.FILTER_SUITE_COMPLETED) && presentation.presentAllDurations()) {
                lines.add(info("green", e.suite().suiteName() + " completed" + duration(e.durationMs())));
            }
        } else if (event instanceof SuiteAborted e) {
            lines.add(error("*** ABORTED *** " + e.suite().suiteName() + ": " + e.message()));
            addStackTrace(lines, e.throwable());
        } else if (event instanceof TestStarting e) {
            if (presentation.presentUnformatted() && !presentation.has(PresentationFlag.FILTER_TEST_STARTING)) {
                lines.add(info("green", "Test starting: " + e.testName()));
            }
        } else if (event instanceof TestSucceeded e) {
            if (!presentation.has(PresentationFlag.FILTER_TEST_SUCCEEDED)) {
                lines.add(info("green", "- " + e.testName() + duration(e.durationMs())));
            }
        } else if (event instanceof TestFailed e) {
            lines.add(error("- " + e.testName() + " *** FAILED ***" + duration(e.durationMs())));
            lines.add(error("  " + FailureDescription.of(e.throwable())));
            addStackTrace(lines, e.throwable());
        } else if (event instanceof TestCanceled e) {
            lines.add(info("yellow", "- " + e.testName() + " !!! CANCELED !!!" + duration(e.durationMs())));
            lines.add(info("yellow", "  " + FailureDescription.of(e.throwable())));
        } else if (event instanceof TestIgnored e) {
            if (!presentation.has(PresentationFlag.FILTER_TEST_IGNORED)) {
                lines.add(info("yellow", "- " + e.testName() + " !!! IGNORED !!!"));
            }
        } else if (event instanceof TestPending e) {
            if (!presentation.has(PresentationFlag.FILTER_TEST_PENDING)) {
                lines.add(info("yellow", "- " + e.testName() + " (pending)"));
            }
        } else if (event instanceof TestSkipped e) {
            lines.add(info("yellow", "- " + e.testName() + " !!! SKIPPED !!!"));
        } else if (event instanceof AlertProvided || event instanceof NoteProvided) {
            lines.add(info("yellow", "  + " + ((MessageEvent) event).message() + " "));
        } else if (event instanceof InfoProvided e) {
            if (!presentation.has(PresentationFlag.FILTER_INFO_PROVIDED)) {
                lines.add(info("green", "  + " + e.message() + " "));
            }
        }
        return lines;
    }

    private void addStackTrace(List<Line> lines, Throwable throwable) {
        if (throwable == null || !presentation.presentShortStackTraces()) {
            return;
        }
        StackTraceElement[] frames = throwable.getStackTrace();
        int depth = presentation.presentFullStackTraces() ? frames.length : Math.min(SHORT_STACK_DEPTH, frames.length);
        for (int i = 0; i < depth; i++) {
            lines.add(error("  at " + frames[i]));
        }
        if (depth < frames.length) {
            lines.add(error("  ..."));
        }
    }

    private String duration(long durationMs) {
        return presentation.presentAllDurations() ? " (" + DurationText.format(durationMs) + ")" : "";
    }

    private Line info(String color, String text) {
        return new Line(Level.INFO, colored(color, text));
    }

    private Line error(String text) {
        return new Line(Level.ERROR, colored("red", text));
    }

    private String colored(String color, String text) {
        if (ansi == CommandLine.Help.Ansi.OFF) {
            return text;
        }
        return ansi.string("@|fg(" + color + ") " + text + "|@");
    }
}
