package com.suitebridge.core.report;

import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.report.EventLineFormatter.Line;

import java.io.PrintStream;

/**
 * Reporter enabled by {@code -e}: prints formatted event lines to standard error.
 */
public class StandardErrReporter implements Reporter {

    private final PrintStream out;
    private final EventLineFormatter formatter;

    public StandardErrReporter(PresentationConfig presentation) {
        this(presentation, System.err);
    }

    public StandardErrReporter(PresentationConfig presentation, PrintStream out) {
        this.out = out;
        this.formatter = new EventLineFormatter(presentation, System.console() != null);
    }

    @Override
    public void apply(RunEvent event) {
        for (Line line : formatter.format(event)) {
            synchronized (out) {
                out.println(line.text());
            }
        }
    }
}
