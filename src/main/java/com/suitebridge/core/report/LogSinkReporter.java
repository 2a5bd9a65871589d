package com.suitebridge.core.report;

import com.suitebridge.core.config.PresentationConfig;
import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.report.EventLineFormatter.Line;
import com.suitebridge.dispatch.host.TaskLogger;

import java.util.List;

/**
 * Writes formatted event lines to the host loggers of one task execution.
 * <p>
 * Each logger gets its own formatter because ANSI support differs per logger.
 */
public class LogSinkReporter implements Reporter {

    private final List<TaskLogger> loggers;
    private final List<EventLineFormatter> formatters;

    public LogSinkReporter(PresentationConfig presentation, List<TaskLogger> loggers) {
        this.loggers = List.copyOf(loggers);
        this.formatters = this.loggers.stream()
                .map(logger -> new EventLineFormatter(presentation, logger.ansiCodesSupported()))
                .toList();
    }

    @Override
    public void apply(RunEvent event) {
        for (int i = 0; i < loggers.size(); i++) {
            TaskLogger logger = loggers.get(i);
            for (Line line : formatters.get(i).format(event)) {
                if (line.level() == EventLineFormatter.Level.ERROR) {
                    logger.error(line.text());
                } else {
                    logger.info(line.text());
                }
            }
        }
    }
}
