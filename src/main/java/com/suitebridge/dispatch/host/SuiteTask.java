package com.suitebridge.dispatch.host;

import com.suitebridge.core.config.Configuration;
import com.suitebridge.core.events.DispatchReporter;
import com.suitebridge.core.events.EventTranslator;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteStarting;
import com.suitebridge.core.events.SuiteInfo;
import com.suitebridge.core.logging.MdcContext;
import com.suitebridge.core.model.RunRequest;
import com.suitebridge.core.report.LogSinkReporter;
import com.suitebridge.core.resolver.ResolvedUnits;
import com.suitebridge.suite.Args;
import com.suitebridge.suite.Suite;
import com.suitebridge.suite.SuiteConstructionException;
import com.suitebridge.suite.SuiteRunner;
import com.suitebridge.suite.SuiteTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * One admitted run request, ready to execute.
 * <p>
 * Execution constructs the suite, resolves the request's selectors against it and runs
 * it on the calling thread. Every event is translated and handed to the host as soon as
 * it is raised.
 */
public class SuiteTask {

    private static final Logger log = LoggerFactory.getLogger(SuiteTask.class);

    private static final SuiteTask[] NO_NESTED_TASKS = new SuiteTask[0];

    private final Runner runner;
    private final RunRequest request;
    private final Class<?> suiteClass;
    private final String taskId;
    private final Set<String> tags;

    SuiteTask(Runner runner, RunRequest request, Class<?> suiteClass, String taskId) {
        this.runner = runner;
        this.request = request;
        this.suiteClass = suiteClass;
        this.taskId = taskId;
        this.tags = Set.copyOf(SuiteTags.classTags(suiteClass));
    }

    public RunRequest request() {
        return request;
    }

    public String taskId() {
        return taskId;
    }

    /** Tags of the suite class and its superclasses. */
    public Set<String> tags() {
        return tags;
    }

    /**
     * Runs the task.
     *
     * @return nested tasks; always empty because nested suites run inside their parent
     * @throws SuiteConstructionException when the suite could not be created, after the
     *                                    suite-starting and suite-aborted events were reported;
     *                                    a {@link VirtualMachineError} is rethrown as is
     */
    public SuiteTask[] execute(EventHandler handler, TaskLogger... loggers) {
        Configuration configuration = runner.configuration();
        runner.inFlight().enter();
        MdcContext.setTask(runner.runId(), taskId, request.qualifiedName());
        long start = System.currentTimeMillis();
        try {
            log.info("Starting task {} for {}", taskId, request.qualifiedName());
            Suite suite;
            try {
                suite = runner.suiteFactory().create(suiteClass);
            } catch (Throwable t) {
                reportConstructionFailure(handler, loggers, t, System.currentTimeMillis() - start);
                if (t instanceof VirtualMachineError vmError) {
                    throw vmError;
                }
                throw new SuiteConstructionException("Unable to construct suite " + request.qualifiedName(), t);
            }

            DispatchReporter reporter = taskReporter(suite.suiteId(), handler, loggers);
            ResolvedUnits units = runner.resolver().resolve(request, suite);
            Args args = new Args(reporter, configuration.testFilter(), configuration.configMap(),
                    units.toSelection(suite.suiteId()));
            boolean completed = SuiteRunner.run(suite, args);
            log.info("Finished task {} for {} ({})", taskId, request.qualifiedName(),
                    completed ? "completed" : "aborted");
            return NO_NESTED_TASKS;
        } finally {
            runner.metrics().recordTaskDuration(request.qualifiedName(), System.currentTimeMillis() - start);
            MdcContext.clear();
            runner.inFlight().exit();
        }
    }

    private void reportConstructionFailure(EventHandler handler, TaskLogger[] loggers, Throwable cause, long elapsed) {
        log.error("Unable to construct suite {}: {}", request.qualifiedName(), cause.toString(), cause);
        SuiteInfo info = new SuiteInfo(suiteClass.getSimpleName(), suiteClass.getName(), suiteClass.getName());
        DispatchReporter reporter = taskReporter(info.suiteId(), handler, loggers);
        reporter.apply(new SuiteStarting(info));
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName() + " was thrown.";
        reporter.apply(new SuiteAborted(info, message, cause, elapsed));
    }

    private DispatchReporter taskReporter(String topLevelSuiteId, EventHandler handler, TaskLogger[] loggers) {
        EventTranslator translator = new EventTranslator(request, topLevelSuiteId);
        return new DispatchReporter(
                runner.dispatchReporter(),
                translator.forwardingTo(handler::handle),
                new LogSinkReporter(runner.configuration().logReporter(), List.of(loggers))
        );
    }

    @Override
    public String toString() {
        return "SuiteTask{" + taskId + ", " + request.qualifiedName() + "}";
    }
}
