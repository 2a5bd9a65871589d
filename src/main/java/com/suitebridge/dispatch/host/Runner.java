package com.suitebridge.dispatch.host;

import com.suitebridge.core.config.ArgumentException;
import com.suitebridge.core.config.Configuration;
import com.suitebridge.core.events.DispatchReporter;
import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent.RunCompleted;
import com.suitebridge.core.events.RunEvent.RunStarting;
import com.suitebridge.core.logging.MdcContext;
import com.suitebridge.core.metrics.RunMetrics;
import com.suitebridge.core.model.RunRequest;
import com.suitebridge.core.model.RunSummary;
import com.suitebridge.core.remote.RemoteConfigCodec;
import com.suitebridge.core.report.SlowpokeDetector;
import com.suitebridge.core.report.StandardErrReporter;
import com.suitebridge.core.resolver.SelectorResolver;
import com.suitebridge.core.scheduler.InFlightTracker;
import com.suitebridge.core.scheduler.TaskExecutor;
import com.suitebridge.core.summary.DoubleCompletionException;
import com.suitebridge.core.summary.SummaryAggregator;
import com.suitebridge.suite.SuiteFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One run: turns requests into tasks, collects their events and renders the summary.
 * <p>
 * Created by {@link Framework#runner}. Tasks may execute concurrently on host threads or
 * through {@link #taskExecutor()}. {@link #done()} must be called exactly once, after
 * which the runner accepts no more requests.
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

    private final String runId;
    private final String[] args;
    private final Configuration configuration;
    private final SuiteFactory suiteFactory;
    private final SelectorResolver resolver;
    private final SummaryAggregator summary = new SummaryAggregator();
    private final RunMetrics metrics;
    private final DispatchReporter dispatchReporter;
    private final TaskExecutor taskExecutor;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final RemoteConfigCodec remoteConfigCodec = new RemoteConfigCodec();
    private final AtomicBoolean done = new AtomicBoolean(false);
    private final AtomicInteger taskCounter = new AtomicInteger();
    private final long startMillis = System.currentTimeMillis();

    Runner(String[] args, ClassLoader classLoader, Configuration configuration,
           SuiteFactory suiteFactory, MeterRegistry meterRegistry) {
        this.runId = String.format("RUN-%04d", RUN_COUNTER.incrementAndGet());
        this.args = args.clone();
        this.configuration = configuration;
        this.suiteFactory = suiteFactory;
        this.resolver = new SelectorResolver(suiteFactory, configuration);
        this.metrics = new RunMetrics(meterRegistry);
        this.taskExecutor = new TaskExecutor(configuration.threadCount());

        List<Reporter> reporters = new ArrayList<>();
        reporters.add(summary);
        reporters.add(metrics);
        configuration.stderrReporter().ifPresent(p -> reporters.add(new StandardErrReporter(p)));
        for (String className : configuration.customReporterClasses()) {
            reporters.add(instantiateReporter(className, classLoader));
        }
        this.dispatchReporter = new DispatchReporter(reporters);
        SlowpokeDetector slowpokeDetector = configuration.slowpoke()
                .map(settings -> new SlowpokeDetector(dispatchReporter, settings))
                .orElse(null);
        if (slowpokeDetector != null) {
            dispatchReporter.add(slowpokeDetector);
        }

        MdcContext.setRun(runId);
        try {
            log.info("Runner {} created with {} worker thread(s)", runId, configuration.threadCount());
        } finally {
            MdcContext.clear();
        }
        dispatchReporter.apply(new RunStarting(0));
    }

    public String runId() {
        return runId;
    }

    public String[] args() {
        return args.clone();
    }

    /**
     * Arguments to hand a forked runner so it reports the way this one does.
     */
    public String[] remoteArgs() {
        return remoteConfigCodec.encode(configuration);
    }

    /**
     * Creates one task per admitted request.
     *
     * @throws com.suitebridge.core.resolver.ResolutionException when an explicitly specified
     *                                                          request cannot run
     */
    public SuiteTask[] tasks(RunRequest... requests) {
        if (done.get()) {
            throw new IllegalStateException("Runner " + runId + " is already done");
        }
        List<SuiteTask> tasks = new ArrayList<>();
        for (RunRequest request : requests) {
            Optional<Class<?>> suiteClass = resolver.admit(request);
            if (suiteClass.isPresent()) {
                String taskId = String.format("%s-TASK-%03d", runId, taskCounter.incrementAndGet());
                tasks.add(new SuiteTask(this, request, suiteClass.get(), taskId));
            } else {
                metrics.recordDroppedRequest();
            }
        }
        log.debug("Runner {} created {} task(s) from {} request(s)", runId, tasks.size(), requests.length);
        return tasks.toArray(new SuiteTask[0]);
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    /** Counters collected so far. */
    public RunSummary summary() {
        return summary.snapshot();
    }

    /**
     * Completes the run and returns the summary report.
     * <p>
     * Waits up to the sorting timeout for in-flight tasks; tasks still running after that
     * are not aborted, their later events are simply not counted.
     *
     * @throws DoubleCompletionException when called more than once
     */
    public String done() {
        if (!done.compareAndSet(false, true)) {
            throw new DoubleCompletionException("done() has already been called on runner " + runId);
        }
        MdcContext.setRun(runId);
        try {
            try {
                if (!inFlight.awaitIdle(configuration.sortingTimeout())) {
                    log.warn("{} task(s) still running after {} ms, completing anyway",
                            inFlight.active(), configuration.sortingTimeout().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for in-flight tasks of runner {}", runId);
            }
            long elapsed = System.currentTimeMillis() - startMillis;
            dispatchReporter.apply(new RunCompleted(elapsed));
            taskExecutor.close();
            String report = summary.complete(configuration.logReporter(), elapsed);
            dispatchReporter.close();
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    public boolean isDone() {
        return done.get();
    }

    // -- Collaborators used by SuiteTask --------------------------------------

    Configuration configuration() {
        return configuration;
    }

    SuiteFactory suiteFactory() {
        return suiteFactory;
    }

    SelectorResolver resolver() {
        return resolver;
    }

    DispatchReporter dispatchReporter() {
        return dispatchReporter;
    }

    RunMetrics metrics() {
        return metrics;
    }

    InFlightTracker inFlight() {
        return inFlight;
    }

    private static Reporter instantiateReporter(String className, ClassLoader classLoader) {
        try {
            Class<?> reporterClass = Class.forName(className, true, classLoader);
            if (!Reporter.class.isAssignableFrom(reporterClass)) {
                throw new ArgumentException("Custom reporter " + className + " does not implement "
                        + Reporter.class.getName());
            }
            return (Reporter) reporterClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new ArgumentException("Unable to instantiate custom reporter " + className
                    + ": " + e.getMessage(), e);
        }
    }
}
