package com.suitebridge.core.report;

import com.suitebridge.core.config.SlowpokeSettings;
import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.events.RunEvent.AlertProvided;
import com.suitebridge.core.events.RunEvent.TestEvent;
import com.suitebridge.core.events.RunEvent.TestStarting;
import com.suitebridge.core.events.SuiteInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Raises an alert for each test that has been running longer than the configured delay.
 * <p>
 * Tracks test-starting events and forgets a test on its first terminal event. A daemon
 * thread checks every interval; once a test has been reported it is reported again on
 * later checks while it keeps running.
 */
public class SlowpokeDetector implements Reporter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlowpokeDetector.class);

    private final Reporter alerts;
    private final long delayMillis;
    private final Map<RunningTest, Long> running = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    /**
     * @param alerts   where alert events go, usually the run's dispatch reporter
     * @param settings {@code -W} delay and interval
     */
    public SlowpokeDetector(Reporter alerts, SlowpokeSettings settings) {
        this(alerts, settings.delaySeconds() * 1000L);
        scheduler.scheduleAtFixedRate(this::checkSafely,
                settings.intervalSeconds(), settings.intervalSeconds(), TimeUnit.SECONDS);
    }

    SlowpokeDetector(Reporter alerts, long delayMillis) {
        this.alerts = alerts;
        this.delayMillis = delayMillis;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "suitebridge-slowpoke");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void apply(RunEvent event) {
        if (event instanceof TestStarting e) {
            running.put(new RunningTest(e.suite(), e.testName()), e.timestamp());
        } else if (event instanceof TestEvent e) {
            running.remove(new RunningTest(e.suite(), e.testName()));
        }
    }

    /**
     * Emits an alert for every test running at least the delay at {@code nowMillis}.
     *
     * @return the alerts that were emitted
     */
    List<AlertProvided> check(long nowMillis) {
        List<AlertProvided> emitted = new ArrayList<>();
        running.forEach((test, startedAt) -> {
            long elapsed = nowMillis - startedAt;
            if (elapsed >= delayMillis) {
                AlertProvided alert = new AlertProvided(test.suite(),
                        "*** Test still running after " + elapsed / 1000 + " seconds: "
                                + test.suite().suiteName() + " " + test.testName());
                emitted.add(alert);
                alerts.apply(alert);
            }
        });
        return emitted;
    }

    int runningCount() {
        return running.size();
    }

    private void checkSafely() {
        try {
            check(System.currentTimeMillis());
        } catch (Exception e) {
            log.warn("Slow test check failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        running.clear();
    }

    private record RunningTest(SuiteInfo suite, String testName) {
    }
}
