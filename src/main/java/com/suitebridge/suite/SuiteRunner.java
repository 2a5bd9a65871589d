package com.suitebridge.suite;

import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent.SuiteAborted;
import com.suitebridge.core.events.RunEvent.SuiteCompleted;
import com.suitebridge.core.events.RunEvent.SuiteStarting;
import com.suitebridge.core.events.SuiteInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a suite between a suite-starting event and either suite-completed or suite-aborted.
 */
public final class SuiteRunner {

    private static final Logger log = LoggerFactory.getLogger(SuiteRunner.class);

    private SuiteRunner() {}

    public static SuiteInfo infoOf(Suite suite) {
        return new SuiteInfo(suite.suiteName(), suite.suiteId(), suite.getClass().getName());
    }

    /**
     * @return true if the suite completed, false if it aborted
     */
    public static boolean run(Suite suite, Args args) {
        SuiteInfo info = infoOf(suite);
        Reporter reporter = args.reporter();
        reporter.apply(new SuiteStarting(info));
        long start = System.currentTimeMillis();
        try {
            suite.run(args);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Suite {} aborted: {}", info.suiteId(), t.toString());
            reporter.apply(new SuiteAborted(info, abortMessage(t), t, elapsed));
            return false;
        }
        reporter.apply(new SuiteCompleted(info, System.currentTimeMillis() - start));
        return true;
    }

    static String abortMessage(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isEmpty() ? t.getClass().getName() + " was thrown." : message;
    }
}
