package com.suitebridge.dispatch.cli;

import com.suitebridge.core.model.RunRequest;
import com.suitebridge.core.model.RunSummary;
import com.suitebridge.dispatch.host.Framework;
import com.suitebridge.dispatch.host.Runner;
import com.suitebridge.dispatch.host.SuiteTask;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs suite classes from the classpath, acting as a minimal host.
 * <p>
 * Runner options are passed through with {@code --arg}, e.g.
 * {@code suitebridge --arg=-oD --arg=-P4 com.example.MathSuite}.
 */
@Command(
        name = "suitebridge",
        mixinStandardHelpOptions = true,
        version = "Suitebridge 0.1.0",
        description = "Runs test suites and prints their results"
)
public class SuitebridgeCommand implements Callable<Integer> {

    @Parameters(paramLabel = "SUITE", arity = "1..*", description = "Fully qualified suite class names")
    private List<String> suites = new ArrayList<>();

    @Option(names = {"-a", "--arg"}, paramLabel = "OPTION",
            description = "Runner option, repeatable (e.g. --arg=-oD --arg=-P4)")
    private List<String> runnerArgs = new ArrayList<>();

    @Option(names = "--discovered",
            description = "Treat suites as discovered rather than explicitly named (honors @DoNotDiscover)")
    private boolean discovered;

    @Option(names = "--quiet", description = "Do not print per-test status lines")
    private boolean quiet;

    private final Framework framework;

    public SuitebridgeCommand() {
        this(new Framework());
    }

    SuitebridgeCommand(Framework framework) {
        this.framework = framework;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Runner runner;
        try {
            runner = framework.runner(runnerArgs.toArray(new String[0]), new String[0],
                    Thread.currentThread().getContextClassLoader());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        List<RunRequest> requests = new ArrayList<>();
        for (String suite : suites) {
            requests.add(RunRequest.entireSuite(suite, Framework.SUITE_FINGERPRINT, !discovered));
        }

        List<Throwable> failures;
        try {
            SuiteTask[] tasks = runner.tasks(requests.toArray(new RunRequest[0]));
            ConsoleOutput.info("Running " + tasks.length + " suite" + (tasks.length != 1 ? "s" : ""));
            failures = runner.taskExecutor().executeAll(List.of(tasks),
                    event -> {
                        if (!quiet) {
                            ConsoleOutput.statusEvent(event);
                        }
                    },
                    ConsoleOutput.taskLogger());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            runner.done();
            return 2;
        }

        String report = runner.done();
        RunSummary summary = runner.summary();
        boolean passed = summary.allPassed() && failures.isEmpty();
        ConsoleOutput.summary(report, passed);
        return passed ? 0 : 1;
    }
}
