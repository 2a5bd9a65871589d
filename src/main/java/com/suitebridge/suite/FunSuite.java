package com.suitebridge.suite;

import com.suitebridge.core.events.Reporter;
import com.suitebridge.core.events.RunEvent.AlertProvided;
import com.suitebridge.core.events.RunEvent.InfoProvided;
import com.suitebridge.core.events.RunEvent.NoteProvided;
import com.suitebridge.core.events.RunEvent.TestCanceled;
import com.suitebridge.core.events.RunEvent.TestFailed;
import com.suitebridge.core.events.RunEvent.TestIgnored;
import com.suitebridge.core.events.RunEvent.TestPending;
import com.suitebridge.core.events.RunEvent.TestSkipped;
import com.suitebridge.core.events.RunEvent.TestStarting;
import com.suitebridge.core.events.RunEvent.TestSucceeded;
import com.suitebridge.core.events.SuiteInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base class for suites that register named tests in their constructor.
 * <p>
 * Nested suites run first, in declared order, each wrapped by {@link SuiteRunner}.
 * Selected tests follow in declared order. A test body that throws
 * {@link TestCanceledException}, {@link TestPendingException} or {@link TestSkippedException}
 * is reported as such; any other throwable fails the test. Exceptions from the
 * {@code before}/{@code after} hooks propagate and abort the suite.
 *
 * <pre>{@code
 * public class MathSuite extends FunSuite {
 *     public MathSuite() {
 *         test("addition", () -> assertTrue(1 + 1 == 2));
 *         test("slow", () -> Thread.sleep(500), Tag.of("SlowTest"));
 *     }
 * }
 * }</pre>
 */
public abstract class FunSuite implements Suite {

    private final Map<String, RegisteredTest> tests = new LinkedHashMap<>();
    private final List<Suite> nested = new ArrayList<>();

    private Args runArgs;

    protected FunSuite(Suite... nestedSuites) {
        nested.addAll(Arrays.asList(nestedSuites));
    }

    // -- Registration --------------------------------------------------------

    protected final void test(String name, TestBody body, Tag... tags) {
        register(name, body, false, tags);
    }

    protected final void ignore(String name, TestBody body, Tag... tags) {
        register(name, body, true, tags);
    }

    protected final void nestedSuite(Suite suite) {
        nested.add(suite);
    }

    private void register(String name, TestBody body, boolean ignored, Tag... tags) {
        if (tests.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate test name: " + name);
        }
        Set<String> tagNames = Arrays.stream(tags).map(Tag::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        tests.put(name, new RegisteredTest(name, body, ignored, tagNames));
    }

    // -- Hooks ---------------------------------------------------------------

    protected void beforeAll() throws Exception {
    }

    protected void afterAll() throws Exception {
    }

    protected void beforeEach(String testName) throws Exception {
    }

    protected void afterEach(String testName) throws Exception {
    }

    // -- Suite ---------------------------------------------------------------

    @Override
    public List<String> testNames() {
        return List.copyOf(tests.keySet());
    }

    @Override
    public Map<String, Set<String>> testTags() {
        Set<String> classTags = SuiteTags.classTags(getClass());
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (RegisteredTest test : tests.values()) {
            Set<String> all = new LinkedHashSet<>(test.tags());
            all.addAll(classTags);
            result.put(test.name(), all);
        }
        return result;
    }

    @Override
    public List<Suite> nestedSuites() {
        return List.copyOf(nested);
    }

    @Override
    public void run(Args args) throws Exception {
        runArgs = args;
        try {
            beforeAll();
            for (Suite suite : nested) {
                args.selection().nestedSuite(suite.suiteId())
                        .ifPresent(selection -> SuiteRunner.run(suite, args.withSelection(selection)));
            }
            Map<String, Set<String>> tags = testTags();
            for (RegisteredTest test : tests.values()) {
                if (args.selection().includesTest(test.name()) && args.filter().accepts(tags.get(test.name()))) {
                    runTest(test, args.reporter());
                }
            }
            afterAll();
        } finally {
            runArgs = null;
        }
    }

    private void runTest(RegisteredTest test, Reporter reporter) throws Exception {
        SuiteInfo info = SuiteRunner.infoOf(this);
        if (test.ignored()) {
            reporter.apply(new TestIgnored(info, test.name()));
            return;
        }
        beforeEach(test.name());
        reporter.apply(new TestStarting(info, test.name()));
        long start = System.currentTimeMillis();
        try {
            test.body().run();
            reporter.apply(new TestSucceeded(info, test.name(), System.currentTimeMillis() - start));
        } catch (TestCanceledException e) {
            reporter.apply(new TestCanceled(info, test.name(), e, System.currentTimeMillis() - start));
        } catch (TestPendingException e) {
            reporter.apply(new TestPending(info, test.name(), System.currentTimeMillis() - start));
        } catch (TestSkippedException e) {
            reporter.apply(new TestSkipped(info, test.name(), e.getMessage(), System.currentTimeMillis() - start));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            reporter.apply(new TestFailed(info, test.name(), t, System.currentTimeMillis() - start));
        }
        afterEach(test.name());
    }

    // -- Helpers for test bodies ---------------------------------------------

    protected static void fail() {
        throw new TestFailedException(null);
    }

    protected static void fail(String message) {
        throw new TestFailedException(message);
    }

    protected static void cancel() {
        throw new TestCanceledException(null);
    }

    protected static void cancel(String message) {
        throw new TestCanceledException(message);
    }

    protected static void pending() {
        throw new TestPendingException("Test is pending");
    }

    protected static void skip(String reason) {
        throw new TestSkippedException(reason);
    }

    protected static void assertTrue(boolean condition) {
        if (!condition) {
            throw new TestFailedException("Expected true but got false");
        }
    }

    protected static void assertEquals(Object expected, Object actual) {
        if (expected == null ? actual != null : !expected.equals(actual)) {
            throw new TestFailedException("Expected " + expected + " but got " + actual);
        }
    }

    protected final void alert(String message) {
        currentArgs().reporter().apply(new AlertProvided(SuiteRunner.infoOf(this), message));
    }

    protected final void note(String message) {
        currentArgs().reporter().apply(new NoteProvided(SuiteRunner.infoOf(this), message));
    }

    protected final void info(String message) {
        currentArgs().reporter().apply(new InfoProvided(SuiteRunner.infoOf(this), message));
    }

    /** The config map of the current run, built from {@code -D} entries. */
    protected final Map<String, String> configMap() {
        return currentArgs().configMap();
    }

    private Args currentArgs() {
        if (runArgs == null) {
            throw new IllegalStateException("Suite " + suiteName() + " is not running");
        }
        return runArgs;
    }

    private record RegisteredTest(String name, TestBody body, boolean ignored, Set<String> tags) {
    }
}
