package com.suitebridge.suite;

import com.suitebridge.core.events.RunEvent;
import com.suitebridge.core.events.RunEvent.AlertProvided;
import com.suitebridge.core.events.RunEvent.InfoProvided;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FunSuiteTest {

    private final List<RunEvent> events = new ArrayList<>();

    private Args args() {
        return new Args(events::add, TestFilter.acceptAll(), Map.of(), Selection.entireSuite());
    }

    private List<String> eventNames() {
        return events.stream().map(e -> e.getClass().getSimpleName()).toList();
    }

    // -- Suites under test ----------------------------------------------------

    static class OutcomeSuite extends FunSuite {
        final List<String> hooks = new ArrayList<>();

        OutcomeSuite() {
            test("passes", () -> {});
            test("fails", () -> assertEquals(2, 3));
            test("errors", () -> {
                throw new IllegalStateException("boom");
            });
            test("cancels", () -> cancel("no network"));
            test("pends", FunSuite::pending);
            test("skips", () -> skip("not on this platform"));
            ignore("ignored", () -> {
                throw new AssertionError("never runs");
            });
        }

        @Override
        protected void beforeAll() {
            hooks.add("beforeAll");
        }

        @Override
        protected void beforeEach(String testName) {
            hooks.add("before " + testName);
        }

        @Override
        protected void afterEach(String testName) {
            hooks.add("after " + testName);
        }

        @Override
        protected void afterAll() {
            hooks.add("afterAll");
        }
    }

    static class TaggedSuite extends FunSuite {
        TaggedSuite() {
            test("fast", () -> {});
            test("slow", () -> {}, Tag.of("SlowTest"));
            test("network", () -> {}, Tag.of("SlowTest"), Tag.of("Network"));
        }
    }

    static class Inner extends FunSuite {
        private final String id;

        Inner(String id) {
            this.id = id;
            test(id + " a", () -> {});
            test(id + " b", () -> {});
        }

        @Override
        public String suiteId() {
            return id;
        }
    }

    static class Outer extends FunSuite {
        Outer() {
            super(new Inner("one"));
            nestedSuite(new Inner("two"));
            test("top", () -> {});
        }
    }

    static class MessagingSuite extends FunSuite {
        MessagingSuite() {
            test("talks", () -> {
                alert("alert " + configMap().get("k"));
                note("note");
                info("info");
            });
        }

        void alertOutsideRun() {
            alert("too early");
        }
    }

    // -- Outcomes -------------------------------------------------------------

    @Nested
    @DisplayName("test outcomes")
    class Outcomes {

        @Test
        @DisplayName("each body outcome becomes its own event")
        void outcomes() throws Exception {
            new OutcomeSuite().run(args());

            assertEquals(List.of(
                    "TestStarting", "TestSucceeded",
                    "TestStarting", "TestFailed",
                    "TestStarting", "TestFailed",
                    "TestStarting", "TestCanceled",
                    "TestStarting", "TestPending",
                    "TestStarting", "TestSkipped",
                    "TestIgnored"), eventNames());

            var failed = events.stream().filter(TestFailed.class::isInstance).map(TestFailed.class::cast).toList();
            assertInstanceOf(TestFailedException.class, failed.get(0).throwable());
            assertEquals("Expected 2 but got 3", failed.get(0).throwable().getMessage());
            assertInstanceOf(IllegalStateException.class, failed.get(1).throwable());

            var skipped = events.stream().filter(TestSkipped.class::isInstance).map(TestSkipped.class::cast).findFirst();
            assertEquals("not on this platform", skipped.orElseThrow().reason());
            assertTrue(events.stream().anyMatch(TestCanceled.class::isInstance));
            assertTrue(events.stream().anyMatch(TestPending.class::isInstance));
            assertTrue(events.stream().anyMatch(TestSucceeded.class::isInstance));
        }

        @Test
        @DisplayName("hooks wrap every test that runs, ignored tests get none")
        void hooks() throws Exception {
            var suite = new OutcomeSuite();
            suite.run(args());

            assertEquals("beforeAll", suite.hooks.get(0));
            assertEquals("before passes", suite.hooks.get(1));
            assertEquals("after passes", suite.hooks.get(2));
            assertEquals("afterAll", suite.hooks.get(suite.hooks.size() - 1));
            assertFalse(suite.hooks.contains("before ignored"));
            assertEquals(2 + 2 * 6, suite.hooks.size());
        }

        @Test
        @DisplayName("registering a duplicate name fails")
        void duplicateName() {
            class Duplicate extends FunSuite {
                Duplicate() {
                    test("same", () -> {});
                    test("same", () -> {});
                }
            }
            assertThrows(IllegalArgumentException.class, Duplicate::new);
        }
    }

    // -- Selection and filtering ----------------------------------------------

    @Nested
    @DisplayName("selection and filtering")
    class Selecting {

        private List<String> succeeded() {
            return events.stream().filter(TestSucceeded.class::isInstance)
                    .map(e -> ((TestSucceeded) e).testName()).toList();
        }

        @Test
        @DisplayName("nested suites run first, each wrapped in suite events")
        void nestedFirst() throws Exception {
            var suite = new Outer();
            assertEquals(List.of("top"), suite.testNames());
            assertEquals(2, suite.nestedSuites().size());

            suite.run(args());

            assertEquals(List.of("one a", "one b", "two a", "two b", "top"), succeeded());
            assertEquals(2, events.stream().filter(SuiteStarting.class::isInstance).count());
            assertEquals(2, events.stream().filter(SuiteCompleted.class::isInstance).count());
        }

        @Test
        @DisplayName("only selected tests and nested suites run")
        void selection() throws Exception {
            var selection = Selection.of(Set.of("top"), Map.of("two", Selection.of(Set.of("two b"), Map.of())));

            new Outer().run(args().withSelection(selection));

            assertEquals(List.of("two b", "top"), succeeded());
        }

        @Test
        @DisplayName("tags merge with class tags and drive the filter")
        void tags() throws Exception {
            var suite = new TaggedSuite();
            assertEquals(Set.of("SlowTest", "Network"), suite.testTags().get("network"));

            suite.run(new Args(events::add, new TestFilter(Set.of("SlowTest"), Set.of("Network")), Map.of(), null));

            assertEquals(List.of("slow"), succeeded());
        }
    }

    // -- Messages and failures ------------------------------------------------

    @Test
    @DisplayName("alert, note and info report messages and the config map is visible")
    void messages() throws Exception {
        new MessagingSuite().run(new Args(events::add, null, Map.of("k", "v"), null));

        assertEquals("alert v", events.stream().filter(AlertProvided.class::isInstance)
                .map(e -> ((AlertProvided) e).message()).findFirst().orElseThrow());
        assertTrue(events.stream().anyMatch(NoteProvided.class::isInstance));
        assertTrue(events.stream().anyMatch(InfoProvided.class::isInstance));
    }

    @Test
    @DisplayName("fail() without a message leaves the message null")
    void failWithoutMessage() throws Exception {
        assertNull(new TestFailedException(null).getMessage());

        class Failing extends FunSuite {
            Failing() {
                test("fails", FunSuite::fail);
            }
        }
        new Failing().run(args());

        var failed = (TestFailed) events.get(1);
        assertInstanceOf(TestFailedException.class, failed.throwable());
        assertNull(failed.throwable().getMessage());
    }

    @Test
    @DisplayName("an interrupted test body fails and keeps the thread's interrupt flag")
    void interruptedBody() throws Exception {
        class Interrupted extends FunSuite {
            Interrupted() {
                test("waits", () -> {
                    throw new InterruptedException("stopped");
                });
            }
        }
        new Interrupted().run(args());

        assertTrue(Thread.interrupted());
        var failed = (TestFailed) events.get(1);
        assertInstanceOf(InterruptedException.class, failed.throwable());
    }

    @Test
    @DisplayName("messages outside a run fail")
    void messageOutsideRun() {
        assertThrows(IllegalStateException.class, () -> new MessagingSuite().alertOutsideRun());
    }

    @Test
    @DisplayName("SuiteRunner turns a throwing suite into an aborted event")
    void suiteRunnerAborts() {
        class Broken extends FunSuite {
            @Override
            protected void beforeAll() {
                throw new IllegalStateException();
            }
        }

        boolean completed = SuiteRunner.run(new Broken(), args());

        assertFalse(completed);
        var aborted = (SuiteAborted) events.get(events.size() - 1);
        assertEquals("java.lang.IllegalStateException was thrown.", aborted.message());
        assertInstanceOf(SuiteStarting.class, events.get(0));
    }

    @Test
    @DisplayName("TestStarting precedes the outcome of each test")
    void startingPrecedesOutcome() throws Exception {
        new TaggedSuite().run(args());
        assertInstanceOf(TestStarting.class, events.get(0));
        assertInstanceOf(TestSucceeded.class, events.get(1));
    }

    @Test
    @DisplayName("an ignored test reports only TestIgnored")
    void ignoredOnly() throws Exception {
        class OnlyIgnored extends FunSuite {
            OnlyIgnored() {
                ignore("later", () -> {});
            }
        }
        new OnlyIgnored().run(args());
        assertEquals(1, events.size());
        assertInstanceOf(TestIgnored.class, events.get(0));
    }
}
