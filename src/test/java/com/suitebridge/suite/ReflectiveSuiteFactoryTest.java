package com.suitebridge.suite;

import com.suitebridge.fixtures.AbortedSuite2;
import com.suitebridge.fixtures.CPUTaggedSuite;
import com.suitebridge.fixtures.CustomTag;
import com.suitebridge.fixtures.CustomTaggedSuite;
import com.suitebridge.fixtures.MethodSuite;
import com.suitebridge.fixtures.NotASuite;
import com.suitebridge.fixtures.SampleInheritedSuite;
import com.suitebridge.fixtures.SampleSuite;
import com.suitebridge.fixtures.WrappedSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReflectiveSuiteFactoryTest {

    private final ReflectiveSuiteFactory factory = new ReflectiveSuiteFactory(getClass().getClassLoader());

    public abstract static class AbstractSuite extends FunSuite {
    }

    public static class NoDefaultConstructorSuite extends FunSuite {
        public NoDefaultConstructorSuite(String name) {
            test(name, () -> {});
        }
    }

    @Test
    @DisplayName("load finds classes without initializing them and misses quietly")
    void load() {
        assertEquals(SampleSuite.class, factory.load(SampleSuite.class.getName()).orElseThrow());
        assertTrue(factory.load("com.example.DoesNotExist").isEmpty());
    }

    @Test
    @DisplayName("subclass suites need to be public, concrete and have a public no-arg constructor")
    void isSubclassSuite() {
        assertTrue(factory.isSubclassSuite(SampleSuite.class));
        assertFalse(factory.isSubclassSuite(NotASuite.class));
        assertFalse(factory.isSubclassSuite(AbstractSuite.class));
        assertFalse(factory.isSubclassSuite(NoDefaultConstructorSuite.class));
        assertFalse(factory.isSubclassSuite(Suite.class));
    }

    @Test
    @DisplayName("@WrapWith classes are created through the wrapper's Class constructor")
    void createsWrapped() throws Exception {
        assertTrue(factory.isWrappedSuite(WrappedSpec.class));
        assertFalse(factory.isWrappedSuite(SampleSuite.class));

        Suite suite = factory.create(WrappedSpec.class);

        assertInstanceOf(MethodSuite.class, suite);
        assertEquals(WrappedSpec.class.getName(), suite.suiteId());
        assertEquals(List.of("shouldAdd", "shouldFail"), suite.testNames());
    }

    @Test
    @DisplayName("constructor exceptions surface unwrapped")
    void unwrapsConstructorFailure() {
        var thrown = assertThrows(IllegalStateException.class, () -> factory.create(AbortedSuite2.class));
        assertEquals("cannot construct AbortedSuite2", thrown.getMessage());
    }

    @Test
    @DisplayName("a class that is neither kind of suite cannot be created")
    void rejectsNonSuite() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(NotASuite.class));
    }

    @Test
    @DisplayName("class tags come from tag annotations on the class and its superclasses")
    void classTags() {
        assertEquals(Set.of("cpu"), SuiteTags.classTags(CPUTaggedSuite.class));
        assertEquals(Set.of("cpu"), SuiteTags.classTags(SampleInheritedSuite.class));
        assertEquals(Set.of("custom"), SuiteTags.classTags(CustomTaggedSuite.class));
        assertTrue(SuiteTags.classTags(SampleSuite.class).isEmpty());
        assertNotNull(CustomTag.class.getAnnotation(TagAnnotation.class));
    }

    @Test
    @DisplayName("the tag filter includes on any match and excludes on any match")
    void testFilter() {
        var filter = new TestFilter(Set.of("a", "b"), Set.of("x"));

        assertTrue(filter.accepts(Set.of("a")));
        assertTrue(filter.accepts(Set.of("b", "c")));
        assertFalse(filter.accepts(Set.of("c")));
        assertFalse(filter.accepts(Set.of("a", "x")));
        assertTrue(TestFilter.acceptAll().accepts(Set.of()));
        assertFalse(new TestFilter(Set.of(), Set.of("x")).accepts(Set.of("x")));
    }
}
