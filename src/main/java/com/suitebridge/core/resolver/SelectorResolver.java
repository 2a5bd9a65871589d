package com.suitebridge.core.resolver;

import com.suitebridge.core.config.Configuration;
import com.suitebridge.core.model.AnnotatedFingerprint;
import com.suitebridge.core.model.Fingerprint;
import com.suitebridge.core.model.NestedSuiteSelector;
import com.suitebridge.core.model.NestedTestSelector;
import com.suitebridge.core.model.RunRequest;
import com.suitebridge.core.model.Selector;
import com.suitebridge.core.model.SubclassFingerprint;
import com.suitebridge.core.model.SuiteSelector;
import com.suitebridge.core.model.TestSelector;
import com.suitebridge.core.model.TestWildcardSelector;
import com.suitebridge.core.resolver.ResolvedUnits.Unit;
import com.suitebridge.suite.DoNotDiscover;
import com.suitebridge.suite.Suite;
import com.suitebridge.suite.SuiteFactory;
import com.suitebridge.suite.WrapWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns run requests into executable units.
 * <p>
 * Resolution happens in two phases. {@link #admit} runs when tasks are created and only
 * needs the class: it applies package filters, loadability, fingerprint recognition and
 * {@link DoNotDiscover}. {@link #resolve} runs when a task executes and the suite's
 * hierarchy is known: it maps selectors onto tests and nested suites.
 */
public class SelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(SelectorResolver.class);

    private final SuiteFactory suiteFactory;
    private final Configuration configuration;

    public SelectorResolver(SuiteFactory suiteFactory, Configuration configuration) {
        this.suiteFactory = suiteFactory;
        this.configuration = configuration;
    }

    /**
     * Decides whether a request yields a task.
     *
     * @return the loaded suite class, or empty when the request is dropped
     * @throws ResolutionException when an explicitly specified request cannot run
     */
    public Optional<Class<?>> admit(RunRequest request) {
        String name = request.qualifiedName();
        if (!configuration.acceptsPackage(name)) {
            log.debug("Dropping {}: outside the -w/-m package filters", name);
            return Optional.empty();
        }
        if (!isRecognized(request.fingerprint())) {
            return reject(request, "Unrecognized fingerprint " + request.fingerprint() + " for " + name);
        }
        Optional<Class<?>> loaded = suiteFactory.load(name);
        if (loaded.isEmpty()) {
            return reject(request, "Unable to load suite class " + name);
        }
        Class<?> suiteClass = loaded.get();
        if (!suiteFactory.isSubclassSuite(suiteClass) && !suiteFactory.isWrappedSuite(suiteClass)) {
            return reject(request, name + " is neither a Suite with a public no-arg constructor"
                    + " nor annotated with @WrapWith");
        }
        if (suiteClass.isAnnotationPresent(DoNotDiscover.class) && !request.explicitlySpecified()) {
            log.debug("Dropping {}: annotated with @DoNotDiscover and not explicitly specified", name);
            return Optional.empty();
        }
        return loaded;
    }

    /**
     * Maps the request's selectors onto the constructed suite.
     * <p>
     * Order: nested suites in declared order (each one's tests in declared order),
     * then top-level tests in declared order. Selectors naming nothing contribute nothing.
     */
    public ResolvedUnits resolve(RunRequest request, Suite suite) {
        List<Selector> selectors = effectiveSelectors(request);
        if (selectors.isEmpty() || selectors.stream().anyMatch(s -> s instanceof SuiteSelector)) {
            return ResolvedUnits.entire();
        }

        Set<String> topLevel = new LinkedHashSet<>();
        Set<String> wholeNested = new LinkedHashSet<>();
        Set<Unit> nestedTests = new LinkedHashSet<>();
        for (Selector selector : selectors) {
            if (selector instanceof TestSelector s) {
                topLevel.add(s.testName());
            } else if (selector instanceof TestWildcardSelector s) {
                suite.testNames().stream()
                        .filter(testName -> testName.contains(s.testWildcard()))
                        .forEach(topLevel::add);
            } else if (selector instanceof NestedSuiteSelector s) {
                wholeNested.add(s.suiteId());
            } else if (selector instanceof NestedTestSelector s) {
                nestedTests.add(new Unit(s.suiteId(), s.testName()));
            }
        }

        List<Unit> units = new ArrayList<>();
        for (Suite nested : suite.nestedSuites()) {
            String id = nested.suiteId();
            if (wholeNested.contains(id)) {
                units.add(new Unit(id, null));
                continue;
            }
            for (String testName : nested.testNames()) {
                Unit unit = new Unit(id, testName);
                if (nestedTests.contains(unit)) {
                    units.add(unit);
                }
            }
        }
        for (String testName : suite.testNames()) {
            if (topLevel.contains(testName)) {
                units.add(new Unit(suite.suiteId(), testName));
            }
        }
        log.debug("Resolved {} selector(s) of {} to {} unit(s)", selectors.size(), request.qualifiedName(), units.size());
        return new ResolvedUnits(false, units);
    }

    /**
     * Request selectors with the runner-level {@code -z}/{@code -t} filters folded in. The
     * filters replace an entire-suite selection and are OR-ed with everything else.
     */
    List<Selector> effectiveSelectors(RunRequest request) {
        List<Selector> filters = configuration.testFilterSelectors();
        if (filters.isEmpty()) {
            return request.selectors();
        }
        List<Selector> selectors = new ArrayList<>();
        for (Selector selector : request.selectors()) {
            if (!(selector instanceof SuiteSelector)) {
                selectors.add(selector);
            }
        }
        selectors.addAll(filters);
        return selectors;
    }

    private static boolean isRecognized(Fingerprint fingerprint) {
        if (fingerprint instanceof SubclassFingerprint f) {
            return Suite.class.getName().equals(f.superclassName());
        }
        if (fingerprint instanceof AnnotatedFingerprint f) {
            return WrapWith.class.getName().equals(f.annotationName());
        }
        return false;
    }

    private Optional<Class<?>> reject(RunRequest request, String reason) {
        if (request.explicitlySpecified()) {
            throw new ResolutionException(reason);
        }
        log.warn("Dropping {}: {}", request.qualifiedName(), reason);
        return Optional.empty();
    }
}
