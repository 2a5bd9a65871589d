package com.suitebridge.suite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * {@link SuiteFactory} that loads classes through the runner's class loader and
 * instantiates them reflectively.
 */
public class ReflectiveSuiteFactory implements SuiteFactory {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveSuiteFactory.class);

    private final ClassLoader classLoader;

    public ReflectiveSuiteFactory(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<Class<?>> load(String qualifiedName) {
        try {
            return Optional.of(Class.forName(qualifiedName, false, classLoader));
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("Unable to load {}: {}", qualifiedName, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean isSubclassSuite(Class<?> suiteClass) {
        if (!Suite.class.isAssignableFrom(suiteClass)) {
            return false;
        }
        int modifiers = suiteClass.getModifiers();
        if (!Modifier.isPublic(modifiers) || Modifier.isAbstract(modifiers) || suiteClass.isInterface()) {
            return false;
        }
        try {
            return Modifier.isPublic(suiteClass.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    @Override
    public boolean isWrappedSuite(Class<?> suiteClass) {
        return suiteClass.isAnnotationPresent(WrapWith.class);
    }

    @Override
    public Suite create(Class<?> suiteClass) throws Exception {
        try {
            if (isSubclassSuite(suiteClass)) {
                return (Suite) suiteClass.getConstructor().newInstance();
            }
            WrapWith wrapWith = suiteClass.getAnnotation(WrapWith.class);
            if (wrapWith == null) {
                throw new IllegalArgumentException(suiteClass.getName()
                        + " is neither a Suite with a public no-arg constructor nor annotated with @WrapWith");
            }
            Constructor<? extends Suite> constructor = wrapWith.value().getConstructor(Class.class);
            return constructor.newInstance(suiteClass);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
