package com.suitebridge.suite;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class that is not itself a {@link Suite} but is run by one.
 * <p>
 * The {@link #value()} suite class must declare a public constructor taking the
 * annotated {@link Class}.
 */
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface WrapWith {

    Class<? extends Suite> value();
}
