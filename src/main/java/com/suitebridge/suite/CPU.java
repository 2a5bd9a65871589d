package com.suitebridge.suite;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tags a suite whose tests are CPU intensive.
 */
@TagAnnotation("cpu")
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface CPU {
}
