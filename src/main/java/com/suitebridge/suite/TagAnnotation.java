package com.suitebridge.suite;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Meta-annotation turning an annotation type into a tag. Suite classes carrying the
 * annotated annotation, directly or through a superclass, get the tag on the task and on
 * every test.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.ANNOTATION_TYPE)
public @interface TagAnnotation {

    /** Tag name; defaults to the annotation's fully qualified name when empty. */
    String value() default "";
}
