package com.suitebridge.suite;

import java.lang.annotation.Annotation;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads class-level tags: annotations whose type carries {@link TagAnnotation}.
 */
public final class SuiteTags {

    private SuiteTags() {}

    /**
     * Tags declared on {@code suiteClass} and all of its superclasses.
     */
    public static Set<String> classTags(Class<?> suiteClass) {
        Set<String> tags = new LinkedHashSet<>();
        for (Class<?> c = suiteClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Annotation annotation : c.getDeclaredAnnotations()) {
                TagAnnotation tag = annotation.annotationType().getAnnotation(TagAnnotation.class);
                if (tag != null) {
                    tags.add(tag.value().isEmpty() ? annotation.annotationType().getName() : tag.value());
                }
            }
        }
        return tags;
    }
}
