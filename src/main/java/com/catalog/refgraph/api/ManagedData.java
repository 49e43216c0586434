package com.catalog.refgraph.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a record type as managed by the catalog and assigns it a category.
 *
 * <p>
 * Types without this annotation are grouped under the {@code Other} category.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ManagedData {

    /** Category folder in the catalog tree. Blank means {@code Other}. */
    String category() default "";

    /** Overrides the derived display name of the type. */
    String displayName() default "";
}
