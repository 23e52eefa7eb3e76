package de.t14d3.skein.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A list of links to objects of another type. The annotated field should be a collection;
 * the target type is taken from {@link #targetEntity()} or the collection's type argument.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OneToMany {
    /**
     * The linked entity class; {@code void.class} to use the collection's type argument.
     */
    Class<?> targetEntity() default void.class;
}
