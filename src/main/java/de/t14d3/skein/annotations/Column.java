package de.t14d3.skein.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes the property a field maps to.
 *
 * @see Entity
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * The property name; empty for the field name.
     */
    String name() default "";

    /**
     * Whether the property gets a search index.
     */
    boolean indexed() default false;

    /**
     * Makes a string, binary, date or any property required. Primitive and boxed number
     * properties are always required.
     */
    boolean required() default false;
}
