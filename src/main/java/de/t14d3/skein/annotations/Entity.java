package de.t14d3.skein.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as an object type of the declared schema.
 * <p>
 * Every non-static, non-transient field becomes a property. The object type is named after
 * the simple class name unless {@link #value()} is given.
 *
 * @see Column
 * @see Id
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
    /**
     * Name of the object type; empty for the simple class name.
     */
    String value() default "";
}
