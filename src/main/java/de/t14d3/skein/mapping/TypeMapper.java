package de.t14d3.skein.mapping;

import de.t14d3.skein.schema.PropertyType;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;

/**
 * Centralized mapping from Java field types to property types.
 */
public class TypeMapper {

    /**
     * Property type stored for a Java type, or null when the type is not supported.
     * Entity references and collections are resolved by the describer.
     */
    public static PropertyType propertyType(Class<?> javaType) {
        if (javaType == Long.class || javaType == long.class
                || javaType == Integer.class || javaType == int.class
                || javaType == Short.class || javaType == short.class
                || javaType == Byte.class || javaType == byte.class) {
            return PropertyType.INT;
        } else if (javaType == Boolean.class || javaType == boolean.class) {
            return PropertyType.BOOL;
        } else if (javaType == Float.class || javaType == float.class) {
            return PropertyType.FLOAT;
        } else if (javaType == Double.class || javaType == double.class) {
            return PropertyType.DOUBLE;
        } else if (javaType == String.class) {
            return PropertyType.STRING;
        } else if (javaType == byte[].class) {
            return PropertyType.BINARY;
        } else if (Date.class.isAssignableFrom(javaType) || javaType == Instant.class) {
            return PropertyType.DATE;
        } else if (javaType == Object.class) {
            return PropertyType.ANY;
        } else if (Collection.class.isAssignableFrom(javaType)) {
            return PropertyType.ARRAY;
        }
        return null;
    }

    /**
     * Whether properties of this Java type can never be null. Numbers and booleans are
     * required, boxed or not.
     */
    public static boolean isAlwaysRequired(Class<?> javaType) {
        if (javaType.isPrimitive()) {
            return true;
        }
        return Number.class.isAssignableFrom(javaType) || javaType == Boolean.class;
    }
}
