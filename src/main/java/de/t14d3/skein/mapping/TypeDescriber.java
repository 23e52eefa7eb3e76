package de.t14d3.skein.mapping;

import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Turns application classes into object schemas.
 */
public interface TypeDescriber {

    /**
     * @throws IllegalArgumentException when the class cannot be described
     */
    ObjectSchema describe(Class<?> type);

    /**
     * Describes every class, ordered by object type name.
     */
    default Schema describeAll(Collection<Class<?>> types) {
        List<ObjectSchema> objectSchemas = new ArrayList<>(types.size());
        for (Class<?> type : types) {
            objectSchemas.add(describe(type));
        }
        objectSchemas.sort(Comparator.comparing(ObjectSchema::getName));
        return new Schema(objectSchemas);
    }
}
