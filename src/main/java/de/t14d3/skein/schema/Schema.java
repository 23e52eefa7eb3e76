package de.t14d3.skein.schema;

import java.util.*;

/**
 * The object model: an ordered set of {@link ObjectSchema}s with unique names.
 * <p>
 * A Schema has value semantics through {@link #copy()}. Each open instance works on
 * its own copy so resolving column positions never disturbs other holders.
 */
public class Schema implements Iterable<ObjectSchema> {
    private final List<ObjectSchema> objectSchemas;
    private final Map<String, ObjectSchema> byName;

    public Schema(Collection<ObjectSchema> objectSchemas) {
        this.objectSchemas = new ArrayList<>(objectSchemas.size());
        this.byName = new HashMap<>();
        for (ObjectSchema objectSchema : objectSchemas) {
            if (byName.putIfAbsent(objectSchema.getName(), objectSchema) != null) {
                throw new IllegalArgumentException("Object type '" + objectSchema.getName() + "' is declared more than once");
            }
            this.objectSchemas.add(objectSchema);
        }
    }

    public static Schema of(ObjectSchema... objectSchemas) {
        return new Schema(Arrays.asList(objectSchemas));
    }

    public static Schema empty() {
        return new Schema(List.of());
    }

    public List<ObjectSchema> getObjectSchemas() {
        return Collections.unmodifiableList(objectSchemas);
    }

    /**
     * @return the object schema with the given name, or null
     */
    public ObjectSchema get(String objectType) {
        return byName.get(objectType);
    }

    public boolean contains(String objectType) {
        return byName.containsKey(objectType);
    }

    public int size() {
        return objectSchemas.size();
    }

    @Override
    public Iterator<ObjectSchema> iterator() {
        return getObjectSchemas().iterator();
    }

    /**
     * Deep copy, independent of this schema.
     */
    public Schema copy() {
        List<ObjectSchema> copies = new ArrayList<>(objectSchemas.size());
        for (ObjectSchema objectSchema : objectSchemas) {
            copies.add(objectSchema.copy());
        }
        return new Schema(copies);
    }

    /**
     * New container sharing the object schemas of this one. Only valid for schemas whose
     * column mapping is final, e.g. the schema of an instance that is already open.
     */
    public Schema shallowCopy() {
        return new Schema(objectSchemas);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema that)) return false;
        return objectSchemas.equals(that.objectSchemas);
    }

    @Override
    public int hashCode() {
        return objectSchemas.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Schema{\n");
        for (ObjectSchema objectSchema : objectSchemas) {
            sb.append(objectSchema).append('\n');
        }
        return sb.append('}').toString();
    }
}
