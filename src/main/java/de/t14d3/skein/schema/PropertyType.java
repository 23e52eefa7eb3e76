package de.t14d3.skein.schema;

import java.util.Locale;

/**
 * Semantic type of a property, independent of how the storage engine lays it out.
 */
public enum PropertyType {
    INT("int", true, false),
    BOOL("bool", true, false),
    FLOAT("float", false, false),
    DOUBLE("double", false, false),
    STRING("string", true, true),
    BINARY("data", false, true),
    DATE("date", true, true),
    ANY("any", false, true),
    OBJECT("object", false, true),
    ARRAY("array", false, false);

    private final String tag;
    private final boolean indexable;
    private final boolean nullable;

    PropertyType(String tag, boolean indexable, boolean nullable) {
        this.tag = tag;
        this.indexable = indexable;
        this.nullable = nullable;
    }

    /**
     * Short name used in error messages and persisted column descriptors.
     */
    public String tag() {
        return tag;
    }

    public boolean isIndexable() {
        return indexable;
    }

    /**
     * Whether properties of this type may be declared optional.
     */
    public boolean isNullable() {
        return nullable;
    }

    public boolean isLink() {
        return this == OBJECT || this == ARRAY;
    }

    public boolean canBePrimaryKey() {
        return this == INT || this == STRING;
    }

    public static PropertyType fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Property type tag must not be null");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (PropertyType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown property type '" + tag + "'");
    }

    @Override
    public String toString() {
        return tag;
    }
}
