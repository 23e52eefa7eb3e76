package de.t14d3.skein.schema;

import java.util.Objects;

/**
 * One field of an object type.
 * <p>
 * The column position is only meaningful after the owning {@link ObjectSchema} has been
 * reconciled against its table; until then it is {@link #NO_COLUMN}.
 */
public class Property {
    public static final int NO_COLUMN = -1;

    private final String name;
    private final PropertyType type;
    private final String objectType;
    private final boolean nullable;
    private boolean indexed;
    private boolean primary;
    private int column;

    private Property(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.objectType = builder.objectType;
        this.nullable = builder.nullable;
        this.indexed = builder.indexed;
        this.primary = builder.primary;
        this.column = builder.column;
    }

    public static Builder builder(String name, PropertyType type) {
        return new Builder(name, type);
    }

    public static Property of(String name, PropertyType type) {
        return builder(name, type).build();
    }

    public static Property link(String name, PropertyType type, String objectType) {
        return builder(name, type).objectType(objectType).nullable(type == PropertyType.OBJECT).build();
    }

    public String getName() {
        return name;
    }

    public PropertyType getType() {
        return type;
    }

    /**
     * Target object type for {@link PropertyType#OBJECT} and {@link PropertyType#ARRAY} properties, otherwise null.
     */
    public String getObjectType() {
        return objectType;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public void setIndexed(boolean indexed) {
        this.indexed = indexed;
    }

    public boolean isPrimary() {
        return primary;
    }

    void setPrimary(boolean primary) {
        this.primary = primary;
    }

    public int getColumn() {
        return column;
    }

    public void setColumn(int column) {
        this.column = column;
    }

    public boolean hasColumn() {
        return column != NO_COLUMN;
    }

    public Property copy() {
        return new Builder(name, type)
                .objectType(objectType)
                .nullable(nullable)
                .indexed(indexed)
                .primary(primary)
                .column(column)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Property that)) return false;
        return nullable == that.nullable
                && indexed == that.indexed
                && primary == that.primary
                && column == that.column
                && type == that.type
                && name.equals(that.name)
                && Objects.equals(objectType, that.objectType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, objectType, nullable, indexed, primary, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" {type=").append(type);
        if (objectType != null) sb.append(", objectType=").append(objectType);
        if (nullable) sb.append(", optional");
        if (indexed) sb.append(", indexed");
        if (primary) sb.append(", primary");
        if (column != NO_COLUMN) sb.append(", column=").append(column);
        return sb.append('}').toString();
    }

    /**
     * Builder for creating Property instances.
     */
    public static class Builder {
        private final String name;
        private final PropertyType type;
        private String objectType;
        private boolean nullable;
        private boolean indexed;
        private boolean primary;
        private int column = NO_COLUMN;

        private Builder(String name, PropertyType type) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Property name must not be empty");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder objectType(String objectType) {
            this.objectType = objectType;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder indexed(boolean indexed) {
            this.indexed = indexed;
            return this;
        }

        public Builder primary(boolean primary) {
            this.primary = primary;
            return this;
        }

        public Builder column(int column) {
            this.column = column;
            return this;
        }

        public Property build() {
            return new Property(this);
        }
    }
}
