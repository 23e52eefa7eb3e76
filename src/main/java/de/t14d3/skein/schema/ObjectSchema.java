package de.t14d3.skein.schema;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Describes one object type: its name, its ordered properties and its optional primary key.
 * <p>
 * Property order is significant: properties created by a migration are appended to the
 * persisted table in this order.
 */
public class ObjectSchema {
    private final String name;
    private final List<Property> properties;
    private final Map<String, Property> propertiesByName;
    private String primaryKey;

    public ObjectSchema(String name, List<Property> properties) {
        this(name, properties, null);
    }

    public ObjectSchema(String name, List<Property> properties, String primaryKey) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Object type name must not be empty");
        }
        this.name = name;
        this.properties = new ArrayList<>(properties);
        this.propertiesByName = new LinkedHashMap<>();
        for (Property property : this.properties) {
            propertiesByName.putIfAbsent(property.getName(), property);
        }

        if (primaryKey != null && !primaryKey.isEmpty()) {
            this.primaryKey = primaryKey;
            for (Property property : this.properties) {
                property.setPrimary(property.getName().equals(primaryKey));
            }
        } else {
            List<Property> flagged = primaryFlagged();
            this.primaryKey = flagged.size() == 1 ? flagged.get(0).getName() : null;
        }
    }

    public static ObjectSchema of(String name, Property... properties) {
        return new ObjectSchema(name, Arrays.asList(properties));
    }

    public String getName() {
        return name;
    }

    public List<Property> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public Property property(String propertyName) {
        return propertiesByName.get(propertyName);
    }

    /**
     * Name of the primary key property, or null when the type has none.
     */
    public String getPrimaryKey() {
        return primaryKey;
    }

    public Property getPrimaryKeyProperty() {
        return primaryKey == null ? null : propertiesByName.get(primaryKey);
    }

    public void setPrimaryKey(String primaryKey) {
        this.primaryKey = (primaryKey == null || primaryKey.isEmpty()) ? null : primaryKey;
        for (Property property : properties) {
            property.setPrimary(property.getName().equals(this.primaryKey));
        }
    }

    /**
     * Checks the internal consistency of this object type, independent of any persisted table.
     *
     * @return human readable errors, empty when the object type is well formed
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (Property property : properties) {
            if (!seen.add(property.getName())) {
                errors.add("Property '" + property.getName() + "' is declared more than once.");
            }
        }

        List<Property> flagged = primaryFlagged();
        if (flagged.size() > 1) {
            errors.add("Only one property can be the primary key, but "
                    + flagged.stream().map(p -> "'" + p.getName() + "'").collect(Collectors.joining(", "))
                    + " are marked as primary.");
        }

        if (primaryKey != null) {
            Property pk = propertiesByName.get(primaryKey);
            if (pk == null) {
                errors.add("No property matching primary key '" + primaryKey + "'");
            } else if (!pk.getType().canBePrimaryKey()) {
                errors.add("Property '" + primaryKey + "' cannot be made the primary key of '" + name
                        + "' because it is not a 'string' or 'int' property.");
            }
        }

        for (Property property : properties) {
            PropertyType type = property.getType();
            if (type.isLink() && (property.getObjectType() == null || property.getObjectType().isEmpty())) {
                errors.add("Property '" + property.getName() + "' of type '" + type + "' has no target object type.");
            }
            if (type == PropertyType.OBJECT && !property.isNullable()) {
                errors.add("Object property '" + property.getName() + "' cannot be made required.");
            } else if (property.isNullable() && !type.isNullable()) {
                errors.add("Property '" + property.getName() + "' of type '" + type + "' cannot be made optional.");
            }
        }
        return errors;
    }

    /**
     * Deep copy: properties are copied so column positions can be changed independently.
     */
    public ObjectSchema copy() {
        List<Property> copied = new ArrayList<>(properties.size());
        for (Property property : properties) {
            copied.add(property.copy());
        }
        return new ObjectSchema(name, copied, primaryKey);
    }

    private List<Property> primaryFlagged() {
        List<Property> flagged = new ArrayList<>();
        for (Property property : properties) {
            if (property.isPrimary()) {
                flagged.add(property);
            }
        }
        return flagged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectSchema that)) return false;
        return name.equals(that.name)
                && Objects.equals(primaryKey, that.primaryKey)
                && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, primaryKey, properties);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" {\n");
        for (Property property : properties) {
            sb.append("  ").append(property).append('\n');
        }
        return sb.append('}').toString();
    }
}
