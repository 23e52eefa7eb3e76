package de.t14d3.skein.migration;

import de.t14d3.skein.exceptions.SchemaValidationException;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps object types to their tables: type {@code Dog} lives in table {@code class_Dog}.
 */
public final class TableBinding {
    public static final String TABLE_PREFIX = "class_";

    private TableBinding() {
    }

    public static String tableNameForType(String objectType) {
        return TABLE_PREFIX + objectType;
    }

    /**
     * @return the object type stored in {@code tableName}, or null for tables that hold no objects
     */
    public static String typeForTableName(String tableName) {
        if (tableName == null || !tableName.startsWith(TABLE_PREFIX) || tableName.length() == TABLE_PREFIX.length()) {
            return null;
        }
        return tableName.substring(TABLE_PREFIX.length());
    }

    /**
     * @return the table of {@code objectType}, or null when it has not been created
     */
    public static Table tableForType(Group group, String objectType) {
        return group.getTable(tableNameForType(objectType));
    }

    public static List<String> objectTypes(Group group) {
        List<String> types = new ArrayList<>();
        for (String tableName : group.getTableNames()) {
            String type = typeForTableName(tableName);
            if (type != null) {
                types.add(type);
            }
        }
        return types;
    }

    /**
     * Builds the object schema persisted for {@code objectType}, with column positions set.
     *
     * @return the object schema, or null when the table does not exist
     * @throws SchemaValidationException when the stored primary key names a missing property
     */
    public static ObjectSchema readObjectSchema(Group group, String objectType) {
        Table table = tableForType(group, objectType);
        if (table == null) {
            return null;
        }
        List<Property> properties = new ArrayList<>();
        for (int column = 0; column < table.getColumnCount(); column++) {
            PropertyType type = table.getColumnType(column);
            properties.add(Property.builder(table.getColumnName(column), type)
                    .objectType(type.isLink() ? typeForTableName(table.getLinkTarget(column)) : null)
                    .nullable(table.isColumnNullable(column))
                    .indexed(type.isIndexable() && table.hasSearchIndex(column))
                    .column(column)
                    .build());
        }

        String primaryKey = SchemaMetadata.getPrimaryKey(group, objectType);
        ObjectSchema objectSchema = new ObjectSchema(objectType, properties, primaryKey);
        if (primaryKey != null && objectSchema.property(primaryKey) == null) {
            throw new SchemaValidationException(objectType,
                    List.of("No property matching primary key '" + primaryKey + "'"));
        }
        return objectSchema;
    }

    /**
     * Builds the schema persisted in the group, one object schema per object table.
     */
    public static Schema readSchema(Group group) {
        List<ObjectSchema> objectSchemas = new ArrayList<>();
        for (String objectType : objectTypes(group)) {
            objectSchemas.add(readObjectSchema(group, objectType));
        }
        return new Schema(objectSchemas);
    }
}
