package de.t14d3.skein.migration;

import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.DataOnlyTable;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;

/**
 * What a {@link Migration} sees: both versions, the schema before and after the structural
 * update, and access to the tables of the group being migrated.
 */
public class MigrationContext {
    private final Group group;
    private final long oldSchemaVersion;
    private final long newSchemaVersion;
    private final Schema oldSchema;
    private final Schema newSchema;

    MigrationContext(Group group, long oldSchemaVersion, long newSchemaVersion, Schema oldSchema, Schema newSchema) {
        this.group = group;
        this.oldSchemaVersion = oldSchemaVersion;
        this.newSchemaVersion = newSchemaVersion;
        this.oldSchema = oldSchema;
        this.newSchema = newSchema;
    }

    /**
     * Version the file had before this migration, {@link SchemaMetadata#NOT_VERSIONED} for a new file.
     */
    public long getOldSchemaVersion() {
        return oldSchemaVersion;
    }

    public long getNewSchemaVersion() {
        return newSchemaVersion;
    }

    /**
     * Schema persisted before the structural update. Properties removed from the model are still
     * listed here.
     */
    public Schema getOldSchema() {
        return oldSchema;
    }

    public Schema getNewSchema() {
        return newSchema;
    }

    /**
     * Table of {@code objectType}. Rows may be moved freely; columns and indexes are fixed.
     *
     * @throws IllegalArgumentException when no table exists for the type
     */
    public Table table(String objectType) {
        Table table = TableBinding.tableForType(group, objectType);
        if (table == null) {
            throw new IllegalArgumentException("Object type '" + objectType + "' has no table");
        }
        return DataOnlyTable.of(table);
    }

    /**
     * Column of {@code property} in the new schema.
     *
     * @throws IllegalArgumentException when the type or property is unknown
     */
    public int column(String objectType, String property) {
        ObjectSchema objectSchema = newSchema.get(objectType);
        if (objectSchema == null || objectSchema.property(property) == null) {
            throw new IllegalArgumentException("Unknown property '" + objectType + "." + property + "'");
        }
        return objectSchema.property(property).getColumn();
    }
}
