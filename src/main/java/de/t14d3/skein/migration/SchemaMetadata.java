package de.t14d3.skein.migration;

import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;

/**
 * Reads and writes the reserved metadata tables: {@code metadata} holds the schema version in
 * a single row, {@code pk} maps object types to their primary key property.
 */
public final class SchemaMetadata {
    public static final long NOT_VERSIONED = -1;

    public static final String METADATA_TABLE = "metadata";
    public static final String VERSION_COLUMN = "version";
    public static final String PK_TABLE = "pk";
    public static final String PK_TABLE_COLUMN = "pk_table";
    public static final String PK_PROPERTY_COLUMN = "pk_property";

    private static final int VERSION_COLUMN_INDEX = 0;
    private static final int PK_TABLE_COLUMN_INDEX = 0;
    private static final int PK_PROPERTY_COLUMN_INDEX = 1;

    private SchemaMetadata() {
    }

    public static boolean hasMetadata(Group group) {
        return group.hasTable(METADATA_TABLE) && group.hasTable(PK_TABLE);
    }

    /**
     * Creates the reserved tables when they are missing. Requires a write transaction.
     *
     * @return true when anything was created
     */
    public static boolean createTables(Group group, StructuralUndoLog undo) {
        boolean changed = false;
        if (!group.hasTable(METADATA_TABLE)) {
            Table table = group.addTable(METADATA_TABLE);
            undo.tableCreated(METADATA_TABLE);
            table.addColumn(PropertyType.INT, VERSION_COLUMN, false);
            changed = true;
        }
        if (!group.hasTable(PK_TABLE)) {
            Table table = group.addTable(PK_TABLE);
            undo.tableCreated(PK_TABLE);
            table.addColumn(PropertyType.STRING, PK_TABLE_COLUMN, false);
            table.addColumn(PropertyType.STRING, PK_PROPERTY_COLUMN, false);
            changed = true;
        }
        Table metadata = group.getTable(METADATA_TABLE);
        if (metadata.size() == 0) {
            long row = metadata.addRow();
            metadata.set(VERSION_COLUMN_INDEX, row, NOT_VERSIONED);
        }
        return changed;
    }

    /**
     * @return the stored schema version, or {@link #NOT_VERSIONED}
     */
    public static long getSchemaVersion(Group group) {
        Table table = group.getTable(METADATA_TABLE);
        if (table == null || table.getColumnCount() == 0 || table.size() == 0) {
            return NOT_VERSIONED;
        }
        Object version = table.get(VERSION_COLUMN_INDEX, 0);
        return version == null ? NOT_VERSIONED : ((Number) version).longValue();
    }

    public static void setSchemaVersion(Group group, long version) {
        Table table = group.getTable(METADATA_TABLE);
        if (table == null) {
            throw new IllegalStateException("Metadata tables have not been created");
        }
        if (table.size() == 0) {
            table.addRow();
        }
        table.set(VERSION_COLUMN_INDEX, 0, version);
    }

    /**
     * @return the stored primary key property of {@code objectType}, or null
     */
    public static String getPrimaryKey(Group group, String objectType) {
        Table table = group.getTable(PK_TABLE);
        if (table == null) {
            return null;
        }
        long row = findPrimaryKeyRow(table, objectType);
        if (row < 0) {
            return null;
        }
        String property = (String) table.get(PK_PROPERTY_COLUMN_INDEX, row);
        return property == null || property.isEmpty() ? null : property;
    }

    /**
     * Records the primary key of {@code objectType}. A null property clears it.
     */
    public static void setPrimaryKey(Group group, String objectType, String property) {
        Table table = group.getTable(PK_TABLE);
        if (table == null) {
            throw new IllegalStateException("Metadata tables have not been created");
        }
        long row = findPrimaryKeyRow(table, objectType);
        if (row < 0) {
            if (property == null) {
                return;
            }
            row = table.addRow();
            table.set(PK_TABLE_COLUMN_INDEX, row, objectType);
        }
        table.set(PK_PROPERTY_COLUMN_INDEX, row, property == null ? "" : property);
    }

    private static long findPrimaryKeyRow(Table table, String objectType) {
        long size = table.size();
        for (long row = 0; row < size; row++) {
            if (objectType.equals(table.get(PK_TABLE_COLUMN_INDEX, row))) {
                return row;
            }
        }
        return -1;
    }
}
