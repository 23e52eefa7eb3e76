package de.t14d3.skein.migration;

import de.t14d3.skein.exceptions.SchemaValidationException;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares object schemas with their persisted tables.
 * <p>
 * {@link #validate} is strict: every difference is an error. {@link #plan} is used while
 * migrating: missing tables and columns become changes, obsolete columns are left alone, and
 * only differences that cannot be migrated automatically are errors.
 */
public final class SchemaReconciler {
    private static final Logger log = LoggerFactory.getLogger(SchemaReconciler.class);

    private SchemaReconciler() {
    }

    /**
     * Strictly validates {@code objectSchema} against {@code table}, ignoring the stored primary key.
     * On success the column position of every property is set.
     *
     * @param table the persisted table, or null when it does not exist
     * @return every error found, empty when the table matches
     */
    public static List<String> validate(ObjectSchema objectSchema, Table table) {
        return validate(objectSchema, table, objectSchema.getPrimaryKey());
    }

    /**
     * Strictly validates {@code objectSchema} against {@code table} and the primary key recorded
     * for it. On success the column position of every property is set.
     */
    public static List<String> validate(ObjectSchema objectSchema, Table table, String storedPrimaryKey) {
        List<String> errors = new ArrayList<>(objectSchema.validate());
        if (!errors.isEmpty()) {
            return errors;
        }

        if (table == null) {
            errors.add("Table for object type '" + objectSchema.getName() + "' does not exist.");
            return errors;
        }

        for (int column = 0; column < table.getColumnCount(); column++) {
            String name = table.getColumnName(column);
            Property property = objectSchema.property(name);
            if (property == null) {
                errors.add("Property '" + name + "' is missing from latest object model.");
                continue;
            }
            compareColumn(property, table, column, errors);
        }

        for (Property property : objectSchema.getProperties()) {
            if (table.findColumn(property.getName()) < 0) {
                errors.add("Property '" + property.getName() + "' has been added to latest object model.");
            }
        }

        if (!Objects.equals(storedPrimaryKey, objectSchema.getPrimaryKey())) {
            if (storedPrimaryKey == null) {
                errors.add("Property '" + objectSchema.getPrimaryKey() + "' has been made a primary key.");
            } else if (objectSchema.getPrimaryKey() == null) {
                errors.add("Primary Key for class '" + objectSchema.getName() + "' has been removed.");
            } else {
                errors.add("Primary Key for class '" + objectSchema.getName() + "' has changed from '"
                        + storedPrimaryKey + "' to '" + objectSchema.getPrimaryKey() + "'.");
            }
        }

        if (errors.isEmpty()) {
            resolveColumns(objectSchema, table);
        }
        return errors;
    }

    /**
     * Whether the search index of every column matches the indexed flag of its property.
     */
    public static boolean indexesMatch(ObjectSchema objectSchema, Table table) {
        for (Property property : objectSchema.getProperties()) {
            int column = table.findColumn(property.getName());
            if (column < 0) {
                return false;
            }
            boolean indexed = property.getType().isIndexable() && table.hasSearchIndex(column);
            if (indexed != property.isIndexed()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computes the changes needed for {@code objectSchema} and adds them to {@code diff}.
     * Nothing is applied.
     *
     * @param updateExisting whether existing tables get missing columns and index changes;
     *                       when false only missing tables are planned
     * @return errors that prevent the migration, empty when the plan can be applied
     * @throws IllegalArgumentException when an index is requested on a type that cannot be indexed
     */
    public static List<String> plan(Group group, ObjectSchema objectSchema, boolean updateExisting, SchemaDiff diff) {
        List<String> errors = new ArrayList<>(objectSchema.validate());
        if (!errors.isEmpty()) {
            return errors;
        }
        String name = objectSchema.getName();

        for (Property property : objectSchema.getProperties()) {
            if (property.isIndexed() && !property.getType().isIndexable()) {
                throw new IllegalArgumentException("Can't index property " + name + "." + property.getName()
                        + ": indexing a property of type '" + property.getType() + "' is currently not supported.");
            }
        }

        Table table = TableBinding.tableForType(group, name);
        if (table == null) {
            diff.addChange(SchemaDiff.SchemaChange.createTable(name));
            for (Property property : objectSchema.getProperties()) {
                diff.addChange(SchemaDiff.SchemaChange.addColumn(name, property));
                if (property.isIndexed()) {
                    diff.addChange(SchemaDiff.SchemaChange.addIndex(name, property));
                }
            }
            return errors;
        }
        if (!updateExisting) {
            return errors;
        }

        for (Property property : objectSchema.getProperties()) {
            int column = table.findColumn(property.getName());
            if (column < 0) {
                diff.addChange(SchemaDiff.SchemaChange.addColumn(name, property));
                if (property.isIndexed()) {
                    diff.addChange(SchemaDiff.SchemaChange.addIndex(name, property));
                }
                continue;
            }
            int before = errors.size();
            compareColumn(property, table, column, errors);
            if (errors.size() > before) {
                continue;
            }
            boolean hasIndex = property.getType().isIndexable() && table.hasSearchIndex(column);
            if (property.isIndexed() && !hasIndex) {
                diff.addChange(SchemaDiff.SchemaChange.addIndex(name, property));
            } else if (!property.isIndexed() && hasIndex) {
                diff.addChange(SchemaDiff.SchemaChange.removeIndex(name, property));
            }
        }
        return errors;
    }

    /**
     * Applies a planned diff: tables first, then plain columns, then link columns (whose targets
     * now exist), then index changes. Every change is recorded in {@code undo}.
     *
     * @return true when anything was changed
     */
    public static boolean apply(Group group, SchemaDiff diff, StructuralUndoLog undo) {
        for (SchemaDiff.SchemaChange change : diff.getChanges(SchemaDiff.ChangeType.CREATE_TABLE)) {
            String tableName = TableBinding.tableNameForType(change.getObjectType());
            group.addTable(tableName);
            undo.tableCreated(tableName);
            log.debug("Created table for object type '{}'", change.getObjectType());
        }

        List<SchemaDiff.SchemaChange> columns = diff.getChanges(SchemaDiff.ChangeType.ADD_COLUMN);
        for (SchemaDiff.SchemaChange change : columns) {
            Property property = change.getProperty();
            if (!property.getType().isLink()) {
                Table table = TableBinding.tableForType(group, change.getObjectType());
                table.addColumn(property.getType(), property.getName(), property.isNullable());
                undo.columnAdded(table.getName(), property.getName());
            }
        }
        for (SchemaDiff.SchemaChange change : columns) {
            Property property = change.getProperty();
            if (property.getType().isLink()) {
                Table table = TableBinding.tableForType(group, change.getObjectType());
                table.addLinkColumn(property.getType(), property.getName(),
                        TableBinding.tableNameForType(property.getObjectType()));
                undo.columnAdded(table.getName(), property.getName());
            }
        }

        for (SchemaDiff.SchemaChange change : diff.getChanges()) {
            if (change.getType() != SchemaDiff.ChangeType.ADD_INDEX
                    && change.getType() != SchemaDiff.ChangeType.REMOVE_INDEX) {
                continue;
            }
            Table table = TableBinding.tableForType(group, change.getObjectType());
            String columnName = change.getProperty().getName();
            int column = table.findColumn(columnName);
            if (change.getType() == SchemaDiff.ChangeType.ADD_INDEX) {
                table.addSearchIndex(column);
                undo.indexAdded(table.getName(), columnName);
            } else {
                table.removeSearchIndex(column);
                undo.indexRemoved(table.getName(), columnName);
            }
            log.debug("{} on {}.{}", change.getType(), change.getObjectType(), columnName);
        }
        return diff.hasChanges();
    }

    /**
     * Creates or updates the table of one object type and resolves its columns.
     *
     * @return true when anything was changed
     * @throws SchemaValidationException when the table cannot be migrated automatically
     */
    public static boolean update(Group group, ObjectSchema objectSchema, boolean updateExisting, StructuralUndoLog undo) {
        SchemaDiff diff = new SchemaDiff();
        List<String> errors = plan(group, objectSchema, updateExisting, diff);
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(objectSchema.getName(), errors);
        }
        boolean changed = apply(group, diff, undo);
        resolveColumns(objectSchema, TableBinding.tableForType(group, objectSchema.getName()));
        return changed;
    }

    /**
     * Sets the column position of every property by name. Persisted columns without a
     * property are tolerated.
     *
     * @throws IllegalStateException when a property has no column
     */
    public static void resolveColumns(ObjectSchema objectSchema, Table table) {
        for (Property property : objectSchema.getProperties()) {
            int column = table.findColumn(property.getName());
            if (column < 0) {
                throw new IllegalStateException("Property '" + property.getName() + "' of '"
                        + objectSchema.getName() + "' has no column in table '" + table.getName() + "'");
            }
            property.setColumn(column);
        }
    }

    private static void compareColumn(Property property, Table table, int column, List<String> errors) {
        String name = property.getName();
        PropertyType persistedType = table.getColumnType(column);
        if (persistedType != property.getType()) {
            errors.add("Property types for '" + name + "' property do not match. Old type '"
                    + persistedType + "', new type '" + property.getType() + "'.");
            return;
        }
        if (persistedType.isLink()) {
            String persistedTarget = TableBinding.typeForTableName(table.getLinkTarget(column));
            if (!Objects.equals(persistedTarget, property.getObjectType())) {
                errors.add("Target object type for property '" + name + "' do not match. Old type '"
                        + persistedTarget + "', new type '" + property.getObjectType() + "'.");
            }
            return;
        }
        boolean persistedNullable = table.isColumnNullable(column);
        if (persistedNullable && !property.isNullable()) {
            errors.add("Property '" + name + "' has been made required.");
        } else if (!persistedNullable && property.isNullable()) {
            errors.add("Property '" + name + "' has been made optional.");
        }
    }
}
