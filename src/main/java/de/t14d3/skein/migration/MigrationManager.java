package de.t14d3.skein.migration;

import de.t14d3.skein.exceptions.MigrationException;
import de.t14d3.skein.exceptions.SchemaValidationException;
import de.t14d3.skein.exceptions.SchemaVersionException;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brings a group to a target schema and schema version.
 * <p>
 * All structural changes are planned before anything is applied, so a model that cannot be
 * migrated leaves the file untouched. The user migration runs in the same write transaction
 * as the version update; if it fails the transaction is rolled back and the structure
 * changes are reverted.
 */
public final class MigrationManager {
    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private MigrationManager() {
    }

    /**
     * @return the stored schema version, or {@link SchemaMetadata#NOT_VERSIONED}
     */
    public static long schemaVersion(Group group) {
        return SchemaMetadata.getSchemaVersion(group);
    }

    /**
     * Whether opening the group at {@code version} runs a migration.
     */
    public static boolean isMigrationRequired(Group group, long version) {
        return schemaVersion(group) != version;
    }

    /**
     * Whether the group already matches {@code schema} exactly, including indexes and primary keys.
     * Column positions are resolved when it does.
     */
    public static boolean isUpToDate(Group group, Schema schema) {
        if (!SchemaMetadata.hasMetadata(group)) {
            return false;
        }
        for (ObjectSchema objectSchema : schema) {
            Table table = TableBinding.tableForType(group, objectSchema.getName());
            String storedPrimaryKey = SchemaMetadata.getPrimaryKey(group, objectSchema.getName());
            if (!SchemaReconciler.validate(objectSchema, table, storedPrimaryKey).isEmpty()
                    || !SchemaReconciler.indexesMatch(objectSchema, table)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Strictly validates every object type of {@code schema} against the group and resolves
     * column positions. Used for files that are opened without migrating.
     *
     * @throws SchemaValidationException listing every error
     */
    public static void verify(Group group, Schema schema) {
        List<String> errors = new ArrayList<>();
        String failedType = null;
        int failedTypes = 0;
        for (ObjectSchema objectSchema : schema) {
            Table table = TableBinding.tableForType(group, objectSchema.getName());
            String storedPrimaryKey = SchemaMetadata.getPrimaryKey(group, objectSchema.getName());
            List<String> typeErrors = SchemaReconciler.validate(objectSchema, table, storedPrimaryKey);
            if (!typeErrors.isEmpty()) {
                errors.addAll(typeErrors);
                failedType = objectSchema.getName();
                failedTypes++;
            }
        }
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(failedTypes == 1 ? failedType : null, errors);
        }
    }

    /**
     * Updates the group to {@code schema} at {@code version}.
     * <ol>
     *     <li>A stored version newer than {@code version} fails with {@link SchemaVersionException}.</li>
     *     <li>Same version and an exact match: columns are resolved and nothing is written.</li>
     *     <li>Otherwise, in one write transaction: metadata tables are created, every table is
     *     created or extended, primary keys are recorded, {@code migration} runs when the stored
     *     version is older or tables were created, and the new version is written.</li>
     * </ol>
     *
     * @param migration routine to run, or null
     * @return true when anything was written
     * @throws SchemaValidationException when the model cannot be migrated automatically
     * @throws MigrationException        when {@code migration} fails
     */
    public static boolean updateToSchema(Group group, long version, Schema schema, Migration migration) {
        if (group.isReadOnly()) {
            throw new IllegalStateException("Can't migrate a read-only file at '" + group.getPath() + "'");
        }
        if (version < 0) {
            throw new IllegalArgumentException("Schema version must not be negative, was " + version);
        }
        Schema target = schema == null ? Schema.empty() : schema;

        long oldVersion = schemaVersion(group);
        checkVersion(oldVersion, version);
        if (oldVersion == version && isUpToDate(group, target)) {
            return false;
        }

        StructuralUndoLog undo = new StructuralUndoLog();
        group.beginWrite();
        try {
            // another group may have migrated while we waited for the write lock
            oldVersion = schemaVersion(group);
            checkVersion(oldVersion, version);
            Schema oldSchema = TableBinding.readSchema(group);

            SchemaDiff diff = plan(group, target);
            if (diff.hasChanges() && log.isDebugEnabled()) {
                log.debug("Planned changes for '{}':\n{}", group.getPath(), diff.describe());
            }
            boolean changed = SchemaMetadata.createTables(group, undo);
            changed |= SchemaReconciler.apply(group, diff, undo);

            for (ObjectSchema objectSchema : target) {
                String stored = SchemaMetadata.getPrimaryKey(group, objectSchema.getName());
                if (!Objects.equals(stored, objectSchema.getPrimaryKey())) {
                    SchemaMetadata.setPrimaryKey(group, objectSchema.getName(), objectSchema.getPrimaryKey());
                    log.debug("Primary key of '{}' changed from '{}' to '{}'", objectSchema.getName(), stored,
                            objectSchema.getPrimaryKey());
                    changed = true;
                }
                SchemaReconciler.resolveColumns(objectSchema, TableBinding.tableForType(group, objectSchema.getName()));
            }

            if (migration != null && (oldVersion < version || diff.createsTables())) {
                MigrationContext context = new MigrationContext(group, oldVersion, version, oldSchema, target);
                try {
                    migration.migrate(context);
                } catch (Exception e) {
                    throw new MigrationException(oldVersion, version, e);
                }
                changed = true;
            }

            if (oldVersion != version) {
                SchemaMetadata.setSchemaVersion(group, version);
                changed = true;
            }
            group.commit();
            if (oldVersion != version) {
                log.info("Migrated '{}' from schema version {} to {}", group.getPath(), oldVersion, version);
            }
            return changed;
        } catch (RuntimeException e) {
            if (group.isInWriteTransaction()) {
                group.rollback();
            }
            undo.revert(group, e);
            throw e;
        }
    }

    private static SchemaDiff plan(Group group, Schema target) {
        SchemaDiff diff = new SchemaDiff();
        List<String> errors = new ArrayList<>();
        String failedType = null;
        int failedTypes = 0;
        for (ObjectSchema objectSchema : target) {
            List<String> typeErrors = SchemaReconciler.plan(group, objectSchema, true, diff);
            typeErrors.addAll(missingLinkTargets(group, target, objectSchema));
            if (!typeErrors.isEmpty()) {
                errors.addAll(typeErrors);
                failedType = objectSchema.getName();
                failedTypes++;
            }
        }
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(failedTypes == 1 ? failedType : null, errors);
        }
        return diff;
    }

    private static List<String> missingLinkTargets(Group group, Schema target, ObjectSchema objectSchema) {
        List<String> errors = new ArrayList<>();
        for (Property property : objectSchema.getProperties()) {
            String linked = property.getObjectType();
            if (property.getType().isLink() && linked != null && !linked.isEmpty()
                    && !target.contains(linked) && TableBinding.tableForType(group, linked) == null) {
                errors.add("Target type '" + linked + "' doesn't exist for property '" + property.getName() + "'.");
            }
        }
        return errors;
    }

    private static void checkVersion(long oldVersion, long version) {
        if (oldVersion != SchemaMetadata.NOT_VERSIONED && oldVersion > version) {
            throw new SchemaVersionException(oldVersion, version);
        }
    }
}
