package de.t14d3.skein.migration;

import de.t14d3.skein.schema.Property;

import java.util.*;

/**
 * Structural changes needed to bring persisted tables in line with an object model.
 * A diff is computed completely before anything is applied.
 */
public class SchemaDiff {

    /**
     * Types of schema changes.
     */
    public enum ChangeType {
        CREATE_TABLE,
        ADD_COLUMN,
        ADD_INDEX,
        REMOVE_INDEX
    }

    /**
     * Represents a single schema change.
     */
    public static class SchemaChange {
        private final ChangeType type;
        private final String objectType;
        private final Property property;

        private SchemaChange(ChangeType type, String objectType, Property property) {
            this.type = type;
            this.objectType = objectType;
            this.property = property;
        }

        public static SchemaChange createTable(String objectType) {
            return new SchemaChange(ChangeType.CREATE_TABLE, objectType, null);
        }

        public static SchemaChange addColumn(String objectType, Property property) {
            return new SchemaChange(ChangeType.ADD_COLUMN, objectType, property);
        }

        public static SchemaChange addIndex(String objectType, Property property) {
            return new SchemaChange(ChangeType.ADD_INDEX, objectType, property);
        }

        public static SchemaChange removeIndex(String objectType, Property property) {
            return new SchemaChange(ChangeType.REMOVE_INDEX, objectType, property);
        }

        public ChangeType getType() {
            return type;
        }

        public String getObjectType() {
            return objectType;
        }

        /**
         * The affected property, null for {@link ChangeType#CREATE_TABLE}.
         */
        public Property getProperty() {
            return property;
        }

        @Override
        public String toString() {
            return "SchemaChange{" +
                    "type=" + type +
                    ", objectType='" + objectType + '\'' +
                    ", property=" + (property != null ? property.getName() : "null") +
                    '}';
        }
    }

    private final List<SchemaChange> changes;

    public SchemaDiff() {
        this.changes = new ArrayList<>();
    }

    public void addChange(SchemaChange change) {
        changes.add(change);
    }

    public List<SchemaChange> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public List<SchemaChange> getChanges(ChangeType type) {
        List<SchemaChange> result = new ArrayList<>();
        for (SchemaChange change : changes) {
            if (change.getType() == type) {
                result.add(change);
            }
        }
        return result;
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public boolean createsTables() {
        return !getChanges(ChangeType.CREATE_TABLE).isEmpty();
    }

    /**
     * Human readable report, one line per change.
     */
    public String describe() {
        if (!hasChanges()) {
            return "Schema is up to date. No changes needed.";
        }
        StringBuilder report = new StringBuilder();
        for (SchemaChange change : changes) {
            switch (change.getType()) {
                case CREATE_TABLE -> report.append("CREATE TABLE: ").append(change.getObjectType());
                case ADD_COLUMN -> report.append("ADD COLUMN: ").append(change.getObjectType()).append('.')
                        .append(change.getProperty().getName()).append(" (").append(change.getProperty().getType()).append(')');
                case ADD_INDEX -> report.append("ADD INDEX: ").append(change.getObjectType()).append('.')
                        .append(change.getProperty().getName());
                case REMOVE_INDEX -> report.append("REMOVE INDEX: ").append(change.getObjectType()).append('.')
                        .append(change.getProperty().getName());
            }
            report.append('\n');
        }
        return report.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SchemaDiff{\n");
        for (SchemaChange change : changes) {
            sb.append("  ").append(change).append("\n");
        }
        sb.append("}");
        return sb.toString();
    }
}
