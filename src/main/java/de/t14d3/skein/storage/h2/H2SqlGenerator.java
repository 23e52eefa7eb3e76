package de.t14d3.skein.storage.h2;

import de.t14d3.skein.schema.PropertyType;

/**
 * Generates the H2 statements used by the engine. Identifiers are always quoted, so table
 * and column names keep their case.
 */
final class H2SqlGenerator {

    private H2SqlGenerator() {
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String escapeStringLiteral(String literal) {
        return literal.replace("'", "''");
    }

    // the table name length keeps names unique when table or column contain '_'
    static String indexName(String table, String column) {
        return "idx_" + table.length() + "_" + table + "_" + column;
    }

    static String createTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + "()";
    }

    static String dropTable(String table) {
        return "DROP TABLE " + quoteIdentifier(table);
    }

    /**
     * ALTER TABLE ADD COLUMN for a column of the given type. Required columns get a
     * default so the column can be added to a table that already holds rows.
     */
    static String addColumn(String table, String column, PropertyType type, boolean nullable) {
        StringBuilder sql = new StringBuilder();
        sql.append("ALTER TABLE ").append(quoteIdentifier(table));
        sql.append(" ADD COLUMN ").append(quoteIdentifier(column)).append(' ');
        sql.append(columnType(type));

        if (type == PropertyType.ARRAY) {
            sql.append(" DEFAULT ARRAY[] NOT NULL");
        } else if (!nullable && type != PropertyType.OBJECT) {
            String defaultValue = defaultValue(type);
            if (defaultValue != null) {
                sql.append(" DEFAULT ").append(defaultValue);
            }
            sql.append(" NOT NULL");
        }
        return sql.toString();
    }

    static String dropColumn(String table, String column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(column);
    }

    static String commentOnColumn(String table, String column, String remarks) {
        return "COMMENT ON COLUMN " + quoteIdentifier(table) + "." + quoteIdentifier(column)
                + " IS '" + escapeStringLiteral(remarks) + "'";
    }

    static String createIndex(String table, String column) {
        return "CREATE INDEX " + quoteIdentifier(indexName(table, column))
                + " ON " + quoteIdentifier(table) + "(" + quoteIdentifier(column) + ")";
    }

    static String dropIndex(String table, String column) {
        return "DROP INDEX IF EXISTS " + quoteIdentifier(indexName(table, column));
    }

    static String insertDefaultRow(String table) {
        return "INSERT INTO " + quoteIdentifier(table) + " DEFAULT VALUES";
    }

    static String count(String table) {
        return "SELECT COUNT(*) FROM " + quoteIdentifier(table);
    }

    static String selectRowId(String table) {
        return "SELECT _ROWID_ FROM " + quoteIdentifier(table)
                + " ORDER BY _ROWID_ OFFSET ? ROWS FETCH NEXT 1 ROWS ONLY";
    }

    static String selectValue(String table, String column) {
        return "SELECT " + quoteIdentifier(column) + " FROM " + quoteIdentifier(table)
                + " ORDER BY _ROWID_ OFFSET ? ROWS FETCH NEXT 1 ROWS ONLY";
    }

    static String updateValue(String table, String column) {
        return "UPDATE " + quoteIdentifier(table) + " SET " + quoteIdentifier(column) + " = ? WHERE _ROWID_ = ?";
    }

    static String deleteAll(String table) {
        return "DELETE FROM " + quoteIdentifier(table);
    }

    /**
     * SQL type used to store a property type.
     */
    static String columnType(PropertyType type) {
        return switch (type) {
            case INT, OBJECT -> "BIGINT";
            case BOOL -> "BOOLEAN";
            case FLOAT -> "REAL";
            case DOUBLE -> "DOUBLE PRECISION";
            case STRING -> "CHARACTER VARYING";
            case BINARY -> "BINARY VARYING";
            case DATE -> "TIMESTAMP";
            case ANY -> "JAVA_OBJECT";
            case ARRAY -> "BIGINT ARRAY";
        };
    }

    private static String defaultValue(PropertyType type) {
        return switch (type) {
            case INT, FLOAT, DOUBLE -> "0";
            case BOOL -> "FALSE";
            case STRING -> "''";
            case BINARY -> "X''";
            case DATE -> "TIMESTAMP '1970-01-01 00:00:00'";
            default -> null;
        };
    }

    /**
     * Best effort mapping for columns without type remarks, e.g. tables created by other tools.
     */
    static PropertyType inferType(String sqlType) {
        if (sqlType == null) return PropertyType.ANY;
        String type = sqlType.toUpperCase();
        if (type.equals("BIGINT") || type.equals("INTEGER") || type.equals("SMALLINT") || type.equals("TINYINT")) {
            return PropertyType.INT;
        }
        if (type.equals("BOOLEAN")) return PropertyType.BOOL;
        if (type.equals("REAL")) return PropertyType.FLOAT;
        if (type.startsWith("DOUBLE")) return PropertyType.DOUBLE;
        if (type.startsWith("CHARACTER") || type.startsWith("VARCHAR")) return PropertyType.STRING;
        if (type.startsWith("BINARY") || type.equals("BLOB")) return PropertyType.BINARY;
        if (type.startsWith("TIMESTAMP")) return PropertyType.DATE;
        if (type.equals("ARRAY")) return PropertyType.ARRAY;
        return PropertyType.ANY;
    }
}
