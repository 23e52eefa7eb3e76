package de.t14d3.skein.storage;

import de.t14d3.skein.schema.PropertyType;

/**
 * Handle to one table of a {@link Group}. Columns are addressed by position, rows by index
 * in insertion order.
 */
public interface Table {

    String getName();

    int getColumnCount();

    String getColumnName(int column);

    PropertyType getColumnType(int column);

    boolean isColumnNullable(int column);

    /**
     * @return the position of the named column, or -1
     */
    int findColumn(String name);

    /**
     * Name of the table a link column points to, or null for plain columns.
     */
    String getLinkTarget(int column);

    /**
     * Appends a plain column.
     *
     * @return the position of the new column
     */
    int addColumn(PropertyType type, String name, boolean nullable);

    /**
     * Appends an {@link PropertyType#OBJECT} or {@link PropertyType#ARRAY} column linking to {@code targetTable}.
     *
     * @return the position of the new column
     */
    int addLinkColumn(PropertyType type, String name, String targetTable);

    void removeColumn(int column);

    boolean hasSearchIndex(int column);

    void addSearchIndex(int column);

    void removeSearchIndex(int column);

    long size();

    /**
     * Appends a row holding default values.
     *
     * @return the index of the new row
     */
    long addRow();

    Object get(int column, long row);

    void set(int column, long row, Object value);

    void clear();
}
