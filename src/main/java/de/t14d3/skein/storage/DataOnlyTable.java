package de.t14d3.skein.storage;

import de.t14d3.skein.schema.PropertyType;

/**
 * {@link Table} view that allows reading and writing rows but rejects changes to columns and
 * indexes. Handed out to user code, where a structural change would commit the surrounding
 * write transaction.
 */
public final class DataOnlyTable implements Table {
    private final Table delegate;

    private DataOnlyTable(Table delegate) {
        this.delegate = delegate;
    }

    public static Table of(Table table) {
        if (table == null || table instanceof DataOnlyTable) {
            return table;
        }
        return new DataOnlyTable(table);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public int getColumnCount() {
        return delegate.getColumnCount();
    }

    @Override
    public String getColumnName(int column) {
        return delegate.getColumnName(column);
    }

    @Override
    public PropertyType getColumnType(int column) {
        return delegate.getColumnType(column);
    }

    @Override
    public boolean isColumnNullable(int column) {
        return delegate.isColumnNullable(column);
    }

    @Override
    public int findColumn(String name) {
        return delegate.findColumn(name);
    }

    @Override
    public String getLinkTarget(int column) {
        return delegate.getLinkTarget(column);
    }

    @Override
    public int addColumn(PropertyType type, String name, boolean nullable) {
        throw structural();
    }

    @Override
    public int addLinkColumn(PropertyType type, String name, String targetTable) {
        throw structural();
    }

    @Override
    public void removeColumn(int column) {
        throw structural();
    }

    @Override
    public boolean hasSearchIndex(int column) {
        return delegate.hasSearchIndex(column);
    }

    @Override
    public void addSearchIndex(int column) {
        throw structural();
    }

    @Override
    public void removeSearchIndex(int column) {
        throw structural();
    }

    @Override
    public long size() {
        return delegate.size();
    }

    @Override
    public long addRow() {
        return delegate.addRow();
    }

    @Override
    public Object get(int column, long row) {
        return delegate.get(column, row);
    }

    @Override
    public void set(int column, long row, Object value) {
        delegate.set(column, row, value);
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    private IllegalStateException structural() {
        return new IllegalStateException("Cannot change the structure of '" + delegate.getName()
                + "' outside of a schema migration. Raise the schema version instead.");
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
