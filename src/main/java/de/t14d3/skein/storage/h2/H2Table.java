package de.t14d3.skein.storage.h2;

import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * {@link Table} handle over an H2 table. Rows are addressed by their position in
 * {@code _ROWID_} order; link values are row positions in the target table.
 */
class H2Table implements Table {
    private static final Logger log = LoggerFactory.getLogger(H2Table.class);

    private final H2Group group;
    private final String name;
    private final long generation;

    H2Table(H2Group group, String name, long generation) {
        this.group = group;
        this.name = name;
        this.generation = generation;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getColumnCount() {
        return columns().size();
    }

    @Override
    public String getColumnName(int column) {
        return column(column).name();
    }

    @Override
    public PropertyType getColumnType(int column) {
        return column(column).type();
    }

    @Override
    public boolean isColumnNullable(int column) {
        return column(column).nullable();
    }

    @Override
    public int findColumn(String columnName) {
        List<H2Group.ColumnInfo> columns = columns();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String getLinkTarget(int column) {
        H2Group.ColumnInfo info = column(column);
        return info.type().isLink() ? info.linkTarget() : null;
    }

    @Override
    public int addColumn(PropertyType type, String columnName, boolean nullable) {
        if (type.isLink()) {
            throw new IllegalArgumentException("Link columns must be added with addLinkColumn");
        }
        return add(type, columnName, nullable, null);
    }

    @Override
    public int addLinkColumn(PropertyType type, String columnName, String targetTable) {
        if (!type.isLink()) {
            throw new IllegalArgumentException("Type '" + type + "' is not a link type");
        }
        if (!group.hasTable(targetTable)) {
            throw new IllegalArgumentException("Link target table '" + targetTable + "' does not exist");
        }
        return add(type, columnName, type == PropertyType.OBJECT, targetTable);
    }

    private int add(PropertyType type, String columnName, boolean nullable, String linkTarget) {
        checkWrite();
        if (findColumn(columnName) >= 0) {
            throw new IllegalArgumentException("Column '" + columnName + "' already exists in '" + name + "'");
        }
        group.execute(H2SqlGenerator.addColumn(name, columnName, type, nullable));
        group.execute(H2SqlGenerator.commentOnColumn(name, columnName, H2Group.ColumnInfo.remarks(type, linkTarget)));
        group.invalidateColumns(name);
        log.debug("Added column '{}' ({}) to '{}'", columnName, type, name);
        return getColumnCount() - 1;
    }

    @Override
    public void removeColumn(int column) {
        checkWrite();
        String columnName = column(column).name();
        group.execute(H2SqlGenerator.dropIndex(name, columnName));
        group.execute(H2SqlGenerator.dropColumn(name, columnName));
        group.invalidateColumns(name);
        log.debug("Removed column '{}' from '{}'", columnName, name);
    }

    @Override
    public boolean hasSearchIndex(int column) {
        return group.hasIndex(name, column(column).name());
    }

    @Override
    public void addSearchIndex(int column) {
        checkWrite();
        H2Group.ColumnInfo info = column(column);
        if (!info.type().isIndexable()) {
            throw new IllegalArgumentException("Column '" + info.name() + "' of type '" + info.type() + "' cannot be indexed");
        }
        if (!hasSearchIndex(column)) {
            group.execute(H2SqlGenerator.createIndex(name, info.name()));
            log.debug("Added index on '{}.{}'", name, info.name());
        }
    }

    @Override
    public void removeSearchIndex(int column) {
        checkWrite();
        String columnName = column(column).name();
        group.execute(H2SqlGenerator.dropIndex(name, columnName));
        log.debug("Removed index on '{}.{}'", name, columnName);
    }

    @Override
    public long size() {
        check();
        try (Statement stmt = group.connection().createStatement();
             ResultSet rs = stmt.executeQuery(H2SqlGenerator.count(name))) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw group.translate(e);
        }
    }

    @Override
    public long addRow() {
        checkWrite();
        group.execute(H2SqlGenerator.insertDefaultRow(name));
        return size() - 1;
    }

    @Override
    public Object get(int column, long row) {
        H2Group.ColumnInfo info = column(column);
        checkRow(row);
        try (PreparedStatement ps = group.connection().prepareStatement(H2SqlGenerator.selectValue(name, info.name()))) {
            ps.setLong(1, row);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return fromSql(info.type(), rs.getObject(1));
            }
        } catch (SQLException e) {
            throw group.translate(e);
        }
    }

    @Override
    public void set(int column, long row, Object value) {
        checkWrite();
        H2Group.ColumnInfo info = column(column);
        checkRow(row);
        if (value == null && !info.nullable() && info.type() != PropertyType.OBJECT) {
            throw new IllegalArgumentException("Column '" + info.name() + "' of '" + name + "' is not nullable");
        }
        Connection connection = group.connection();
        try (PreparedStatement select = connection.prepareStatement(H2SqlGenerator.selectRowId(name));
             PreparedStatement update = connection.prepareStatement(H2SqlGenerator.updateValue(name, info.name()))) {
            select.setLong(1, row);
            long rowId;
            try (ResultSet rs = select.executeQuery()) {
                rs.next();
                rowId = rs.getLong(1);
            }
            update.setObject(1, toSql(connection, info.type(), value));
            update.setLong(2, rowId);
            update.executeUpdate();
        } catch (SQLException e) {
            throw group.translate(e);
        }
    }

    @Override
    public void clear() {
        checkWrite();
        group.execute(H2SqlGenerator.deleteAll(name));
    }

    private Object toSql(Connection connection, PropertyType type, Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case INT, OBJECT -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).floatValue();
            case DOUBLE -> ((Number) value).doubleValue();
            case DATE -> value instanceof Date date
                    ? new Timestamp(date.getTime())
                    : Timestamp.from((Instant) value);
            case ARRAY -> {
                Collection<?> links = (Collection<?>) value;
                Long[] rows = new Long[links.size()];
                int i = 0;
                for (Object link : links) {
                    rows[i++] = ((Number) link).longValue();
                }
                yield connection.createArrayOf("BIGINT", rows);
            }
            default -> value;
        };
    }

    private Object fromSql(PropertyType type, Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case DATE -> value instanceof Timestamp timestamp ? timestamp.toInstant() : value;
            case FLOAT -> ((Number) value).floatValue();
            case DOUBLE -> ((Number) value).doubleValue();
            case INT, OBJECT -> ((Number) value).longValue();
            case ARRAY -> {
                Object[] elements = value instanceof Array array ? (Object[]) array.getArray() : (Object[]) value;
                List<Long> rows = new ArrayList<>(elements.length);
                for (Object element : elements) {
                    rows.add(((Number) element).longValue());
                }
                yield rows;
            }
            default -> value;
        };
    }

    private List<H2Group.ColumnInfo> columns() {
        check();
        return group.columns(name);
    }

    private H2Group.ColumnInfo column(int column) {
        List<H2Group.ColumnInfo> columns = columns();
        if (column < 0 || column >= columns.size()) {
            throw new IndexOutOfBoundsException("Column " + column + " out of range for '" + name + "' with "
                    + columns.size() + " columns");
        }
        return columns.get(column);
    }

    private void checkRow(long row) {
        long size = size();
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for '" + name + "' with " + size + " rows");
        }
    }

    private void check() {
        group.checkHandle(generation, name);
    }

    private void checkWrite() {
        check();
        group.checkWrite();
    }

    @Override
    public String toString() {
        return "H2Table{" + name + '}';
    }
}
