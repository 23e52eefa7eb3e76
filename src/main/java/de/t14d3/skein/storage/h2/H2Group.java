package de.t14d3.skein.storage.h2;

import de.t14d3.skein.exceptions.StorageException;
import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.GroupConfig;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * {@link Group} over one H2 connection. A read view is a snapshot transaction held open
 * until {@link #endRead()} or the next write transaction; without one the connection runs
 * in auto-commit mode.
 * <p>
 * H2 commits DDL implicitly, so structural changes made inside a write transaction are
 * durable as soon as they are executed. Callers that need all-or-nothing structure changes
 * have to record and revert them on rollback.
 */
class H2Group implements Group {
    private static final Logger log = LoggerFactory.getLogger(H2Group.class);

    private static final String TABLES_SQL =
            "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC' ORDER BY TABLE_NAME";
    private static final String COLUMNS_SQL =
            "SELECT COLUMN_NAME, DATA_TYPE, IS_NULLABLE, REMARKS FROM INFORMATION_SCHEMA.COLUMNS "
                    + "WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = ? ORDER BY ORDINAL_POSITION";
    private static final String INDEX_SQL =
            "SELECT COUNT(*) FROM INFORMATION_SCHEMA.INDEXES WHERE INDEX_SCHEMA = 'PUBLIC' AND INDEX_NAME = ?";

    private final H2StorageEngine engine;
    private final GroupConfig config;
    private final H2StorageEngine.PathState state;
    private final Map<String, List<ColumnInfo>> columnCache = new HashMap<>();
    private Connection connection;
    private long readVersion;
    private long generation;
    private boolean inWrite;
    private boolean reading;
    private boolean closed;

    H2Group(H2StorageEngine engine, GroupConfig config, Connection connection, H2StorageEngine.PathState state) {
        this.engine = engine;
        this.config = config;
        this.connection = connection;
        this.state = state;
        this.readVersion = state.commitVersion.get();
    }

    @Override
    public String getPath() {
        return config.path();
    }

    @Override
    public boolean isReadOnly() {
        return config.readOnly();
    }

    @Override
    public boolean isInMemory() {
        return config.inMemory();
    }

    @Override
    public void beginRead() {
        checkOpen();
        if (inWrite) {
            return;
        }
        readVersion = state.commitVersion.get();
        try {
            if (reading) {
                connection.commit();
            } else {
                connection.setAutoCommit(false);
            }
            pinSnapshot();
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
        reading = true;
        columnCache.clear();
    }

    @Override
    public void endRead() {
        checkOpen();
        generation++;
        columnCache.clear();
        if (reading && !inWrite) {
            reading = false;
            try {
                connection.commit();
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                throw H2Errors.translate(e, config.path());
            }
        }
    }

    // the first statement of a snapshot transaction fixes what it sees
    private void pinSnapshot() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            rs.next();
        }
    }

    @Override
    public boolean hasChanged() {
        checkOpen();
        return state.commitVersion.get() != readVersion;
    }

    @Override
    public void beginWrite() {
        checkOpen();
        if (config.readOnly()) {
            throw new IllegalStateException("Can't perform transactions on read-only files.");
        }
        if (inWrite) {
            throw new IllegalStateException("The group is already in a write transaction");
        }
        state.writeLock.acquireUninterruptibly();
        try {
            if (reading) {
                connection.commit();
            } else {
                connection.setAutoCommit(false);
            }
        } catch (SQLException e) {
            state.writeLock.release();
            throw H2Errors.translate(e, config.path());
        }
        inWrite = true;
        readVersion = state.commitVersion.get();
        columnCache.clear();
    }

    @Override
    public void commit() {
        checkWrite();
        try {
            connection.commit();
            readVersion = state.commitVersion.incrementAndGet();
            resumeRead();
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        } finally {
            endWrite();
        }
    }

    // called with the write lock held, so the new read view starts at the latest state
    private void resumeRead() throws SQLException {
        if (reading) {
            pinSnapshot();
        } else {
            connection.setAutoCommit(true);
        }
    }

    @Override
    public void rollback() {
        checkWrite();
        try {
            connection.rollback();
            resumeRead();
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        } finally {
            endWrite();
            generation++;
            columnCache.clear();
        }
    }

    private void endWrite() {
        inWrite = false;
        state.writeLock.release();
    }

    @Override
    public boolean isInWriteTransaction() {
        return inWrite;
    }

    @Override
    public List<String> getTableNames() {
        checkOpen();
        List<String> names = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(TABLES_SQL)) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
        return names;
    }

    @Override
    public boolean hasTable(String name) {
        return !columns(name).isEmpty() || getTableNames().contains(name);
    }

    @Override
    public Table getTable(String name) {
        return hasTable(name) ? new H2Table(this, name, generation) : null;
    }

    @Override
    public Table addTable(String name) {
        checkWrite();
        if (hasTable(name)) {
            throw new IllegalArgumentException("Table '" + name + "' already exists");
        }
        execute(H2SqlGenerator.createTable(name));
        log.debug("Created table '{}'", name);
        return new H2Table(this, name, generation);
    }

    @Override
    public void removeTable(String name) {
        checkWrite();
        execute(H2SqlGenerator.dropTable(name));
        invalidateColumns(name);
        log.debug("Dropped table '{}'", name);
    }

    @Override
    public void writeCopy(String path, byte[] encryptionKey) {
        checkOpen();
        H2StorageEngine.requireAbsent(path);
        H2Errors.checkPermissions(H2StorageEngine.dataFile(path), false);

        List<String> script = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SCRIPT NOPASSWORDS NOSETTINGS")) {
            while (rs.next()) {
                String sql = rs.getString(1);
                if (!sql.trim().startsWith("--")) {
                    script.add(sql);
                }
            }
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }

        try (Connection target = engine.connect(path, encryptionKey, false, false);
             Statement stmt = target.createStatement()) {
            for (String sql : script) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw H2Errors.translate(e, path);
        }
        log.debug("Wrote copy of '{}' to '{}' ({} statements)", config.path(), path, script.size());
    }

    @Override
    public boolean compact() {
        checkOpen();
        if (config.inMemory() || config.readOnly() || inWrite
                || engine.openCount(config.path(), false) > 1) {
            return false;
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SHUTDOWN COMPACT");
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
        closeQuietly();
        connection = engine.connect(config.path(), config.encryptionKey(), false, true);
        reading = false;
        generation++;
        columnCache.clear();
        log.debug("Compacted '{}'", config.path());
        return true;
    }

    @Override
    public long generation() {
        return generation;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            if (inWrite) {
                rollback();
            }
        } finally {
            closed = true;
            generation++;
            columnCache.clear();
            closeQuietly();
            engine.release(state);
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection to '{}'", config.path(), e);
        }
    }

    // -----------------------
    // Helpers used by H2Table
    // -----------------------

    void checkOpen() {
        if (closed) {
            throw new IllegalStateException("The group at '" + config.path() + "' has been closed");
        }
    }

    void checkHandle(long handleGeneration, String table) {
        checkOpen();
        if (handleGeneration != generation) {
            throw new IllegalStateException("Table '" + table + "' is no longer valid. Re-fetch it from the group.");
        }
    }

    void checkWrite() {
        checkOpen();
        if (!inWrite) {
            throw new IllegalStateException("Cannot modify managed objects outside of a write transaction.");
        }
    }

    Connection connection() {
        return connection;
    }

    void execute(String sql) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
    }

    void invalidateColumns(String table) {
        columnCache.remove(table);
    }

    boolean hasIndex(String table, String column) {
        try (PreparedStatement ps = connection.prepareStatement(INDEX_SQL)) {
            ps.setString(1, H2SqlGenerator.indexName(table, column));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
    }

    List<ColumnInfo> columns(String table) {
        checkOpen();
        List<ColumnInfo> cached = columnCache.get(table);
        if (cached != null) {
            return cached;
        }
        List<ColumnInfo> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(ColumnInfo.of(rs.getString("COLUMN_NAME"), rs.getString("DATA_TYPE"),
                            "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")), rs.getString("REMARKS")));
                }
            }
        } catch (SQLException e) {
            throw H2Errors.translate(e, config.path());
        }
        List<ColumnInfo> result = Collections.unmodifiableList(columns);
        if (!result.isEmpty()) {
            columnCache.put(table, result);
        }
        return result;
    }

    StorageException translate(SQLException e) {
        return H2Errors.translate(e, config.path());
    }

    /**
     * Column as stored: type tag and link target are kept in the column remarks.
     */
    record ColumnInfo(String name, PropertyType type, boolean nullable, String linkTarget) {

        static ColumnInfo of(String name, String sqlType, boolean nullable, String remarks) {
            if (remarks == null || remarks.isEmpty()) {
                return new ColumnInfo(name, H2SqlGenerator.inferType(sqlType), nullable, null);
            }
            int separator = remarks.indexOf(':');
            String tag = separator < 0 ? remarks : remarks.substring(0, separator);
            String target = separator < 0 ? null : remarks.substring(separator + 1);
            return new ColumnInfo(name, PropertyType.fromTag(tag), nullable, target);
        }

        static String remarks(PropertyType type, String linkTarget) {
            return linkTarget == null ? type.tag() : type.tag() + ":" + linkTarget;
        }
    }
}
