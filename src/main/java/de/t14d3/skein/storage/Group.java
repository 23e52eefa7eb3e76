package de.t14d3.skein.storage;

import java.util.List;

/**
 * A transactional collection of named tables backed by one file.
 * <p>
 * A group is confined to the thread that uses it, except for {@link #close()}.
 * Structural and row changes are only allowed inside a write transaction; table handles
 * obtained before {@link #endRead()}, {@link #rollback()}, {@link #compact()} or
 * {@link #close()} become stale and throw {@link IllegalStateException} when used.
 */
public interface Group extends AutoCloseable {

    String getPath();

    boolean isReadOnly();

    boolean isInMemory();

    /**
     * Starts a read view at the latest committed state. Commits of other groups stay invisible
     * to it until the next {@code beginRead}, {@link #endRead()} or write transaction.
     */
    void beginRead();

    void endRead();

    /**
     * Whether another group on the same path committed since the current read view started.
     */
    boolean hasChanged();

    /**
     * Takes the write lock of the path and starts a write transaction on the latest state.
     */
    void beginWrite();

    void commit();

    void rollback();

    boolean isInWriteTransaction();

    List<String> getTableNames();

    boolean hasTable(String name);

    /**
     * @return the table, or null when it does not exist
     */
    Table getTable(String name);

    Table addTable(String name);

    void removeTable(String name);

    /**
     * Writes a consistent copy of the current state to a new file.
     *
     * @param path          target path, which must not exist
     * @param encryptionKey key for the copy, or null
     */
    void writeCopy(String path, byte[] encryptionKey);

    /**
     * Reclaims unused space.
     *
     * @return false when compaction was not possible in the current state
     */
    boolean compact();

    /**
     * Counter bumped whenever previously obtained table handles become stale.
     */
    long generation();

    boolean isClosed();

    @Override
    void close();
}
