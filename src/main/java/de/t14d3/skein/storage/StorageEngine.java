package de.t14d3.skein.storage;

/**
 * Opens transactional groups of tables. Implementations are shared by every instance of a
 * registry and must be safe for use from several threads.
 */
public interface StorageEngine {

    /**
     * Opens the group described by {@code config}, creating the file when it does not exist
     * and the config is writable.
     *
     * @throws de.t14d3.skein.exceptions.StorageException when the file cannot be opened
     */
    Group open(GroupConfig config);

    /**
     * Whether a persisted file exists for the given path. Always false for in-memory groups
     * that are not currently open.
     */
    boolean exists(String path, boolean inMemory);
}
