package de.t14d3.skein.core;

import de.t14d3.skein.exceptions.SkeinException;
import de.t14d3.skein.migration.MigrationManager;
import de.t14d3.skein.migration.SchemaMetadata;
import de.t14d3.skein.migration.TableBinding;
import de.t14d3.skein.notification.CommitEvent;
import de.t14d3.skein.notification.Notification;
import de.t14d3.skein.notification.NotificationListener;
import de.t14d3.skein.notification.NotificationToken;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.DataOnlyTable;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.GroupConfig;
import de.t14d3.skein.storage.StorageEngine;
import de.t14d3.skein.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An open view of one file, confined to the thread that opened it.
 * <p>
 * Instances are obtained through {@link #open(InstanceRegistry, SkeinConfiguration)}. Opening
 * the same path again on the same thread returns the same instance; the first open of a path
 * brings the file to the registry's schema version, running the migration registered for it.
 * Every operation except {@link #close()} must be called on the opening thread.
 */
public class Skein implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Skein.class);

    private final InstanceRegistry registry;
    private final SkeinConfiguration configuration;
    private final String path;
    private final byte[] encryptionKey;
    private final Group group;
    private final Thread owner;
    private final Map<String, Table> tables = new HashMap<>();
    private final List<NotificationToken.Registration> listeners = new CopyOnWriteArrayList<>();
    private final Queue<CommitEvent> mailbox = new ConcurrentLinkedQueue<>();
    private Schema schema;
    private boolean autorefresh;
    private boolean readActive;
    private volatile boolean closed;

    private Skein(InstanceRegistry registry, SkeinConfiguration configuration, String path, byte[] encryptionKey, Group group) {
        this.registry = registry;
        this.configuration = configuration;
        this.path = path;
        this.encryptionKey = encryptionKey;
        this.group = group;
        this.owner = Thread.currentThread();
        this.autorefresh = configuration.isAutorefresh();
    }

    /**
     * Opens the file described by {@code configuration}.
     *
     * @throws IllegalArgumentException when the path is empty, or a custom schema is given without dynamic
     * @throws IllegalStateException    when the path is already open on this thread with different options
     * @throws SkeinException           when the file cannot be opened or migrated
     */
    public static Skein open(InstanceRegistry registry, SkeinConfiguration configuration) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(configuration, "configuration");
        String path = registry.resolvePath(configuration.getPath());
        if (configuration.getCustomSchema() != null && !configuration.isDynamic()) {
            throw new IllegalArgumentException("Custom schema only supported when using dynamic instances");
        }

        byte[] key = configuration.getEncryptionKey() != null
                ? InstanceRegistry.validatedKey(configuration.getEncryptionKey())
                : registry.getEncryptionKey(path);
        if (registry.isEncryptionDisabled()) {
            key = null;
        }

        Skein cached = registry.cachedInstance(path, Thread.currentThread().getId());
        if (cached != null) {
            if (cached.isReadOnly() != configuration.isReadOnly()) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different read permissions");
            }
            if (cached.isInMemory() != configuration.isInMemory()) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different inMemory settings");
            }
            if (configuration.isDynamic()) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different dynamic settings");
            }
            if (!Arrays.equals(cached.encryptionKey, key)) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different encryption key");
            }
            return cached;
        }

        registry.initLock().lock();
        try {
            return create(registry, configuration, path, key);
        } finally {
            registry.initLock().unlock();
        }
    }

    private static Skein create(InstanceRegistry registry, SkeinConfiguration configuration, String path, byte[] key) {
        Skein existing = registry.anyInstance(path);
        if (existing != null) {
            if (existing.isInMemory() != configuration.isInMemory()) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different inMemory settings");
            }
            if (!Arrays.equals(existing.encryptionKey, key)) {
                throw new IllegalStateException("File at path '" + path + "' already opened with different encryption key");
            }
        }
        GroupConfig groupConfig = new GroupConfig(path, key, configuration.isReadOnly(), configuration.isInMemory());
        Group group = registry.getStorageEngine().open(groupConfig);
        Skein skein = new Skein(registry, configuration, path, key, group);
        try {
            Schema schema;
            if (configuration.isReadOnly()) {
                if (MigrationManager.schemaVersion(group) == SchemaMetadata.NOT_VERSIONED) {
                    throw new SkeinException("Cannot open an uninitialized file in read-only mode");
                }
                if (configuration.isDynamic()) {
                    schema = TableBinding.readSchema(group);
                } else {
                    schema = registry.getSchema().copy();
                    MigrationManager.verify(group, schema);
                }
            } else if (configuration.isDynamic() && configuration.getCustomSchema() == null) {
                if (MigrationManager.schemaVersion(group) == SchemaMetadata.NOT_VERSIONED) {
                    // new file: only the metadata tables are created
                    MigrationManager.updateToSchema(group, registry.getSchemaVersion(path), Schema.empty(), null);
                }
                schema = TableBinding.readSchema(group);
            } else {
                if (existing != null) {
                    schema = existing.schema.shallowCopy();
                } else {
                    schema = configuration.getCustomSchema() != null
                            ? configuration.getCustomSchema().copy()
                            : registry.getSchema().copy();
                    MigrationManager.updateToSchema(group, registry.getSchemaVersion(path), schema,
                            registry.getMigration(path));
                }
            }
            skein.schema = schema;
            skein.group.beginRead();
            skein.readActive = true;

            if (!configuration.isDynamic()) {
                registry.cacheInstance(path, skein.owner.getId(), skein);
            }
            if (!configuration.isReadOnly()) {
                registry.subscribe(path, skein);
            }
            log.debug("Opened '{}' (readOnly={}, inMemory={}, dynamic={})", path,
                    configuration.isReadOnly(), configuration.isInMemory(), configuration.isDynamic());
            return skein;
        } catch (RuntimeException e) {
            group.close();
            throw e;
        }
    }

    // -----------------------
    // Static file operations
    // -----------------------

    /**
     * Reads the schema version of a file without keeping it open.
     *
     * @param key key for an encrypted file, or null to use the key registered for the path
     * @return the stored version, or {@link SchemaMetadata#NOT_VERSIONED} when the file does not exist
     *         or was never versioned
     */
    public static long schemaVersionAtPath(InstanceRegistry registry, String path, byte[] key) {
        String resolved = registry.resolvePath(path);
        StorageEngine engine = registry.getStorageEngine();
        boolean inMemory = false;
        Skein open = registry.anyInstance(resolved);
        if (open != null) {
            inMemory = open.isInMemory();
        }
        if (!engine.exists(resolved, inMemory)) {
            return SchemaMetadata.NOT_VERSIONED;
        }
        byte[] validated = key != null ? InstanceRegistry.validatedKey(key) : registry.getEncryptionKey(resolved);
        if (registry.isEncryptionDisabled()) {
            validated = null;
        }
        try (Group group = engine.open(new GroupConfig(resolved, validated, true, inMemory))) {
            return MigrationManager.schemaVersion(group);
        }
    }

    /**
     * Brings a file to the schema version registered for it without keeping it open.
     *
     * @return true when anything was written
     * @throws IllegalStateException when instances are open on the path
     */
    public static boolean migrate(InstanceRegistry registry, String path, byte[] key) {
        String resolved = registry.resolvePath(path);
        if (registry.hasOpenInstances(resolved)) {
            throw new IllegalStateException("Cannot migrate files that are already open.");
        }
        byte[] validated = key != null ? InstanceRegistry.validatedKey(key) : registry.getEncryptionKey(resolved);
        if (registry.isEncryptionDisabled()) {
            validated = null;
        }
        registry.initLock().lock();
        try (Group group = registry.getStorageEngine().open(new GroupConfig(resolved, validated, false, false))) {
            return MigrationManager.updateToSchema(group, registry.getSchemaVersion(resolved),
                    registry.getSchema().copy(), registry.getMigration(resolved));
        } finally {
            registry.initLock().unlock();
        }
    }

    // -----------------------
    // Transactions
    // -----------------------

    /**
     * Begin a write transaction. Takes the write lock of the file, waiting for writers on
     * other threads, and advances this instance to the latest data.
     *
     * @throws IllegalStateException if already in a write transaction or the instance is read-only
     */
    public void beginWriteTransaction() {
        verifyThread();
        if (isReadOnly()) {
            throw new IllegalStateException("Can't perform transactions on read-only files.");
        }
        if (group.isInWriteTransaction()) {
            throw new IllegalStateException("The instance is already in a write transaction");
        }
        ensureRead();
        boolean announce = group.hasChanged();
        group.beginWrite();
        tables.clear();
        if (announce) {
            sendNotifications(Notification.DID_CHANGE);
        }
    }

    /**
     * Commit the current write transaction and notify listeners of this and other instances.
     *
     * @throws IllegalStateException if not in a write transaction
     */
    public void commitWriteTransaction() {
        verifyThread();
        if (!group.isInWriteTransaction()) {
            throw new IllegalStateException("Can't commit a non-existing write transaction");
        }
        group.commit();
        registry.publishCommit(this);
        sendNotifications(Notification.DID_CHANGE);
    }

    /**
     * Discard all changes of the current write transaction.
     *
     * @throws IllegalStateException if not in a write transaction
     */
    public void cancelWriteTransaction() {
        verifyThread();
        if (!group.isInWriteTransaction()) {
            throw new IllegalStateException("Can't cancel a non-existing write transaction");
        }
        group.rollback();
        tables.clear();
    }

    /**
     * Runs {@code block} in a write transaction. The transaction is committed when the block
     * returns, unless the block cancelled it, and cancelled when the block throws.
     */
    public void executeTransaction(Consumer<Skein> block) {
        Objects.requireNonNull(block, "block");
        beginWriteTransaction();
        try {
            block.accept(this);
        } catch (RuntimeException | Error e) {
            if (group.isInWriteTransaction()) {
                cancelWriteTransaction();
            }
            throw e;
        }
        if (group.isInWriteTransaction()) {
            commitWriteTransaction();
        }
    }

    public boolean isInWriteTransaction() {
        verifyThread();
        return group.isInWriteTransaction();
    }

    // -----------------------
    // Read view
    // -----------------------

    /**
     * Releases the current read view. Table handles become invalid; the next access starts a
     * new read view at the latest data. A write transaction in progress is cancelled.
     */
    public void invalidate() {
        verifyThread();
        if (group.isInWriteTransaction()) {
            log.warn("Invalidating '{}' during a write transaction. The transaction is cancelled.", path);
            group.rollback();
        }
        if (readActive) {
            group.endRead();
            readActive = false;
        }
        tables.clear();
    }

    /**
     * Advances to the latest data if another instance committed since the read view started.
     *
     * @return true when new data became visible
     */
    public boolean refresh() {
        verifyThread();
        if (group.isInWriteTransaction()) {
            return false;
        }
        if (readActive && !group.hasChanged()) {
            return false;
        }
        if (readActive) {
            group.endRead();
        }
        group.beginRead();
        readActive = true;
        tables.clear();
        sendNotifications(Notification.DID_CHANGE);
        return true;
    }

    /**
     * Handles commits made by other instances since the last call. With autorefresh the instance
     * refreshes and sends {@link Notification#DID_CHANGE}, otherwise listeners get
     * {@link Notification#REFRESH_REQUIRED}.
     */
    public void notifyChanges() {
        if (closed) {
            return;
        }
        verifyThread();
        boolean pending = false;
        while (mailbox.poll() != null) {
            pending = true;
        }
        if (!pending) {
            return;
        }
        if (autorefresh) {
            refresh();
        } else {
            sendNotifications(Notification.REFRESH_REQUIRED);
        }
    }

    /**
     * Number of commits of other instances not yet handled by {@link #notifyChanges()}.
     */
    public int pendingCommits() {
        return mailbox.size();
    }

    void deliver(CommitEvent event) {
        if (!closed) {
            mailbox.add(event);
        }
    }

    public boolean isAutorefresh() {
        return autorefresh;
    }

    public void setAutorefresh(boolean autorefresh) {
        verifyThread();
        this.autorefresh = autorefresh;
    }

    // -----------------------
    // Notifications
    // -----------------------

    /**
     * Registers a listener for changes of this instance.
     *
     * @return a token that must be kept and closed to stop notifications
     * @throws IllegalStateException for read-only instances
     */
    public NotificationToken addNotification(NotificationListener listener) {
        verifyThread();
        if (listener == null) {
            throw new IllegalArgumentException("Listener must not be null");
        }
        if (isReadOnly()) {
            throw new IllegalStateException("Read-only files do not change and do not have change notifications");
        }
        NotificationToken token = new NotificationToken(path, listener, this::removeNotification);
        listeners.add(token.registration());
        return token;
    }

    public void removeNotification(NotificationToken token) {
        if (token == null) {
            return;
        }
        if (!closed) {
            verifyThread();
        }
        listeners.remove(token.registration());
        token.detach();
    }

    private void sendNotifications(Notification notification) {
        for (NotificationToken.Registration registration : listeners) {
            if (!registration.isAttached()) {
                listeners.remove(registration);
                continue;
            }
            registration.listener().onNotification(notification, this);
        }
    }

    // -----------------------
    // File operations
    // -----------------------

    /**
     * Reclaims unused space in the file.
     *
     * @return false when the file could not be compacted, e.g. because other instances have it open
     */
    public boolean compact() {
        verifyThread();
        if (group.isInWriteTransaction()) {
            return false;
        }
        boolean compacted = group.compact();
        if (compacted) {
            tables.clear();
            group.beginRead();
            readActive = true;
        }
        return compacted;
    }

    /**
     * Writes a compacted copy of the current data to a new file.
     *
     * @param key key for the copy, or null for an unencrypted copy
     * @throws de.t14d3.skein.exceptions.StorageException when the target exists or cannot be written
     */
    public void writeCopy(String targetPath, byte[] key) {
        verifyThread();
        group.writeCopy(registry.resolvePath(targetPath), InstanceRegistry.validatedKey(key));
    }

    // -----------------------
    // Accessors
    // -----------------------

    /**
     * Table of a managed object type, re-resolved after refresh or invalidation. Its columns
     * and indexes can only be changed by a schema migration.
     *
     * @throws IllegalArgumentException for a type not in this instance's schema
     */
    public Table table(String objectType) {
        verifyThread();
        if (schema.get(objectType) == null) {
            throw new IllegalArgumentException("Object type '" + objectType + "' is not managed by this instance");
        }
        ensureRead();
        Table table = tables.get(objectType);
        if (table == null) {
            Table stored = TableBinding.tableForType(group, objectType);
            if (stored == null) {
                throw new IllegalStateException("Table for object type '" + objectType + "' does not exist");
            }
            table = DataOnlyTable.of(stored);
            tables.put(objectType, table);
        }
        return table;
    }

    /**
     * The schema of this instance, with column positions resolved against the file.
     */
    public Schema schema() {
        verifyThread();
        return schema;
    }

    public long schemaVersion() {
        verifyThread();
        return MigrationManager.schemaVersion(group);
    }

    public String getPath() {
        return path;
    }

    public SkeinConfiguration getConfiguration() {
        return configuration;
    }

    public boolean isReadOnly() {
        return configuration.isReadOnly();
    }

    public boolean isInMemory() {
        return configuration.isInMemory();
    }

    public boolean isDynamic() {
        return configuration.isDynamic();
    }

    public boolean isClosed() {
        return closed;
    }

    byte[] encryptionKey() {
        return encryptionKey;
    }

    /**
     * Closes the instance. May be called from any thread; a write transaction in progress is
     * cancelled.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (group.isInWriteTransaction()) {
                log.warn("Closing '{}' during a write transaction. The transaction is cancelled.", path);
                group.rollback();
            }
        } finally {
            registry.uncacheInstance(path, this);
            registry.unsubscribe(path, this);
            mailbox.clear();
            for (NotificationToken.Registration registration : listeners) {
                log.debug("Listener still attached while closing '{}': {}", path, registration.listener());
            }
            listeners.clear();
            tables.clear();
            group.close();
        }
        log.debug("Closed '{}'", path);
    }

    private void ensureRead() {
        if (!readActive) {
            group.beginRead();
            readActive = true;
        }
    }

    private void verifyThread() {
        if (closed) {
            throw new IllegalStateException("Instance at '" + path + "' has been closed");
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Instance at '" + path + "' accessed from incorrect thread");
        }
    }

    @Override
    public String toString() {
        return "Skein{path='" + path + "', readOnly=" + isReadOnly() + ", inMemory=" + isInMemory()
                + ", dynamic=" + isDynamic() + '}';
    }
}
