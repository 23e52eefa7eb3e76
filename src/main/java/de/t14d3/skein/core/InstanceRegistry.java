package de.t14d3.skein.core;

import de.t14d3.skein.migration.Migration;
import de.t14d3.skein.migration.SchemaMetadata;
import de.t14d3.skein.notification.CommitEvent;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.StorageEngine;
import de.t14d3.skein.storage.h2.H2StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-path state shared by every instance opened through it: encryption keys, schema
 * versions and migrations, open instances per thread, and commit subscribers.
 * <p>
 * The three maps are guarded by separate locks, always taken in the order key, version,
 * instance. Opening instances is serialized through {@link #initLock()}.
 */
public class InstanceRegistry {
    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    public static final int KEY_LENGTH = 64;
    public static final long DEFAULT_SCHEMA_VERSION = 0;
    public static final String DEFAULT_FILE_NAME = "default.skein";

    static final boolean ENCRYPTION_DISABLED_BY_ENVIRONMENT = readEncryptionDisabled();

    private final Schema schema;
    private final StorageEngine storageEngine;
    private final String defaultPath;
    private final boolean encryptionDisabled;

    private final Object keyLock = new Object();
    private final Object versionLock = new Object();
    private final Object instanceLock = new Object();
    private final ReentrantLock initLock = new ReentrantLock();

    private final Map<String, byte[]> keys = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();
    private final Map<String, Migration> migrations = new HashMap<>();
    private final Map<String, Map<Long, Skein>> instances = new HashMap<>();
    private final Map<String, List<Skein>> subscribers = new HashMap<>();
    private long commitSequence;

    private InstanceRegistry(Builder builder) {
        this.schema = builder.schema == null ? Schema.empty() : builder.schema;
        this.storageEngine = builder.storageEngine == null ? new H2StorageEngine() : builder.storageEngine;
        this.defaultPath = canonicalPath(builder.defaultPath == null
                ? Paths.get(System.getProperty("user.dir"), DEFAULT_FILE_NAME).toString()
                : builder.defaultPath);
        this.encryptionDisabled = builder.encryptionDisabled == null
                ? ENCRYPTION_DISABLED_BY_ENVIRONMENT
                : builder.encryptionDisabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The declared object model every non-dynamic instance is opened with.
     */
    public Schema getSchema() {
        return schema;
    }

    public StorageEngine getStorageEngine() {
        return storageEngine;
    }

    public String getDefaultPath() {
        return defaultPath;
    }

    /**
     * When set, keys are ignored and files are opened unencrypted.
     */
    public boolean isEncryptionDisabled() {
        return encryptionDisabled;
    }

    /**
     * Normalized form of {@code path} used as registry key.
     *
     * @throws IllegalArgumentException for an empty path
     */
    public String resolvePath(String path) {
        if (path == null) {
            return defaultPath;
        }
        if (path.isBlank()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        return canonicalPath(path);
    }

    // -----------------------
    // Encryption keys
    // -----------------------

    /**
     * Sets the key used for instances of {@code path} opened without an explicit key.
     *
     * @param key 64 byte key, or null to clear it
     * @throws IllegalStateException when instances are open on the path with a different key
     */
    public void setEncryptionKey(String path, byte[] key) {
        String resolved = resolvePath(path);
        byte[] validated = validatedKey(key);
        synchronized (keyLock) {
            if (!encryptionDisabled && openWithOtherKey(resolved, validated)) {
                throw new IllegalStateException("Cannot set encryption key for files that are already open.");
            }
            if (validated == null) {
                keys.remove(resolved);
            } else {
                keys.put(resolved, validated);
            }
        }
    }

    public byte[] getEncryptionKey(String path) {
        String resolved = resolvePath(path);
        synchronized (keyLock) {
            byte[] key = keys.get(resolved);
            return key == null ? null : key.clone();
        }
    }

    /**
     * @return a copy of {@code key}, or null
     * @throws IllegalArgumentException when the key is not exactly {@value #KEY_LENGTH} bytes long
     */
    public static byte[] validatedKey(byte[] key) {
        if (key == null) {
            return null;
        }
        if (key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Encryption key must be exactly " + KEY_LENGTH + " bytes long");
        }
        return key.clone();
    }

    // -----------------------
    // Schema versions and migrations
    // -----------------------

    /**
     * Sets the schema version and migration used when {@code path} is first opened.
     *
     * @throws IllegalArgumentException when the version is negative
     * @throws IllegalStateException    when instances are open on the path at another version
     */
    public void setSchemaVersion(String path, long version, Migration migration) {
        if (version == SchemaMetadata.NOT_VERSIONED || version < 0) {
            throw new IllegalArgumentException("Cannot set schema version to " + version);
        }
        String resolved = resolvePath(path);
        synchronized (versionLock) {
            long current = versions.getOrDefault(resolved, DEFAULT_SCHEMA_VERSION);
            if (current != version && hasOpenInstances(resolved)) {
                throw new IllegalStateException("Cannot set schema version for files that are already open.");
            }
            versions.put(resolved, version);
            if (migration == null) {
                migrations.remove(resolved);
            } else {
                migrations.put(resolved, migration);
            }
        }
    }

    public long getSchemaVersion(String path) {
        String resolved = resolvePath(path);
        synchronized (versionLock) {
            return versions.getOrDefault(resolved, DEFAULT_SCHEMA_VERSION);
        }
    }

    public Migration getMigration(String path) {
        String resolved = resolvePath(path);
        synchronized (versionLock) {
            return migrations.get(resolved);
        }
    }

    // -----------------------
    // Open instances
    // -----------------------

    Skein cachedInstance(String path, long threadId) {
        synchronized (instanceLock) {
            Map<Long, Skein> byThread = instances.get(path);
            return byThread == null ? null : byThread.get(threadId);
        }
    }

    /**
     * Any cached instance of the path, on any thread.
     */
    Skein anyInstance(String path) {
        synchronized (instanceLock) {
            Map<Long, Skein> byThread = instances.get(path);
            return byThread == null || byThread.isEmpty() ? null : byThread.values().iterator().next();
        }
    }

    void cacheInstance(String path, long threadId, Skein skein) {
        synchronized (instanceLock) {
            instances.computeIfAbsent(path, p -> new HashMap<>()).put(threadId, skein);
        }
    }

    void uncacheInstance(String path, Skein skein) {
        synchronized (instanceLock) {
            Map<Long, Skein> byThread = instances.get(path);
            if (byThread != null) {
                byThread.values().removeIf(cached -> cached == skein);
                if (byThread.isEmpty()) {
                    instances.remove(path);
                }
            }
        }
    }

    /**
     * Whether any instance, cached or subscribed, is open on the path.
     */
    public boolean hasOpenInstances(String path) {
        String resolved = resolvePath(path);
        synchronized (instanceLock) {
            Map<Long, Skein> byThread = instances.get(resolved);
            List<Skein> subscribed = subscribers.get(resolved);
            return (byThread != null && !byThread.isEmpty()) || (subscribed != null && !subscribed.isEmpty());
        }
    }

    private boolean openWithOtherKey(String path, byte[] key) {
        synchronized (instanceLock) {
            List<Skein> open = new ArrayList<>(subscribers.getOrDefault(path, Collections.emptyList()));
            Map<Long, Skein> byThread = instances.get(path);
            if (byThread != null) {
                open.addAll(byThread.values());
            }
            for (Skein skein : open) {
                if (!Arrays.equals(skein.encryptionKey(), key)) {
                    return true;
                }
            }
            return false;
        }
    }

    void subscribe(String path, Skein skein) {
        synchronized (instanceLock) {
            subscribers.computeIfAbsent(path, p -> new ArrayList<>()).add(skein);
        }
    }

    void unsubscribe(String path, Skein skein) {
        synchronized (instanceLock) {
            List<Skein> subscribed = subscribers.get(path);
            if (subscribed != null) {
                subscribed.removeIf(s -> s == skein);
                if (subscribed.isEmpty()) {
                    subscribers.remove(path);
                }
            }
        }
    }

    /**
     * Delivers a commit of {@code source} to every other subscriber of its path. Subscribers with
     * a notification executor get {@link Skein#notifyChanges()} scheduled on it.
     */
    void publishCommit(Skein source) {
        List<Skein> targets;
        CommitEvent event;
        synchronized (instanceLock) {
            List<Skein> subscribed = subscribers.get(source.getPath());
            if (subscribed == null) {
                return;
            }
            targets = new ArrayList<>(subscribed);
            event = new CommitEvent(source.getPath(), ++commitSequence);
            for (Skein target : targets) {
                if (target != source) {
                    target.deliver(event);
                }
            }
        }
        for (Skein target : targets) {
            if (target != source && target.getConfiguration().getNotificationExecutor() != null) {
                target.getConfiguration().getNotificationExecutor().execute(target::notifyChanges);
            }
        }
        log.debug("Published {} to {} instances", event, targets.size() - 1);
    }

    ReentrantLock initLock() {
        return initLock;
    }

    /**
     * Forgets every key, version, migration and instance. Open instances are not closed.
     */
    public void reset() {
        synchronized (keyLock) {
            synchronized (versionLock) {
                synchronized (instanceLock) {
                    keys.clear();
                    versions.clear();
                    migrations.clear();
                    instances.clear();
                    subscribers.clear();
                }
            }
        }
    }

    private static String canonicalPath(String path) {
        return Paths.get(path).toAbsolutePath().normalize().toString();
    }

    private static boolean readEncryptionDisabled() {
        String value = System.getenv("SKEIN_DISABLE_ENCRYPTION");
        if (value == null) {
            value = System.getProperty("skein.disableEncryption");
        }
        return value != null && !value.isEmpty() && !value.equalsIgnoreCase("false") && !value.equals("0");
    }

    public static class Builder {
        private Schema schema;
        private StorageEngine storageEngine;
        private String defaultPath;
        private Boolean encryptionDisabled;

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder storageEngine(StorageEngine storageEngine) {
            this.storageEngine = storageEngine;
            return this;
        }

        public Builder defaultPath(String defaultPath) {
            this.defaultPath = defaultPath;
            return this;
        }

        public Builder disableEncryption(boolean encryptionDisabled) {
            this.encryptionDisabled = encryptionDisabled;
            return this;
        }

        public InstanceRegistry build() {
            return new InstanceRegistry(this);
        }
    }
}
