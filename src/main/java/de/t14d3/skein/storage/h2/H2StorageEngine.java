package de.t14d3.skein.storage.h2;

import de.t14d3.skein.exceptions.StorageException;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.GroupConfig;
import de.t14d3.skein.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Storage engine backed by embedded H2 databases.
 * <p>
 * Every group owns one JDBC connection. Groups on the same path share a write lock and a
 * commit counter, which is how a group detects commits made through other groups. Across
 * processes H2's own file lock applies.
 */
public class H2StorageEngine implements StorageEngine {
    private static final Logger log = LoggerFactory.getLogger(H2StorageEngine.class);

    static final String FILE_SUFFIX = ".mv.db";
    private static final String USER = "sa";
    private static final String USER_PASSWORD = "skein";
    // read views see every table as of their first statement
    private static final String SNAPSHOT_ISOLATION = "SET SESSION CHARACTERISTICS AS TRANSACTION ISOLATION LEVEL SNAPSHOT";

    private final Map<String, PathState> states = new HashMap<>();

    @Override
    public Group open(GroupConfig config) {
        if (!config.inMemory()) {
            H2Errors.checkPermissions(dataFile(config.path()), config.readOnly());
        }
        Connection connection = connect(config.path(), config.encryptionKey(), config.inMemory(), config.readOnly());
        PathState state = acquire(stateKey(config.path(), config.inMemory()));
        log.debug("Opened group at '{}' (readOnly={}, inMemory={})", config.path(), config.readOnly(), config.inMemory());
        return new H2Group(this, config, connection, state);
    }

    @Override
    public boolean exists(String path, boolean inMemory) {
        if (inMemory) {
            synchronized (states) {
                return states.containsKey(stateKey(path, true));
            }
        }
        return Files.exists(dataFile(path));
    }

    /**
     * File H2 keeps the data of {@code path} in.
     */
    public static Path dataFile(String path) {
        return Paths.get(path + FILE_SUFFIX);
    }

    Connection connect(String path, byte[] encryptionKey, boolean inMemory, boolean mustExist) {
        String url = jdbcUrl(path, encryptionKey, inMemory, mustExist);
        String password = encryptionKey == null || inMemory
                ? USER_PASSWORD
                : HexFormat.of().formatHex(encryptionKey) + " " + USER_PASSWORD;
        try {
            Connection connection = DriverManager.getConnection(url, USER, password);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(SNAPSHOT_ISOLATION);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            return connection;
        } catch (SQLException e) {
            throw H2Errors.translate(e, path);
        }
    }

    /**
     * Number of groups currently open on the path through this engine.
     */
    int openCount(String path, boolean inMemory) {
        synchronized (states) {
            PathState state = states.get(stateKey(path, inMemory));
            return state == null ? 0 : state.openCount;
        }
    }

    void release(PathState state) {
        synchronized (states) {
            state.openCount--;
            if (state.openCount == 0) {
                states.remove(state.key);
            }
        }
    }

    private PathState acquire(String key) {
        synchronized (states) {
            PathState state = states.computeIfAbsent(key, PathState::new);
            state.openCount++;
            return state;
        }
    }

    static String jdbcUrl(String path, byte[] encryptionKey, boolean inMemory, boolean mustExist) {
        StringBuilder url = new StringBuilder("jdbc:h2:");
        if (inMemory) {
            url.append("mem:").append(memoryName(path));
        } else {
            url.append("file:").append(Paths.get(path).toAbsolutePath());
            if (encryptionKey != null) {
                url.append(";CIPHER=AES");
            }
        }
        if (mustExist) {
            url.append(";IFEXISTS=TRUE");
        }
        return url.toString();
    }

    private static String memoryName(String path) {
        return path.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String stateKey(String path, boolean inMemory) {
        if (inMemory) {
            return "mem:" + memoryName(path);
        }
        return "file:" + Paths.get(path).toAbsolutePath().normalize();
    }

    static void requireAbsent(String path) {
        if (Files.exists(dataFile(path))) {
            throw new StorageException(StorageException.Kind.FILE_EXISTS,
                    "File at path '" + path + "' already exists");
        }
    }

    /**
     * Shared state of all groups open on one path.
     */
    static final class PathState {
        final String key;
        final Semaphore writeLock = new Semaphore(1);
        final AtomicLong commitVersion = new AtomicLong();
        int openCount;

        PathState(String key) {
            this.key = key;
        }
    }
}
