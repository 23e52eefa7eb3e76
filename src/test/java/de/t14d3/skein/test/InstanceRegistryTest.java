package de.t14d3.skein.test;

import de.t14d3.skein.core.InstanceRegistry;
import de.t14d3.skein.core.Skein;
import de.t14d3.skein.core.SkeinConfiguration;
import de.t14d3.skein.mapping.EntityScanner;
import de.t14d3.skein.migration.Migration;
import de.t14d3.skein.test.entities.Person;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class InstanceRegistryTest {
    @TempDir
    Path tempDir;

    private InstanceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = InstanceRegistry.builder()
                .schema(EntityScanner.schemaOf(Person.class))
                .defaultPath(tempDir.resolve("default").toString())
                .disableEncryption(false)
                .build();
    }

    private static byte[] key(int fill) {
        byte[] key = new byte[InstanceRegistry.KEY_LENGTH];
        Arrays.fill(key, (byte) fill);
        return key;
    }

    @Test
    void testResolvePath() {
        assertEquals(registry.getDefaultPath(), registry.resolvePath(null));
        assertEquals(Paths.get("data/../people").toAbsolutePath().normalize().toString(),
                registry.resolvePath("data/../people"));
        assertThrows(IllegalArgumentException.class, () -> registry.resolvePath("  "));
    }

    @Test
    void testEncryptionKeys() {
        String path = tempDir.resolve("keys").toString();
        assertNull(registry.getEncryptionKey(path));

        registry.setEncryptionKey(path, key(1));
        assertArrayEquals(key(1), registry.getEncryptionKey(path));

        registry.getEncryptionKey(path)[0] = 9;
        assertArrayEquals(key(1), registry.getEncryptionKey(path));

        registry.setEncryptionKey(path, null);
        assertNull(registry.getEncryptionKey(path));
        assertThrows(IllegalArgumentException.class, () -> registry.setEncryptionKey(path, new byte[16]));
    }

    @Test
    void testSchemaVersions() {
        String path = tempDir.resolve("versions").toString();
        Migration migration = context -> { };

        assertEquals(InstanceRegistry.DEFAULT_SCHEMA_VERSION, registry.getSchemaVersion(path));
        assertNull(registry.getMigration(path));

        registry.setSchemaVersion(path, 4, migration);
        assertEquals(4, registry.getSchemaVersion(path));
        assertSame(migration, registry.getMigration(path));

        assertThrows(IllegalArgumentException.class, () -> registry.setSchemaVersion(path, -1, null));
        assertThrows(IllegalArgumentException.class, () -> registry.setSchemaVersion(path, -5, null));
    }

    @Test
    void testChangesRejectedWhileOpen() {
        String path = tempDir.resolve("open").toString();
        try (Skein skein = Skein.open(registry, SkeinConfiguration.builder().path(path).build())) {
            assertTrue(registry.hasOpenInstances(path));

            IllegalStateException keyError = assertThrows(IllegalStateException.class,
                    () -> registry.setEncryptionKey(path, key(2)));
            assertEquals("Cannot set encryption key for files that are already open.", keyError.getMessage());

            IllegalStateException versionError = assertThrows(IllegalStateException.class,
                    () -> registry.setSchemaVersion(path, 3, null));
            assertEquals("Cannot set schema version for files that are already open.", versionError.getMessage());

            registry.setSchemaVersion(path, InstanceRegistry.DEFAULT_SCHEMA_VERSION, null);
            assertEquals(0, skein.schemaVersion());
        }
        assertFalse(registry.hasOpenInstances(path));
        registry.setSchemaVersion(path, 3, null);
    }

    @Test
    void testSameKeyAcceptedWhileOpen() {
        String path = tempDir.resolve("explicit").toString();
        try (Skein skein = Skein.open(registry, SkeinConfiguration.builder().path(path).encryptionKey(key(5)).build())) {
            registry.setEncryptionKey(path, key(5));
            assertArrayEquals(key(5), registry.getEncryptionKey(path));

            assertThrows(IllegalStateException.class, () -> registry.setEncryptionKey(path, key(6)));
            assertThrows(IllegalStateException.class, () -> registry.setEncryptionKey(path, null));
            assertArrayEquals(key(5), registry.getEncryptionKey(path));
        }
    }

    @Test
    void testReset() {
        String path = tempDir.resolve("reset").toString();
        registry.setEncryptionKey(path, key(3));
        registry.setSchemaVersion(path, 2, context -> { });

        registry.reset();

        assertNull(registry.getEncryptionKey(path));
        assertEquals(InstanceRegistry.DEFAULT_SCHEMA_VERSION, registry.getSchemaVersion(path));
        assertNull(registry.getMigration(path));
    }

    @Test
    void testDisabledEncryptionIgnoresKeys() {
        InstanceRegistry plain = InstanceRegistry.builder()
                .schema(EntityScanner.schemaOf(Person.class))
                .disableEncryption(true)
                .build();
        String path = tempDir.resolve("plain").toString();

        Skein.open(plain, SkeinConfiguration.builder().path(path).encryptionKey(key(4)).build()).close();

        // the file was written without encryption and opens without a key
        assertEquals(0, Skein.schemaVersionAtPath(registry, path, null));
    }

    @Test
    void testConfigurationFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("skein.path", "people");
        properties.setProperty("skein.readOnly", "true");
        properties.setProperty("skein.autorefresh", " false ");

        SkeinConfiguration configuration = SkeinConfiguration.fromProperties(properties);

        assertEquals("people", configuration.getPath());
        assertTrue(configuration.isReadOnly());
        assertFalse(configuration.isInMemory());
        assertFalse(configuration.isAutorefresh());
        assertFalse(configuration.toBuilder().readOnly(false).build().isReadOnly());
    }
}
