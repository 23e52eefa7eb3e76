package de.t14d3.skein.test;

import de.t14d3.skein.core.InstanceRegistry;
import de.t14d3.skein.core.Skein;
import de.t14d3.skein.core.SkeinConfiguration;
import de.t14d3.skein.exceptions.SchemaValidationException;
import de.t14d3.skein.exceptions.SchemaVersionException;
import de.t14d3.skein.exceptions.SkeinException;
import de.t14d3.skein.mapping.EntityScanner;
import de.t14d3.skein.migration.MigrationContext;
import de.t14d3.skein.migration.SchemaMetadata;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.GroupConfig;
import de.t14d3.skein.storage.Table;
import de.t14d3.skein.storage.h2.H2StorageEngine;
import de.t14d3.skein.test.entities.Dog;
import de.t14d3.skein.test.entities.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SkeinLifecycleTest {
    @TempDir
    Path tempDir;

    private InstanceRegistry registry;
    private ExecutorService otherThread;
    private final List<Skein> opened = new ArrayList<>();
    private String path;

    @BeforeEach
    void setUp() {
        registry = InstanceRegistry.builder()
                .schema(EntityScanner.schemaOf(Person.class, Dog.class))
                .disableEncryption(false)
                .build();
        otherThread = Executors.newSingleThreadExecutor();
        path = tempDir.resolve("people").toString();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Skein skein : opened) {
            skein.close();
        }
        otherThread.shutdownNow();
        otherThread.awaitTermination(5, TimeUnit.SECONDS);
    }

    private Skein open(SkeinConfiguration configuration) {
        Skein skein = Skein.open(registry, configuration);
        opened.add(skein);
        return skein;
    }

    private Skein open() {
        return open(SkeinConfiguration.builder().path(path).build());
    }

    private static void addPerson(Skein skein, String name) {
        Table people = skein.table("Person");
        long row = people.addRow();
        people.set(skein.schema().get("Person").property("name").getColumn(), row, name);
    }

    @Test
    void testFirstOpenCreatesFile() {
        assertEquals(SchemaMetadata.NOT_VERSIONED, Skein.schemaVersionAtPath(registry, path, null));

        Skein skein = open();

        assertEquals(0, skein.schemaVersion());
        assertEquals(0, skein.table("Person").size());
        assertEquals(2, skein.schema().get("Dog").property("owner").getColumn());
        assertEquals(0, Skein.schemaVersionAtPath(registry, path, null));
        assertSame(skein, open());
    }

    @Test
    void testReopenWithDifferentOptions() {
        open();

        IllegalStateException readOnly = assertThrows(IllegalStateException.class,
                () -> open(SkeinConfiguration.builder().path(path).readOnly(true).build()));
        assertTrue(readOnly.getMessage().endsWith("already opened with different read permissions"));
        IllegalStateException inMemory = assertThrows(IllegalStateException.class,
                () -> open(SkeinConfiguration.builder().path(path).inMemory(true).build()));
        assertTrue(inMemory.getMessage().endsWith("already opened with different inMemory settings"));
        IllegalStateException key = assertThrows(IllegalStateException.class,
                () -> open(SkeinConfiguration.builder().path(path).encryptionKey(new byte[64]).build()));
        assertTrue(key.getMessage().endsWith("already opened with different encryption key"));
    }

    @Test
    void testOtherThreadOpenedWithDifferentOptions() throws Exception {
        Skein inMemory = otherThread.submit(
                () -> Skein.open(registry, SkeinConfiguration.builder().path(path).inMemory(true).build())).get();
        opened.add(inMemory);

        IllegalStateException e = assertThrows(IllegalStateException.class, this::open);
        assertTrue(e.getMessage().endsWith("already opened with different inMemory settings"));
        assertFalse(Files.exists(H2StorageEngine.dataFile(registry.resolvePath(path))));

        String encrypted = tempDir.resolve("encrypted").toString();
        byte[] key = new byte[InstanceRegistry.KEY_LENGTH];
        key[0] = 7;
        opened.add(otherThread.submit(() -> Skein.open(registry,
                SkeinConfiguration.builder().path(encrypted).encryptionKey(key).build())).get());

        IllegalStateException keyError = assertThrows(IllegalStateException.class,
                () -> open(SkeinConfiguration.builder().path(encrypted).build()));
        assertTrue(keyError.getMessage().endsWith("already opened with different encryption key"));
        assertNotNull(open(SkeinConfiguration.builder().path(encrypted).encryptionKey(key).build()));
    }

    @Test
    void testCustomSchemaRequiresDynamic() {
        Schema custom = Schema.of(ObjectSchema.of("Cat", Property.of("name", PropertyType.STRING)));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> open(SkeinConfiguration.builder().path(path).customSchema(custom).build()));
        assertEquals("Custom schema only supported when using dynamic instances", e.getMessage());
    }

    @Test
    void testDynamicInstances() {
        Schema custom = Schema.of(ObjectSchema.of("Cat", Property.of("name", PropertyType.STRING)));
        Skein withCustom = open(SkeinConfiguration.builder().path(path).dynamic(true).customSchema(custom).build());
        assertTrue(withCustom.isDynamic());
        assertNotNull(withCustom.table("Cat"));
        withCustom.close();

        Skein first = open(SkeinConfiguration.builder().path(path).dynamic(true).build());
        Skein second = open(SkeinConfiguration.builder().path(path).dynamic(true).build());

        assertNotSame(first, second);
        assertTrue(first.schema().contains("Cat"));
        assertEquals(0, first.schema().get("Cat").property("name").getColumn());
        assertFalse(first.schema().contains("Person"));
    }

    @Test
    void testReadOnlyRequiresVersionedFile() {
        new H2StorageEngine().open(new GroupConfig(registry.resolvePath(path), null, false, false)).close();

        SkeinException e = assertThrows(SkeinException.class,
                () -> open(SkeinConfiguration.builder().path(path).readOnly(true).build()));
        assertEquals("Cannot open an uninitialized file in read-only mode", e.getMessage());
    }

    @Test
    void testReadOnlyInstance() {
        open().close();
        opened.clear();

        Skein readOnly = open(SkeinConfiguration.builder().path(path).readOnly(true).build());

        assertTrue(readOnly.isReadOnly());
        assertEquals(0, readOnly.table("Person").size());
        IllegalStateException e = assertThrows(IllegalStateException.class, readOnly::beginWriteTransaction);
        assertEquals("Can't perform transactions on read-only files.", e.getMessage());
        assertThrows(IllegalStateException.class, () -> readOnly.addNotification((n, s) -> { }));
    }

    @Test
    void testReadOnlyWithDifferentModelFails() {
        InstanceRegistry onlyPerson = InstanceRegistry.builder()
                .schema(EntityScanner.schemaOf(Person.class))
                .build();
        Skein.open(onlyPerson, SkeinConfiguration.builder().path(path).build()).close();

        assertThrows(SchemaValidationException.class,
                () -> open(SkeinConfiguration.builder().path(path).readOnly(true).build()));
    }

    @Test
    void testMigrationRunsOnFirstOpenOnly() throws Exception {
        List<MigrationContext> calls = new ArrayList<>();
        registry.setSchemaVersion(path, 2, calls::add);

        Skein skein = open();
        Skein other = otherThread.submit(() -> Skein.open(registry, SkeinConfiguration.builder().path(path).build())).get();
        opened.add(other);

        assertEquals(1, calls.size());
        assertEquals(2, skein.schemaVersion());
        assertNotSame(skein, other);
        assertEquals(2, Skein.schemaVersionAtPath(registry, path, null));
    }

    @Test
    void testOlderRegisteredVersionFails() {
        registry.setSchemaVersion(path, 5, null);
        open().close();
        opened.clear();
        registry.setSchemaVersion(path, 4, null);

        SchemaVersionException e = assertThrows(SchemaVersionException.class, this::open);
        assertEquals(5, e.getStoredVersion());
        assertFalse(registry.hasOpenInstances(path));
    }

    @Test
    void testWriteTransactions() {
        Skein skein = open();

        skein.beginWriteTransaction();
        assertTrue(skein.isInWriteTransaction());
        assertThrows(IllegalStateException.class, skein::beginWriteTransaction);
        addPerson(skein, "Ada");
        skein.commitWriteTransaction();
        assertEquals(1, skein.table("Person").size());

        skein.beginWriteTransaction();
        addPerson(skein, "Grace");
        skein.cancelWriteTransaction();
        assertEquals(1, skein.table("Person").size());

        assertThrows(IllegalStateException.class, skein::commitWriteTransaction);
        assertThrows(IllegalStateException.class, skein::cancelWriteTransaction);
    }

    @Test
    void testStructureChangesRejectedInTransactions() {
        Skein skein = open();
        int name = skein.schema().get("Person").property("name").getColumn();

        skein.beginWriteTransaction();
        addPerson(skein, "Ada");
        Table people = skein.table("Person");
        assertThrows(IllegalStateException.class, () -> people.addSearchIndex(name));
        assertThrows(IllegalStateException.class, () -> people.addColumn(PropertyType.INT, "age", false));
        assertThrows(IllegalStateException.class, () -> people.removeColumn(name));
        skein.cancelWriteTransaction();

        assertEquals(0, skein.table("Person").size());
        assertFalse(skein.table("Person").hasSearchIndex(name));
        assertEquals(2, skein.table("Person").getColumnCount());
    }

    @Test
    void testExecuteTransaction() {
        Skein skein = open();

        skein.executeTransaction(s -> addPerson(s, "Ada"));
        assertEquals(1, skein.table("Person").size());

        assertThrows(IllegalArgumentException.class, () -> skein.executeTransaction(s -> {
            addPerson(s, "Grace");
            throw new IllegalArgumentException("rejected");
        }));
        assertFalse(skein.isInWriteTransaction());
        assertEquals(1, skein.table("Person").size());

        skein.executeTransaction(s -> {
            addPerson(s, "Linus");
            s.cancelWriteTransaction();
        });
        assertEquals(1, skein.table("Person").size());
    }

    @Test
    void testTableHandlesAfterInvalidate() {
        Skein skein = open();
        Table before = skein.table("Person");

        skein.beginWriteTransaction();
        addPerson(skein, "Ada");
        skein.invalidate();

        assertFalse(skein.isInWriteTransaction());
        assertThrows(IllegalStateException.class, before::size);
        assertEquals(0, skein.table("Person").size());
        assertThrows(IllegalArgumentException.class, () -> skein.table("Cat"));
    }

    @Test
    void testThreadConfinement() throws Exception {
        Skein skein = open();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> otherThread.submit(() -> skein.table("Person")).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());

        otherThread.submit(skein::close).get();
        assertTrue(skein.isClosed());
        assertThrows(IllegalStateException.class, skein::schema);
        assertFalse(registry.hasOpenInstances(path));
    }

    @Test
    void testCloseCancelsWriteTransaction() {
        Skein skein = open();
        skein.beginWriteTransaction();
        addPerson(skein, "Ada");
        skein.close();

        Skein reopened = open();
        assertNotSame(skein, reopened);
        assertEquals(0, reopened.table("Person").size());
    }

    @Test
    void testWritersOnTwoThreadsSeeEachOther() throws Exception {
        Skein skein = open();
        skein.table("Person");

        Skein other = otherThread.submit(() -> {
            Skein s = Skein.open(registry, SkeinConfiguration.builder().path(path).build());
            s.executeTransaction(t -> addPerson(t, "Ada"));
            return s;
        }).get();
        opened.add(other);

        assertEquals(1, skein.pendingCommits());
        assertEquals(0, skein.table("Person").size());
        assertTrue(skein.refresh());
        assertFalse(skein.refresh());
        assertEquals(1, skein.table("Person").size());
    }

    @Test
    void testCompactAndWriteCopy() {
        Skein skein = open();
        skein.executeTransaction(s -> addPerson(s, "Ada"));

        assertTrue(skein.compact());
        assertEquals(1, skein.table("Person").size());

        skein.beginWriteTransaction();
        assertFalse(skein.compact());
        skein.cancelWriteTransaction();

        String copy = tempDir.resolve("copy").toString();
        skein.writeCopy(copy, null);
        Skein copied = open(SkeinConfiguration.builder().path(copy).readOnly(true).build());
        assertEquals(1, copied.table("Person").size());
        assertEquals(0, copied.schemaVersion());
    }

    @Test
    void testEncryptedFile() {
        byte[] key = new byte[InstanceRegistry.KEY_LENGTH];
        key[0] = 1;
        registry.setEncryptionKey(path, key);
        open().close();
        opened.clear();

        assertEquals(0, Skein.schemaVersionAtPath(registry, path, null));
        assertThrows(SkeinException.class, () -> Skein.schemaVersionAtPath(registry, path, new byte[64]));
    }

    @Test
    void testStaticMigrate() {
        Skein skein = open();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Skein.migrate(registry, path, null));
        assertEquals("Cannot migrate files that are already open.", e.getMessage());
        skein.close();

        registry.setSchemaVersion(path, 7, null);
        assertTrue(Skein.migrate(registry, path, null));
        assertEquals(7, Skein.schemaVersionAtPath(registry, path, null));
        assertFalse(Skein.migrate(registry, path, null));
    }

    @Test
    void testInMemoryInstances() throws Exception {
        String name = "memory-" + System.nanoTime();
        SkeinConfiguration configuration = SkeinConfiguration.builder().path(name).inMemory(true).build();
        Skein skein = open(configuration);
        skein.executeTransaction(s -> addPerson(s, "Ada"));

        long seen = otherThread.submit(() -> {
            try (Skein other = Skein.open(registry, configuration)) {
                return other.table("Person").size();
            }
        }).get();

        assertEquals(1, seen);
        assertFalse(skein.compact());
    }
}
