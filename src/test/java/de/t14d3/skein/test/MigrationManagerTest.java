package de.t14d3.skein.test;

import de.t14d3.skein.exceptions.MigrationException;
import de.t14d3.skein.exceptions.SchemaValidationException;
import de.t14d3.skein.exceptions.SchemaVersionException;
import de.t14d3.skein.mapping.EntityScanner;
import de.t14d3.skein.migration.MigrationContext;
import de.t14d3.skein.migration.MigrationManager;
import de.t14d3.skein.migration.SchemaMetadata;
import de.t14d3.skein.migration.TableBinding;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.PropertyType;
import de.t14d3.skein.schema.Schema;
import de.t14d3.skein.storage.Group;
import de.t14d3.skein.storage.GroupConfig;
import de.t14d3.skein.storage.Table;
import de.t14d3.skein.storage.h2.H2StorageEngine;
import de.t14d3.skein.test.entities.Dog;
import de.t14d3.skein.test.entities.Measurement;
import de.t14d3.skein.test.entities.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MigrationManagerTest {
    private H2StorageEngine engine;
    private Group group;
    private String name;

    @BeforeEach
    void setUp() {
        engine = new H2StorageEngine();
        name = "migration-" + System.nanoTime();
        group = engine.open(new GroupConfig(name, null, false, true));
    }

    @AfterEach
    void tearDown() {
        group.close();
    }

    private static Schema personAndDog() {
        return EntityScanner.schemaOf(Person.class, Dog.class);
    }

    @Test
    void testInitialMigration() {
        List<MigrationContext> calls = new ArrayList<>();
        Schema schema = personAndDog();

        assertTrue(MigrationManager.isMigrationRequired(group, 1));
        assertTrue(MigrationManager.updateToSchema(group, 1, schema, calls::add));

        assertEquals(1, MigrationManager.schemaVersion(group));
        assertTrue(SchemaMetadata.hasMetadata(group));
        assertEquals("id", SchemaMetadata.getPrimaryKey(group, "Person"));
        assertNull(SchemaMetadata.getPrimaryKey(group, "Dog"));
        assertEquals(1, calls.size());
        assertEquals(SchemaMetadata.NOT_VERSIONED, calls.get(0).getOldSchemaVersion());
        assertEquals(1, calls.get(0).getNewSchemaVersion());
        assertEquals(0, calls.get(0).getOldSchema().size());
        assertTrue(schema.get("Dog").property("owner").hasColumn());
        assertTrue(TableBinding.tableForType(group, "Person").hasSearchIndex(0));
    }

    @Test
    void testSameVersionAndModelWritesNothing() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);
        List<MigrationContext> calls = new ArrayList<>();
        Schema fresh = personAndDog();

        assertFalse(MigrationManager.isMigrationRequired(group, 1));
        assertTrue(MigrationManager.isUpToDate(group, fresh));
        assertFalse(MigrationManager.updateToSchema(group, 1, fresh, calls::add));

        assertTrue(calls.isEmpty());
        assertEquals(0, fresh.get("Person").property("id").getColumn());
    }

    @Test
    void testAddingPropertyWithNewVersion() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);
        ObjectSchema person = new ObjectSchema("Person", List.of(
                Property.builder("id", PropertyType.INT).indexed(true).build(),
                Property.builder("name", PropertyType.STRING).nullable(true).build(),
                Property.builder("email", PropertyType.STRING).nullable(true).build()), "id");
        Schema next = Schema.of(person, personAndDog().get("Dog"));

        List<MigrationContext> calls = new ArrayList<>();
        MigrationManager.updateToSchema(group, 2, next, calls::add);

        assertEquals(2, MigrationManager.schemaVersion(group));
        assertEquals(2, person.property("email").getColumn());
        MigrationContext context = calls.get(0);
        assertEquals(1, context.getOldSchemaVersion());
        assertNull(context.getOldSchema().get("Person").property("email"));
        assertEquals(2, context.column("Person", "email"));
    }

    @Test
    void testMigrationCanWriteRows() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), context -> {
            Table people = context.table("Person");
            int nameColumn = context.column("Person", "name");
            long row = people.addRow();
            people.set(nameColumn, row, "Ada");
        });

        Table people = TableBinding.tableForType(group, "Person");
        assertEquals(1, people.size());
        assertEquals("Ada", people.get(people.findColumn("name"), 0));
    }

    @Test
    void testNewTypeAtSameVersionRunsMigration() {
        Schema onlyPerson = EntityScanner.schemaOf(Person.class);
        MigrationManager.updateToSchema(group, 0, onlyPerson, null);

        List<MigrationContext> calls = new ArrayList<>();
        assertTrue(MigrationManager.updateToSchema(group, 0, personAndDog(), calls::add));

        assertEquals(1, calls.size());
        assertEquals(0, calls.get(0).getOldSchemaVersion());
        assertTrue(group.hasTable("class_Dog"));
    }

    @Test
    void testOlderVersionIsRejected() {
        MigrationManager.updateToSchema(group, 3, personAndDog(), null);

        SchemaVersionException e = assertThrows(SchemaVersionException.class,
                () -> MigrationManager.updateToSchema(group, 2, personAndDog(), null));
        assertEquals(3, e.getStoredVersion());
        assertEquals(2, e.getTargetVersion());
    }

    @Test
    void testFailedMigrationIsReverted() {
        MigrationManager.updateToSchema(group, 1, EntityScanner.schemaOf(Person.class), null);
        ObjectSchema person = new ObjectSchema("Person", List.of(
                Property.builder("id", PropertyType.INT).indexed(true).build(),
                Property.builder("name", PropertyType.STRING).nullable(true).build(),
                Property.builder("email", PropertyType.STRING).nullable(true).build()), "id");
        Schema next = Schema.of(person, EntityScanner.schemaOf(Dog.class).get("Dog"));
        IllegalStateException failure = new IllegalStateException("boom");

        MigrationException e = assertThrows(MigrationException.class,
                () -> MigrationManager.updateToSchema(group, 2, next, context -> {
                    throw failure;
                }));

        assertSame(failure, e.getCause());
        assertEquals(1, MigrationManager.schemaVersion(group));
        assertFalse(group.hasTable("class_Dog"));
        assertEquals(-1, TableBinding.tableForType(group, "Person").findColumn("email"));
        assertFalse(group.isInWriteTransaction());
    }

    @Test
    void testMigrationCannotChangeStructure() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);

        MigrationException e = assertThrows(MigrationException.class,
                () -> MigrationManager.updateToSchema(group, 2, personAndDog(), context -> {
                    Table people = context.table("Person");
                    people.addRow();
                    people.addSearchIndex(context.column("Person", "name"));
                }));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, MigrationManager.schemaVersion(group));
        Table people = TableBinding.tableForType(group, "Person");
        assertEquals(0, people.size());
        assertFalse(people.hasSearchIndex(people.findColumn("name")));
    }

    @Test
    void testIncompatibleModelLeavesFileUntouched() {
        ObjectSchema broken = new ObjectSchema("Dog", List.of(
                Property.link("owner", PropertyType.OBJECT, "Cat")));

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> MigrationManager.updateToSchema(group, 1, Schema.of(broken), null));

        assertEquals("Dog", e.getObjectType());
        assertEquals(List.of("Target type 'Cat' doesn't exist for property 'owner'."), e.getErrors());
        assertFalse(SchemaMetadata.hasMetadata(group));
        assertTrue(group.getTableNames().isEmpty());
    }

    @Test
    void testUnindexableIndexLeavesFileUntouched() {
        Schema schema = EntityScanner.schemaOf(Measurement.class);

        assertThrows(IllegalArgumentException.class, () -> MigrationManager.updateToSchema(group, 1, schema, null));

        assertFalse(SchemaMetadata.hasMetadata(group));
        assertFalse(group.isInWriteTransaction());
    }

    @Test
    void testChangedColumnTypeIsRejected() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);
        ObjectSchema person = new ObjectSchema("Person", List.of(
                Property.builder("id", PropertyType.STRING).indexed(true).build(),
                Property.builder("name", PropertyType.STRING).nullable(true).build()), "id");

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> MigrationManager.updateToSchema(group, 2, Schema.of(person), null));

        assertTrue(e.getErrors().contains("Property types for 'id' property do not match. Old type 'int', new type 'string'."));
        assertEquals(1, MigrationManager.schemaVersion(group));
    }

    @Test
    void testVerify() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);
        Schema fresh = personAndDog();

        MigrationManager.verify(group, fresh);
        assertEquals(1, fresh.get("Person").property("name").getColumn());

        Schema withCat = Schema.of(ObjectSchema.of("Cat", Property.of("name", PropertyType.STRING)));
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> MigrationManager.verify(group, withCat));
        assertEquals(List.of("Table for object type 'Cat' does not exist."), e.getErrors());
    }

    @Test
    void testReadSchemaReflectsPersistedModel() {
        MigrationManager.updateToSchema(group, 1, personAndDog(), null);

        Schema persisted = TableBinding.readSchema(group);

        assertEquals(2, persisted.size());
        assertEquals("id", persisted.get("Person").getPrimaryKey());
        assertEquals("Person", persisted.get("Dog").property("owner").getObjectType());
        assertTrue(persisted.get("Person").property("id").isIndexed());
    }

    @Test
    void testArgumentChecks() {
        assertThrows(IllegalArgumentException.class,
                () -> MigrationManager.updateToSchema(group, -1, personAndDog(), null));

        MigrationManager.updateToSchema(group, 1, personAndDog(), null);
        Group readOnly = engine.open(new GroupConfig(name, null, true, true));
        try {
            assertThrows(IllegalStateException.class,
                    () -> MigrationManager.updateToSchema(readOnly, 2, personAndDog(), null));
        } finally {
            readOnly.close();
        }
    }
}
