package de.t14d3.skein.migration;

/**
 * User routine run inside the migration transaction when a file is brought to a newer
 * schema version. Tables already have the new structure when it runs; it may move data, and
 * calls that change columns or indexes fail with {@link IllegalStateException}.
 */
@FunctionalInterface
public interface Migration {

    void migrate(MigrationContext context) throws Exception;
}
