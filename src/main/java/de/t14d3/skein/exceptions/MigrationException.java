package de.t14d3.skein.exceptions;

/**
 * A user supplied migration failed. The migration transaction has been rolled back
 * and the file is still at its previous schema version.
 */
public class MigrationException extends SkeinException {
    private final long fromVersion;
    private final long toVersion;

    public MigrationException(long fromVersion, long toVersion, Throwable cause) {
        super("Migration from schema version " + fromVersion + " to " + toVersion
                + " failed: " + cause.getMessage(), cause);
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public long getFromVersion() {
        return fromVersion;
    }

    public long getToVersion() {
        return toVersion;
    }
}
