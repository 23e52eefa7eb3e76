package de.t14d3.skein.exceptions;

/**
 * The file was written by a newer schema version than the one being opened with.
 * Files are never downgraded.
 */
public class SchemaVersionException extends SkeinException {
    private final long storedVersion;
    private final long targetVersion;

    public SchemaVersionException(long storedVersion, long targetVersion) {
        super("Provided schema version " + targetVersion
                + " is less than last set version " + storedVersion + ".");
        this.storedVersion = storedVersion;
        this.targetVersion = targetVersion;
    }

    public long getStoredVersion() {
        return storedVersion;
    }

    public long getTargetVersion() {
        return targetVersion;
    }
}
