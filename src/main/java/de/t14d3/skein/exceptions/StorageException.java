package de.t14d3.skein.exceptions;

/**
 * Failure reported by the storage engine, reduced to a small set of kinds.
 */
public class StorageException extends SkeinException {

    public enum Kind {
        PERMISSION_DENIED,
        FILE_EXISTS,
        ACCESS_ERROR,
        FAIL
    }

    private final Kind kind;

    public StorageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
