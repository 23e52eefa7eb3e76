package de.t14d3.skein.storage.h2;

import de.t14d3.skein.exceptions.StorageException;
import org.h2.api.ErrorCode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Translates H2 failures into {@link StorageException}s.
 */
final class H2Errors {

    private H2Errors() {
    }

    static StorageException translate(SQLException e, String path) {
        return switch (e.getErrorCode()) {
            case ErrorCode.WRONG_USER_OR_PASSWORD, ErrorCode.FILE_ENCRYPTION_ERROR_1 ->
                    new StorageException(StorageException.Kind.ACCESS_ERROR,
                            "Unable to open '" + path + "': invalid encryption key", e);
            case ErrorCode.DATABASE_NOT_FOUND_WITH_IF_EXISTS_1 ->
                    new StorageException(StorageException.Kind.ACCESS_ERROR,
                            "File at path '" + path + "' does not exist", e);
            case ErrorCode.DATABASE_ALREADY_OPEN_1 ->
                    new StorageException(StorageException.Kind.ACCESS_ERROR,
                            "File at path '" + path + "' is locked by another process", e);
            case ErrorCode.FILE_CORRUPTED_1 ->
                    new StorageException(StorageException.Kind.ACCESS_ERROR,
                            "Unable to open '" + path + "': " + e.getMessage(), e);
            default -> new StorageException(StorageException.Kind.FAIL,
                    "Storage operation on '" + path + "' failed: " + e.getMessage(), e);
        };
    }

    /**
     * Checks file system permissions before H2 gets a chance to fail with a less specific error.
     */
    static void checkPermissions(Path dataFile, boolean readOnly) {
        if (Files.exists(dataFile)) {
            if (!Files.isReadable(dataFile) || (!readOnly && !Files.isWritable(dataFile))) {
                throw new StorageException(StorageException.Kind.PERMISSION_DENIED,
                        "Permission denied for file at path '" + dataFile + "'");
            }
            return;
        }
        Path parent = dataFile.toAbsolutePath().getParent();
        if (!readOnly && parent != null && Files.exists(parent) && !Files.isWritable(parent)) {
            throw new StorageException(StorageException.Kind.PERMISSION_DENIED,
                    "Permission denied for directory '" + parent + "'");
        }
    }
}
