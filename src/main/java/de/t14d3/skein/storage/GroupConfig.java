package de.t14d3.skein.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * Parameters for opening a {@link Group}.
 *
 * @param path          file path, or name of the in-memory database
 * @param encryptionKey 64 byte key, or null for an unencrypted file
 * @param readOnly      whether writes are forbidden
 * @param inMemory      whether the data lives in memory only
 */
public record GroupConfig(String path, byte[] encryptionKey, boolean readOnly, boolean inMemory) {

    public GroupConfig {
        Objects.requireNonNull(path, "path");
        encryptionKey = encryptionKey == null ? null : encryptionKey.clone();
    }

    @Override
    public byte[] encryptionKey() {
        return encryptionKey == null ? null : encryptionKey.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupConfig that)) return false;
        return readOnly == that.readOnly
                && inMemory == that.inMemory
                && path.equals(that.path)
                && Arrays.equals(encryptionKey, that.encryptionKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, readOnly, inMemory) * 31 + Arrays.hashCode(encryptionKey);
    }

    @Override
    public String toString() {
        return "GroupConfig{path='" + path + "', encrypted=" + (encryptionKey != null)
                + ", readOnly=" + readOnly + ", inMemory=" + inMemory + '}';
    }
}
