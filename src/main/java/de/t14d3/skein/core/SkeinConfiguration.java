package de.t14d3.skein.core;

import de.t14d3.skein.schema.Schema;

import java.util.Properties;
import java.util.concurrent.Executor;

/**
 * Options for opening an instance. Build one with {@link #builder()}.
 */
public final class SkeinConfiguration {
    private final String path;
    private final byte[] encryptionKey;
    private final boolean readOnly;
    private final boolean inMemory;
    private final boolean dynamic;
    private final Schema customSchema;
    private final boolean autorefresh;
    private final Executor notificationExecutor;

    private SkeinConfiguration(Builder builder) {
        this.path = builder.path;
        this.encryptionKey = builder.encryptionKey == null ? null : builder.encryptionKey.clone();
        this.readOnly = builder.readOnly;
        this.inMemory = builder.inMemory;
        this.dynamic = builder.dynamic;
        this.customSchema = builder.customSchema;
        this.autorefresh = builder.autorefresh;
        this.notificationExecutor = builder.notificationExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code skein.path}, {@code skein.readOnly}, {@code skein.inMemory}, {@code skein.dynamic}
     * and {@code skein.autorefresh}. Missing keys keep their defaults.
     */
    public static SkeinConfiguration fromProperties(Properties properties) {
        Builder builder = builder().path(properties.getProperty("skein.path"));
        String value = properties.getProperty("skein.readOnly");
        if (value != null) builder.readOnly(Boolean.parseBoolean(value.trim()));
        value = properties.getProperty("skein.inMemory");
        if (value != null) builder.inMemory(Boolean.parseBoolean(value.trim()));
        value = properties.getProperty("skein.dynamic");
        if (value != null) builder.dynamic(Boolean.parseBoolean(value.trim()));
        value = properties.getProperty("skein.autorefresh");
        if (value != null) builder.autorefresh(Boolean.parseBoolean(value.trim()));
        return builder.build();
    }

    /**
     * Path of the file, or null for the registry's default path.
     */
    public String getPath() {
        return path;
    }

    public byte[] getEncryptionKey() {
        return encryptionKey == null ? null : encryptionKey.clone();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isInMemory() {
        return inMemory;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public Schema getCustomSchema() {
        return customSchema;
    }

    public boolean isAutorefresh() {
        return autorefresh;
    }

    /**
     * Executor of the opening thread's event loop, used to deliver commits made elsewhere.
     * Null when changes are picked up through {@link Skein#notifyChanges()} or {@link Skein#refresh()} only.
     */
    public Executor getNotificationExecutor() {
        return notificationExecutor;
    }

    public Builder toBuilder() {
        return new Builder()
                .path(path)
                .encryptionKey(encryptionKey)
                .readOnly(readOnly)
                .inMemory(inMemory)
                .dynamic(dynamic)
                .customSchema(customSchema)
                .autorefresh(autorefresh)
                .notificationExecutor(notificationExecutor);
    }

    public static class Builder {
        private String path;
        private byte[] encryptionKey;
        private boolean readOnly;
        private boolean inMemory;
        private boolean dynamic;
        private Schema customSchema;
        private boolean autorefresh = true;
        private Executor notificationExecutor;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder encryptionKey(byte[] encryptionKey) {
            this.encryptionKey = encryptionKey;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder inMemory(boolean inMemory) {
            this.inMemory = inMemory;
            return this;
        }

        public Builder dynamic(boolean dynamic) {
            this.dynamic = dynamic;
            return this;
        }

        public Builder customSchema(Schema customSchema) {
            this.customSchema = customSchema;
            return this;
        }

        public Builder autorefresh(boolean autorefresh) {
            this.autorefresh = autorefresh;
            return this;
        }

        public Builder notificationExecutor(Executor notificationExecutor) {
            this.notificationExecutor = notificationExecutor;
            return this;
        }

        public SkeinConfiguration build() {
            return new SkeinConfiguration(this);
        }
    }
}
