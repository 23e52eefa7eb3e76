package de.t14d3.skein.notification;

import java.util.Objects;

/**
 * Message put into the mailbox of every other instance of a path after a commit.
 */
public final class CommitEvent {
    private final String path;
    private final long sequence;

    public CommitEvent(String path, long sequence) {
        this.path = Objects.requireNonNull(path, "path");
        this.sequence = sequence;
    }

    public String path() {
        return path;
    }

    /**
     * Position of the commit in the order commits were published by the registry.
     */
    public long sequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "CommitEvent{path='" + path + "', sequence=" + sequence + '}';
    }
}
