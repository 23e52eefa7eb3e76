package de.t14d3.skein.exceptions;

/**
 * Base type for all errors raised by Skein that are not plain usage errors.
 * Usage errors (wrong flags on reopen, double commit, ...) are reported as
 * {@link IllegalStateException} or {@link IllegalArgumentException}.
 */
public class SkeinException extends RuntimeException {
    public SkeinException(String message) {
        super(message);
    }

    public SkeinException(Throwable cause) {
        super(cause);
    }

    public SkeinException(String message, Throwable cause) {
        super(message, cause);
    }
}
