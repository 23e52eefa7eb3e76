package de.t14d3.skein.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Handle for a registered {@link NotificationListener}. Keep a reference for as long as
 * notifications should be delivered and detach it with {@link #close()}; a token that becomes
 * unreachable while still attached is detached with a warning.
 */
public final class NotificationToken implements AutoCloseable {
    private static final Cleaner CLEANER = Cleaner.create();

    private final Registration registration;
    private final Cleaner.Cleanable cleanable;
    private final Consumer<NotificationToken> remover;

    public NotificationToken(String path, NotificationListener listener, Consumer<NotificationToken> remover) {
        this.registration = new Registration(path, Objects.requireNonNull(listener, "listener"));
        this.remover = remover;
        this.cleanable = CLEANER.register(this, registration);
    }

    public Registration registration() {
        return registration;
    }

    public boolean isAttached() {
        return registration.isAttached();
    }

    /**
     * Detaches the listener. Has no effect when it was already detached.
     */
    @Override
    public void close() {
        if (registration.isAttached()) {
            remover.accept(this);
        }
    }

    /**
     * Marks the listener as detached without logging. Called by the owning instance.
     */
    public void detach() {
        registration.attached = false;
        cleanable.clean();
    }

    /**
     * Listener state shared between the token and its owning instance. Runs as the cleanup
     * action when the token is collected, so it must not reference the token.
     */
    public static final class Registration implements Runnable {
        private static final Logger log = LoggerFactory.getLogger(Registration.class);

        private final String path;
        private final NotificationListener listener;
        private volatile boolean attached = true;

        private Registration(String path, NotificationListener listener) {
            this.path = path;
            this.listener = listener;
        }

        public NotificationListener listener() {
            return listener;
        }

        public boolean isAttached() {
            return attached;
        }

        @Override
        public void run() {
            if (attached) {
                attached = false;
                log.warn("Notification token for '{}' was garbage collected without being closed. "
                        + "Keep a reference to the token and close it when notifications are no longer needed.", path);
            }
        }
    }
}
