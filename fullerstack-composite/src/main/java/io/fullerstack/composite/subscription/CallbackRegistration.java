package io.fullerstack.composite.subscription;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration of a single one-shot callback on a change signal.
 *
 * <p>The registration is claimed exactly once: either by {@link #close()} (the subscriber
 * lost interest) or by {@link #claim()} (the signal fired and is about to run the callback).
 * Whichever happens first wins, so a callback never runs after a close that completed first.
 *
 * @see Registration
 */
public class CallbackRegistration implements Registration {

    private final UUID id;
    private final Runnable callback;
    private final Runnable onClose;
    private final AtomicBoolean claimed = new AtomicBoolean(false);

    /**
     * Creates a registration for the given callback.
     *
     * @param id       registration identity, used by the signal to index its callbacks
     * @param callback the callback to run when the signal fires
     * @param onClose  runnable to execute when the registration is closed before firing
     * @throws NullPointerException if any argument is null
     */
    public CallbackRegistration(UUID id, Runnable callback, Runnable onClose) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.callback = Objects.requireNonNull(callback, "callback cannot be null");
        this.onClose = Objects.requireNonNull(onClose, "onClose cannot be null");
    }

    /**
     * Claims the registration for execution.
     *
     * @return the callback to run, or null when the registration was already closed
     */
    public Runnable claim() {
        return claimed.compareAndSet(false, true) ? callback : null;
    }

    @Override
    public boolean isClosed() {
        return claimed.get();
    }

    @Override
    public void close() {
        if (claimed.compareAndSet(false, true)) {
            onClose.run();
        }
    }

    @Override
    public String toString() {
        return "Registration[" + id + (isClosed() ? ", closed" : "") + "]";
    }
}
