package io.fullerstack.composite.subscription;

/**
 * Handle returned from {@link io.fullerstack.composite.signal.ChangeSignal#subscribe(Runnable)}.
 *
 * <p>Closing a registration before the signal fires prevents the callback from running.
 * Closing is best-effort: a close racing with the fire may still see the callback invoked.
 * Closing more than once is a no-op.
 */
public interface Registration extends AutoCloseable {

    /**
     * Registration for a callback that has already run (or will never run).
     */
    Registration NONE = new Registration() {
        @Override
        public boolean isClosed() {
            return true;
        }

        @Override
        public void close() {
        }

        @Override
        public String toString() {
            return "Registration[none]";
        }
    };

    /**
     * @return true once closed, or once the callback has been handed off for execution
     */
    boolean isClosed();

    @Override
    void close();
}
