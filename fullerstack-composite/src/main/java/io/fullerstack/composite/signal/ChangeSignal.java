package io.fullerstack.composite.signal;

import io.fullerstack.composite.subscription.Registration;

import java.time.Duration;

/**
 * One-shot notification that the data it was handed out with has become stale.
 *
 * <p>A signal represents one epoch. It starts ARMED and moves to FIRED at most once; it never
 * re-arms. Holders react to the fire by re-reading the data and asking the owner for the
 * current signal.
 *
 * <p>This is the read-only view handed to consumers. Owners fire through {@link OneShotSignal}.
 */
public interface ChangeSignal {

    /**
     * @return true once the signal has fired
     */
    boolean hasChanged();

    /**
     * Registers a callback to run once, when this signal fires.
     *
     * <p>If the signal has already fired, the callback runs on the calling thread before this
     * method returns and {@link Registration#NONE} is returned.
     *
     * @param callback the callback
     * @return a handle that can unsubscribe the callback before the signal fires
     * @throws NullPointerException if callback is null
     */
    Registration subscribe(Runnable callback);

    /**
     * Blocks until the signal fires or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return true if the signal fired
     * @throws InterruptedException if interrupted while waiting
     */
    boolean await(Duration timeout) throws InterruptedException;
}
