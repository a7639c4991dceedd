package io.fullerstack.composite.signal;

import io.fullerstack.composite.subscription.CallbackRegistration;
import io.fullerstack.composite.subscription.Registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fireable {@link ChangeSignal}: one epoch, ARMED until {@link #fire()} is called.
 *
 * <p><b>Threading:</b>
 * <ul>
 *   <li>Subscribe and fire may race from any thread. The ARMED to FIRED transition is
 *       decided under a small internal lock, so exactly one {@code fire()} call wins.</li>
 *   <li>Callbacks run on the winning caller's thread, in registration order, after the
 *       internal lock is released. A callback may subscribe to other signals or fire them.</li>
 *   <li>A callback that throws is logged and the remaining callbacks still run.</li>
 * </ul>
 */
public class OneShotSignal implements ChangeSignal {

    private static final Logger logger = LoggerFactory.getLogger(OneShotSignal.class);

    private final Object lock = new Object();
    private final Map<UUID, CallbackRegistration> registrations = new LinkedHashMap<>();
    private final CountDownLatch firedLatch = new CountDownLatch(1);
    private volatile boolean fired = false;

    @Override
    public boolean hasChanged() {
        return fired;
    }

    @Override
    public Registration subscribe(Runnable callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        synchronized (lock) {
            if (!fired) {
                UUID id = UUID.randomUUID();
                CallbackRegistration registration = new CallbackRegistration(id, callback, () -> unregister(id));
                registrations.put(id, registration);
                return registration;
            }
        }
        // Already fired: run now, outside the lock
        runSafely(callback);
        return Registration.NONE;
    }

    /**
     * Transitions this signal from ARMED to FIRED and runs the registered callbacks.
     *
     * @return true if this call performed the transition, false if already fired
     */
    public boolean fire() {
        List<CallbackRegistration> pending;
        synchronized (lock) {
            if (fired) {
                return false;
            }
            fired = true;
            pending = new ArrayList<>(registrations.values());
            registrations.clear();
        }
        firedLatch.countDown();

        for (CallbackRegistration registration : pending) {
            Runnable callback = registration.claim();
            if (callback != null) {
                runSafely(callback);
            }
        }
        return true;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return firedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * @return number of callbacks still waiting for this signal
     */
    public int pendingCallbacks() {
        synchronized (lock) {
            return registrations.size();
        }
    }

    private void unregister(UUID id) {
        synchronized (lock) {
            registrations.remove(id);
        }
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Change callback failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "OneShotSignal[" + (fired ? "FIRED" : "ARMED") + "]";
    }
}
