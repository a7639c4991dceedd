package io.fullerstack.composite.watch;

import io.fullerstack.composite.provider.Provider;
import io.fullerstack.composite.signal.ChangeSignal;
import io.fullerstack.composite.subscription.Registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Durable watch over a source whose change signal is rotated on every change.
 *
 * <p>A single {@link ChangeSignal} fires once. The watcher turns that into a continuous watch:
 * <ol>
 *   <li>When the watched signal fires, the source's <em>next</em> signal is captured first.</li>
 *   <li>The change callback runs.</li>
 *   <li>The watcher subscribes to the captured signal.</li>
 * </ol>
 * Capturing before the callback runs means a change that lands while the callback executes
 * still fires the captured signal, so there is no window in which a change goes unseen.
 *
 * <p>A captured signal may already have fired by the time the watcher subscribes, either because
 * the source changed again in the meantime or because the source has not rotated yet. The watcher
 * treats both as another change and processes them in a loop on the current thread instead of
 * recursing. Only a source that hands back the same fired signal again counts as stuck: after
 * {@code maxConsecutiveRefires} such repeats in a row the watcher logs a warning and detaches.
 *
 * <p>The callback can be held weakly ({@link #weak}). A weakly held callback that has been
 * garbage collected detaches the watcher the next time the source fires, so an abandoned owner
 * does not keep a subscription chain alive.
 */
public class SourceWatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SourceWatcher.class);

    public static final int DEFAULT_MAX_CONSECUTIVE_REFIRES = 16;

    private static final int SUBSCRIBING = 0;
    private static final int SETTLED = 1;
    private static final int FIRED_INLINE = 2;

    private final String name;
    private final Supplier<? extends ChangeSignal> producer;
    private final Supplier<Runnable> target;
    private final int maxConsecutiveRefires;
    private final AtomicLong notifications = new AtomicLong();

    private final Object lock = new Object();
    private volatile boolean active = true;
    private boolean started = false;
    private long sequence = 0;
    private Registration current = Registration.NONE;

    private SourceWatcher(
        String name,
        Supplier<? extends ChangeSignal> producer,
        Supplier<Runnable> target,
        int maxConsecutiveRefires
    ) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.producer = Objects.requireNonNull(producer, "producer cannot be null");
        this.target = target;
        if (maxConsecutiveRefires < 1) {
            throw new IllegalArgumentException("maxConsecutiveRefires must be positive: " + maxConsecutiveRefires);
        }
        this.maxConsecutiveRefires = maxConsecutiveRefires;
    }

    /**
     * Creates a watcher that holds its callback strongly.
     *
     * @param name                  name used in log messages
     * @param producer              returns the source's current signal
     * @param onChanged             callback run on every change
     * @param maxConsecutiveRefires cap on back-to-back already-fired signals
     * @return an unstarted watcher
     */
    public static SourceWatcher strong(
        String name,
        Supplier<? extends ChangeSignal> producer,
        Runnable onChanged,
        int maxConsecutiveRefires
    ) {
        Objects.requireNonNull(onChanged, "onChanged cannot be null");
        return new SourceWatcher(name, producer, () -> onChanged, maxConsecutiveRefires);
    }

    /**
     * Creates a watcher that holds its callback weakly. The caller must keep the callback
     * reachable for as long as it wants to be notified.
     *
     * @param name                  name used in log messages
     * @param producer              returns the source's current signal
     * @param onChanged             callback run on every change, held weakly
     * @param maxConsecutiveRefires cap on back-to-back already-fired signals
     * @return an unstarted watcher
     */
    public static SourceWatcher weak(
        String name,
        Supplier<? extends ChangeSignal> producer,
        Runnable onChanged,
        int maxConsecutiveRefires
    ) {
        Objects.requireNonNull(onChanged, "onChanged cannot be null");
        WeakReference<Runnable> reference = new WeakReference<>(onChanged);
        return new SourceWatcher(name, producer, reference::get, maxConsecutiveRefires);
    }

    /**
     * Creates a watcher over a provider that holds its callback weakly.
     *
     * @param name                  name used in log messages
     * @param provider              the watched provider
     * @param onChanged             callback run on every change, held weakly
     * @param maxConsecutiveRefires cap on back-to-back already-fired signals
     * @return an unstarted watcher
     */
    public static SourceWatcher weak(String name, Provider<?> provider, Runnable onChanged, int maxConsecutiveRefires) {
        Objects.requireNonNull(provider, "provider cannot be null");
        return weak(name, provider::changeSignal, onChanged, maxConsecutiveRefires);
    }

    /**
     * Starts watching from the source's current signal.
     *
     * @return this watcher
     */
    public SourceWatcher start() {
        return start(producer.get());
    }

    /**
     * Starts watching from a signal captured earlier. If it fired in the meantime the callback
     * runs before this method returns.
     *
     * @param initial the signal to watch first
     * @return this watcher
     * @throws IllegalStateException if already started
     */
    public SourceWatcher start(ChangeSignal initial) {
        Objects.requireNonNull(initial, "initial signal cannot be null");
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Watcher '" + name + "' already started");
            }
            started = true;
        }
        watch(initial);
        return this;
    }

    /**
     * @return true until closed, detached by a collected callback, or detached after too many refires
     */
    public boolean isActive() {
        return active;
    }

    /**
     * @return how many times the change callback has been invoked
     */
    public long notifications() {
        return notifications.get();
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        Registration registration;
        synchronized (lock) {
            if (!active) {
                return;
            }
            active = false;
            registration = current;
            current = Registration.NONE;
        }
        registration.close();
        logger.debug("Watcher '{}' closed after {} notifications", name, notifications.get());
    }

    private void watch(ChangeSignal initial) {
        watch(initial, 0);
    }

    /**
     * Follows the signal chain iteratively. {@code repeats} counts how many times in a row the
     * producer handed back the very signal that had just fired.
     */
    private void watch(ChangeSignal initial, int initialRepeats) {
        ChangeSignal signal = initial;
        int repeats = initialRepeats;

        while (active && signal != null) {
            if (repeats >= maxConsecutiveRefires) {
                detachAfterRefires();
                return;
            }

            if (!signal.hasChanged()) {
                long step;
                synchronized (lock) {
                    step = ++sequence;
                }

                ChangeSignal watched = signal;
                AtomicInteger state = new AtomicInteger(SUBSCRIBING);
                Registration registration = signal.subscribe(() -> {
                    // Fired while subscribe() was still on the stack: let the loop below pick it up
                    if (!state.compareAndSet(SUBSCRIBING, FIRED_INLINE)) {
                        onFired(watched);
                    }
                });

                if (state.compareAndSet(SUBSCRIBING, SETTLED)) {
                    synchronized (lock) {
                        if (!active) {
                            registration.close();
                        } else if (step == sequence) {
                            current = registration;
                        }
                    }
                    return;
                }
            }

            // A fresh signal that already fired is another change, not a stuck source
            ChangeSignal next = advance();
            repeats = next == signal ? repeats + 1 : 0;
            signal = next;
        }
    }

    private void onFired(ChangeSignal fired) {
        ChangeSignal next = advance();
        if (next != null) {
            watch(next, next == fired ? 1 : 0);
        }
    }

    /**
     * Captures the next signal, then runs the callback.
     *
     * @return the captured signal, or null when the watcher should stop
     */
    private ChangeSignal advance() {
        if (!active) {
            return null;
        }
        Runnable onChanged = target.get();
        if (onChanged == null) {
            logger.debug("Watcher '{}' target was collected, detaching", name);
            close();
            return null;
        }

        ChangeSignal next = producer.get();
        notifications.incrementAndGet();
        try {
            onChanged.run();
        } catch (RuntimeException e) {
            logger.warn("Watcher '{}' change callback failed: {}", name, e.getMessage(), e);
        }
        return next;
    }

    private void detachAfterRefires() {
        logger.warn(
            "Watcher '{}' was handed the same fired signal {} times in a row; the source is not rotating its signal, detaching",
            name, maxConsecutiveRefires);
        close();
    }

    @Override
    public String toString() {
        return "SourceWatcher[" + name + (active ? "" : ", inactive") + ", notifications=" + notifications.get() + "]";
    }
}
