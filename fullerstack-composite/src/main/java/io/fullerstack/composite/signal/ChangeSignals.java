package io.fullerstack.composite.signal;

import io.fullerstack.composite.subscription.Registration;
import io.fullerstack.composite.watch.SourceWatcher;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Factory methods for {@link ChangeSignal}s.
 *
 * <h3>Example Usage:</h3>
 * <pre>{@code
 * // Re-read routes every time the composite changes, until closed
 * AutoCloseable watch = ChangeSignals.onChange(
 *     composite::changeToken,
 *     () -> router.rebuild(composite.endpoints())
 * );
 * }</pre>
 */
@UtilityClass
public class ChangeSignals {

    private static final ChangeSignal NEVER = new ChangeSignal() {
        @Override
        public boolean hasChanged() {
            return false;
        }

        @Override
        public Registration subscribe(Runnable callback) {
            Objects.requireNonNull(callback, "callback cannot be null");
            return Registration.NONE;
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            TimeUnit.NANOSECONDS.sleep(timeout.toNanos());
            return false;
        }

        @Override
        public String toString() {
            return "ChangeSignal[never]";
        }
    };

    /**
     * @return a signal that never fires, for sources whose items are fixed
     */
    public static ChangeSignal never() {
        return NEVER;
    }

    /**
     * @return a signal that has already fired
     */
    public static ChangeSignal fired() {
        OneShotSignal signal = new OneShotSignal();
        signal.fire();
        return signal;
    }

    /**
     * Runs {@code consumer} every time the signal returned by {@code producer} fires, until the
     * returned watch is closed.
     *
     * @param producer returns the current signal; called again after every change
     * @param consumer runs on every change
     * @return the running watch
     */
    public static SourceWatcher onChange(Supplier<? extends ChangeSignal> producer, Runnable consumer) {
        return SourceWatcher.strong(
            "onChange@" + Integer.toHexString(System.identityHashCode(consumer)),
            producer,
            consumer,
            SourceWatcher.DEFAULT_MAX_CONSECUTIVE_REFIRES
        ).start();
    }
}
