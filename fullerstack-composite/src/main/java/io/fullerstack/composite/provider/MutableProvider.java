package io.fullerstack.composite.provider;

import io.fullerstack.composite.signal.ChangeSignal;
import io.fullerstack.composite.signal.OneShotSignal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Provider whose items are replaced at runtime.
 *
 * <p>Every replacement publishes the new items together with a fresh signal, then fires the
 * previous signal. Watchers woken by the fire therefore read the new items and subscribe to
 * the new signal.
 *
 * @param <T> item type
 */
public class MutableProvider<T> implements Provider<T> {

    private final Object lock = new Object();
    private volatile List<T> items;
    private volatile OneShotSignal signal = new OneShotSignal();

    public MutableProvider(List<? extends T> items) {
        Objects.requireNonNull(items, "items cannot be null");
        this.items = List.copyOf(items);
    }

    @SafeVarargs
    public static <T> MutableProvider<T> of(T... items) {
        return new MutableProvider<>(Arrays.asList(items));
    }

    @Override
    public List<T> items() {
        return items;
    }

    @Override
    public ChangeSignal changeSignal() {
        return signal;
    }

    /**
     * Replaces all items and announces the change.
     *
     * @param newItems the new items
     */
    public void replace(List<? extends T> newItems) {
        Objects.requireNonNull(newItems, "newItems cannot be null");
        List<T> copy = List.copyOf(newItems);
        OneShotSignal previous;
        synchronized (lock) {
            items = copy;
            previous = signal;
            signal = new OneShotSignal();
        }
        previous.fire();
    }

    /**
     * Applies a transformation to a copy of the current items and publishes the result.
     *
     * @param update transformation of the current items
     */
    public void update(UnaryOperator<List<T>> update) {
        Objects.requireNonNull(update, "update cannot be null");
        OneShotSignal previous;
        synchronized (lock) {
            items = List.copyOf(update.apply(new ArrayList<>(items)));
            previous = signal;
            signal = new OneShotSignal();
        }
        previous.fire();
    }

    @Override
    public String toString() {
        return "MutableProvider[items=" + items.size() + "]";
    }
}
