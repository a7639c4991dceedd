package io.fullerstack.composite.provider;

import io.fullerstack.composite.signal.ChangeSignal;
import io.fullerstack.composite.signal.ChangeSignals;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Provider over a fixed list of items. Its signal never fires.
 *
 * @param <T> item type
 */
public final class StaticProvider<T> implements Provider<T> {

    private final List<T> items;

    public StaticProvider(List<? extends T> items) {
        Objects.requireNonNull(items, "items cannot be null");
        this.items = List.copyOf(items);
    }

    @SafeVarargs
    public static <T> StaticProvider<T> of(T... items) {
        return new StaticProvider<>(Arrays.asList(items));
    }

    @Override
    public List<T> items() {
        return items;
    }

    @Override
    public ChangeSignal changeSignal() {
        return ChangeSignals.never();
    }

    @Override
    public String toString() {
        return "StaticProvider[items=" + items.size() + "]";
    }
}
