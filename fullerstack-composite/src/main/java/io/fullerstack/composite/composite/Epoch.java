package io.fullerstack.composite.composite;

import io.fullerstack.composite.signal.OneShotSignal;

import java.util.List;

/**
 * Snapshot and the signal that invalidates it, published together as one reference.
 *
 * @param items      merged items of every provider, immutable
 * @param signal     fires when this epoch ends
 * @param generation 1 for the first epoch, incremented on every recompute
 */
record Epoch<T>(List<T> items, OneShotSignal signal, long generation) {

    Epoch<T> next(List<T> nextItems) {
        return new Epoch<>(nextItems, new OneShotSignal(), generation + 1);
    }
}
