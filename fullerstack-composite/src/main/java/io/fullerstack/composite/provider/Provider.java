package io.fullerstack.composite.provider;

import io.fullerstack.composite.signal.ChangeSignal;

import java.util.List;

/**
 * A source of items that can announce when its items change.
 *
 * <p>Contract for implementations:
 * <ul>
 *   <li>{@link #items()} returns a snapshot; callers never see it mutate.</li>
 *   <li>{@link #changeSignal()} returns the <em>current</em> signal. Once a change happens,
 *       that signal fires and stays fired; the provider creates a fresh signal for the next
 *       generation.</li>
 *   <li>A provider should rotate to the fresh signal before firing the old one, so a watcher
 *       reacting to the fire picks up the new signal.</li>
 * </ul>
 *
 * @param <T> item type
 */
public interface Provider<T> {

    /**
     * @return the current items, in the provider's order
     */
    List<T> items();

    /**
     * @return the signal for the current generation of {@link #items()}
     */
    ChangeSignal changeSignal();
}
