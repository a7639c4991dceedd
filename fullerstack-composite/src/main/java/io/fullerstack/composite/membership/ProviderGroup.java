package io.fullerstack.composite.membership;

import io.fullerstack.composite.provider.Provider;
import io.fullerstack.composite.signal.ChangeSignal;
import io.fullerstack.composite.signal.OneShotSignal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Ordered, mutable set of providers whose membership changes are observable.
 *
 * <p>Membership changes are announced through {@link #membershipSignal()}, a rotating one-shot
 * signal separate from the members' own item signals. Composites built over a group watch this
 * signal and re-scan when it fires. A group can be shared by several composites.
 *
 * <p>Every mutation publishes an immutable member list together with a fresh signal, then fires
 * the previous signal outside the group's lock.
 *
 * @param <T> item type of the member providers
 */
public class ProviderGroup<T> {

    private static final Logger logger = LoggerFactory.getLogger(ProviderGroup.class);

    private final Object lock = new Object();
    private volatile List<Provider<T>> members;
    private volatile OneShotSignal membershipSignal = new OneShotSignal();
    private volatile long version = 0;

    public ProviderGroup() {
        this.members = List.of();
    }

    public ProviderGroup(Collection<? extends Provider<T>> initial) {
        Objects.requireNonNull(initial, "initial providers cannot be null");
        initial.forEach(provider -> Objects.requireNonNull(provider, "provider cannot be null"));
        this.members = List.copyOf(initial);
    }

    /**
     * Appends a provider.
     *
     * @param provider the provider to add
     */
    public void add(Provider<T> provider) {
        Objects.requireNonNull(provider, "provider cannot be null");
        mutate(current -> {
            current.add(provider);
            return current;
        });
    }

    /**
     * Inserts a provider at the given position.
     *
     * @param index    position in the member order
     * @param provider the provider to add
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public void add(int index, Provider<T> provider) {
        Objects.requireNonNull(provider, "provider cannot be null");
        mutate(current -> {
            current.add(index, provider);
            return current;
        });
    }

    /**
     * Removes the first occurrence of a provider. Nothing is announced when the provider is not
     * a member.
     *
     * @param provider the provider to remove
     * @return true if it was a member
     */
    public boolean remove(Provider<T> provider) {
        Objects.requireNonNull(provider, "provider cannot be null");
        OneShotSignal previous;
        synchronized (lock) {
            List<Provider<T>> copy = new ArrayList<>(members);
            if (!copy.remove(provider)) {
                return false;
            }
            previous = publish(copy);
        }
        previous.fire();
        return true;
    }

    public boolean contains(Provider<T> provider) {
        return members.contains(provider);
    }

    /**
     * @return immutable snapshot of the current members, in order
     */
    public List<Provider<T>> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    /**
     * @return number of membership changes so far
     */
    public long version() {
        return version;
    }

    /**
     * @return the signal that fires on the next membership change
     */
    public ChangeSignal membershipSignal() {
        return membershipSignal;
    }

    private void mutate(UnaryOperator<List<Provider<T>>> change) {
        OneShotSignal previous;
        synchronized (lock) {
            previous = publish(change.apply(new ArrayList<>(members)));
        }
        previous.fire();
    }

    private OneShotSignal publish(List<Provider<T>> next) {
        OneShotSignal previous = membershipSignal;
        members = List.copyOf(next);
        membershipSignal = new OneShotSignal();
        version++;
        logger.debug("Provider group membership changed to {} members (version {})", next.size(), version);
        return previous;
    }

    @Override
    public String toString() {
        return "ProviderGroup[members=" + members.size() + ", version=" + version + "]";
    }
}
