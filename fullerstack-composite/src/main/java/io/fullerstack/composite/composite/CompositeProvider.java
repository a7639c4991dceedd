package io.fullerstack.composite.composite;

import io.fullerstack.composite.config.CompositeConfig;
import io.fullerstack.composite.error.FailureHandler;
import io.fullerstack.composite.error.ProviderReadException;
import io.fullerstack.composite.membership.ProviderGroup;
import io.fullerstack.composite.provider.Provider;
import io.fullerstack.composite.signal.ChangeSignal;
import io.fullerstack.composite.signal.OneShotSignal;
import io.fullerstack.composite.watch.SourceWatcher;

import lombok.Builder;
import lombok.Singular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Provider whose items are the concatenation of the items of a list of providers.
 *
 * <p>The merged list is computed lazily on the first call to {@link #endpoints()} or
 * {@link #changeToken()} and cached until a member provider changes or membership changes.
 * Each recompute publishes a new epoch (snapshot plus a fresh signal) and then fires the
 * signal of the epoch it replaced.
 *
 * <p><b>Ordering rules:</b>
 * <ul>
 *   <li>The new epoch is published before the old signal fires. A consumer that re-subscribes
 *       from inside its callback therefore lands on the new, armed signal and cannot loop on
 *       the signal that is firing.</li>
 *   <li>The old signal fires after the composite lock is released. Callbacks may call back into
 *       the composite, including {@link #addProvider} and {@link #removeProvider}.</li>
 *   <li>The merged list is built off to the side. A provider failure leaves the current epoch
 *       in place.</li>
 * </ul>
 *
 * <p><b>Threading:</b> recomputes are serialized by one lock. Reads are lock-free: they read one
 * volatile epoch reference, so a snapshot is never observed with another epoch's signal.
 *
 * <p><b>Membership:</b> every composite follows a {@link ProviderGroup}. A composite built from a
 * plain list owns a private group; one built with {@link #over(ProviderGroup)} follows a shared
 * group, and its {@link #addProvider}/{@link #removeProvider} mutate that shared group.
 *
 * @param <T> item type
 */
public class CompositeProvider<T> implements Provider<T>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CompositeProvider.class);

    public static final String DEFAULT_NAME = "composite";

    private final String name;
    private final ProviderGroup<T> group;
    private final Function<? super T, String> formatter;
    private final FailureHandler failureHandler;
    private final int maxConsecutiveRefires;
    private final int diagnosticsMaxItems;

    // Watchers hold these weakly; the composite keeps them alive
    private final Runnable providerChangeHandler = this::onProviderChanged;
    private final Runnable membershipChangeHandler = this::onMembershipChanged;

    private final Object lock = new Object();
    private volatile Epoch<T> epoch;
    private final List<Member<T>> members = new ArrayList<>();
    private SourceWatcher membershipWatcher;
    private volatile boolean closed = false;

    private record Member<T>(Provider<T> provider, SourceWatcher watcher) {
    }

    @Builder(builderMethodName = "builder")
    private CompositeProvider(
        String name,
        @Singular List<Provider<T>> providers,
        ProviderGroup<T> group,
        Function<? super T, String> formatter,
        FailureHandler failureHandler,
        CompositeConfig config
    ) {
        if (group != null && !providers.isEmpty()) {
            throw new IllegalArgumentException("Use either a provider list or a shared group, not both");
        }
        this.name = name != null ? name : DEFAULT_NAME;
        this.group = group != null ? group : new ProviderGroup<>(providers);
        this.formatter = formatter != null ? formatter : String::valueOf;
        this.failureHandler = failureHandler != null ? failureHandler : FailureHandler.LOGGING;

        CompositeConfig effective = config != null ? config : CompositeConfig.forComposite(this.name);
        this.maxConsecutiveRefires = effective.maxConsecutiveRefires();
        this.diagnosticsMaxItems = effective.diagnosticsMaxItems();
    }

    /**
     * Creates a composite over a fixed initial list of providers.
     *
     * @param providers providers in concatenation order
     * @return a composite that has not read any provider yet
     */
    @SafeVarargs
    public static <T> CompositeProvider<T> of(Provider<T>... providers) {
        return of(Arrays.asList(providers));
    }

    public static <T> CompositeProvider<T> of(List<? extends Provider<T>> providers) {
        Objects.requireNonNull(providers, "providers cannot be null");
        return CompositeProvider.<T>builder().providers(new ArrayList<>(providers)).build();
    }

    /**
     * Creates a composite that follows a shared, mutable group of providers.
     *
     * @param group the group to follow
     * @return a composite that has not read any provider yet
     */
    public static <T> CompositeProvider<T> over(ProviderGroup<T> group) {
        Objects.requireNonNull(group, "group cannot be null");
        return CompositeProvider.<T>builder().group(group).build();
    }

    /**
     * Returns the merged items of all providers, computing them on first use.
     *
     * @return immutable merged snapshot, in provider order
     * @throws ProviderReadException if the first computation fails
     */
    public List<T> endpoints() {
        return ensureInitialized().items();
    }

    /**
     * Returns the signal of the current epoch, computing the snapshot on first use.
     *
     * <p>Once the returned signal has fired, {@link #endpoints()} returns data at least as new
     * as the change that fired it.
     *
     * @return the current epoch's signal
     * @throws ProviderReadException if the first computation fails
     */
    public ChangeSignal changeToken() {
        return ensureInitialized().signal();
    }

    @Override
    public List<T> items() {
        return endpoints();
    }

    @Override
    public ChangeSignal changeSignal() {
        return changeToken();
    }

    /**
     * Adds a provider at the end of the membership. When the composite is initialized the
     * snapshot is recomputed and the current signal fires before this method returns.
     *
     * @param provider the provider to add
     */
    public void addProvider(Provider<T> provider) {
        group.add(provider);
    }

    /**
     * Removes a provider. When it was a member and the composite is initialized the snapshot is
     * recomputed and the current signal fires before this method returns.
     *
     * @param provider the provider to remove
     * @return true if it was a member
     */
    public boolean removeProvider(Provider<T> provider) {
        return group.remove(provider);
    }

    /**
     * @return current membership, in concatenation order
     */
    public List<Provider<T>> providers() {
        return group.members();
    }

    public boolean isInitialized() {
        return epoch != null;
    }

    /**
     * @return number of epochs published so far, 0 before initialization
     */
    public long generation() {
        Epoch<T> current = epoch;
        return current == null ? 0 : current.generation();
    }

    public String name() {
        return name;
    }

    /**
     * Human-readable dump of the current snapshot. Does not trigger initialization.
     *
     * @return one line per item, or "No endpoints" before initialization
     */
    public String describe() {
        Epoch<T> current = epoch;
        if (current == null) {
            return "No endpoints";
        }

        StringBuilder sb = new StringBuilder();
        List<T> items = current.items();
        int shown = Math.min(items.size(), diagnosticsMaxItems);
        for (int i = 0; i < shown; i++) {
            sb.append(formatter.apply(items.get(i))).append(System.lineSeparator());
        }
        if (items.size() > shown) {
            sb.append("... (").append(items.size() - shown).append(" more)").append(System.lineSeparator());
        }
        return sb.toString();
    }

    /**
     * Detaches every watcher. The last snapshot stays readable but no longer changes.
     */
    @Override
    public void close() {
        List<SourceWatcher> watchers = new ArrayList<>();
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            members.forEach(member -> watchers.add(member.watcher()));
            if (membershipWatcher != null) {
                watchers.add(membershipWatcher);
            }
        }
        watchers.forEach(SourceWatcher::close);
        logger.debug("Composite '{}' closed at generation {}", name, generation());
    }

    // =========================================================================
    // Initialization and recompute
    // =========================================================================

    private Epoch<T> ensureInitialized() {
        Epoch<T> current = epoch;
        if (current != null) {
            return current;
        }

        List<Runnable> starters = new ArrayList<>();
        synchronized (lock) {
            if (epoch == null) {
                // Capture every signal before reading, so a change during the read is not lost
                ChangeSignal membershipInitial = group.membershipSignal();
                List<Provider<T>> providers = group.members();
                List<ChangeSignal> initialSignals = new ArrayList<>(providers.size());
                for (Provider<T> provider : providers) {
                    initialSignals.add(provider.changeSignal());
                }

                List<T> items = readAll(providers);
                epoch = new Epoch<>(items, new OneShotSignal(), 1);

                if (!closed) {
                    for (int i = 0; i < providers.size(); i++) {
                        Member<T> member = newMember(providers.get(i), i);
                        ChangeSignal initial = initialSignals.get(i);
                        members.add(member);
                        starters.add(() -> member.watcher().start(initial));
                    }
                    SourceWatcher watcher = SourceWatcher.weak(
                        name + "/membership",
                        group::membershipSignal,
                        membershipChangeHandler,
                        maxConsecutiveRefires
                    );
                    membershipWatcher = watcher;
                    starters.add(() -> watcher.start(membershipInitial));
                }
                logger.debug("Composite '{}' initialized with {} providers and {} items",
                    name, providers.size(), items.size());
            }
            current = epoch;
        }

        // Outside the lock: a signal that fired since capture triggers a recompute right here
        starters.forEach(Runnable::run);
        return current;
    }

    private void onProviderChanged() {
        OneShotSignal previous;
        try {
            synchronized (lock) {
                previous = publishLocked();
            }
        } catch (ProviderReadException e) {
            failureHandler.onFailure(e);
            return;
        }
        if (previous != null) {
            previous.fire();
        }
    }

    private void onMembershipChanged() {
        List<SourceWatcher> removed = new ArrayList<>();
        List<Runnable> starters = new ArrayList<>();
        OneShotSignal previous = null;
        ProviderReadException failure = null;

        synchronized (lock) {
            if (epoch == null || closed) {
                return;
            }
            reconcileLocked(group.members(), removed, starters);
            try {
                previous = publishLocked();
            } catch (ProviderReadException e) {
                failure = e;
            }
        }

        removed.forEach(SourceWatcher::close);
        if (previous != null) {
            previous.fire();
        }
        starters.forEach(Runnable::run);
        if (failure != null) {
            failureHandler.onFailure(failure);
        }
    }

    /**
     * Rebuilds the snapshot from the current members and publishes a new epoch.
     *
     * @return the signal of the replaced epoch, to be fired by the caller outside the lock;
     * null when not initialized or closed
     */
    private OneShotSignal publishLocked() {
        Epoch<T> current = epoch;
        if (current == null || closed) {
            return null;
        }
        List<Provider<T>> providers = new ArrayList<>(members.size());
        for (Member<T> member : members) {
            providers.add(member.provider());
        }
        Epoch<T> next = current.next(readAll(providers));
        epoch = next;
        logger.debug("Composite '{}' advanced to generation {} with {} items",
            name, next.generation(), next.items().size());
        return current.signal();
    }

    /**
     * Lines up watchers with the target membership: kept providers keep their watcher, removed
     * ones are collected for closing, added ones get a new watcher to start after the lock.
     */
    private void reconcileLocked(List<Provider<T>> target, List<SourceWatcher> removed, List<Runnable> starters) {
        List<Member<T>> remaining = new ArrayList<>(members);
        List<Member<T>> next = new ArrayList<>(target.size());

        for (Provider<T> provider : target) {
            Member<T> member = takeMember(remaining, provider);
            if (member == null) {
                member = newMember(provider, next.size());
                ChangeSignal initial = provider.changeSignal();
                SourceWatcher watcher = member.watcher();
                starters.add(() -> watcher.start(initial));
            }
            next.add(member);
        }

        remaining.forEach(member -> removed.add(member.watcher()));
        members.clear();
        members.addAll(next);
    }

    private Member<T> takeMember(List<Member<T>> remaining, Provider<T> provider) {
        Iterator<Member<T>> iterator = remaining.iterator();
        while (iterator.hasNext()) {
            Member<T> member = iterator.next();
            if (member.provider() == provider) {
                iterator.remove();
                return member;
            }
        }
        return null;
    }

    private Member<T> newMember(Provider<T> provider, int index) {
        SourceWatcher watcher = SourceWatcher.weak(
            name + "/provider-" + index,
            provider,
            providerChangeHandler,
            maxConsecutiveRefires
        );
        return new Member<>(provider, watcher);
    }

    private List<T> readAll(List<Provider<T>> providers) {
        List<T> merged = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            try {
                merged.addAll(providers.get(i).items());
            } catch (RuntimeException e) {
                throw new ProviderReadException(name, i, e);
            }
        }
        return Collections.unmodifiableList(merged);
    }

    @Override
    public String toString() {
        return "CompositeProvider[name=" + name
            + ", providers=" + group.size()
            + ", generation=" + generation() + "]";
    }
}
