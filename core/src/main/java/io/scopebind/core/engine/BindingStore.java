package io.scopebind.core.engine;

import io.scopebind.core.error.TransactionAbortException;
import io.scopebind.core.model.Prop;
import io.scopebind.core.model.Resource;
import io.scopebind.core.model.StoreCollection;
import io.scopebind.core.model.Variable;
import io.scopebind.core.spi.TransactionListener;
import io.scopebind.core.spi.TransactionListener.CommittedTransaction;
import io.scopebind.core.spi.TransactionListener.EntityChange;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the variables, resources and props collections. All writes go through
 * {@link #transact}, which commits every write of a mutator as one unit or none of them.
 *
 * <p>
 * Thread-safe: uses {@link AtomicReference} to hold an immutable {@link StoreSnapshot}.
 * Transactions are serialized; a commit atomically swaps the entire snapshot, so readers never
 * observe a half-applied transaction. After each commit, observers receive the new snapshot and
 * transaction listeners receive the entity deltas.
 */
public final class BindingStore {

    private static final Logger LOG = LoggerFactory.getLogger(BindingStore.class);

    private final AtomicReference<StoreSnapshot> snapshotRef;
    private final List<TransactionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<StoreSnapshot>> observers = new CopyOnWriteArrayList<>();
    private final Object commitLock = new Object();
    private long sequence;

    /** Creates an empty store. */
    public BindingStore() {
        this(StoreSnapshot.empty());
    }

    /**
     * Creates a store seeded with existing state.
     *
     * @param initial the initial snapshot
     */
    public BindingStore(StoreSnapshot initial) {
        this.snapshotRef = new AtomicReference<>(Objects.requireNonNull(initial, "initial must not be null"));
    }

    /**
     * Returns the current snapshot.
     *
     * @return the current immutable snapshot
     */
    public StoreSnapshot snapshot() {
        return snapshotRef.get();
    }

    /**
     * Registers a listener for committed transactions (the persistence/sync collaborator).
     *
     * @param listener the listener
     */
    public void addTransactionListener(TransactionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Subscribes to snapshot changes. The observer is called after every commit that changed at
     * least one entity.
     *
     * @param observer receives the new snapshot
     * @return a subscription that stops further notifications when cancelled
     */
    public Subscription subscribe(Consumer<StoreSnapshot> observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    /**
     * Runs a mutator against mutable views of exactly the named collections and commits all of
     * its writes as one unit.
     *
     * @param collections the collections the mutator may touch; must not be empty
     * @param mutator     the writes to apply
     * @return the committed transaction; its change list is empty if nothing changed
     * @throws TransactionAbortException if the mutator throws; no collection is changed
     */
    public CommittedTransaction transact(Set<StoreCollection> collections, TransactionMutator mutator) {
        Objects.requireNonNull(collections, "collections must not be null");
        Objects.requireNonNull(mutator, "mutator must not be null");
        if (collections.isEmpty()) {
            throw new IllegalArgumentException("a transaction must name at least one collection");
        }
        Set<StoreCollection> named = EnumSet.copyOf(collections);
        List<String> names = named.stream().map(StoreCollection::collectionName).collect(Collectors.toList());

        CommittedTransaction committed;
        StoreSnapshot next;
        synchronized (commitLock) {
            StoreSnapshot base = snapshotRef.get();
            Transaction transaction = new Transaction(base, named);
            try {
                mutator.mutate(transaction);
            } catch (RuntimeException e) {
                LOG.warn("Transaction aborted: collections={}, cause={}", names, e.getMessage());
                throw new TransactionAbortException(
                        "Transaction on " + names + " aborted: " + e.getMessage(), e, names);
            } finally {
                transaction.close();
            }

            List<EntityChange> changes = new ArrayList<>();
            for (MutableCollection<?> view : transaction.views().values()) {
                changes.addAll(view.changes());
            }
            committed = new CommittedTransaction(++sequence, named, changes);
            if (changes.isEmpty()) {
                LOG.debug("Transaction committed without changes: sequence={}, collections={}", sequence, names);
                return committed;
            }
            next = base.with(
                    changedWorkingCopy(transaction, StoreCollection.VARIABLES, Variable.class),
                    changedWorkingCopy(transaction, StoreCollection.RESOURCES, Resource.class),
                    changedWorkingCopy(transaction, StoreCollection.PROPS, Prop.class));
            // readers holding the old snapshot keep it
            snapshotRef.set(next);
            LOG.debug(
                    "Transaction committed: sequence={}, collections={}, changes={}",
                    committed.sequence(),
                    names,
                    changes.size());
        }
        notifyObservers(next);
        notifyListeners(committed);
        return committed;
    }

    @SuppressWarnings("unchecked")
    private static <T> Map<String, T> changedWorkingCopy(
            Transaction transaction, StoreCollection collection, Class<T> type) {
        MutableCollection<?> view = transaction.views().get(collection);
        if (view == null || !view.isChanged()) {
            return null;
        }
        return (Map<String, T>) view.working();
    }

    private void notifyObservers(StoreSnapshot snapshot) {
        for (Consumer<StoreSnapshot> observer : observers) {
            try {
                observer.accept(snapshot);
            } catch (Exception e) {
                LOG.warn("Store observer failed", e);
            }
        }
    }

    private void notifyListeners(CommittedTransaction committed) {
        for (TransactionListener listener : listeners) {
            try {
                listener.onCommitted(committed);
            } catch (Exception e) {
                LOG.warn("TransactionListener.onCommitted failed", e);
            }
        }
    }

    /** Handle returned by {@link #subscribe}. */
    @FunctionalInterface
    public interface Subscription {

        /** Stops further notifications. Cancelling twice is harmless. */
        void cancel();
    }
}
