package io.scopebind.core.spi;

import io.scopebind.core.model.StoreCollection;
import java.util.List;
import java.util.Set;

/**
 * Hook for the persistence/sync collaborator. Receives every committed transaction with the
 * before/after state of each changed entity; durability and multi-client convergence are the
 * listener's concern.
 *
 * <p>
 * Listeners are called after the commit is visible. Exceptions thrown by a listener are caught
 * by the store and logged; they do NOT roll back the transaction. The store does not wait for
 * any acknowledgement.
 */
@FunctionalInterface
public interface TransactionListener {

    /**
     * Called once per committed transaction that changed at least one entity.
     *
     * @param transaction the committed transaction
     */
    void onCommitted(CommittedTransaction transaction);

    // --- Event records ---

    /**
     * A committed transaction.
     *
     * @param sequence    commit sequence number, strictly increasing per store
     * @param collections the collections the transaction was allowed to touch
     * @param changes     per-entity deltas, in mutation order
     */
    record CommittedTransaction(long sequence, Set<StoreCollection> collections, List<EntityChange> changes) {
        public CommittedTransaction {
            collections = Set.copyOf(collections);
            changes = List.copyOf(changes);
        }
    }

    /**
     * State of one entity before and after a transaction. {@code before} is {@code null} for an
     * insert, {@code after} is {@code null} for a delete.
     */
    record EntityChange(StoreCollection collection, String id, Object before, Object after) {

        /** Returns {@code true} if the entity did not exist before. */
        public boolean isInsert() {
            return before == null;
        }

        /** Returns {@code true} if the entity no longer exists. */
        public boolean isDelete() {
            return after == null;
        }
    }
}
