package io.scopebind.core.engine;

/** Body of a transaction: performs zero or more writes against the views it is given. */
@FunctionalInterface
public interface TransactionMutator {

    /**
     * Applies the writes. Throwing aborts the transaction and discards every write.
     *
     * @param transaction views of the collections the transaction was opened for
     */
    void mutate(Transaction transaction);
}
