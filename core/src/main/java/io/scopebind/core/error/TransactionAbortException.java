package io.scopebind.core.error;

import java.util.List;

/**
 * Thrown when a transaction mutator fails. The whole batch is discarded and every collection is
 * left exactly as it was before the attempt. The failing step is available as the cause.
 */
public final class TransactionAbortException extends StoreException {

    private static final long serialVersionUID = 1L;

    private final List<String> collections;

    public TransactionAbortException(String message, Throwable cause, List<String> collections) {
        super(message, cause);
        this.collections = List.copyOf(collections);
    }

    /** Names of the collections the aborted transaction was allowed to touch. */
    public List<String> collections() {
        return collections;
    }
}
