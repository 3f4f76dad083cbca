package io.scopebind.core.error;

/**
 * Abstract parent for errors raised by store mutations. Whenever one of these escapes a store
 * operation, no collection has been changed.
 */
public abstract class StoreException extends BindingException {

    private static final long serialVersionUID = 1L;

    protected StoreException(String message) {
        super(message, Phase.COMMIT);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause, Phase.COMMIT);
    }
}
