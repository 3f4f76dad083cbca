package io.scopebind.core.error;

/** Thrown when a variable write is structurally invalid (missing name, unknown scope, wrong kind). */
public final class InvalidVariableException extends StoreException {

    private static final long serialVersionUID = 1L;

    public InvalidVariableException(String message) {
        super(message);
    }
}
