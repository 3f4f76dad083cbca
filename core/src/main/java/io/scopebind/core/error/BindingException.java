package io.scopebind.core.error;

/**
 * Abstract base for all scope-bind exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ExpressionException} or {@link StoreException}.
 */
public abstract class BindingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        VALIDATION,
        EVALUATION,
        COMMIT
    }

    private final Phase phase;

    protected BindingException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected BindingException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
