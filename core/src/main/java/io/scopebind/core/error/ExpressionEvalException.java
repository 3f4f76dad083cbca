package io.scopebind.core.error;

/** Thrown when a pure literal expression cannot be reduced to a storable value. */
public final class ExpressionEvalException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, String expression) {
        super(message, expression, Phase.EVALUATION);
    }

    public ExpressionEvalException(String message, Throwable cause, String expression) {
        super(message, cause, expression, Phase.EVALUATION);
    }
}
