package io.scopebind.core.error;

/**
 * Abstract parent for errors raised while parsing, validating or evaluating expression text.
 * Carries the offending expression so callers can show it next to the message.
 */
public abstract class ExpressionException extends BindingException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    protected ExpressionException(String message, String expression, Phase phase) {
        super(message, phase);
        this.expression = expression;
    }

    protected ExpressionException(String message, Throwable cause, String expression, Phase phase) {
        super(message, cause, phase);
        this.expression = expression;
    }

    /** The expression text that triggered the error, or {@code null} if not known. */
    public String expression() {
        return expression;
    }
}
