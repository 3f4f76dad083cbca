package io.scopebind.core.error;

/** Thrown when expression text is malformed or uses a construct outside the restricted grammar. */
public final class ExpressionParseException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ExpressionParseException(String message, String expression, int position) {
        super(message, expression, Phase.VALIDATION);
        this.position = position;
    }

    /** Zero-based character offset where the problem was detected. */
    public int position() {
        return position;
    }
}
