package io.scopebind.core.error;

/** Thrown when an identifier in an expression is rejected by the identifier allow-list. */
public final class UnknownIdentifierException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public UnknownIdentifierException(String identifier, String expression) {
        super("Unknown variable \"" + identifier + "\"", expression, Phase.VALIDATION);
        this.identifier = identifier;
    }

    /** The raw identifier that is not allowed. */
    public String identifier() {
        return identifier;
    }
}
