package io.scopebind.core.error;

import java.util.List;

/**
 * Thrown when a value variable's literal references other identifiers. Only expression props may
 * depend on variables; a value must be self-contained.
 */
public final class ValueDependsOnVariablesException extends ExpressionException {

    private static final long serialVersionUID = 1L;

    private final List<String> identifiers;

    public ValueDependsOnVariablesException(List<String> identifiers, String expression) {
        super("Cannot use variables " + String.join(", ", identifiers) + " as variable value",
                expression,
                Phase.EVALUATION);
        this.identifiers = List.copyOf(identifiers);
    }

    /** The referenced identifiers, in order of first appearance. */
    public List<String> identifiers() {
        return identifiers;
    }
}
