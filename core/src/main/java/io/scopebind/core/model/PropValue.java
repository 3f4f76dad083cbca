package io.scopebind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * The bound value of a {@link Prop}. Exactly one payload is set, matching {@link #kind()}:
 * {@code literal} for {@link PropKind#LITERAL}, {@code expression} for {@link PropKind#EXPRESSION},
 * {@code actions} for {@link PropKind#ACTION}.
 */
public record PropValue(PropKind kind, JsonNode literal, String expression, List<ActionStep> actions) {

    /** Canonical constructor: validates that the payload matches the kind. */
    public PropValue {
        Objects.requireNonNull(kind, "kind must not be null");
        switch (kind) {
            case LITERAL -> {
                Objects.requireNonNull(literal, "literal prop requires a value");
                literal = literal.deepCopy();
            }
            case EXPRESSION -> Objects.requireNonNull(expression, "expression prop requires text");
            case ACTION -> actions = List.copyOf(Objects.requireNonNull(actions, "action prop requires steps"));
        }
        if (kind != PropKind.LITERAL && literal != null
                || kind != PropKind.EXPRESSION && expression != null
                || kind != PropKind.ACTION && actions != null) {
            throw new IllegalArgumentException("prop value of kind " + kind + " must carry only its own payload");
        }
    }

    /** Returns a copy of the literal node, or {@code null} for a non-literal value. */
    @Override
    public JsonNode literal() {
        return literal == null ? null : literal.deepCopy();
    }

    /** Creates a literal prop value. */
    public static PropValue literal(JsonNode value) {
        return new PropValue(PropKind.LITERAL, value, null, null);
    }

    /** Creates an expression prop value. */
    public static PropValue expression(String text) {
        return new PropValue(PropKind.EXPRESSION, null, text, null);
    }

    /** Creates an action prop value. */
    public static PropValue action(List<ActionStep> steps) {
        return new PropValue(PropKind.ACTION, null, null, steps);
    }
}
