package io.scopebind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Typed literal held by a value variable. Strings, numbers and booleans carry their own type;
 * arrays, objects and {@code null} are stored as {@link ValueType#JSON}.
 *
 * <p>
 * Immutable and thread-safe: the node is copied on the way in and {@link #value()} hands out a
 * copy, so a stored value can only change through a new {@code VariableValue}.
 */
public record VariableValue(ValueType type, JsonNode value) {

    public VariableValue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (value.isMissingNode()) {
            throw new IllegalArgumentException("value must not be missing");
        }
        boolean consistent =
                switch (type) {
                    case STRING -> value.isTextual();
                    case NUMBER -> value.isNumber();
                    case BOOLEAN -> value.isBoolean();
                    case JSON -> value.isContainerNode() || value.isNull();
                };
        if (!consistent) {
            throw new IllegalArgumentException("value " + value + " does not match type " + type);
        }
        value = value.deepCopy();
    }

    /** Returns a copy of the stored node. */
    @Override
    public JsonNode value() {
        return value.deepCopy();
    }

    /**
     * Classifies a value into its storage type.
     *
     * @param value a string, number, boolean, array, object or null node
     * @return the typed value
     */
    public static VariableValue of(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isTextual()) {
            return new VariableValue(ValueType.STRING, value);
        }
        if (value.isNumber()) {
            return new VariableValue(ValueType.NUMBER, value);
        }
        if (value.isBoolean()) {
            return new VariableValue(ValueType.BOOLEAN, value);
        }
        return new VariableValue(ValueType.JSON, value);
    }
}
