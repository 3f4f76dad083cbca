package io.scopebind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;
import java.util.Optional;

/**
 * Component metadata for one prop, used to derive the literal a prop falls back to when its
 * binding is cleared.
 *
 * @param type         storage type of the prop's literal
 * @param required     whether the component needs a value for this prop
 * @param defaultValue declared default, or {@code null}
 */
public record PropMeta(ValueType type, boolean required, JsonNode defaultValue) {

    public PropMeta {
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Derives the starting literal: the declared default if present, otherwise the zero value of
     * the type for a required prop ({@code ""}, {@code 0}, {@code false}, {@code null}); empty for
     * an optional prop without a default.
     */
    public Optional<PropValue> startingValue() {
        if (defaultValue != null && !defaultValue.isMissingNode()) {
            return Optional.of(PropValue.literal(defaultValue));
        }
        if (!required) {
            return Optional.empty();
        }
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        JsonNode zero =
                switch (type) {
                    case STRING -> nodes.textNode("");
                    case NUMBER -> nodes.numberNode(0);
                    case BOOLEAN -> nodes.booleanNode(false);
                    case JSON -> nodes.nullNode();
                };
        return Optional.of(PropValue.literal(zero));
    }
}
