package io.scopebind.core.model;

import java.util.Objects;

/**
 * A named binding on one instance.
 *
 * @param id         stable prop id
 * @param instanceId the owning instance
 * @param name       prop name
 * @param value      bound value
 */
public record Prop(String id, String instanceId, String name, PropValue value) {

    public Prop {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(instanceId, "instanceId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** Returns a copy bound to a new value; id, instance and name are kept. */
    public Prop withValue(PropValue newValue) {
        return new Prop(id, instanceId, name, newValue);
    }

    /** Shortcut for {@code value().kind()}. */
    public PropKind kind() {
        return value.kind();
    }
}
