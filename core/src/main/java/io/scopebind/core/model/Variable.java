package io.scopebind.core.model;

import java.util.Objects;

/**
 * A named, scoped variable. A tagged union on {@link #kind()}: a {@link VariableKind#VALUE} variable
 * carries {@link #value()}, a {@link VariableKind#RESOURCE} variable carries {@link #resourceId()},
 * and a {@link VariableKind#PARAMETER} variable carries neither.
 *
 * <p>
 * {@code id} and {@code scopeInstanceId} never change after creation; edits produce a copy with
 * the same id and scope.
 *
 * @param id              stable, globally unique id
 * @param scopeInstanceId the instance declaring this variable; bounds its visibility
 * @param name            human label
 * @param kind            discriminant
 * @param value           literal value, only for {@code VALUE}
 * @param resourceId      referenced resource id, only for {@code RESOURCE}
 */
public record Variable(
        String id, String scopeInstanceId, String name, VariableKind kind, VariableValue value, String resourceId) {

    /** Canonical constructor: validates required fields and the kind-specific payload. */
    public Variable {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(scopeInstanceId, "scopeInstanceId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        switch (kind) {
            case VALUE -> {
                Objects.requireNonNull(value, "value variable requires a value");
                if (resourceId != null) {
                    throw new IllegalArgumentException("value variable must not reference a resource");
                }
            }
            case RESOURCE -> {
                Objects.requireNonNull(resourceId, "resource variable requires a resourceId");
                if (value != null) {
                    throw new IllegalArgumentException("resource variable must not hold a value");
                }
            }
            case PARAMETER -> {
                if (value != null || resourceId != null) {
                    throw new IllegalArgumentException("parameter variable holds neither value nor resource");
                }
            }
        }
    }

    /** Creates a value variable. */
    public static Variable value(String id, String scopeInstanceId, String name, VariableValue value) {
        return new Variable(id, scopeInstanceId, name, VariableKind.VALUE, value, null);
    }

    /** Creates a resource variable. */
    public static Variable resource(String id, String scopeInstanceId, String name, String resourceId) {
        return new Variable(id, scopeInstanceId, name, VariableKind.RESOURCE, null, resourceId);
    }

    /** Creates a parameter variable. */
    public static Variable parameter(String id, String scopeInstanceId, String name) {
        return new Variable(id, scopeInstanceId, name, VariableKind.PARAMETER, null, null);
    }

    /** Returns a copy with a new name; id, scope and payload are kept. */
    public Variable withName(String newName) {
        return new Variable(id, scopeInstanceId, newName, kind, value, resourceId);
    }
}
