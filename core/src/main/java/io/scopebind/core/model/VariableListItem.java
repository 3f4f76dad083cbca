package io.scopebind.core.model;

import java.util.Objects;

/**
 * One entry of the variables list shown for a prop.
 *
 * @param variable  the variable
 * @param label     {@code name} or {@code name: preview}
 * @param selected  whether the prop's current expression references the variable
 * @param deletable whether the variable can be deleted right now
 */
public record VariableListItem(Variable variable, String label, boolean selected, boolean deletable) {

    public VariableListItem {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
