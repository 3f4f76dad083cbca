package io.scopebind.core.error;

import java.util.Set;

/** Thrown when deleting a value or resource variable that is still referenced by a prop. */
public final class DeletionBlockedException extends StoreException {

    private static final long serialVersionUID = 1L;

    private final String variableId;
    private final Set<String> propIds;

    public DeletionBlockedException(String variableId, String variableName, Set<String> propIds) {
        super("Variable \"" + variableName + "\" is used by " + propIds.size() + " prop(s) and cannot be deleted");
        this.variableId = variableId;
        this.propIds = Set.copyOf(propIds);
    }

    /** Id of the variable that could not be deleted. */
    public String variableId() {
        return variableId;
    }

    /** Ids of the props whose expressions reference the variable. */
    public Set<String> propIds() {
        return propIds;
    }
}
