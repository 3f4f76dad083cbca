package io.scopebind.core.engine;

import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableKind;
import io.scopebind.core.spi.InstanceTree;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes the variables visible at an instance.
 *
 * <p>
 * A variable is visible iff its scope instance is the target or one of its ancestors. One
 * exception: a parameter declared on the target instance itself is hidden when that instance is a
 * collection component, since the collection's item parameter has no value while the collection
 * itself is being configured.
 *
 * <p>
 * Thread-safe: stateless apart from the injected tree.
 */
public final class ScopeResolver {

    private final InstanceTree tree;
    private final String collectionComponent;

    /**
     * @param tree                the instance tree collaborator
     * @param collectionComponent component name of the repeating construct whose own parameters
     *                            are hidden from it
     */
    public ScopeResolver(InstanceTree tree, String collectionComponent) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.collectionComponent = Objects.requireNonNull(collectionComponent, "collectionComponent must not be null");
    }

    /**
     * Returns the variables visible at the selector's target, in the order of the given
     * collection.
     *
     * @param selector  target-first instance path
     * @param variables all variables
     * @return visible variables; never null
     */
    public List<Variable> visibleVariables(InstanceSelector selector, Collection<Variable> variables) {
        Objects.requireNonNull(selector, "selector must not be null");
        boolean targetIsCollection = isCollection(selector.targetInstanceId());
        return variables.stream()
                .filter(variable -> isVisible(selector, variable, targetIsCollection))
                .collect(Collectors.toList());
    }

    /**
     * Returns {@code true} if the variable is visible at the selector's target.
     *
     * @param selector target-first instance path
     * @param variable the variable
     */
    public boolean isVisible(InstanceSelector selector, Variable variable) {
        return isVisible(selector, variable, isCollection(selector.targetInstanceId()));
    }

    private boolean isVisible(InstanceSelector selector, Variable variable, boolean targetIsCollection) {
        if (!selector.contains(variable.scopeInstanceId())) {
            return false;
        }
        return !(targetIsCollection
                && variable.kind() == VariableKind.PARAMETER
                && variable.scopeInstanceId().equals(selector.targetInstanceId()));
    }

    private boolean isCollection(String instanceId) {
        return tree.componentOf(instanceId).map(collectionComponent::equals).orElse(false);
    }
}
