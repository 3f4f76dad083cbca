package io.scopebind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopebind.core.error.DeletionBlockedException;
import io.scopebind.core.error.ExpressionException;
import io.scopebind.core.error.InvalidVariableException;
import io.scopebind.core.error.TransactionAbortException;
import io.scopebind.core.expression.LiteralEvaluator;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Resource;
import io.scopebind.core.model.StoreCollection;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableKind;
import io.scopebind.core.model.VariableValue;
import io.scopebind.core.spi.InstanceTree;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, update, rename and delete operations on variables. Every write is a single
 * {@link BindingStore#transact} call, so a save either fully applies or leaves the store as it
 * was.
 */
public final class VariableService {

    private static final Logger LOG = LoggerFactory.getLogger(VariableService.class);

    private static final Set<StoreCollection> VARIABLES_AND_RESOURCES =
            EnumSet.of(StoreCollection.VARIABLES, StoreCollection.RESOURCES);

    private final BindingStore store;
    private final ScopeResolver scopes;
    private final DependencyTracker dependencies;
    private final LiteralEvaluator evaluator;
    private final InstanceTree tree;
    private final Supplier<String> idGenerator;

    public VariableService(
            BindingStore store,
            ScopeResolver scopes,
            DependencyTracker dependencies,
            LiteralEvaluator evaluator,
            InstanceTree tree,
            Supplier<String> idGenerator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * Returns the variables visible at the selector's target.
     *
     * @param selector target-first instance path
     */
    public List<Variable> visibleVariables(InstanceSelector selector) {
        return scopes.visibleVariables(selector, store.snapshot().variables().values());
    }

    /**
     * Creates or updates a value variable.
     *
     * <p>
     * The value text is evaluated as a self-contained literal first; nothing is written if it is
     * malformed or references a variable. An edited variable keeps its id and scope; a new one is
     * scoped to the selector's target. Saving over a resource variable converts it: the resource
     * entry is deleted in the same transaction that writes the value variable.
     *
     * @param selector  target-first instance path
     * @param existing  the variable being edited, or {@code null} to create one
     * @param name      the variable name; must not be blank
     * @param valueText literal expression text
     * @return the saved variable
     * @throws InvalidVariableException  if the name is blank or {@code existing} is a parameter
     * @throws ExpressionException       if the value text does not evaluate to a literal
     * @throws TransactionAbortException if the write fails; the store is unchanged
     */
    public Variable saveValueVariable(InstanceSelector selector, Variable existing, String name, String valueText) {
        Objects.requireNonNull(selector, "selector must not be null");
        String trimmedName = requireName(name);
        rejectParameter(existing, "a value");
        VariableValue value = VariableValue.of(evaluator.evaluate(valueText));

        String id = existing != null ? existing.id() : idGenerator.get();
        AtomicReference<Variable> saved = new AtomicReference<>();
        store.transact(VARIABLES_AND_RESOURCES, tx -> {
            Variable current = tx.variables().get(id);
            if (current != null && current.kind() == VariableKind.RESOURCE) {
                tx.resources().delete(current.resourceId());
            }
            String scope = current != null ? current.scopeInstanceId() : scopeFor(existing, selector);
            Variable variable = Variable.value(id, requireLiveScope(scope), trimmedName, value);
            tx.variables().set(id, variable);
            saved.set(variable);
        });
        LOG.debug("Saved value variable: id={}, name={}, type={}", id, trimmedName, value.type());
        return saved.get();
    }

    /**
     * Creates or updates a resource variable. The descriptor is written to the resources
     * collection and the variable to the variables collection in one transaction. A value
     * variable saved here is converted and keeps its id, name and scope; an existing resource
     * variable keeps its resource id.
     *
     * @param selector   target-first instance path
     * @param existing   the variable being edited, or {@code null} to create one
     * @param name       the variable name; must not be blank
     * @param descriptor opaque resource descriptor
     * @return the saved variable
     * @throws InvalidVariableException  if the name is blank or {@code existing} is a parameter
     * @throws TransactionAbortException if the write fails; the store is unchanged
     */
    public Variable saveResourceVariable(
            InstanceSelector selector, Variable existing, String name, JsonNode descriptor) {
        Objects.requireNonNull(selector, "selector must not be null");
        String trimmedName = requireName(name);
        rejectParameter(existing, "a resource");

        String id = existing != null ? existing.id() : idGenerator.get();
        AtomicReference<Variable> saved = new AtomicReference<>();
        store.transact(VARIABLES_AND_RESOURCES, tx -> {
            Variable current = tx.variables().get(id);
            String resourceId = current != null && current.kind() == VariableKind.RESOURCE
                    ? current.resourceId()
                    : idGenerator.get();
            String scope = current != null ? current.scopeInstanceId() : scopeFor(existing, selector);
            Variable variable = Variable.resource(id, requireLiveScope(scope), trimmedName, resourceId);
            tx.resources().set(resourceId, new Resource(resourceId, trimmedName, descriptor));
            tx.variables().set(id, variable);
            saved.set(variable);
        });
        LOG.debug("Saved resource variable: id={}, name={}, resourceId={}", id, trimmedName, saved.get().resourceId());
        return saved.get();
    }

    /**
     * Renames a variable of any kind. Touches only the variables collection.
     *
     * @param variableId the variable id
     * @param name       the new name; must not be blank
     * @return the renamed variable
     * @throws InvalidVariableException if the name is blank or the variable does not exist
     */
    public Variable renameVariable(String variableId, String name) {
        String trimmedName = requireName(name);
        Variable variable = requireVariable(variableId);
        Variable renamed = variable.withName(trimmedName);
        store.transact(EnumSet.of(StoreCollection.VARIABLES), tx -> tx.variables().set(variableId, renamed));
        LOG.debug("Renamed variable: id={}, from={}, to={}", variableId, variable.name(), trimmedName);
        return renamed;
    }

    /**
     * Deletes a variable. A value or resource variable that is still referenced by a prop is not
     * deleted. Touches only the variables collection; a resource referenced by a deleted
     * resource variable stays in the resources collection.
     *
     * @param variableId the variable id
     * @throws InvalidVariableException if the variable does not exist
     * @throws DeletionBlockedException if a prop references the variable
     */
    public void deleteVariable(String variableId) {
        Variable variable = requireVariable(variableId);
        dependencies.checkDeletable(variable, store.snapshot());
        store.transact(EnumSet.of(StoreCollection.VARIABLES), tx -> tx.variables().delete(variableId));
        LOG.debug("Deleted variable: id={}, name={}", variableId, variable.name());
    }

    /**
     * Returns {@code true} if the variable can be deleted from the panel: it is not a parameter
     * and no prop references it.
     */
    public boolean isDeletable(Variable variable) {
        return variable.kind() != VariableKind.PARAMETER
                && dependencies.referencingProps(variable.id(), store.snapshot()).isEmpty();
    }

    /** Returns the ids of all variables currently referenced by any prop. */
    public Set<String> usedVariableIds() {
        return dependencies.referencedVariableIds(store.snapshot());
    }

    private Variable requireVariable(String variableId) {
        Variable variable = store.snapshot().variable(variableId);
        if (variable == null) {
            throw new InvalidVariableException("Variable '" + variableId + "' does not exist");
        }
        return variable;
    }

    private String requireLiveScope(String scopeInstanceId) {
        if (!tree.contains(scopeInstanceId)) {
            throw new InvalidVariableException("Scope instance '" + scopeInstanceId + "' does not exist");
        }
        return scopeInstanceId;
    }

    private static String scopeFor(Variable existing, InstanceSelector selector) {
        return existing != null ? existing.scopeInstanceId() : selector.targetInstanceId();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidVariableException("Variable name is required");
        }
        return name.trim();
    }

    private static void rejectParameter(Variable existing, String what) {
        if (existing != null && existing.kind() == VariableKind.PARAMETER) {
            throw new InvalidVariableException(
                    "Parameter '" + existing.name() + "' cannot hold " + what + "; only its name can change");
        }
    }
}
