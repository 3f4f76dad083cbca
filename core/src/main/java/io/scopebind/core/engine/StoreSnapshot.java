package io.scopebind.core.engine;

import io.scopebind.core.model.Prop;
import io.scopebind.core.model.Resource;
import io.scopebind.core.model.Variable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the three store collections.
 *
 * <p>
 * This is the unit of atomic swap in {@link BindingStore#transact}. The store holds a
 * {@code StoreSnapshot} reference via {@link java.util.concurrent.atomic.AtomicReference}; a
 * commit builds a new snapshot and swaps it in. Readers that captured the old snapshot keep a
 * consistent view; new readers pick up the new one. A collection untouched by a commit is shared
 * between the old and the new snapshot, so identity comparison of a collection map tells whether
 * it changed.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable. Iteration order is
 * insertion order.
 */
public final class StoreSnapshot {

    private static final StoreSnapshot EMPTY = new StoreSnapshot(Map.of(), Map.of(), Map.of());

    private final Map<String, Variable> variables;
    private final Map<String, Resource> resources;
    private final Map<String, Prop> props;

    private StoreSnapshot(Map<String, Variable> variables, Map<String, Resource> resources, Map<String, Prop> props) {
        this.variables = variables;
        this.resources = resources;
        this.props = props;
    }

    /**
     * Returns an empty snapshot.
     *
     * @return an empty, immutable snapshot
     */
    public static StoreSnapshot empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link Builder} for constructing a snapshot incrementally.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the variable with the given id, or {@code null} if absent. */
    public Variable variable(String id) {
        return variables.get(id);
    }

    /** Returns the resource with the given id, or {@code null} if absent. */
    public Resource resource(String id) {
        return resources.get(id);
    }

    /** Returns the prop with the given id, or {@code null} if absent. */
    public Prop prop(String id) {
        return props.get(id);
    }

    /** Unmodifiable view of all variables by id. */
    public Map<String, Variable> variables() {
        return variables;
    }

    /** Unmodifiable view of all resources by id. */
    public Map<String, Resource> resources() {
        return resources;
    }

    /** Unmodifiable view of all props by id. */
    public Map<String, Prop> props() {
        return props;
    }

    /** Returns a snapshot with the given collections replaced; {@code null} keeps the current one. */
    StoreSnapshot with(Map<String, Variable> newVariables, Map<String, Resource> newResources, Map<String, Prop> newProps) {
        return new StoreSnapshot(
                newVariables == null ? variables : freeze(newVariables),
                newResources == null ? resources : freeze(newResources),
                newProps == null ? props : freeze(newProps));
    }

    private static <T> Map<String, T> freeze(Map<String, T> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * Builder for constructing a {@link StoreSnapshot} incrementally, e.g. to seed a store with
     * state loaded by the persistence collaborator.
     */
    public static final class Builder {

        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final Map<String, Resource> resources = new LinkedHashMap<>();
        private final Map<String, Prop> props = new LinkedHashMap<>();

        Builder() {}

        /**
         * Adds a variable, keyed by its id.
         *
         * @param variable the variable
         * @return this builder (fluent)
         */
        public Builder addVariable(Variable variable) {
            variables.put(variable.id(), variable);
            return this;
        }

        /**
         * Adds a resource, keyed by its id.
         *
         * @param resource the resource
         * @return this builder (fluent)
         */
        public Builder addResource(Resource resource) {
            resources.put(resource.id(), resource);
            return this;
        }

        /**
         * Adds a prop, keyed by its id.
         *
         * @param prop the prop
         * @return this builder (fluent)
         */
        public Builder addProp(Prop prop) {
            props.put(prop.id(), prop);
            return this;
        }

        /**
         * Builds an immutable {@link StoreSnapshot} from the accumulated state.
         *
         * @return the new snapshot
         */
        public StoreSnapshot build() {
            return new StoreSnapshot(freeze(variables), freeze(resources), freeze(props));
        }
    }
}
