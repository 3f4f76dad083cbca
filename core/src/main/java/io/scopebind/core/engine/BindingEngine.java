package io.scopebind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopebind.core.config.BindingsConfig;
import io.scopebind.core.expression.ExpressionValidator;
import io.scopebind.core.expression.LiteralEvaluator;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableListItem;
import io.scopebind.core.spi.InstanceTree;
import io.scopebind.core.spi.TransactionListener;
import io.scopebind.core.spi.VariableValueProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring the binding core together: one {@link BindingStore} owning all collections,
 * plus the services that read and write it.
 *
 * <p>
 * Construct via {@link #builder()}. The instance tree is required; everything else has a
 * default.
 *
 * <pre>{@code
 * BindingEngine engine = BindingEngine.builder()
 *         .config(ConfigLoader.loadDefault())
 *         .instanceTree(tree)
 *         .valueProvider(provider)
 *         .transactionListener(persistence::enqueue)
 *         .build();
 * }</pre>
 */
public final class BindingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(BindingEngine.class);

    private final BindingsConfig config;
    private final BindingStore store;
    private final ExpressionValidator validator;
    private final LiteralEvaluator evaluator;
    private final ScopeResolver scopes;
    private final DependencyTracker dependencies;
    private final VariableService variables;
    private final PropBindingService props;
    private final VariablePreviews previews;

    private BindingEngine(Builder builder) {
        this.config = builder.config;
        this.store = new BindingStore(builder.initialState);
        builder.listeners.forEach(store::addTransactionListener);
        this.validator = new ExpressionValidator(config.expressionLimits(), config.effectCalls());
        this.evaluator = new LiteralEvaluator(validator);
        this.scopes = new ScopeResolver(builder.instanceTree, config.collectionComponent());
        this.dependencies = new DependencyTracker(validator);
        this.variables =
                new VariableService(store, scopes, dependencies, evaluator, builder.instanceTree, builder.idGenerator);
        this.props = new PropBindingService(store, scopes, dependencies, validator, builder.idGenerator);
        this.previews = new VariablePreviews(store, scopes, builder.valueProvider);
        LOG.info(
                "Binding engine ready: collectionComponent={}, effectCalls={}, variables={}, props={}",
                config.collectionComponent(),
                config.effectCalls(),
                store.snapshot().variables().size(),
                store.snapshot().props().size());
    }

    /** Creates a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    public BindingsConfig config() {
        return config;
    }

    public BindingStore store() {
        return store;
    }

    public ExpressionValidator validator() {
        return validator;
    }

    public LiteralEvaluator evaluator() {
        return evaluator;
    }

    public ScopeResolver scopes() {
        return scopes;
    }

    public DependencyTracker dependencies() {
        return dependencies;
    }

    public VariableService variables() {
        return variables;
    }

    public PropBindingService props() {
        return props;
    }

    public VariablePreviews previews() {
        return previews;
    }

    /**
     * Lists the variables visible at an instance, as shown next to one of its props.
     *
     * @param selector target-first instance path
     * @param propId   the prop being edited, or {@code null}; its expression marks entries selected
     * @return one item per visible variable, in store order
     */
    public List<VariableListItem> listVariables(InstanceSelector selector, String propId) {
        Set<String> selected = props.expressionVariables(propId);
        Map<String, JsonNode> values = previews.valuesFor(selector);
        List<VariableListItem> items = new ArrayList<>();
        for (Variable variable : variables.visibleVariables(selector)) {
            items.add(new VariableListItem(
                    variable,
                    VariablePreviews.label(variable, values.get(variable.id())),
                    selected.contains(variable.id()),
                    variables.isDeletable(variable)));
        }
        return items;
    }

    /**
     * Opens a new, closed edit session.
     *
     * @param selectorSource supplies the currently selected instance, if any
     */
    public VariableEditSession openSession(Supplier<Optional<InstanceSelector>> selectorSource) {
        return new VariableEditSession(variables, selectorSource);
    }

    /** Builder for {@link BindingEngine}. */
    public static final class Builder {
        private BindingsConfig config = BindingsConfig.DEFAULT;
        private InstanceTree instanceTree;
        private VariableValueProvider valueProvider = VariableValueProvider.NONE;
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
        private StoreSnapshot initialState = StoreSnapshot.empty();
        private final List<TransactionListener> listeners = new ArrayList<>();

        Builder() {}

        public Builder config(BindingsConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder instanceTree(InstanceTree instanceTree) {
            this.instanceTree = instanceTree;
            return this;
        }

        public Builder valueProvider(VariableValueProvider valueProvider) {
            this.valueProvider = Objects.requireNonNull(valueProvider, "valueProvider must not be null");
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        /** Seeds the store, e.g. with state loaded by the persistence collaborator. */
        public Builder initialState(StoreSnapshot initialState) {
            this.initialState = Objects.requireNonNull(initialState, "initialState must not be null");
            return this;
        }

        public Builder transactionListener(TransactionListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public BindingEngine build() {
            if (instanceTree == null) {
                throw new IllegalStateException("instanceTree is required");
            }
            return new BindingEngine(this);
        }
    }
}
