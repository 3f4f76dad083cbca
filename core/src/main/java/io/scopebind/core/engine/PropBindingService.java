package io.scopebind.core.engine;

import io.scopebind.core.error.ExpressionException;
import io.scopebind.core.error.UnknownIdentifierException;
import io.scopebind.core.expression.ExpressionValidator;
import io.scopebind.core.expression.IdentifierPolicy;
import io.scopebind.core.expression.ValidateOptions;
import io.scopebind.core.expression.VariableIdentifiers;
import io.scopebind.core.model.ActionStep;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Prop;
import io.scopebind.core.model.PropKind;
import io.scopebind.core.model.PropMeta;
import io.scopebind.core.model.PropValue;
import io.scopebind.core.model.StoreCollection;
import io.scopebind.core.model.Variable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds props to variables and expressions. Every operation touches only the props collection.
 *
 * <p>
 * A prop is addressed by its id when it exists, otherwise by the selector's target instance and
 * the prop name; it is created lazily on the first binding.
 */
public final class PropBindingService {

    private static final Logger LOG = LoggerFactory.getLogger(PropBindingService.class);

    private static final Set<StoreCollection> PROPS = EnumSet.of(StoreCollection.PROPS);

    private final BindingStore store;
    private final ScopeResolver scopes;
    private final DependencyTracker dependencies;
    private final ExpressionValidator validator;
    private final Supplier<String> idGenerator;

    public PropBindingService(
            BindingStore store,
            ScopeResolver scopes,
            DependencyTracker dependencies,
            ExpressionValidator validator,
            Supplier<String> idGenerator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * Binds a prop to a single variable: the prop becomes an expression consisting of the
     * variable's encoded identifier.
     *
     * @param selector   target-first instance path
     * @param propId     the prop id, or {@code null} if the prop does not exist yet
     * @param propName   the prop name
     * @param variableId the variable to bind
     * @return the bound prop
     * @throws UnknownIdentifierException if the variable is not visible at the target
     */
    public Prop bindVariable(InstanceSelector selector, String propId, String propName, String variableId) {
        Variable variable = store.snapshot().variable(variableId);
        String identifier = VariableIdentifiers.encode(variableId);
        if (variable == null || !scopes.isVisible(selector, variable)) {
            throw new UnknownIdentifierException(identifier, identifier);
        }
        return setPropValue(selector, propId, propName, PropValue.expression(identifier));
    }

    /**
     * Sets a prop's expression. The text may reference only variables visible at the target.
     * Blank text clears the binding.
     *
     * @param selector target-first instance path
     * @param propId   the prop id, or {@code null} if the prop does not exist yet
     * @param propName the prop name
     * @param text     expression text with encoded variable identifiers
     * @param meta     metadata used to derive the starting value when clearing
     * @return the bound prop, or empty if clearing deleted it or there was nothing to clear
     * @throws ExpressionException if the text is malformed or references an unknown variable
     */
    public Optional<Prop> setExpression(
            InstanceSelector selector, String propId, String propName, String text, PropMeta meta) {
        if (text == null || text.isBlank()) {
            return clearBinding(selector, propId, propName, meta);
        }
        ValidateOptions options =
                ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.allowOnly(allowedIdentifiers(selector)));
        String normalized = validator.validate(text, options);
        return Optional.of(setPropValue(selector, propId, propName, PropValue.expression(normalized)));
    }

    /**
     * Sets a prop's action steps. Each step is validated in effectful mode; it may reference the
     * variables visible at the target and the step's own argument names.
     *
     * @param selector target-first instance path
     * @param propId   the prop id, or {@code null} if the prop does not exist yet
     * @param propName the prop name
     * @param steps    the steps, in execution order
     * @return the bound prop
     * @throws ExpressionException if a step is malformed or references an unknown variable
     */
    public Prop setActions(InstanceSelector selector, String propId, String propName, List<ActionStep> steps) {
        Set<String> allowed = allowedIdentifiers(selector);
        List<ActionStep> normalized = new ArrayList<>();
        for (ActionStep step : steps) {
            Set<String> stepAllowed = new LinkedHashSet<>(allowed);
            stepAllowed.addAll(step.args());
            ValidateOptions options = ValidateOptions.defaults()
                    .asEffectful()
                    .withIdentifiers(IdentifierPolicy.allowOnly(stepAllowed));
            normalized.add(new ActionStep(step.args(), validator.validate(step.code(), options)));
        }
        return setPropValue(selector, propId, propName, PropValue.action(normalized));
    }

    /**
     * Writes a prop value, creating the prop if needed. An existing prop keeps its id, instance
     * and name.
     *
     * @param selector target-first instance path
     * @param propId   the prop id, or {@code null} if the prop does not exist yet
     * @param propName the prop name
     * @param value    the new value
     * @return the written prop
     */
    public Prop setPropValue(InstanceSelector selector, String propId, String propName, PropValue value) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(propName, "propName must not be null");
        Objects.requireNonNull(value, "value must not be null");
        AtomicReference<Prop> written = new AtomicReference<>();
        store.transact(PROPS, tx -> {
            Prop existing = find(tx.props().values(), propId, selector.targetInstanceId(), propName);
            Prop prop = existing != null
                    ? existing.withValue(value)
                    : new Prop(propId != null ? propId : idGenerator.get(), selector.targetInstanceId(), propName, value);
            tx.props().set(prop.id(), prop);
            written.set(prop);
        });
        LOG.debug("Set prop value: id={}, name={}, kind={}", written.get().id(), propName, value.kind());
        return written.get();
    }

    /**
     * Clears a prop's binding. The prop falls back to the starting value derived from its
     * metadata, and is created holding that value if it does not exist yet; if no starting value
     * can be derived the prop is deleted.
     *
     * @param selector target-first instance path
     * @param propId   the prop id, or {@code null} to address the prop by name
     * @param propName the prop name
     * @param meta     the prop's metadata
     * @return the prop holding the starting value, or empty if no starting value exists
     */
    public Optional<Prop> clearBinding(InstanceSelector selector, String propId, String propName, PropMeta meta) {
        Objects.requireNonNull(meta, "meta must not be null");
        Optional<PropValue> startingValue = meta.startingValue();
        AtomicReference<Prop> written = new AtomicReference<>();
        store.transact(PROPS, tx -> {
            Prop existing = find(tx.props().values(), propId, selector.targetInstanceId(), propName);
            if (startingValue.isPresent()) {
                Prop reset = existing != null
                        ? existing.withValue(startingValue.get())
                        : new Prop(
                                propId != null ? propId : idGenerator.get(),
                                selector.targetInstanceId(),
                                propName,
                                startingValue.get());
                tx.props().set(reset.id(), reset);
                written.set(reset);
            } else if (existing != null) {
                tx.props().delete(existing.id());
            }
        });
        LOG.debug("Cleared prop binding: name={}, deleted={}", propName, written.get() == null);
        return Optional.ofNullable(written.get());
    }

    /**
     * Returns the variables referenced by a prop's expression; empty for a missing, literal or
     * action prop and for an expression that no longer parses.
     *
     * @param propId the prop id, may be {@code null}
     */
    public Set<String> expressionVariables(String propId) {
        Prop prop = propId == null ? null : store.snapshot().prop(propId);
        if (prop == null || prop.kind() != PropKind.EXPRESSION) {
            return Set.of();
        }
        try {
            return dependencies.variableIdsOf(prop.value().expression(), false);
        } catch (ExpressionException e) {
            LOG.debug("Prop expression does not parse: propId={}, cause={}", propId, e.getMessage());
            return Set.of();
        }
    }

    private Set<String> allowedIdentifiers(InstanceSelector selector) {
        Set<String> allowed = new LinkedHashSet<>();
        for (Variable variable : scopes.visibleVariables(selector, store.snapshot().variables().values())) {
            allowed.add(VariableIdentifiers.encode(variable.id()));
        }
        return allowed;
    }

    private static Prop find(Iterable<Prop> props, String propId, String instanceId, String propName) {
        Prop byName = null;
        for (Prop prop : props) {
            if (propId != null && prop.id().equals(propId)) {
                return prop;
            }
            if (byName == null && prop.instanceId().equals(instanceId) && prop.name().equals(propName)) {
                byName = prop;
            }
        }
        return byName;
    }
}
