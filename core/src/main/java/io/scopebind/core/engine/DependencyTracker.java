package io.scopebind.core.engine;

import io.scopebind.core.error.DeletionBlockedException;
import io.scopebind.core.error.ExpressionException;
import io.scopebind.core.expression.ExpressionValidator;
import io.scopebind.core.expression.IdentifierPolicy;
import io.scopebind.core.expression.ValidateOptions;
import io.scopebind.core.model.ActionStep;
import io.scopebind.core.model.Prop;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives which variables are referenced by props, and guards deletion of referenced variables.
 *
 * <p>
 * The reference index is a pure function of a snapshot's props collection. It is memoized by the
 * identity of that collection: a {@link StoreSnapshot} holds unmodifiable maps, shares an
 * untouched collection between commits and replaces a changed one, so a commit touching props
 * invalidates the memo and any other commit keeps it.
 *
 * <p>
 * Scanning is lenient: a prop whose text does not parse contributes no references and the scan
 * goes on. Extracting the references of a single expression via {@link #variableIdsOf} is strict.
 *
 * <p>
 * Thread-safe.
 */
public final class DependencyTracker {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyTracker.class);

    private final ExpressionValidator validator;
    private final AtomicReference<Memo> memo = new AtomicReference<>();

    public DependencyTracker(ExpressionValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Returns the ids of all variables referenced by any expression or action prop.
     *
     * @param snapshot the store state to scan
     * @return referenced variable ids; never null
     */
    public Set<String> referencedVariableIds(StoreSnapshot snapshot) {
        return index(snapshot.props()).keySet();
    }

    /**
     * Returns the ids of the props that reference the given variable.
     *
     * @param variableId the variable id
     * @param snapshot   the store state to scan
     * @return referencing prop ids, empty if the variable is unused
     */
    public Set<String> referencingProps(String variableId, StoreSnapshot snapshot) {
        return index(snapshot.props()).getOrDefault(variableId, Set.of());
    }

    /**
     * Extracts the variable ids referenced by one expression.
     *
     * @param expression the expression text; blank text references nothing
     * @param effectful  whether the text is an action step
     * @return referenced variable ids in order of first appearance
     * @throws ExpressionException if the text does not parse
     */
    public Set<String> variableIdsOf(String expression, boolean effectful) {
        Set<String> ids = new LinkedHashSet<>();
        ValidateOptions options = ValidateOptions.defaults()
                .asOptional()
                .withIdentifiers(IdentifierPolicy.collectingVariableIds(ids));
        validator.validate(expression, effectful ? options.asEffectful() : options);
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Refuses deletion of a value or resource variable that is still referenced. Parameters are
     * never refused.
     *
     * @param variable the variable about to be deleted
     * @param snapshot the store state to scan
     * @throws DeletionBlockedException if a prop references the variable
     */
    public void checkDeletable(Variable variable, StoreSnapshot snapshot) {
        if (variable.kind() == VariableKind.PARAMETER) {
            return;
        }
        Set<String> referencing = referencingProps(variable.id(), snapshot);
        if (!referencing.isEmpty()) {
            throw new DeletionBlockedException(variable.id(), variable.name(), referencing);
        }
    }

    private Map<String, Set<String>> index(Map<String, Prop> props) {
        Memo current = memo.get();
        if (current != null && current.props() == props) {
            return current.index();
        }
        Map<String, Set<String>> index = buildIndex(props);
        memo.set(new Memo(props, index));
        return index;
    }

    private Map<String, Set<String>> buildIndex(Map<String, Prop> props) {
        Map<String, Set<String>> index = new LinkedHashMap<>();
        for (Prop prop : props.values()) {
            switch (prop.kind()) {
                case EXPRESSION -> scan(prop, prop.value().expression(), false, index);
                case ACTION -> {
                    for (ActionStep step : prop.value().actions()) {
                        scan(prop, step.code(), true, index);
                    }
                }
                case LITERAL -> {
                    // literals reference nothing
                }
            }
        }
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        index.forEach((variableId, propIds) -> frozen.put(variableId, Collections.unmodifiableSet(propIds)));
        return Collections.unmodifiableMap(frozen);
    }

    private void scan(Prop prop, String text, boolean effectful, Map<String, Set<String>> index) {
        Set<String> ids;
        try {
            ids = variableIdsOf(text, effectful);
        } catch (ExpressionException e) {
            LOG.debug("Skipping unparseable prop during dependency scan: propId={}, cause={}", prop.id(), e.getMessage());
            return;
        }
        for (String id : ids) {
            index.computeIfAbsent(id, key -> new LinkedHashSet<>()).add(prop.id());
        }
    }

    private record Memo(Map<String, Prop> props, Map<String, Set<String>> index) {}
}
