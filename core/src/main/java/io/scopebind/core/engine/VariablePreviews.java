package io.scopebind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopebind.core.expression.ExpressionFormatter;
import io.scopebind.core.expression.VariableIdentifiers;
import io.scopebind.core.model.InstanceSelector;
import io.scopebind.core.model.Variable;
import io.scopebind.core.model.VariableKind;
import io.scopebind.core.spi.VariableValueProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only value previews for the variables visible at an instance.
 *
 * <p>
 * Runtime values come from the {@link VariableValueProvider}; a value variable the provider
 * knows nothing about falls back to its stored literal. Nothing here triggers a resource fetch.
 */
public final class VariablePreviews {

    private final BindingStore store;
    private final ScopeResolver scopes;
    private final VariableValueProvider provider;

    public VariablePreviews(BindingStore store, ScopeResolver scopes, VariableValueProvider provider) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    /**
     * Returns the values of the visible variables, keyed by variable id. Variables without a
     * known value are absent.
     *
     * @param selector target-first instance path
     */
    public Map<String, JsonNode> valuesFor(InstanceSelector selector) {
        Map<String, JsonNode> runtime = provider.valuesFor(selector);
        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (Variable variable : scopes.visibleVariables(selector, store.snapshot().variables().values())) {
            JsonNode value = runtime.get(variable.id());
            if (value == null && variable.kind() == VariableKind.VALUE) {
                value = variable.value().value();
            }
            if (value != null) {
                values.put(variable.id(), value);
            }
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * Returns the values of the visible variables keyed by encoded identifier, as seen by an
     * expression editor.
     *
     * @param selector target-first instance path
     */
    public Map<String, JsonNode> editorScope(InstanceSelector selector) {
        Map<String, JsonNode> scope = new LinkedHashMap<>();
        valuesFor(selector).forEach((id, value) -> scope.put(VariableIdentifiers.encode(id), value));
        return Collections.unmodifiableMap(scope);
    }

    /**
     * Returns the display name of every visible variable keyed by encoded identifier, so an
     * editor can show names in place of identifiers.
     *
     * @param selector target-first instance path
     */
    public Map<String, String> editorAliases(InstanceSelector selector) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Variable variable : scopes.visibleVariables(selector, store.snapshot().variables().values())) {
            aliases.put(VariableIdentifiers.encode(variable.id()), variable.name());
        }
        return Collections.unmodifiableMap(aliases);
    }

    /**
     * Formats a list label: {@code name: preview} when a value is known, otherwise the name.
     *
     * @param variable the variable
     * @param value    its value, or {@code null}
     */
    public static String label(Variable variable, JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return variable.name();
        }
        return variable.name() + ": " + ExpressionFormatter.formatValuePreview(value);
    }
}
