package io.scopebind.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.scopebind.core.model.InstanceSelector;
import java.util.Map;

/**
 * Supplies runtime variable values computed by the resource-execution collaborator (resource
 * fetches, parameter values, evaluated variables). Consumed read-only for value previews; the
 * core never triggers a fetch itself.
 */
@FunctionalInterface
public interface VariableValueProvider {

    /** Provider that knows no values. */
    VariableValueProvider NONE = selector -> Map.of();

    /**
     * Returns the values visible at the given instance, keyed by variable id.
     *
     * @param selector the instance selector
     * @return values by variable id; never null
     */
    Map<String, JsonNode> valuesFor(InstanceSelector selector);
}
