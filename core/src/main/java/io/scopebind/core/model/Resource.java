package io.scopebind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * An externally defined data fetch referenced by a resource variable. The descriptor (method,
 * url, headers, body and so on) is opaque here; it is only stored and forwarded to the
 * resource-execution collaborator.
 *
 * @param id         stable resource id
 * @param name       human label
 * @param descriptor opaque descriptor
 */
public record Resource(String id, String name, JsonNode descriptor) {

    public Resource {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        descriptor = descriptor == null ? JsonNodeFactory.instance.objectNode() : descriptor.deepCopy();
    }

    /** Returns a copy of the descriptor. */
    @Override
    public JsonNode descriptor() {
        return descriptor.deepCopy();
    }
}
