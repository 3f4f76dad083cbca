package io.scopebind.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Path through the instance tree, target instance first, then its ancestors up to the root.
 *
 * @param instanceIds instance ids, target first; never empty
 */
public record InstanceSelector(List<String> instanceIds) {

    public InstanceSelector {
        instanceIds = List.copyOf(Objects.requireNonNull(instanceIds, "instanceIds must not be null"));
        if (instanceIds.isEmpty()) {
            throw new IllegalArgumentException("instance selector must not be empty");
        }
    }

    /** Creates a selector from ids, target first. */
    public static InstanceSelector of(String... instanceIds) {
        return new InstanceSelector(List.of(instanceIds));
    }

    /** The instance the selector points at. */
    public String targetInstanceId() {
        return instanceIds.get(0);
    }

    /** Returns {@code true} if the instance is the target or one of its ancestors. */
    public boolean contains(String instanceId) {
        return instanceIds.contains(instanceId);
    }

    /** Stable string key, suitable for caching per-selector results. */
    public String key() {
        return String.join("/", instanceIds);
    }
}
