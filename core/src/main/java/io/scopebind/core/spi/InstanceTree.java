package io.scopebind.core.spi;

import java.util.Optional;

/**
 * Read-only view of the externally owned instance tree. The core never mutates the tree; it only
 * asks whether an instance exists and which component it renders.
 *
 * <p>
 * Implementations MUST be side-effect free.
 */
public interface InstanceTree {

    /**
     * Returns {@code true} if an instance with the given id exists.
     *
     * @param instanceId the instance id
     */
    boolean contains(String instanceId);

    /**
     * Returns the structural kind (component name) of an instance.
     *
     * @param instanceId the instance id
     * @return the component name, or empty if the instance is unknown
     */
    Optional<String> componentOf(String instanceId);
}
