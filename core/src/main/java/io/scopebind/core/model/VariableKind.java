package io.scopebind.core.model;

/**
 * Kind of a {@link Variable}.
 *
 * <ul>
 *   <li>{@link #VALUE}: holds a typed literal value.
 *   <li>{@link #RESOURCE}: references an externally defined {@link Resource}; its value is fetched
 *       by the resource-execution collaborator.
 *   <li>{@link #PARAMETER}: holds no value; a name inherited into a scope (e.g. a collection item)
 *       whose value is supplied at render time.
 * </ul>
 */
public enum VariableKind {
    VALUE,
    RESOURCE,
    PARAMETER
}
