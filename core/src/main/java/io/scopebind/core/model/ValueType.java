package io.scopebind.core.model;

/** Storage type of a {@link VariableValue} or literal prop value. */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    JSON
}
