package io.scopebind.core.model;

/** Kind of a {@link PropValue}. */
public enum PropKind {
    /** A concrete value, no expression. */
    LITERAL,
    /** A single expression that may reference variables. */
    EXPRESSION,
    /** An ordered list of effectful expression steps. */
    ACTION
}
