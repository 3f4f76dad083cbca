package io.scopebind.core.expression;

/**
 * Size limits applied before and during parsing, guarding against pathological input.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxLength maximum expression length in characters (default: 10000)
 * @param maxDepth  maximum syntactic nesting depth (default: 64)
 */
public record ExpressionLimits(int maxLength, int maxDepth) {

    /** Default limits: 10000 characters, nesting depth 64. */
    public static final ExpressionLimits DEFAULT = new ExpressionLimits(10_000, 64);

    public ExpressionLimits {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
