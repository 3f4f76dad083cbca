package io.scopebind.core.config;

import io.scopebind.core.expression.ExpressionLimits;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a {@link io.scopebind.core.engine.BindingEngine}.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances.
 *
 * @param collectionComponent component name of the repeating construct whose own parameters
 *                            are hidden from it
 * @param effectCalls         callee names accepted as effect calls in action steps
 * @param maxExpressionLength maximum length of an expression, in characters
 * @param maxNestingDepth     maximum nesting depth of an expression
 */
public record BindingsConfig(
        String collectionComponent, Set<String> effectCalls, int maxExpressionLength, int maxNestingDepth) {

    /** Default configuration. */
    public static final BindingsConfig DEFAULT = builder().build();

    public BindingsConfig {
        Objects.requireNonNull(collectionComponent, "collectionComponent must not be null");
        if (collectionComponent.isBlank()) {
            throw new IllegalArgumentException("collectionComponent must not be blank");
        }
        effectCalls = Set.copyOf(Objects.requireNonNull(effectCalls, "effectCalls must not be null"));
        // validates both limits
        new ExpressionLimits(maxExpressionLength, maxNestingDepth);
    }

    /** The expression limits derived from this configuration. */
    public ExpressionLimits expressionLimits() {
        return new ExpressionLimits(maxExpressionLength, maxNestingDepth);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link BindingsConfig}. */
    public static final class Builder {
        private String collectionComponent = "ws:collection";
        private Set<String> effectCalls = new LinkedHashSet<>();
        private int maxExpressionLength = ExpressionLimits.DEFAULT.maxLength();
        private int maxNestingDepth = ExpressionLimits.DEFAULT.maxDepth();

        Builder() {}

        public Builder collectionComponent(String collectionComponent) {
            this.collectionComponent = collectionComponent;
            return this;
        }

        public Builder effectCalls(Set<String> effectCalls) {
            this.effectCalls = new LinkedHashSet<>(effectCalls);
            return this;
        }

        public Builder addEffectCall(String effectCall) {
            this.effectCalls.add(effectCall);
            return this;
        }

        public Builder maxExpressionLength(int maxExpressionLength) {
            this.maxExpressionLength = maxExpressionLength;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public BindingsConfig build() {
            return new BindingsConfig(collectionComponent, effectCalls, maxExpressionLength, maxNestingDepth);
        }
    }
}
