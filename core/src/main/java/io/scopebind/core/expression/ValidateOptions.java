package io.scopebind.core.expression;

import java.util.Objects;

/**
 * Options for {@link ExpressionValidator#validate(String, ValidateOptions)}.
 *
 * @param optional    empty or blank text is valid and denotes "no expression"
 * @param effectful   permit assignments and whitelisted effect calls, as used by action steps
 * @param identifiers policy applied to every bare identifier
 */
public record ValidateOptions(boolean optional, boolean effectful, IdentifierPolicy identifiers) {

    public ValidateOptions {
        Objects.requireNonNull(identifiers, "identifiers must not be null");
    }

    /** Required, side-effect free, identifiers unchanged. */
    public static ValidateOptions defaults() {
        return new ValidateOptions(false, false, IdentifierPolicy.identity());
    }

    /** Returns a copy that accepts empty text. */
    public ValidateOptions asOptional() {
        return new ValidateOptions(true, effectful, identifiers);
    }

    /** Returns a copy that permits effect forms. */
    public ValidateOptions asEffectful() {
        return new ValidateOptions(optional, true, identifiers);
    }

    /** Returns a copy using the given identifier policy. */
    public ValidateOptions withIdentifiers(IdentifierPolicy policy) {
        return new ValidateOptions(optional, effectful, policy);
    }
}
