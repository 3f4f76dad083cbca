package io.scopebind.core.expression;

import io.scopebind.core.error.UnknownIdentifierException;
import java.util.Collection;
import java.util.Set;

/**
 * Callback invoked once per bare identifier found during validation. Receives the raw identifier
 * and returns the identifier to substitute in the normalized text, or throws to reject it.
 *
 * <p>
 * Collecting references and rejecting unknown ones go through the same callback in the same
 * pass, so both always agree on what counts as a reference. Member names, object keys and effect
 * callee names are not identifiers in this sense and never reach the policy.
 */
@FunctionalInterface
public interface IdentifierPolicy {

    /**
     * Transforms one identifier.
     *
     * @param identifier the raw identifier
     * @return the identifier to write in its place
     * @throws UnknownIdentifierException to reject the identifier
     */
    String transform(String identifier);

    /** Accepts every identifier unchanged. */
    static IdentifierPolicy identity() {
        return identifier -> identifier;
    }

    /** Accepts every identifier unchanged and adds it to {@code sink}. */
    static IdentifierPolicy collecting(Collection<String> sink) {
        return identifier -> {
            sink.add(identifier);
            return identifier;
        };
    }

    /**
     * Accepts every identifier unchanged and adds the variable id of each encoded variable
     * reference to {@code sink}; other identifiers are ignored.
     */
    static IdentifierPolicy collectingVariableIds(Collection<String> sink) {
        return identifier -> {
            VariableIdentifiers.decode(identifier).ifPresent(sink::add);
            return identifier;
        };
    }

    /** Accepts only identifiers contained in {@code allowed}; any other identifier is rejected. */
    static IdentifierPolicy allowOnly(Set<String> allowed) {
        return identifier -> {
            if (!allowed.contains(identifier)) {
                throw new UnknownIdentifierException(identifier, null);
            }
            return identifier;
        };
    }

    /** Applies this policy, then {@code next} to its result. */
    default IdentifierPolicy andThen(IdentifierPolicy next) {
        return identifier -> next.transform(transform(identifier));
    }
}
