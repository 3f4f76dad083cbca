package io.scopebind.core.expression;

import java.util.Objects;
import java.util.Optional;

/**
 * Bidirectional mapping between a variable id and the identifier that names it inside expression
 * text.
 *
 * <p>
 * An encoded identifier is the reserved prefix {@value #PREFIX} followed by the id with ASCII
 * letters and digits kept as-is, {@code _} doubled, and every other UTF-16 unit written as
 * {@code _} plus four lowercase hex digits. The result only uses characters legal in an
 * identifier, so any opaque id can appear as a bare name.
 *
 * <p>
 * {@link #decode(String)} accepts only canonical encodings: an identifier that would not
 * re-encode to the exact same text is not a variable reference. Ordinary user names therefore
 * never decode.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class VariableIdentifiers {

    /** Reserved prefix marking an identifier as an encoded variable id. */
    public static final String PREFIX = "$ws$dataSource$";

    private static final char ESCAPE = '_';
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private VariableIdentifiers() {}

    /**
     * Encodes a variable id into an expression identifier.
     *
     * @param variableId the variable id, must not be null or empty
     * @return the encoded identifier
     */
    public static String encode(String variableId) {
        Objects.requireNonNull(variableId, "variableId must not be null");
        if (variableId.isEmpty()) {
            throw new IllegalArgumentException("variableId must not be empty");
        }
        StringBuilder out = new StringBuilder(PREFIX.length() + variableId.length() * 2);
        out.append(PREFIX);
        for (int i = 0; i < variableId.length(); i++) {
            char c = variableId.charAt(i);
            if (isPlain(c)) {
                out.append(c);
            } else if (c == ESCAPE) {
                out.append(ESCAPE).append(ESCAPE);
            } else {
                out.append(ESCAPE)
                        .append(HEX[(c >> 12) & 0xF])
                        .append(HEX[(c >> 8) & 0xF])
                        .append(HEX[(c >> 4) & 0xF])
                        .append(HEX[c & 0xF]);
            }
        }
        return out.toString();
    }

    /**
     * Decodes an expression identifier back into a variable id.
     *
     * @param identifier any identifier found in expression text
     * @return the variable id, or empty if the identifier is not a canonical encoding
     */
    public static Optional<String> decode(String identifier) {
        if (identifier == null || !identifier.startsWith(PREFIX) || identifier.length() == PREFIX.length()) {
            return Optional.empty();
        }
        StringBuilder id = new StringBuilder(identifier.length() - PREFIX.length());
        int i = PREFIX.length();
        while (i < identifier.length()) {
            char c = identifier.charAt(i);
            if (isPlain(c)) {
                id.append(c);
                i++;
            } else if (c == ESCAPE) {
                if (i + 1 < identifier.length() && identifier.charAt(i + 1) == ESCAPE) {
                    id.append(ESCAPE);
                    i += 2;
                    continue;
                }
                if (i + 5 > identifier.length()) {
                    return Optional.empty();
                }
                int code = 0;
                for (int k = i + 1; k < i + 5; k++) {
                    int digit = Character.digit(identifier.charAt(k), 16);
                    // uppercase hex is not canonical
                    if (digit < 0 || Character.isUpperCase(identifier.charAt(k))) {
                        return Optional.empty();
                    }
                    code = (code << 4) | digit;
                }
                char decoded = (char) code;
                if (isPlain(decoded) || decoded == ESCAPE) {
                    return Optional.empty();
                }
                id.append(decoded);
                i += 5;
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(id.toString());
    }

    /** Returns {@code true} if the identifier is a canonical encoded variable reference. */
    public static boolean isVariableIdentifier(String identifier) {
        return decode(identifier).isPresent();
    }

    private static boolean isPlain(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
