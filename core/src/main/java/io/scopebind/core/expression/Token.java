package io.scopebind.core.expression;

import java.util.List;

/**
 * A lexical token.
 *
 * @param type   token kind
 * @param text   raw source text for identifiers, numbers and punctuators; the cooked value for
 *               strings
 * @param start  offset of the first character in the source
 * @param end    offset just past the last character in the source
 * @param quasis cooked string chunks of a template literal, empty for other tokens
 * @param holes  source ranges {@code [start, end)} of the {@code ${...}} expressions of a
 *               template literal, empty for other tokens
 */
record Token(TokenType type, String text, int start, int end, List<String> quasis, List<int[]> holes) {

    Token(TokenType type, String text, int start, int end) {
        this(type, text, start, end, List.of(), List.of());
    }

    boolean is(String punctuator) {
        return type == TokenType.PUNCTUATOR && text.equals(punctuator);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of expression" : "\"" + text + "\"";
    }
}
