package io.scopebind.core.expression;

import java.util.List;

/**
 * Result of a successful validation.
 *
 * @param text        the normalized text, with identifiers substituted by the policy
 * @param root        the syntax tree of the original text, or {@code null} for an empty optional
 *                    expression
 * @param identifiers distinct raw identifiers in order of first appearance
 */
public record ParsedExpression(String text, ExpressionNode root, List<String> identifiers) {

    public ParsedExpression {
        identifiers = List.copyOf(identifiers);
    }

    /** Returns {@code true} if the text was empty and accepted as "no expression". */
    public boolean isEmpty() {
        return root == null;
    }
}
