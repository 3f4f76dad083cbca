package io.scopebind.core.expression;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Syntax tree of a parsed expression. The hierarchy is sealed: every construct the restricted
 * grammar accepts has exactly one node type here, and nothing else can be represented.
 *
 * <p>
 * Immutable and thread-safe.
 */
public sealed interface ExpressionNode {

    /** A string, number, boolean or null literal. */
    record Literal(JsonNode value) implements ExpressionNode {}

    /**
     * A bare identifier reference.
     *
     * @param name  identifier text
     * @param start source offset of the first character
     * @param end   source offset just past the last character
     */
    record Identifier(String name, int start, int end) implements ExpressionNode {}

    /** An untagged template literal; {@code quasis} has exactly one more entry than {@code expressions}. */
    record Template(List<String> quasis, List<ExpressionNode> expressions) implements ExpressionNode {}

    /** Array construction. */
    record ArrayLiteral(List<ExpressionNode> elements) implements ExpressionNode {}

    /** Object construction. */
    record ObjectLiteral(List<Property> properties) implements ExpressionNode {}

    /**
     * One {@code key: value} entry of an object literal.
     *
     * @param shorthand {@code true} for {@code {a}}, whose value is the identifier {@code a}
     */
    record Property(String key, ExpressionNode value, boolean shorthand) {}

    /** Prefix operator: {@code ! - + ~ typeof void}. */
    record Unary(String operator, ExpressionNode operand) implements ExpressionNode {}

    /** Arithmetic, comparison, equality and logical operators. */
    record Binary(String operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {}

    /**
     * Property access: {@code object.name}, {@code object[index]} and their optional-chaining forms.
     * Exactly one of {@code name} and {@code index} is non-null.
     *
     * @param chained {@code true} if {@code object} is an unparenthesized access of the same chain,
     *                so a short-circuit inside it skips this access as well
     */
    record Member(ExpressionNode object, String name, ExpressionNode index, boolean optional, boolean chained)
            implements ExpressionNode {}

    /** {@code test ? consequent : alternate}. */
    record Conditional(ExpressionNode test, ExpressionNode consequent, ExpressionNode alternate)
            implements ExpressionNode {}

    /** Call of a whitelisted effect. Only produced in effectful mode and never evaluated. */
    record EffectCall(String callee, List<ExpressionNode> arguments) implements ExpressionNode {}

    /** Assignment to a variable. Only produced in effectful mode and never evaluated. */
    record Assignment(Identifier target, String operator, ExpressionNode value) implements ExpressionNode {}
}
