package io.scopebind.core.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scopebind.core.error.ExpressionEvalException;
import io.scopebind.core.error.ExpressionParseException;
import io.scopebind.core.error.ValueDependsOnVariablesException;
import io.scopebind.core.expression.ExpressionNode.ArrayLiteral;
import io.scopebind.core.expression.ExpressionNode.Assignment;
import io.scopebind.core.expression.ExpressionNode.Binary;
import io.scopebind.core.expression.ExpressionNode.Conditional;
import io.scopebind.core.expression.ExpressionNode.EffectCall;
import io.scopebind.core.expression.ExpressionNode.Identifier;
import io.scopebind.core.expression.ExpressionNode.Literal;
import io.scopebind.core.expression.ExpressionNode.Member;
import io.scopebind.core.expression.ExpressionNode.ObjectLiteral;
import io.scopebind.core.expression.ExpressionNode.Property;
import io.scopebind.core.expression.ExpressionNode.Template;
import io.scopebind.core.expression.ExpressionNode.Unary;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a self-contained expression to a literal value: a string, number, boolean, or
 * structured data (array, object, {@code null}) represented as a Jackson node.
 *
 * <p>
 * Only expressions that reference no identifier can be evaluated; there is no scope to resolve a
 * name against, so any identifier fails the evaluation up front with a
 * {@link ValueDependsOnVariablesException}. Evaluation walks the tree produced by the restricted
 * parser, is pure and deterministic, and never delegates to a general-purpose script engine.
 *
 * <p>
 * Thread-safe: holds only the (thread-safe) validator.
 */
public final class LiteralEvaluator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ExpressionValidator validator;

    public LiteralEvaluator(ExpressionValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Evaluates literal expression text.
     *
     * @param text the expression text
     * @return the value; never {@code undefined}, never a non-finite number
     * @throws ExpressionParseException           if the text is malformed or empty
     * @throws ValueDependsOnVariablesException   if the text references any identifier
     * @throws ExpressionEvalException           if the value cannot be computed or stored
     */
    public JsonNode evaluate(String text) {
        ParsedExpression parsed = validator.parse(text, ValidateOptions.defaults());
        if (!parsed.identifiers().isEmpty()) {
            throw new ValueDependsOnVariablesException(parsed.identifiers(), text);
        }
        JsonNode value = new Evaluation(text).eval(parsed.root());
        if (JsonValues.isUndefined(value)) {
            throw new ExpressionEvalException("Expression evaluates to undefined", text);
        }
        if (value.isNumber() && !Double.isFinite(value.doubleValue())) {
            throw new ExpressionEvalException(
                    "Expression evaluates to " + JsonValues.formatNumber(value.doubleValue())
                            + ", which cannot be stored",
                    text);
        }
        return value;
    }

    /** One evaluation run; carries the source text for error messages. */
    private static final class Evaluation {

        private final String text;

        Evaluation(String text) {
            this.text = text;
        }

        JsonNode eval(ExpressionNode node) {
            if (node instanceof Literal literal) {
                return literal.value();
            }
            if (node instanceof Template template) {
                StringBuilder sb = new StringBuilder(template.quasis().get(0));
                for (int i = 0; i < template.expressions().size(); i++) {
                    sb.append(JsonValues.toDisplayString(eval(template.expressions().get(i))));
                    sb.append(template.quasis().get(i + 1));
                }
                return NODES.textNode(sb.toString());
            }
            if (node instanceof ArrayLiteral array) {
                ArrayNode result = NODES.arrayNode();
                for (ExpressionNode element : array.elements()) {
                    JsonNode value = eval(element);
                    result.add(JsonValues.isUndefined(value) ? NODES.nullNode() : storable(value));
                }
                return result;
            }
            if (node instanceof ObjectLiteral object) {
                ObjectNode result = NODES.objectNode();
                for (Property property : object.properties()) {
                    JsonNode value = eval(property.value());
                    // undefined members are dropped, as in JSON serialization
                    if (!JsonValues.isUndefined(value)) {
                        result.set(property.key(), storable(value));
                    }
                }
                return result;
            }
            if (node instanceof Unary unary) {
                return unary(unary.operator(), eval(unary.operand()));
            }
            if (node instanceof Binary binary) {
                return binary(binary);
            }
            if (node instanceof Member member) {
                return member(member);
            }
            if (node instanceof Conditional conditional) {
                return JsonValues.isTruthy(eval(conditional.test()))
                        ? eval(conditional.consequent())
                        : eval(conditional.alternate());
            }
            if (node instanceof Identifier identifier) {
                throw new ValueDependsOnVariablesException(List.of(identifier.name()), text);
            }
            if (node instanceof EffectCall || node instanceof Assignment) {
                throw new ExpressionEvalException("Effects cannot be evaluated as a value", text);
            }
            throw new IllegalStateException("Unhandled expression node: " + node);
        }

        /** Non-finite numbers nested in structured data become {@code null}, as in JSON serialization. */
        private JsonNode storable(JsonNode value) {
            if (value.isNumber() && !Double.isFinite(value.doubleValue())) {
                return NODES.nullNode();
            }
            return value;
        }

        private JsonNode unary(String operator, JsonNode operand) {
            return switch (operator) {
                case "!" -> NODES.booleanNode(!JsonValues.isTruthy(operand));
                case "-" -> JsonValues.number(-JsonValues.toNumber(operand));
                case "+" -> JsonValues.number(JsonValues.toNumber(operand));
                case "~" -> JsonValues.number(~toInt32(JsonValues.toNumber(operand)));
                case "typeof" -> NODES.textNode(JsonValues.typeOf(operand));
                case "void" -> JsonValues.undefined();
                default -> throw new IllegalStateException("Unhandled unary operator: " + operator);
            };
        }

        private JsonNode binary(Binary binary) {
            String operator = binary.operator();
            JsonNode left = eval(binary.left());
            switch (operator) {
                case "&&" -> {
                    return JsonValues.isTruthy(left) ? eval(binary.right()) : left;
                }
                case "||" -> {
                    return JsonValues.isTruthy(left) ? left : eval(binary.right());
                }
                case "??" -> {
                    return JsonValues.isNullish(left) ? eval(binary.right()) : left;
                }
                default -> {
                    // both operands are evaluated
                }
            }
            JsonNode right = eval(binary.right());
            return switch (operator) {
                case "+" -> plus(left, right);
                case "-" -> JsonValues.number(JsonValues.toNumber(left) - JsonValues.toNumber(right));
                case "*" -> JsonValues.number(JsonValues.toNumber(left) * JsonValues.toNumber(right));
                case "/" -> JsonValues.number(JsonValues.toNumber(left) / JsonValues.toNumber(right));
                case "%" -> JsonValues.number(JsonValues.toNumber(left) % JsonValues.toNumber(right));
                case "**" -> JsonValues.number(power(JsonValues.toNumber(left), JsonValues.toNumber(right)));
                case "<", ">", "<=", ">=" -> NODES.booleanNode(compare(operator, left, right));
                case "===" -> NODES.booleanNode(strictEquals(left, right));
                case "!==" -> NODES.booleanNode(!strictEquals(left, right));
                case "==" -> NODES.booleanNode(looseEquals(left, right));
                case "!=" -> NODES.booleanNode(!looseEquals(left, right));
                default -> throw new IllegalStateException("Unhandled binary operator: " + operator);
            };
        }

        private JsonNode member(Member member) {
            JsonNode value = access(member);
            return value == null ? JsonValues.undefined() : value;
        }

        /** Evaluates one access of a chain; {@code null} when an optional access short-circuited. */
        private JsonNode access(Member member) {
            JsonNode object = member.chained() && member.object() instanceof Member inner
                    ? access(inner)
                    : eval(member.object());
            if (object == null) {
                return null;
            }
            if (JsonValues.isNullish(object)) {
                if (member.optional()) {
                    return null;
                }
                String key = member.name() != null ? member.name() : JsonValues.toDisplayString(eval(member.index()));
                throw new ExpressionEvalException(
                        "Cannot read properties of " + JsonValues.toDisplayString(object) + " (reading '" + key + "')",
                        text);
            }
            String key = member.name() != null ? member.name() : propertyKey(eval(member.index()));
            if (key.equals("length") && (object.isArray() || object.isTextual())) {
                return JsonValues.number(object.isArray() ? object.size() : object.textValue().length());
            }
            if (object.isArray() || object.isTextual()) {
                int index = arrayIndex(key);
                if (index < 0) {
                    return JsonValues.undefined();
                }
                if (object.isArray()) {
                    return index < object.size() ? object.get(index) : JsonValues.undefined();
                }
                String s = object.textValue();
                return index < s.length() ? NODES.textNode(String.valueOf(s.charAt(index))) : JsonValues.undefined();
            }
            if (object.isObject()) {
                JsonNode value = object.get(key);
                return value == null ? JsonValues.undefined() : value;
            }
            return JsonValues.undefined();
        }

        private static String propertyKey(JsonNode index) {
            return JsonValues.toDisplayString(index);
        }

        private static int arrayIndex(String key) {
            if (key.isEmpty() || key.length() > 9 || !key.chars().allMatch(Character::isDigit)) {
                return -1;
            }
            if (key.length() > 1 && key.charAt(0) == '0') {
                return -1;
            }
            return Integer.parseInt(key);
        }

        private static JsonNode plus(JsonNode left, JsonNode right) {
            if (isStringLike(left) || isStringLike(right)) {
                return NODES.textNode(JsonValues.toDisplayString(left) + JsonValues.toDisplayString(right));
            }
            return JsonValues.number(JsonValues.toNumber(left) + JsonValues.toNumber(right));
        }

        /** Strings, arrays and objects concatenate; they convert to strings before addition. */
        private static boolean isStringLike(JsonNode node) {
            return !JsonValues.isUndefined(node) && (node.isTextual() || node.isContainerNode());
        }

        private static boolean compare(String operator, JsonNode left, JsonNode right) {
            if (isStringLike(left) && isStringLike(right)) {
                int c = JsonValues.toDisplayString(left).compareTo(JsonValues.toDisplayString(right));
                return switch (operator) {
                    case "<" -> c < 0;
                    case ">" -> c > 0;
                    case "<=" -> c <= 0;
                    default -> c >= 0;
                };
            }
            double l = JsonValues.toNumber(left);
            double r = JsonValues.toNumber(right);
            return switch (operator) {
                case "<" -> l < r;
                case ">" -> l > r;
                case "<=" -> l <= r;
                default -> l >= r;
            };
        }

        private static boolean strictEquals(JsonNode left, JsonNode right) {
            if (JsonValues.isUndefined(left) || JsonValues.isUndefined(right)) {
                return JsonValues.isUndefined(left) && JsonValues.isUndefined(right);
            }
            if (left.isNumber() && right.isNumber()) {
                return left.doubleValue() == right.doubleValue();
            }
            if (left.isContainerNode() || right.isContainerNode()) {
                // structured values compare by identity
                return left == right;
            }
            return left.getNodeType() == right.getNodeType() && left.equals(right);
        }

        private static boolean looseEquals(JsonNode left, JsonNode right) {
            if (JsonValues.isNullish(left) || JsonValues.isNullish(right)) {
                return JsonValues.isNullish(left) && JsonValues.isNullish(right);
            }
            if (left.getNodeType() == right.getNodeType() || (left.isNumber() && right.isNumber())) {
                return strictEquals(left, right);
            }
            if (left.isContainerNode() && right.isContainerNode()) {
                return left == right;
            }
            if (left.isContainerNode() || right.isContainerNode()) {
                JsonNode primitive = left.isContainerNode() ? right : left;
                JsonNode container = left.isContainerNode() ? left : right;
                return looseEquals(NODES.textNode(JsonValues.toDisplayString(container)), primitive);
            }
            return JsonValues.toNumber(left) == JsonValues.toNumber(right);
        }

        private static double power(double base, double exponent) {
            if (Double.isNaN(exponent) || ((base == 1 || base == -1) && Double.isInfinite(exponent))) {
                return Double.NaN;
            }
            return Math.pow(base, exponent);
        }

        private static int toInt32(double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return 0;
            }
            return (int) (long) (value % 4294967296.0);
        }
    }
}
