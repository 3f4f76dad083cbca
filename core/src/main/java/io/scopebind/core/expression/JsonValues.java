package io.scopebind.core.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Script-value semantics over Jackson nodes, shared by the parser (number literals) and the
 * literal evaluator. {@link MissingNode} stands for {@code undefined}; a double node may hold
 * {@code NaN} or an infinity as an intermediate result.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    /** The {@code undefined} value. */
    public static JsonNode undefined() {
        return MissingNode.getInstance();
    }

    /** Returns {@code true} for {@code undefined}, including a Java {@code null}. */
    public static boolean isUndefined(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /** Returns {@code true} for {@code null} or {@code undefined}. */
    public static boolean isNullish(JsonNode node) {
        return isUndefined(node) || node.isNull();
    }

    /**
     * Creates the narrowest numeric node for a double: integral values in {@code int} or
     * {@code long} range become integer nodes, everything else a double node.
     */
    public static JsonNode number(double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value) && value == Math.rint(value)) {
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return NODES.numberNode((int) value);
            }
            if (value >= -9.007199254740992E15 && value <= 9.007199254740992E15) {
                return NODES.numberNode((long) value);
            }
        }
        return NODES.numberNode(value);
    }

    /**
     * Determines if a value is truthy: {@code undefined}, {@code null}, {@code false}, {@code 0},
     * {@code NaN} and the empty string are falsy, everything else (including empty arrays and
     * objects) is truthy.
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNullish(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double d = node.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return true;
    }

    /** Converts a value to a number the way unary {@code +} does. */
    public static double toNumber(JsonNode node) {
        if (isUndefined(node)) {
            return Double.NaN;
        }
        if (node.isNull()) {
            return 0;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual() || node.isArray()) {
            return parseNumber(toDisplayString(node));
        }
        return Double.NaN;
    }

    /** Converts a value to a string the way string concatenation does. */
    public static String toDisplayString(JsonNode node) {
        if (isUndefined(node)) {
            return "undefined";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isBoolean()) {
            return String.valueOf(node.booleanValue());
        }
        if (node.isNumber()) {
            return formatNumber(node.doubleValue());
        }
        if (node.isArray()) {
            List<String> parts = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                parts.add(isNullish(element) ? "" : toDisplayString(element));
            }
            return String.join(",", parts);
        }
        return "[object Object]";
    }

    /** Result of the {@code typeof} operator. */
    public static String typeOf(JsonNode node) {
        if (isUndefined(node)) {
            return "undefined";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isNumber()) {
            return "number";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        return "object";
    }

    /** Formats a number without a trailing {@code .0} for integral values. */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e21) {
            return new BigDecimal(value).toPlainString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toString().replace("E+", "e+").replace("E-", "e-");
    }

    private static double parseNumber(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            try {
                return Long.parseLong(trimmed.substring(2), 16);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        switch (trimmed) {
            case "Infinity", "+Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {
                // Double.parseDouble accepts suffixes such as "1d" and words such as "NaN"
                if (!trimmed.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
                    return Double.NaN;
                }
                return Double.parseDouble(trimmed);
            }
        }
    }
}
