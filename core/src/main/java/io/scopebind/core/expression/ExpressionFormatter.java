package io.scopebind.core.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders stored values as expression text.
 *
 * <p>
 * {@link #formatValue(JsonNode)} produces text that {@link LiteralEvaluator} evaluates back to an
 * equal value, so a stored value can be shown in an editor and saved again unchanged.
 * {@link #formatValuePreview(JsonNode)} produces a single-line, truncated label.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ExpressionFormatter {

    /** Default maximum preview length in characters. */
    public static final int DEFAULT_PREVIEW_LENGTH = 80;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExpressionFormatter() {}

    /**
     * Formats a value as editable expression text: JSON with two-space indentation for structured
     * data, a quoted literal for strings, plain text for numbers and booleans.
     *
     * @param value the value, {@code null} or missing formats as the empty string
     * @return expression text
     */
    public static String formatValue(JsonNode value) {
        if (JsonValues.isUndefined(value)) {
            return "";
        }
        if (value.isNumber()) {
            return JsonValues.formatNumber(value.doubleValue());
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to format value as expression", e);
        }
    }

    /** Formats a single-line preview of at most {@link #DEFAULT_PREVIEW_LENGTH} characters. */
    public static String formatValuePreview(JsonNode value) {
        return formatValuePreview(value, DEFAULT_PREVIEW_LENGTH);
    }

    /**
     * Formats a single-line preview.
     *
     * @param value     the value
     * @param maxLength maximum length; longer previews are cut and end with an ellipsis
     * @return preview text
     */
    public static String formatValuePreview(JsonNode value, int maxLength) {
        if (maxLength < 2) {
            throw new IllegalArgumentException("maxLength must be at least 2, got: " + maxLength);
        }
        String preview;
        if (JsonValues.isUndefined(value)) {
            preview = "undefined";
        } else if (value.isNumber()) {
            preview = JsonValues.formatNumber(value.doubleValue());
        } else {
            try {
                preview = MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Failed to format value preview", e);
            }
        }
        if (preview.length() <= maxLength) {
            return preview;
        }
        int cut = maxLength - 1;
        if (Character.isHighSurrogate(preview.charAt(cut - 1))) {
            cut--;
        }
        return preview.substring(0, cut) + "…";
    }
}
