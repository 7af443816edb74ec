package com.redash.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts range values between their canonical {@code "<start>|<end>"} form and the wire
 * form, which is a {@code {"start": ..., "end": ...}} object or, for partial ranges, a bare string.
 * <p>
 * Decoding never fails: a value of an unexpected shape is kept as its text rendering.
 */
public final class RangeBridge {

    public static final String SEPARATOR = "|";

    private static final String START = "start";
    private static final String END = "end";

    private RangeBridge() {
    }

    /**
     * Builds the wire form of a canonical range string.
     * <p>
     * Exactly one separator gives a {@code start}/{@code end} object (either side may be empty);
     * any other string is written as is.
     *
     * @param canonical The canonical range, may be {@code null}.
     * @return An object node, a text node, or a null node for a {@code null} range.
     */
    public static JsonNode toWire(String canonical) {
        if (canonical == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        String[] parts = canonical.split("\\|", -1);
        if (parts.length != 2) {
            return JsonNodeFactory.instance.textNode(canonical);
        }
        ObjectNode range = JsonNodeFactory.instance.objectNode();
        range.put(START, parts[0]);
        range.put(END, parts[1]);
        return range;
    }

    /**
     * Reads a wire range value into its canonical string.
     *
     * @param wire The {@code value} node, may be {@code null} or missing.
     * @return {@code start|end} for an object, the text of a string, {@code null} for a null or
     *         missing value, and a stable text rendering of anything else.
     */
    public static String toCanonical(JsonNode wire) {
        if (wire == null || wire.isMissingNode() || wire.isNull()) {
            return null;
        }
        if (wire.isTextual()) {
            return wire.textValue();
        }
        if (wire.isObject()) {
            return render(wire.get(START)) + SEPARATOR + render(wire.get(END));
        }
        return render(wire);
    }

    private static String render(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        // Containers keep their JSON form, scalars their plain text.
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
