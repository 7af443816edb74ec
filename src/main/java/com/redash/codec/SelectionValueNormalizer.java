package com.redash.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.redash.exception.EmptySingleSelectionException;
import com.redash.exception.SelectionShapeMismatchException;
import com.redash.model.parameter.SelectionParameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts the selection of an {@code enum} or {@code query} parameter between its in-memory
 * list and its wire shape.
 * <p>
 * Without {@code multiValuesOptions} the wire value is a single string; with it the wire value
 * is an array of strings. A wire value that does not have the expected shape is an error.
 */
public final class SelectionValueNormalizer {

    static final String SINGLE_SHAPE = "string";
    static final String MULTI_SHAPE = "array of strings";

    private SelectionValueNormalizer() {
    }

    /**
     * Builds the wire {@code value} for a selection parameter.
     *
     * @param parameter The parameter to encode.
     * @param index     Its position in the collection, used for error reporting.
     * @return A text node for single selection, an array node for multiple selection.
     * @throws EmptySingleSelectionException if single selection is used and nothing is selected.
     */
    public static JsonNode toWire(SelectionParameter parameter, int index) {
        List<String> values = parameter.getValues();
        if (parameter.isMultiSelect()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            if (values != null) {
                values.forEach(array::add);
            }
            return array;
        }
        if (values == null || values.isEmpty()) {
            throw new EmptySingleSelectionException(index);
        }
        return JsonNodeFactory.instance.textNode(values.get(0));
    }

    /**
     * Reads the wire {@code value} of a selection parameter into a list, using the parameter's
     * already bound {@code multiValuesOptions} to decide which shape to expect.
     *
     * @param wire      The {@code value} node, may be {@code null} when absent.
     * @param parameter The partially decoded parameter.
     * @param index     Its position in the collection, used for error reporting.
     * @return The selected values, in wire order.
     * @throws SelectionShapeMismatchException if the value does not have the expected shape.
     */
    public static List<String> fromWire(JsonNode wire, SelectionParameter parameter, int index) {
        if (!parameter.isMultiSelect()) {
            if (wire == null || !wire.isTextual()) {
                throw new SelectionShapeMismatchException(index, SINGLE_SHAPE, describe(wire));
            }
            return new ArrayList<>(Collections.singletonList(wire.textValue()));
        }

        if (wire == null || !wire.isArray()) {
            throw new SelectionShapeMismatchException(index, MULTI_SHAPE, describe(wire));
        }
        List<String> values = new ArrayList<>(wire.size());
        for (JsonNode element : wire) {
            if (!element.isTextual()) {
                throw new SelectionShapeMismatchException(index, MULTI_SHAPE, "array containing " + describe(element));
            }
            values.add(element.textValue());
        }
        return values;
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "missing";
        }
        return node.getNodeType().name().toLowerCase();
    }
}
