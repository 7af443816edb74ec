package com.redash.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redash.model.QueryOptions;
import com.redash.model.parameter.QueryParameter;
import java.util.List;

/**
 * Encodes and decodes the {@code options} object of a query, including its polymorphic,
 * ordered list of parameters.
 * <p>
 * Every operation either succeeds completely or throws a
 * {@link com.redash.exception.QueryCodecException}; a collection is never returned with some
 * of its parameters missing. Failures tied to one parameter are reported through a
 * {@link com.redash.exception.ParameterException} carrying that parameter's index.
 */
public interface QueryOptionsCodec {

    /**
     * Encodes the options to JSON bytes.
     *
     * @param options The options to encode.
     * @return The UTF-8 JSON representation.
     */
    byte[] encode(QueryOptions options);

    /**
     * Encodes a parameter list and run-as role to JSON bytes.
     *
     * @param parameters The parameters, in declaration order. May be {@code null} or empty.
     * @param runAsRole  The role, omitted from the output when {@code null} or empty.
     * @return The UTF-8 JSON representation.
     */
    byte[] encode(List<QueryParameter> parameters, String runAsRole);

    /**
     * Decodes JSON bytes into options.
     *
     * @param json The UTF-8 JSON representation of an options object.
     * @return The decoded options; the parameter list is empty, never {@code null}, when absent.
     */
    QueryOptions decode(byte[] json);

    /**
     * Encodes the options into a JSON tree, for embedding in an enclosing document.
     *
     * @param options The options to encode.
     * @return A new object node.
     */
    ObjectNode toTree(QueryOptions options);

    /**
     * Decodes options from a JSON tree.
     *
     * @param node The {@code options} node. A {@code null} or JSON null node yields empty options.
     * @return The decoded options.
     */
    QueryOptions fromTree(JsonNode node);
}
