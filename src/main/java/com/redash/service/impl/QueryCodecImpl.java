package com.redash.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redash.exception.QueryCodecException;
import com.redash.model.Query;
import com.redash.service.api.QueryCodec;
import com.redash.service.api.QueryOptionsCodec;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps a query field by field with Jackson and hands its {@code options} object to the
 * {@link QueryOptionsCodec}. Errors raised for the options propagate unchanged.
 */
@Service
@Slf4j
public class QueryCodecImpl implements QueryCodec {

    private static final String OPTIONS = "options";

    private final ObjectMapper objectMapper;
    private final QueryOptionsCodec optionsCodec;

    public QueryCodecImpl(ObjectMapper objectMapper, QueryOptionsCodec optionsCodec) {
        this.objectMapper = objectMapper;
        this.optionsCodec = optionsCodec;
    }

    @Override
    public byte[] encode(Query query) {
        ObjectNode tree = objectMapper.valueToTree(query);
        if (query.getOptions() != null) {
            tree.set(OPTIONS, optionsCodec.toTree(query.getOptions()));
        }
        try {
            return objectMapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new QueryCodecException("Failed to write query '" + query.getName() + "'", e);
        }
    }

    @Override
    public Query decode(byte[] json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new QueryCodecException("Query definition is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new QueryCodecException("Query definition must be a JSON object");
        }

        Query query;
        try {
            query = objectMapper.treeToValue(root, Query.class);
        } catch (JsonProcessingException e) {
            log.debug("Can't read query fields from {}", root);
            throw new QueryCodecException("Failed to read query: " + e.getOriginalMessage(), e);
        }

        JsonNode options = root.get(OPTIONS);
        if (options != null && !options.isNull()) {
            query.setOptions(optionsCodec.fromTree(options));
        }
        log.debug("Decoded query '{}' with id '{}'", query.getName(), query.getId());
        return query;
    }
}
