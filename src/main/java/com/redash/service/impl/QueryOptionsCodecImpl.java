package com.redash.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redash.codec.ParameterDispatchTable;
import com.redash.codec.RangeBridge;
import com.redash.codec.SelectionValueNormalizer;
import com.redash.exception.MalformedParameterException;
import com.redash.exception.QueryCodecException;
import com.redash.model.QueryOptions;
import com.redash.model.parameter.ParameterHeader;
import com.redash.model.parameter.ParameterKind;
import com.redash.model.parameter.QueryParameter;
import com.redash.model.parameter.RangeParameter;
import com.redash.model.parameter.SelectionParameter;
import com.redash.service.api.QueryOptionsCodec;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A Jackson based implementation of the {@link QueryOptionsCodec}.
 * <p>
 * Parameters are self-describing records without an enclosing type wrapper, so each one is
 * decoded in two passes: its header is bound first to read the {@code type} tag, then the same
 * tree is bound into the class that tag names. The {@code value} field of range and selection
 * kinds is converted separately by {@link RangeBridge} and {@link SelectionValueNormalizer}.
 * <p>
 * The service holds no mutable state and may be used from several threads at once.
 */
@Service
@Slf4j
public class QueryOptionsCodecImpl implements QueryOptionsCodec {

    static final String PARAMETERS = "parameters";
    static final String RUN_AS_ROLE = "run_as_role";

    private static final String NAME = "name";
    private static final String TITLE = "title";
    private static final String TYPE = "type";
    private static final String VALUE = "value";

    private final ObjectMapper objectMapper;

    public QueryOptionsCodecImpl(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] encode(QueryOptions options) {
        ObjectNode tree = toTree(options);
        try {
            return objectMapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new QueryCodecException("Failed to write query options", e);
        }
    }

    @Override
    public byte[] encode(List<QueryParameter> parameters, String runAsRole) {
        return encode(new QueryOptions(parameters, runAsRole));
    }

    @Override
    public QueryOptions decode(byte[] json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            log.debug("Can't read query options from bytes of length {}", json == null ? 0 : json.length);
            throw new QueryCodecException("Query options are not valid JSON", e);
        }
        return fromTree(root);
    }

    /**
     * {@inheritDoc}
     * <p>
     * An empty parameter list is left out, as is an empty role.
     */
    @Override
    public ObjectNode toTree(QueryOptions options) {
        ObjectNode tree = objectMapper.createObjectNode();
        List<QueryParameter> parameters = options.getParameters();
        if (parameters != null && !parameters.isEmpty()) {
            ArrayNode encoded = tree.putArray(PARAMETERS);
            for (int i = 0; i < parameters.size(); i++) {
                encoded.add(encodeParameter(parameters.get(i), i));
            }
        }
        String runAsRole = options.getRunAsRole();
        if (runAsRole != null && !runAsRole.isEmpty()) {
            tree.put(RUN_AS_ROLE, runAsRole);
        }
        return tree;
    }

    @Override
    public QueryOptions fromTree(JsonNode node) {
        QueryOptions options = new QueryOptions();
        if (node == null || node.isNull()) {
            return options;
        }
        if (!node.isObject()) {
            throw new QueryCodecException("Query options must be a JSON object but was " + node.getNodeType());
        }

        JsonNode role = node.get(RUN_AS_ROLE);
        if (role != null && !role.isNull()) {
            if (!role.isTextual()) {
                throw new QueryCodecException("'" + RUN_AS_ROLE + "' must be a string but was " + role.getNodeType());
            }
            options.setRunAsRole(role.textValue());
        }

        JsonNode rawParameters = node.get(PARAMETERS);
        if (rawParameters == null || rawParameters.isNull()) {
            return options;
        }
        if (!rawParameters.isArray()) {
            throw new QueryCodecException("'" + PARAMETERS + "' must be a JSON array but was " + rawParameters.getNodeType());
        }

        // Built locally and only published once every element has decoded.
        List<QueryParameter> parameters = new ArrayList<>(rawParameters.size());
        for (int i = 0; i < rawParameters.size(); i++) {
            parameters.add(decodeParameter(rawParameters.get(i), i));
        }
        options.setParameters(parameters);
        log.debug("Decoded {} query parameters", parameters.size());
        return options;
    }

    /**
     * Writes one parameter, tagging it with the {@code type} derived from its class.
     */
    ObjectNode encodeParameter(QueryParameter parameter, int index) {
        if (parameter == null) {
            throw new MalformedParameterException(index, null, "parameter is null", null);
        }
        ParameterKind kind = parameter.getKind();

        ObjectNode encoded = objectMapper.createObjectNode();
        encoded.put(NAME, parameter.getName());
        if (parameter.getTitle() != null) {
            encoded.put(TITLE, parameter.getTitle());
        }
        encoded.put(TYPE, kind.getTag());
        try {
            encoded.setAll((ObjectNode) objectMapper.valueToTree(parameter));
        } catch (IllegalArgumentException e) {
            log.debug("Can't write parameter '{}' at index {}", parameter.getName(), index, e);
            throw new MalformedParameterException(index, kind.getTag(), e.getMessage(), e);
        }

        JsonNode value = switch (kind) {
            case TEXT, NUMBER, DATE, DATETIME_LOCAL, DATETIME_WITH_SECONDS -> encoded.get(VALUE);
            case DATE_RANGE, DATETIME_RANGE, DATETIME_WITH_SECONDS_RANGE ->
                    RangeBridge.toWire(((RangeParameter) parameter).getValue());
            case ENUM, QUERY -> SelectionValueNormalizer.toWire((SelectionParameter) parameter, index);
        };
        encoded.set(VALUE, value);
        return encoded;
    }

    /**
     * Reads one parameter in two passes: header first, then the full record as the kind the
     * header names.
     */
    QueryParameter decodeParameter(JsonNode raw, int index) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedParameterException(index, null,
                    "expected a JSON object but found " + (raw == null ? "nothing" : raw.getNodeType()), null);
        }

        ParameterHeader header;
        try {
            header = objectMapper.treeToValue(raw, ParameterHeader.class);
        } catch (JsonProcessingException e) {
            log.debug("Can't read parameter header at index {}: {}", index, raw);
            throw new MalformedParameterException(index, null, e.getOriginalMessage(), e);
        }
        String tag = header.type();
        if (tag == null) {
            throw new MalformedParameterException(index, null, "missing '" + TYPE + "'", null);
        }
        if (header.name() == null) {
            throw new MalformedParameterException(index, tag, "missing '" + NAME + "'", null);
        }

        ParameterKind kind = ParameterDispatchTable.resolve(tag, index);

        QueryParameter parameter;
        try {
            parameter = objectMapper.treeToValue(raw, kind.getParameterType());
        } catch (JsonProcessingException e) {
            log.debug("Can't read parameter at index {} as '{}': {}", index, tag, raw);
            throw new MalformedParameterException(index, tag, e.getOriginalMessage(), e);
        }

        JsonNode value = raw.get(VALUE);
        return switch (kind) {
            case TEXT, NUMBER, DATE, DATETIME_LOCAL, DATETIME_WITH_SECONDS -> parameter;
            case DATE_RANGE, DATETIME_RANGE, DATETIME_WITH_SECONDS_RANGE -> {
                RangeParameter range = (RangeParameter) parameter;
                range.setValue(RangeBridge.toCanonical(value));
                yield range;
            }
            case ENUM, QUERY -> {
                SelectionParameter selection = (SelectionParameter) parameter;
                selection.setValues(SelectionValueNormalizer.fromWire(value, selection, index));
                yield selection;
            }
        };
    }
}
