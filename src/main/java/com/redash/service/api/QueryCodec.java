package com.redash.service.api;

import com.redash.model.Query;

/**
 * Encodes and decodes a complete query definition.
 */
public interface QueryCodec {

    /**
     * @param query The query to encode.
     * @return The UTF-8 JSON representation.
     */
    byte[] encode(Query query);

    /**
     * @param json The UTF-8 JSON representation of a query.
     * @return The decoded query.
     */
    Query decode(byte[] json);
}
