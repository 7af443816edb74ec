package com.redash.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * A Spring configuration class providing the {@link ObjectMapper} shared by the codecs.
 */
@Configuration
public class CodecConfig {

    /**
     * Creates the mapper used for all query JSON.
     * <p>
     * The service adds fields to queries and parameters over time (e.g. {@code created_at},
     * {@code parentQueryId}), so unknown properties are skipped instead of rejected. Scalars
     * are never converted between types: a string where a number is expected, or a number or
     * boolean where a string is expected, is a binding error.
     *
     * @return A mapper that is safe to share between threads once configured.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .withCoercionConfig(LogicalType.Textual, textual -> textual
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .build();
    }
}
