package com.redash.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The fields every parameter carries regardless of kind. Bound first, ignoring everything
 * else, so that the {@code type} tag can pick the concrete class to bind the full record into.
 *
 * @param name  The placeholder name.
 * @param title The display label, may be {@code null}.
 * @param type  The wire tag naming the parameter kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParameterHeader(String name, String title, String type) {
}
