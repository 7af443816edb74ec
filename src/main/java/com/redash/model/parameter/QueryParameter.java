package com.redash.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The common header shared by every parameter attached to a query.
 * <p>
 * A parameter is a placeholder in the query text that is bound when the query runs. The
 * concrete subclass determines its kind; the {@code type} tag seen on the wire is derived
 * from {@link #getKind()} during encoding and is never stored on the object, so a
 * parameter built in code cannot carry a stale tag.
 * <p>
 * Names are expected to be unique within a query, but duplicates are accepted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "kind", ignoreUnknown = true)
public abstract sealed class QueryParameter
        permits TextParameter, NumberParameter, DateParameter, DateTimeParameter, DateTimeWithSecondsParameter,
        RangeParameter, SelectionParameter {

    /**
     * The placeholder name used in the query text, e.g. {@code {{ region }}}.
     */
    private String name;

    /**
     * The label shown next to the input widget. Omitted from the wire when {@code null}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String title;

    /**
     * @return The kind of this parameter, fixed by its class.
     */
    @JsonIgnore
    public abstract ParameterKind getKind();
}
