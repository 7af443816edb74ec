package com.redash.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.Data;

/**
 * A saved query as exchanged with the service.
 * <p>
 * Visualizations are carried as raw JSON trees and written back exactly as they were read.
 * The {@link #options} are encoded separately because their parameter list is polymorphic.
 */
@Data
public class Query {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String id;

    @JsonProperty("data_source_id")
    private String dataSourceId;

    private String name;

    private String description;

    /**
     * The query text, with parameters referenced as {@code {{ name }}}.
     */
    private String query;

    /**
     * {@code null} when the query is only run on demand.
     */
    private QuerySchedule schedule;

    @JsonIgnore
    private QueryOptions options;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> tags;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<JsonNode> visualizations;
}
