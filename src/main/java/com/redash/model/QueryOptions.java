package com.redash.model;

import com.redash.model.parameter.QueryParameter;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code options} object of a query.
 * <p>
 * It is not bound by plain data binding: the parameter list is polymorphic and goes through
 * {@link com.redash.service.api.QueryOptionsCodec}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryOptions {

    /**
     * The query's parameters in declaration order. The order drives how the parameter form
     * is laid out, so it is preserved through encoding and decoding.
     */
    private List<QueryParameter> parameters = new ArrayList<>();

    /**
     * The database role the query runs as ({@code run_as_role}). Omitted from the wire when empty.
     */
    private String runAsRole;
}
