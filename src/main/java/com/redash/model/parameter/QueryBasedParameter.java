package com.redash.model.parameter;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A dropdown whose choices come from the result of another query (wire tag {@code query}).
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class QueryBasedParameter extends SelectionParameter {

    /**
     * The id of the query whose first column supplies the choices.
     */
    private String queryId;

    public QueryBasedParameter(String name, String title, List<String> values, String queryId,
                               MultiValuesOptions multiValuesOptions) {
        super(name, title, values, multiValuesOptions);
        this.queryId = queryId;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.QUERY;
    }
}
