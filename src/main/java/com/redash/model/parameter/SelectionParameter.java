package com.redash.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Base for the kinds whose value is picked from a list of choices ({@code enum} and
 * {@code query}).
 * <p>
 * The selection is always held as a list. On the wire it is a single string unless
 * {@link #getMultiValuesOptions() multiValuesOptions} is present, in which case it is an array;
 * {@link com.redash.codec.SelectionValueNormalizer} converts between the two.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract sealed class SelectionParameter extends QueryParameter
        permits EnumParameter, QueryBasedParameter {

    /**
     * The selected values, in order. Must hold at least one value unless multiple
     * selection is enabled.
     */
    @JsonIgnore
    private List<String> values;

    /**
     * Present only when the parameter accepts several values.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private MultiValuesOptions multiValuesOptions;

    protected SelectionParameter(String name, String title, List<String> values, MultiValuesOptions multiValuesOptions) {
        super(name, title);
        this.values = values;
        this.multiValuesOptions = multiValuesOptions;
    }

    /**
     * @return {@code true} when the wire value is an array of strings.
     */
    @JsonIgnore
    public boolean isMultiSelect() {
        return multiValuesOptions != null;
    }
}
