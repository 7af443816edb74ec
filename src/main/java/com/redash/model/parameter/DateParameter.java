package com.redash.model.parameter;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A single calendar date, e.g. {@code 2020-01-31}, or a dynamic token such as {@code d_now}.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DateParameter extends QueryParameter {

    private String value;

    public DateParameter(String name, String title, String value) {
        super(name, title);
        this.value = value;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATE;
    }
}
