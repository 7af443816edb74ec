package com.redash.model.parameter;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A date and time with second precision.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DateTimeWithSecondsParameter extends QueryParameter {

    private String value;

    public DateTimeWithSecondsParameter(String name, String title, String value) {
        super(name, title);
        this.value = value;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATETIME_WITH_SECONDS;
    }
}
