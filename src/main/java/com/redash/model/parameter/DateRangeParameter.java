package com.redash.model.parameter;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A range of calendar dates, canonically {@code "2020-01-01|2020-01-31"}.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DateRangeParameter extends RangeParameter {

    public DateRangeParameter(String name, String title, String value) {
        super(name, title, value);
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATE_RANGE;
    }
}
