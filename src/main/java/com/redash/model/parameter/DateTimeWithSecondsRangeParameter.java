package com.redash.model.parameter;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DateTimeWithSecondsRangeParameter extends RangeParameter {

    public DateTimeWithSecondsRangeParameter(String name, String title, String value) {
        super(name, title, value);
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATETIME_WITH_SECONDS_RANGE;
    }
}
