package com.redash.model.parameter;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A date and time with minute precision ({@code datetime-local}).
 * <p>
 * The service is loose about this value: it is usually a string, but may be {@code null}
 * or another JSON value, so it is kept as whatever Jackson binds it to and written back
 * unchanged.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DateTimeParameter extends QueryParameter {

    private Object value;

    public DateTimeParameter(String name, String title, Object value) {
        super(name, title);
        this.value = value;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.DATETIME_LOCAL;
    }
}
