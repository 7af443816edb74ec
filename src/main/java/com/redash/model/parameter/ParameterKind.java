package com.redash.model.parameter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The closed set of parameter kinds understood by the service, each paired with the
 * tag used in the {@code type} field on the wire and the Java type that carries its payload.
 */
@Getter
@RequiredArgsConstructor
public enum ParameterKind {

    TEXT("text", TextParameter.class),
    NUMBER("number", NumberParameter.class),
    DATE("date", DateParameter.class),
    DATETIME_LOCAL("datetime-local", DateTimeParameter.class),
    DATETIME_WITH_SECONDS("datetime-with-seconds", DateTimeWithSecondsParameter.class),
    DATE_RANGE("date-range", DateRangeParameter.class),
    DATETIME_RANGE("datetime-range", DateTimeRangeParameter.class),
    DATETIME_WITH_SECONDS_RANGE("datetime-range-with-seconds", DateTimeWithSecondsRangeParameter.class),
    ENUM("enum", EnumParameter.class),
    QUERY("query", QueryBasedParameter.class);

    /**
     * The value written to and read from the {@code type} field.
     */
    private final String tag;

    /**
     * The concrete class a parameter of this kind is bound into.
     */
    private final Class<? extends QueryParameter> parameterType;
}
